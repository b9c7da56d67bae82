package com.galois.nondet.pass;

import com.galois.nondet.ir.BinaryOperator;
import com.galois.nondet.ir.CallInst;
import com.galois.nondet.ir.CastInst;
import com.galois.nondet.ir.Constant;
import com.galois.nondet.ir.ConstantInt;
import com.galois.nondet.ir.Function;
import com.galois.nondet.ir.Module;
import com.galois.nondet.ir.Type;
import com.galois.nondet.ir.Value;

/**
 * Registers the memory returned by an allocation call.  The call and its
 * uses are left alone; a cast of its result and a registration call are
 * inserted right after it.  For <code>calloc</code> the product of the
 * element count and size is computed just before the call.
 */
final class AllocationCallAugmenter {
    /** Variable field of the names of allocation sites. */
    static final String DYNALLOC = "dynalloc";

    private final DeclarationCache declarations;
    private final IdentifierCounter identifiers;

    AllocationCallAugmenter(DeclarationCache declarations, IdentifierCounter identifiers) {
        this.declarations = declarations;
        this.identifiers = identifiers;
    }

    /**
     * @param m the module containing the site
     * @param site an allocator call site
     * @return the inserted registration call
     */
    CallInst augment(Module m, CallSite site) {
        CallInst call = site.getCall();
        Function entryPoint = declarations.getRegistrationEntryPoint(m);
        String name = DiagnosticName.format(call.getFunction().getName(), DYNALLOC, site.getLine());
        Constant nameG = DiagnosticName.emit(m, name);
        Type sizeType = declarations.getSizeType(m);

        Value nbytes = toSizeType(call.getArgOperand(0), sizeType, call);
        if (site.getKind() == CallSiteKind.AUGMENT_CALLOC) {
            Value size = toSizeType(call.getArgOperand(1), sizeType, call);
            BinaryOperator mul = new BinaryOperator(BinaryOperator.Op.MUL, nbytes, size, null);
            mul.insertBefore(call);
            nbytes = mul;
        }

        CastInst addr = CastInst.createPointerCast(call, Type.I8_PTR, null);
        addr.insertAfter(call);

        Value[] args = new Value[] {
            // memory
            addr,
            // nbytes
            nbytes,
            // name
            nameG,
            // identifier
            ConstantInt.get(Type.I32, identifiers.next())
        };
        CallInst registration =
            new CallInst(entryPoint, args, null);
        registration.insertAfter(addr);
        return registration;
    }

    // Byte counts are passed unchanged unless the declaration uses another width.
    private static Value toSizeType(Value v, Type sizeType, CallInst call) {
        long from = v.type().getIntegerWidth();
        long to = sizeType.getIntegerWidth();
        if (from == to) {
            return v;
        }
        CastInst.Op op = from < to ? CastInst.Op.ZEXT : CastInst.Op.TRUNC;
        CastInst c = new CastInst(op, v, sizeType, null);
        c.insertBefore(call);
        return c;
    }
}
