package com.galois.nondet.pass;

import java.util.Map;

import com.galois.nondet.ir.AllocaInst;
import com.galois.nondet.ir.CallInst;
import com.galois.nondet.ir.CastInst;
import com.galois.nondet.ir.Constant;
import com.galois.nondet.ir.ConstantInt;
import com.galois.nondet.ir.Function;
import com.galois.nondet.ir.LoadInst;
import com.galois.nondet.ir.Module;
import com.galois.nondet.ir.Type;
import com.galois.nondet.ir.Value;

/**
 * Replaces a call to a nondet value producer with a stack slot that is
 * registered as symbolic and then read:
 *
 * <pre>
 *   %slot = alloca T
 *   %addr = bitcast T* %slot to i8*
 *   call void @klee_make_nondet(i8* %addr, size_t sizeof(T), i8* @name, i32 id)
 *   %v    = load T* %slot
 * </pre>
 *
 * Every use of the original call is redirected to <code>%v</code> and the
 * call is erased.
 */
final class StubCallRewriter {
    private final DeclarationCache declarations;
    private final IdentifierCounter identifiers;

    StubCallRewriter(DeclarationCache declarations, IdentifierCounter identifiers) {
        this.declarations = declarations;
        this.identifiers = identifiers;
    }

    /**
     * @param m the module containing the site
     * @param site a producer call site
     * @param variable the recovered variable name or the sentinel
     * @return the load that replaces the call
     */
    LoadInst rewrite(Module m, CallSite site, String variable) {
        CallInst call = site.getCall();
        Function parent = call.getFunction();
        Function entryPoint = declarations.getRegistrationEntryPoint(m);
        String name = DiagnosticName.format(parent.getName(), variable, site.getLine());
        Constant nameG = DiagnosticName.emit(m, name);

        Type valueType = call.type();
        AllocaInst slot = new AllocaInst(valueType, null);
        CastInst addr = CastInst.createPointerCast(slot, Type.I8_PTR, null);

        Value[] args = new Value[] {
            // memory
            addr,
            // nbytes
            ConstantInt.get(declarations.getSizeType(m),
                            m.getDataLayout().getTypeAllocSize(valueType)),
            // name
            nameG,
            // identifier
            ConstantInt.get(Type.I32, identifiers.next())
        };
        CallInst registration =
            new CallInst(entryPoint, args, null);

        for (Map.Entry<String, String> md : call.getAllMetadata().entrySet()) {
            registration.setMetadata(md.getKey(), md.getValue());
        }
        registration.setDebugLoc(call.getDebugLoc());
        registration.setAttributes(call.getAttributes());

        LoadInst value = new LoadInst(slot, name);

        registration.insertBefore(call);
        addr.insertBefore(registration);
        slot.insertBefore(addr);
        value.insertAfter(registration);
        call.replaceAllUsesWith(value);
        call.eraseFromParent();
        return value;
    }
}
