package com.galois.nondet.io;

import com.galois.nondet.ir.BinaryOperator;
import com.galois.nondet.ir.CastInst;
import com.galois.nondet.ir.ICmpInst;
import com.galois.nondet.ir.Linkage;
import com.galois.nondet.proto.Protos;

/**
 * Translation between IR enums and their wire codes.
 */
final class Codes {
    private Codes() {}

    static Protos.Linkage linkageRep(Linkage l) {
        switch (l) {
        case EXTERNAL: return Protos.Linkage.ExternalLinkage;
        case INTERNAL: return Protos.Linkage.InternalLinkage;
        case PRIVATE:  return Protos.Linkage.PrivateLinkage;
        default:
            throw new IllegalArgumentException("Unknown linkage " + l);
        }
    }

    static Linkage linkage(Protos.Linkage l) throws InvalidModuleException {
        switch (l) {
        case ExternalLinkage: return Linkage.EXTERNAL;
        case InternalLinkage: return Linkage.INTERNAL;
        case PrivateLinkage:  return Linkage.PRIVATE;
        default:
            throw new InvalidModuleException("Unknown linkage " + l);
        }
    }

    static Protos.CastOpcode castRep(CastInst.Op op) {
        switch (op) {
        case BITCAST:    return Protos.CastOpcode.BitCast;
        case PTR_TO_INT: return Protos.CastOpcode.PtrToInt;
        case INT_TO_PTR: return Protos.CastOpcode.IntToPtr;
        case TRUNC:      return Protos.CastOpcode.Trunc;
        case ZEXT:       return Protos.CastOpcode.ZExt;
        case SEXT:       return Protos.CastOpcode.SExt;
        default:
            throw new IllegalArgumentException("Unknown cast " + op);
        }
    }

    static CastInst.Op cast(Protos.CastOpcode op) throws InvalidModuleException {
        switch (op) {
        case BitCast:  return CastInst.Op.BITCAST;
        case PtrToInt: return CastInst.Op.PTR_TO_INT;
        case IntToPtr: return CastInst.Op.INT_TO_PTR;
        case Trunc:    return CastInst.Op.TRUNC;
        case ZExt:     return CastInst.Op.ZEXT;
        case SExt:     return CastInst.Op.SEXT;
        default:
            throw new InvalidModuleException("Unknown cast opcode " + op);
        }
    }

    // Binary opcodes and predicates are declared in the same order on both sides.

    static Protos.BinaryOpcode binaryRep(BinaryOperator.Op op) {
        return Protos.BinaryOpcode.forNumber(op.ordinal());
    }

    static BinaryOperator.Op binary(Protos.BinaryOpcode op) throws InvalidModuleException {
        BinaryOperator.Op[] ops = BinaryOperator.Op.values();
        if (op.getNumber() >= ops.length) {
            throw new InvalidModuleException("Unknown binary opcode " + op);
        }
        return ops[op.getNumber()];
    }

    static Protos.ICmpPredicate predicateRep(ICmpInst.Predicate p) {
        return Protos.ICmpPredicate.forNumber(p.ordinal());
    }

    static ICmpInst.Predicate predicate(Protos.ICmpPredicate p) throws InvalidModuleException {
        ICmpInst.Predicate[] ps = ICmpInst.Predicate.values();
        if (p.getNumber() >= ps.length) {
            throw new InvalidModuleException("Unknown predicate " + p);
        }
        return ps[p.getNumber()];
    }
}
