package com.galois.nondet.ir;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.galois.nondet.proto.Protos;

/**
 * IR types.
 *
 * Types are structural: two types are equal if they have the same kind,
 * width and parameters.  The factory methods intern frequently used
 * types, but callers should always compare with <code>equals</code>.
 */
public final class Type {
    final Protos.TypeCode id;
    /** Bit width of an integer, or element count of an array. */
    final long width;
    final Type[] params;
    final boolean varArg;

    /** A private method for creating a type with the given args. */
    private Type(Protos.TypeCode id, long width, Type[] params, boolean varArg) {
        this.id = id;
        this.width = width;
        this.params = params;
        this.varArg = varArg;
    }

    private Type(Protos.TypeCode id, Type ... args) {
        this(id, 0, args, false);
    }

    /**
     * The type of functions and instructions that produce no value.
     */
    public static final Type VOID = new Type(Protos.TypeCode.VoidType);

    /**
     * Type of basic blocks when used as branch targets.
     */
    public static final Type LABEL = new Type(Protos.TypeCode.LabelType);

    /**
     * Type for 32-bit IEEE754 floats.
     */
    public static final Type FLOAT = new Type(Protos.TypeCode.FloatType);

    /**
     * Type for 64-bit IEEE754 floats.
     */
    public static final Type DOUBLE = new Type(Protos.TypeCode.DoubleType);

    // Cache used for integer types.
    private static Map<Long,Type> integerTypes = new HashMap<Long,Type>();

    /**
     * Returns the integer type with <code>width</code> bits.
     *
     * @param width The number of bits.
     * @return The given type.
     */
    public static Type integer(long width) {
        if (width <= 0) {
            throw new IllegalArgumentException("Integer width must be positive.");
        }
        synchronized (integerTypes) {
            Type r = integerTypes.get(width);
            if (r == null) {
                r = new Type(Protos.TypeCode.IntegerType, width, new Type[0], false);
                integerTypes.put(width, r);
            }
            return r;
        }
    }

    public static final Type I1 = integer(1);
    public static final Type I8 = integer(8);
    public static final Type I16 = integer(16);
    public static final Type I32 = integer(32);
    public static final Type I64 = integer(64);

    /** Cache for pointer types. */
    private static Map<Type, Type> pointerTypes = new HashMap<Type, Type>();

    /**
     * Returns the type of pointers to <code>e</code>.
     *
     * @param e The pointee type.
     * @return The pointer type.
     */
    public static Type pointer(Type e) {
        if (e == null) throw new NullPointerException("e");
        synchronized (pointerTypes) {
            Type r = pointerTypes.get(e);
            if (r == null) {
                r = new Type(Protos.TypeCode.PointerType, e);
                pointerTypes.put(e, r);
            }
            return r;
        }
    }

    /**
     * The opaque byte pointer, <code>i8*</code>.
     */
    public static final Type I8_PTR = pointer(I8);

    /**
     * An array of <code>count</code> elements of type <code>e</code>.
     */
    public static Type array(Type e, long count) {
        if (e == null) throw new NullPointerException("e");
        if (count < 0) {
            throw new IllegalArgumentException("Array length must not be negative.");
        }
        return new Type(Protos.TypeCode.ArrayType, count, new Type[] { e }, false);
    }

    /**
     * Type for a struct with elements of the given types.
     *
     * @param fields The types of fields in the struct.
     * @return The resulting type.
     */
    public static Type struct(Type ... fields) {
        return new Type(Protos.TypeCode.StructType, 0, fields.clone(), false);
    }

    // Cache used for function types.
    private static Map<List<Object>,Type> functionTypes =
        new HashMap<List<Object>,Type>();

    /**
     * Type for functions with the given signature.
     *
     * @param ret Return type of function
     * @param args Types of function arguments.
     * @param varArg Whether additional arguments are accepted.
     * @return the function type
     */
    public static Type function(Type ret, Type[] args, boolean varArg) {
        synchronized (functionTypes) {
            ArrayList<Object> key = new ArrayList<Object>();
            key.addAll(Arrays.asList(args));
            key.add(ret);
            key.add(varArg);
            Type r = functionTypes.get(key);
            if (r == null) {
                Type[] params_array = new Type[args.length + 1];
                System.arraycopy(args, 0, params_array, 0, args.length);
                params_array[args.length] = ret;
                r = new Type(Protos.TypeCode.FunctionType, 0, params_array, varArg);
                functionTypes.put(key, r);
            }
            return r;
        }
    }

    public static Type function(Type ret, Type ... args) {
        return function(ret, args, false);
    }

    public boolean isVoid() {
        return id == Protos.TypeCode.VoidType;
    }

    public boolean isLabel() {
        return id == Protos.TypeCode.LabelType;
    }

    public boolean isInteger() {
        return id == Protos.TypeCode.IntegerType;
    }

    public boolean isInteger(long w) {
        return isInteger() && width == w;
    }

    public boolean isPointer() {
        return id == Protos.TypeCode.PointerType;
    }

    public boolean isArray() {
        return id == Protos.TypeCode.ArrayType;
    }

    public boolean isStruct() {
        return id == Protos.TypeCode.StructType;
    }

    public boolean isFunction() {
        return id == Protos.TypeCode.FunctionType;
    }

    public boolean isFloatingPoint() {
        return id == Protos.TypeCode.FloatType
            || id == Protos.TypeCode.DoubleType;
    }

    /**
     * Returns whether values of this type can be stored in memory.
     */
    public boolean isSized() {
        switch (id) {
        case VoidType:
        case LabelType:
        case FunctionType:
            return false;
        case ArrayType:
            return params[0].isSized();
        case StructType:
            for (Type f : params) {
                if (!f.isSized()) return false;
            }
            return true;
        default:
            return true;
        }
    }

    /**
     * Return width of this type if it is an integer, and <code>0</code> otherwise.
     * @return The width
     */
    public long getIntegerWidth() {
        return isInteger() ? width : 0;
    }

    public Type getPointeeType() {
        if (!isPointer()) {
            throw new UnsupportedOperationException("Expected pointer type");
        }
        return params[0];
    }

    public Type getArrayElementType() {
        if (!isArray()) {
            throw new UnsupportedOperationException("Expected array type");
        }
        return params[0];
    }

    public long getArrayLength() {
        if (!isArray()) {
            throw new UnsupportedOperationException("Expected array type");
        }
        return width;
    }

    public int getStructFieldCount() {
        if (!isStruct()) {
            throw new UnsupportedOperationException("Expected struct type");
        }
        return params.length;
    }

    public Type getStructFieldType(int i) {
        if (!(0 <= i && i < getStructFieldCount())) {
            throw new IllegalArgumentException("Struct field is out of bounds.");
        }
        return params[i];
    }

    /**
     * Return the number of parameters of a function type.
     * @return the number of parameters.
     */
    public int getFunctionParamCount() {
        if (!isFunction()) {
            throw new UnsupportedOperationException("Expected function type");
        }
        return params.length - 1;
    }

    /**
     * Return the type of a function parameter at a given 0-based index.
     * @param i index of parameter
     * @return the type
     */
    public Type getFunctionParamType(int i) {
        if (i < 0 || i >= getFunctionParamCount()) {
            throw new IllegalArgumentException("Function argument is out of bounds.");
        }
        return params[i];
    }

    /**
     * Return function return type.
     * @return the return type
     */
    public Type getFunctionReturnType() {
        if (!isFunction()) {
            throw new UnsupportedOperationException("Expected function type");
        }
        return params[params.length - 1];
    }

    public boolean isVarArg() {
        return varArg;
    }

    /**
     * Return protocol buffer representation for type.
     * @return the representation
     */
    public Protos.IrType getTypeRep() {
        Protos.IrType.Builder b
            = Protos.IrType.newBuilder()
            .setCode(id);
        if (isInteger()) {
            b.setWidth((int) width);
        }
        if (isArray()) {
            b.setCount(width);
        }
        if (varArg) {
            b.setVarArg(true);
        }
        for (Type param : params) {
            b.addParam(param.getTypeRep());
        }
        return b.build();
    }

    /**
     * Create a type from its protocol buffer representation.
     */
    public static Type fromTypeRep(Protos.IrType rep) {
        switch (rep.getCode()) {
        case VoidType:
            return VOID;
        case LabelType:
            return LABEL;
        case FloatType:
            return FLOAT;
        case DoubleType:
            return DOUBLE;
        case IntegerType:
            return integer(rep.getWidth());
        case PointerType:
            return pointer(fromTypeRep(singleParam(rep)));
        case ArrayType:
            return array(fromTypeRep(singleParam(rep)), rep.getCount());
        case StructType: {
            Type[] fields = new Type[rep.getParamCount()];
            for (int i = 0; i != fields.length; ++i) {
                fields[i] = fromTypeRep(rep.getParam(i));
            }
            return struct(fields);
        }
        case FunctionType: {
            int cnt = rep.getParamCount();
            if (cnt == 0) {
                throw new IllegalArgumentException("Function type has no return type.");
            }
            Type[] args = new Type[cnt - 1];
            for (int i = 0; i != args.length; ++i) {
                args[i] = fromTypeRep(rep.getParam(i));
            }
            return function(fromTypeRep(rep.getParam(cnt - 1)), args, rep.getVarArg());
        }
        default:
            throw new IllegalArgumentException("Unknown type code: " + rep.getCode());
        }
    }

    private static Protos.IrType singleParam(Protos.IrType rep) {
        if (rep.getParamCount() != 1) {
            throw new IllegalArgumentException(
                String.format("%s expects one parameter, got %d", rep.getCode(), rep.getParamCount()));
        }
        return rep.getParam(0);
    }

    /**
     * Returns the type in LLVM assembly syntax.
     */
    public String toString() {
        switch (id) {
        case VoidType:
            return "void";
        case LabelType:
            return "label";
        case FloatType:
            return "float";
        case DoubleType:
            return "double";
        case IntegerType:
            return "i" + width;
        case PointerType:
            return params[0].toString() + "*";
        case ArrayType:
            return "[" + width + " x " + params[0] + "]";
        case StructType: {
            StringBuilder b = new StringBuilder("{ ");
            for (int i = 0; i != params.length; ++i) {
                if (i > 0) b.append(", ");
                b.append(params[i]);
            }
            return b.append(" }").toString();
        }
        case FunctionType: {
            StringBuilder b = new StringBuilder();
            b.append(getFunctionReturnType()).append(" (");
            int cnt = getFunctionParamCount();
            for (int i = 0; i != cnt; ++i) {
                if (i > 0) b.append(", ");
                b.append(params[i]);
            }
            if (varArg) {
                b.append(cnt > 0 ? ", ..." : "...");
            }
            return b.append(")").toString();
        }
        default:
            return id.toString();
        }
    }

    /**
     * Returns true if <code>this</code> and <code>o</code> are the same type.
     * @param o the other type.
     * @return whether the types are the same.
     */
    public boolean equals(Object o) {
        if (!(o instanceof Type)) return false;
        Type other = (Type) o;
        return this.id.equals(other.id)
            && this.width == other.width
            && this.varArg == other.varArg
            && Arrays.equals(this.params, other.params);
    }

    public int hashCode() {
        return Arrays.hashCode(new Object[] { id, width, varArg, Arrays.hashCode(params) });
    }
}
