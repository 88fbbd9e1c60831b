package io.github.sigwasm.core.wasm;

import io.github.sigwasm.core.ModuleEncodingException;
import io.github.sigwasm.core.signal.SignalType;
import org.objectweb.asm.Type;

/**
 * A WebAssembly number type.
 */
public enum ValType {
    I32((byte) 0x7F),
    I64((byte) 0x7E),
    F32((byte) 0x7D),
    F64((byte) 0x7C),
    ;

    /**
     * The binary encoding of the type.
     */
    public final byte code;

    ValType(byte code) {
        this.code = code;
    }

    /**
     * Look up a type by its binary encoding.
     *
     * @param code The encoding.
     * @return The type.
     * @throws ModuleEncodingException If the code is not a number type.
     */
    public static ValType fromCode(byte code) {
        for (ValType value : values()) {
            if (value.code == code) return value;
        }
        throw new ModuleEncodingException(String.format("unknown value type 0x%02x", code & 0xFF));
    }

    /**
     * Get the type that represents the given Java primitive type.
     * <p>
     * Sub-int types and booleans are represented as {@link #I32}.
     *
     * @param type The Java type.
     * @return The WebAssembly type, or null if the type is not primitive.
     */
    public static ValType fromJava(Type type) {
        switch (type.getSort()) {
            case Type.BOOLEAN:
            case Type.CHAR:
            case Type.BYTE:
            case Type.SHORT:
            case Type.INT:
                return I32;
            case Type.LONG:
                return I64;
            case Type.FLOAT:
                return F32;
            case Type.DOUBLE:
                return F64;
            default:
                return null;
        }
    }

    /**
     * Get the type of the values of a signal, before any narrowing.
     *
     * @param type The signal type.
     * @return The WebAssembly type.
     */
    public static ValType fromSignal(SignalType type) {
        switch (type) {
            case I64:
                return I64;
            case F32:
                return F32;
            case F64:
                return F64;
            default:
                return I32;
        }
    }

    @Override
    public String toString() {
        return name().toLowerCase();
    }
}
