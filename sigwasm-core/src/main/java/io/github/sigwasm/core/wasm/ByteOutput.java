package io.github.sigwasm.core.wasm;

import io.github.sigwasm.core.ModuleEncodingException;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * A growable byte buffer with the primitive encodings of the WebAssembly binary format.
 */
public class ByteOutput {
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    public ByteOutput put(int b) {
        out.write(b);
        return this;
    }

    public ByteOutput putBytes(byte[] bytes) {
        out.write(bytes, 0, bytes.length);
        return this;
    }

    /**
     * Write an unsigned 32-bit LEB128 integer.
     *
     * @param value The value, which must fit in 32 unsigned bits.
     * @return This.
     * @throws ModuleEncodingException If the value is out of range.
     */
    public ByteOutput putU32(long value) {
        if (value < 0 || value > 0xFFFF_FFFFL) {
            throw new ModuleEncodingException("value " + value + " out of range for u32");
        }
        do {
            int b = (int) (value & 0x7F);
            value >>>= 7;
            if (value != 0) b |= 0x80;
            out.write(b);
        } while (value != 0);
        return this;
    }

    /**
     * Write a signed LEB128 integer.
     *
     * @param value The value.
     * @return This.
     */
    public ByteOutput putS64(long value) {
        while (true) {
            int b = (int) (value & 0x7F);
            value >>= 7;
            boolean done = (value == 0 && (b & 0x40) == 0) || (value == -1 && (b & 0x40) != 0);
            if (!done) b |= 0x80;
            out.write(b);
            if (done) return this;
        }
    }

    public ByteOutput putS32(int value) {
        return putS64(value);
    }

    public ByteOutput putF32(float value) {
        int bits = Float.floatToRawIntBits(value);
        for (int i = 0; i < 4; i++) {
            out.write((bits >>> (i * 8)) & 0xFF);
        }
        return this;
    }

    public ByteOutput putF64(double value) {
        long bits = Double.doubleToRawLongBits(value);
        for (int i = 0; i < 8; i++) {
            out.write((int) ((bits >>> (i * 8)) & 0xFF));
        }
        return this;
    }

    /**
     * Write a length-prefixed UTF-8 name.
     *
     * @param name The name.
     * @return This.
     */
    public ByteOutput putName(String name) {
        byte[] bytes = name.getBytes(StandardCharsets.UTF_8);
        putU32(bytes.length);
        return putBytes(bytes);
    }

    /**
     * Write the contents of another buffer, prefixed by its length.
     *
     * @param content The buffer.
     * @return This.
     */
    public ByteOutput putSized(ByteOutput content) {
        byte[] bytes = content.toByteArray();
        putU32(bytes.length);
        return putBytes(bytes);
    }

    public int size() {
        return out.size();
    }

    public byte[] toByteArray() {
        return out.toByteArray();
    }
}
