package io.github.sigwasm.core.wasm;

import io.github.sigwasm.core.ModuleEncodingException;

/**
 * A cursor over bytes in the WebAssembly binary format.
 */
public class ByteInput {
    private final byte[] bytes;
    private int pos;
    private final int limit;

    public ByteInput(byte[] bytes) {
        this.bytes = bytes;
        this.limit = bytes.length;
    }

    public boolean hasMore() {
        return pos < limit;
    }

    public int position() {
        return pos;
    }

    public int get() {
        if (pos >= limit) {
            throw new ModuleEncodingException("unexpected end of input at offset " + pos);
        }
        return bytes[pos++] & 0xFF;
    }

    public long getU32() {
        long result = 0;
        int shift = 0;
        int b;
        do {
            if (shift > 28) {
                throw new ModuleEncodingException("u32 too long at offset " + pos);
            }
            b = get();
            result |= (long) (b & 0x7F) << shift;
            shift += 7;
        } while ((b & 0x80) != 0);
        if (result > 0xFFFF_FFFFL) {
            throw new ModuleEncodingException("u32 out of range at offset " + pos);
        }
        return result;
    }

    /**
     * Read an unsigned 32-bit integer that is used as a count or index.
     *
     * @return The value.
     */
    public int getIndex() {
        long value = getU32();
        if (value > Integer.MAX_VALUE) {
            throw new ModuleEncodingException("index " + value + " too large at offset " + pos);
        }
        return (int) value;
    }

    public long getS64() {
        long result = 0;
        int shift = 0;
        int b;
        do {
            b = get();
            result |= (long) (b & 0x7F) << shift;
            shift += 7;
        } while ((b & 0x80) != 0 && shift < 70);
        if (shift < 64 && (b & 0x40) != 0) {
            result |= -1L << shift;
        }
        return result;
    }

    public int getS32() {
        return (int) getS64();
    }

    public float getF32() {
        int bits = 0;
        for (int i = 0; i < 4; i++) {
            bits |= get() << (i * 8);
        }
        return Float.intBitsToFloat(bits);
    }

    public double getF64() {
        long bits = 0;
        for (int i = 0; i < 8; i++) {
            bits |= (long) get() << (i * 8);
        }
        return Double.longBitsToDouble(bits);
    }
}
