package io.github.sigwasm.core.wasm;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.HashMap;
import java.util.Map;

/**
 * WebAssembly opcodes used by the compiler.
 * <p>
 * Opcodes with the {@code 0xFC} prefix are represented as {@code 0xFC00 | subopcode}.
 */
public final class Opcodes {
    private Opcodes() {
    }

    public static final byte[] MAGIC = {0x00, 0x61, 0x73, 0x6D};
    public static final int VERSION = 1;

    public static final byte SECTION_TYPE = 1;
    public static final byte SECTION_IMPORT = 2;
    public static final byte SECTION_FUNCTION = 3;
    public static final byte SECTION_GLOBAL = 6;
    public static final byte SECTION_EXPORT = 7;
    public static final byte SECTION_CODE = 10;

    public static final byte TYPE_FUNC = 0x60;
    public static final byte EMPTY_BLOCK_TYPE = 0x40;
    public static final byte IMPORT_FUNC = 0x00;

    public static final int UNREACHABLE = 0x00;
    public static final int NOP = 0x01;
    public static final int BLOCK = 0x02;
    public static final int IF = 0x04;
    public static final int ELSE = 0x05;
    public static final int END = 0x0B;
    public static final int BR = 0x0C;
    public static final int BR_IF = 0x0D;
    public static final int RETURN = 0x0F;
    public static final int CALL = 0x10;
    public static final int DROP = 0x1A;

    public static final int LOCAL_GET = 0x20;
    public static final int LOCAL_SET = 0x21;
    public static final int LOCAL_TEE = 0x22;
    public static final int GLOBAL_GET = 0x23;
    public static final int GLOBAL_SET = 0x24;

    public static final int I32_CONST = 0x41;
    public static final int I64_CONST = 0x42;
    public static final int F32_CONST = 0x43;
    public static final int F64_CONST = 0x44;

    public static final int I32_EQZ = 0x45;
    public static final int I32_EQ = 0x46;
    public static final int I32_NE = 0x47;
    public static final int I32_LT_S = 0x48;
    public static final int I32_GT_S = 0x4A;
    public static final int I32_LE_S = 0x4C;
    public static final int I32_GE_S = 0x4E;

    public static final int I64_EQZ = 0x50;
    public static final int I64_EQ = 0x51;
    public static final int I64_NE = 0x52;
    public static final int I64_LT_S = 0x53;
    public static final int I64_GT_S = 0x55;
    public static final int I64_LE_S = 0x57;
    public static final int I64_GE_S = 0x59;

    public static final int F32_EQ = 0x5B;
    public static final int F32_NE = 0x5C;
    public static final int F32_LT = 0x5D;
    public static final int F32_GT = 0x5E;
    public static final int F32_LE = 0x5F;
    public static final int F32_GE = 0x60;

    public static final int F64_EQ = 0x61;
    public static final int F64_NE = 0x62;
    public static final int F64_LT = 0x63;
    public static final int F64_GT = 0x64;
    public static final int F64_LE = 0x65;
    public static final int F64_GE = 0x66;

    public static final int I32_ADD = 0x6A;
    public static final int I32_SUB = 0x6B;
    public static final int I32_MUL = 0x6C;
    public static final int I32_AND = 0x71;
    public static final int I64_ADD = 0x7C;
    public static final int I64_SUB = 0x7D;
    public static final int I64_MUL = 0x7E;
    public static final int F32_ADD = 0x92;
    public static final int F32_SUB = 0x93;
    public static final int F32_MUL = 0x94;
    public static final int F64_ADD = 0xA0;
    public static final int F64_SUB = 0xA1;
    public static final int F64_MUL = 0xA2;

    public static final int I32_WRAP_I64 = 0xA7;
    public static final int I64_EXTEND_I32_S = 0xAC;
    public static final int F32_CONVERT_I32_S = 0xB2;
    public static final int F32_CONVERT_I64_S = 0xB4;
    public static final int F32_DEMOTE_F64 = 0xB6;
    public static final int F64_CONVERT_I32_S = 0xB7;
    public static final int F64_CONVERT_I64_S = 0xB9;
    public static final int F64_PROMOTE_F32 = 0xBB;
    public static final int I32_EXTEND8_S = 0xC0;
    public static final int I32_EXTEND16_S = 0xC1;

    public static final int PREFIX_FC = 0xFC;
    public static final int I32_TRUNC_SAT_F32_S = 0xFC00;
    public static final int I32_TRUNC_SAT_F64_S = 0xFC02;
    public static final int I64_TRUNC_SAT_F32_S = 0xFC04;
    public static final int I64_TRUNC_SAT_F64_S = 0xFC06;

    private static Map<Integer, String> mnemonics = null;

    /**
     * Look up the mnemonic of an instruction.
     * <p>
     * Mnemonics are derived from the names of the constants in this class,
     * e.g. {@link #I32_TRUNC_SAT_F32_S} is {@code i32.trunc_sat_f32_s}.
     *
     * @param opcode The opcode.
     * @return The mnemonic, or null if the opcode is unknown.
     */
    public static String getMnemonic(int opcode) {
        if (mnemonics == null) generateMnemonics();
        return mnemonics.get(opcode);
    }

    private static void generateMnemonics() {
        Map<Integer, String> map = new HashMap<>();
        for (Field field : Opcodes.class.getFields()) {
            String name = field.getName();
            if (!Modifier.isStatic(field.getModifiers())
                    || field.getType() != int.class
                    || name.startsWith("PREFIX")
                    || name.equals("VERSION")) {
                continue;
            }
            try {
                map.put(field.getInt(null), toMnemonic(name));
            } catch (IllegalAccessException e) {
                throw new IllegalStateException(e);
            }
        }
        mnemonics = map;
    }

    private static String toMnemonic(String fieldName) {
        String lower = fieldName.toLowerCase();
        if (lower.matches("^(i32|i64|f32|f64|local|global)_.*")) {
            int sep = lower.indexOf('_');
            return lower.substring(0, sep) + "." + lower.substring(sep + 1);
        }
        return lower;
    }
}
