package io.github.sigwasm.core.wasm;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a module in a readable text form, for debugging.
 */
public class Disassembler {
    /**
     * Disassemble a module.
     *
     * @param module The module.
     * @return The text.
     */
    public static String disassemble(WasmModule module) {
        StringBuilder sb = new StringBuilder("(module\n");
        for (int i = 0; i < module.types.size(); i++) {
            sb.append("  (type ").append(i).append(' ').append(module.types.get(i)).append(")\n");
        }
        for (int i = 0; i < module.imports.size(); i++) {
            ImportEntry imp = module.imports.get(i);
            sb.append("  (import \"").append(imp.module).append("\" \"").append(imp.name)
                    .append("\" (func ").append(i).append(" (type ").append(imp.typeIndex).append(")))\n");
        }
        for (int i = 0; i < module.globals.size(); i++) {
            sb.append("  ").append(module.globals.get(i)).append(" ;; ").append(i).append('\n');
        }
        for (ExportEntry export : module.exports) {
            sb.append("  ").append(export).append('\n');
        }
        Map<Integer, String> names = new HashMap<>();
        for (ExportEntry export : module.exports) {
            if (export.kind == ExportEntry.FUNC) names.put(export.index, export.name);
        }
        for (int i = 0; i < module.codes.size(); i++) {
            int funcIndex = module.imports.size() + i;
            CodeEntry code = module.codes.get(i);
            sb.append("  (func ").append(funcIndex);
            String name = names.get(funcIndex);
            if (name != null) sb.append(" $").append(name);
            sb.append(" (type ").append(module.functions.get(i)).append(')');
            if (!code.locals.isEmpty()) sb.append(" (local ").append(code.locals).append(')');
            sb.append('\n');
            disassembleBody(sb, InstructionReader.read(code.body));
            sb.append("  )\n");
        }
        return sb.append(")\n").toString();
    }

    private static void disassembleBody(StringBuilder sb, List<Instruction> insns) {
        int depth = 2;
        for (int i = 0; i < insns.size() - 1; i++) {
            Instruction insn = insns.get(i);
            if (insn.opcode == Opcodes.END || insn.opcode == Opcodes.ELSE) depth--;
            for (int j = 0; j < depth; j++) sb.append("  ");
            sb.append(insn).append('\n');
            if (insn.opcode == Opcodes.BLOCK || insn.opcode == Opcodes.IF || insn.opcode == Opcodes.ELSE) depth++;
        }
    }
}
