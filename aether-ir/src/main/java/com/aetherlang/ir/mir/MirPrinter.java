package com.aetherlang.ir.mir;

import java.util.Map;

/**
 * MIR 文本转储。
 */
public final class MirPrinter {

    private MirPrinter() {}

    public static String print(MirProgram program) {
        StringBuilder sb = new StringBuilder();
        for (TypeDefinition def : program.getTypeDefinitions().values()) {
            sb.append(def).append("\n");
        }
        for (Map.Entry<String, Constant> e : program.getConstants().entrySet()) {
            sb.append("const ").append(e.getKey()).append(" = ").append(e.getValue()).append(";\n");
        }
        for (ExternalFunction ext : program.getExternalFunctions().values()) {
            sb.append(ext).append(";\n");
        }
        if (sb.length() > 0) sb.append("\n");
        for (MirFunction function : program.getFunctions().values()) {
            sb.append(print(function)).append("\n");
        }
        return sb.toString();
    }

    public static String print(MirFunction function) {
        return function.toString();
    }
}
