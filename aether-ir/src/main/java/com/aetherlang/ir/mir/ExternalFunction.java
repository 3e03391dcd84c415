package com.aetherlang.ir.mir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 外部声明的函数（无函数体）。
 */
public class ExternalFunction {

    private final String name;
    private final List<MirType> paramTypes;
    private final MirType returnType;
    private final CallingConvention callingConvention;
    private final boolean variadic;

    public ExternalFunction(String name, List<MirType> paramTypes, MirType returnType,
                            CallingConvention callingConvention, boolean variadic) {
        this.name = name;
        this.paramTypes = Collections.unmodifiableList(new ArrayList<>(paramTypes));
        this.returnType = returnType;
        this.callingConvention = callingConvention;
        this.variadic = variadic;
    }

    public String getName() { return name; }
    public List<MirType> getParamTypes() { return paramTypes; }
    public MirType getReturnType() { return returnType; }
    public CallingConvention getCallingConvention() { return callingConvention; }
    public boolean isVariadic() { return variadic; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("extern \"");
        sb.append(callingConvention.name().toLowerCase()).append("\" fn ").append(name).append("(");
        for (int i = 0; i < paramTypes.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(paramTypes.get(i));
        }
        if (variadic) sb.append(paramTypes.isEmpty() ? "..." : ", ...");
        sb.append(") -> ").append(returnType);
        return sb.toString();
    }
}
