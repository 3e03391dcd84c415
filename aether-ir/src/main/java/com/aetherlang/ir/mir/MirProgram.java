package com.aetherlang.ir.mir;

import java.util.Map;
import java.util.TreeMap;

/**
 * MIR 程序（编译单元）。按名称持有函数、程序级常量、外部函数声明与类型定义。
 * 函数之间只通过名称关联，不共享任何 IR 节点。
 */
public class MirProgram {

    private final Map<String, MirFunction> functions = new TreeMap<>();
    private final Map<String, Constant> constants = new TreeMap<>();
    private final Map<String, ExternalFunction> externalFunctions = new TreeMap<>();
    private final Map<String, TypeDefinition> typeDefinitions = new TreeMap<>();

    public Map<String, MirFunction> getFunctions() { return functions; }
    public Map<String, Constant> getConstants() { return constants; }
    public Map<String, ExternalFunction> getExternalFunctions() { return externalFunctions; }
    public Map<String, TypeDefinition> getTypeDefinitions() { return typeDefinitions; }

    public void addFunction(MirFunction function) {
        functions.put(function.getName(), function);
    }

    public MirFunction getFunction(String name) {
        return functions.get(name);
    }

    public void addConstant(String name, Constant constant) {
        constants.put(name, constant);
    }

    public void addExternalFunction(ExternalFunction function) {
        externalFunctions.put(function.getName(), function);
    }

    public void addTypeDefinition(TypeDefinition definition) {
        typeDefinitions.put(definition.getName(), definition);
    }

    @Override
    public String toString() {
        return MirPrinter.print(this);
    }
}
