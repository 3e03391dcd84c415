package com.aetherlang.ir.mir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 具名类型定义（结构体字段表）。
 */
public class TypeDefinition {

    private final String name;
    private final Map<String, MirType> fields;

    public TypeDefinition(String name, Map<String, MirType> fields) {
        this.name = name;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public String getName() { return name; }
    public Map<String, MirType> getFields() { return fields; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("type ").append(name).append(" {");
        boolean first = true;
        for (Map.Entry<String, MirType> e : fields.entrySet()) {
            sb.append(first ? " " : ", ").append(e.getKey()).append(": ").append(e.getValue());
            first = false;
        }
        return sb.append(" }").toString();
    }
}
