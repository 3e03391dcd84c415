package com.aetherlang.ir.mir;

import java.util.ArrayList;
import java.util.List;

/**
 * MIR 基本块。
 */
public class BasicBlock {

    private final int id;
    private final List<MirStatement> statements = new ArrayList<>();
    private MirTerminator terminator = MirTerminator.unreachable();
    /** 向量化通道数提示，0 表示未向量化 */
    private int vectorWidth;

    public BasicBlock(int id) {
        this.id = id;
    }

    public int getId() { return id; }
    public List<MirStatement> getStatements() { return statements; }
    public MirTerminator getTerminator() { return terminator; }
    public void setTerminator(MirTerminator terminator) { this.terminator = terminator; }

    public int getVectorWidth() { return vectorWidth; }
    public void setVectorWidth(int vectorWidth) { this.vectorWidth = vectorWidth; }

    public void addStatement(MirStatement statement) {
        statements.add(statement);
    }

    public List<Integer> getSuccessors() {
        return terminator.getSuccessors();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("  B").append(id).append(":");
        if (vectorWidth > 0) sb.append("  // vector x").append(vectorWidth);
        sb.append("\n");
        for (MirStatement stmt : statements) {
            sb.append("    ").append(stmt).append(";\n");
        }
        sb.append("    ").append(terminator).append(";\n");
        return sb.toString();
    }
}
