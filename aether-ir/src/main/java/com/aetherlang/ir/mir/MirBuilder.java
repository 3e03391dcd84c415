package com.aetherlang.ir.mir;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * MIR 构建辅助类。
 * 封装创建函数、局部变量、基本块与语句的便捷方法；块 / 局部变量 id 由当前函数的计数器分配。
 */
public class MirBuilder {

    /** 参数声明 */
    public static class ParamDecl {
        final String name;
        final MirType type;

        ParamDecl(String name, MirType type) {
            this.name = name;
            this.type = type;
        }
    }

    public static ParamDecl param(String name, MirType type) {
        return new ParamDecl(name, type);
    }

    private MirFunction function;
    private BasicBlock currentBlock;
    private final Deque<List<Integer>> scopes = new ArrayDeque<>();

    public MirFunction getFunction() { return function; }

    public int getCurrentBlock() {
        return requireBlock().getId();
    }

    /**
     * 开始构建新函数：注册参数局部变量，非 unit 返回类型时创建返回局部变量，
     * 创建并切换到入口块。
     *
     * @return 入口块 id
     */
    public int startFunction(String name, MirType returnType, ParamDecl... params) {
        function = new MirFunction(name, returnType);
        scopes.clear();
        for (ParamDecl p : params) {
            int local = function.newLocal(p.name, p.type, Mutability.NOT, null);
            function.addParam(new MirParam(p.name, p.type, local));
        }
        MirType.Kind kind = returnType.getKind();
        if (kind != MirType.Kind.UNIT && kind != MirType.Kind.NEVER) {
            function.setReturnLocal(function.newLocal("_ret", returnType));
        }
        BasicBlock entry = function.newBlock();
        function.setEntryBlock(entry.getId());
        currentBlock = entry;
        return entry.getId();
    }

    // ========== 局部变量 ==========

    public int newLocal(MirType type) {
        return requireFunction().newLocal(null, type);
    }

    public int newLocal(String name, MirType type) {
        return requireFunction().newLocal(name, type);
    }

    /**
     * 声明作用域内的局部变量：发射 StorageLive 并登记到当前作用域，
     * 作用域弹出时发射对应的 StorageDead。
     */
    public int declareLocal(String name, MirType type, Mutability mutability) {
        int local = requireFunction().newLocal(name, type, mutability, null);
        pushStatement(new MirStatement.StorageLive(local));
        if (!scopes.isEmpty()) scopes.peek().add(local);
        return local;
    }

    public int getReturnLocal() {
        return requireFunction().getReturnLocal();
    }

    // ========== 基本块 ==========

    public int newBlock() {
        return requireFunction().newBlock().getId();
    }

    public void switchToBlock(int blockId) {
        BasicBlock block = requireFunction().getBlock(blockId);
        if (block == null) {
            throw new IllegalArgumentException("未知基本块: B" + blockId);
        }
        currentBlock = block;
    }

    // ========== 语句与终止指令 ==========

    public void pushStatement(MirStatement statement) {
        requireBlock().addStatement(statement);
    }

    public void assign(int local, Rvalue rvalue) {
        pushStatement(MirStatement.assign(local, rvalue));
    }

    public void assign(Place place, Rvalue rvalue) {
        pushStatement(MirStatement.assign(place, rvalue));
    }

    public void setTerminator(MirTerminator terminator) {
        requireBlock().setTerminator(terminator);
    }

    public void goTo(int target) {
        setTerminator(MirTerminator.goTo(target));
    }

    public void returnValue() {
        setTerminator(MirTerminator.returnValue());
    }

    // ========== 作用域 ==========

    public void pushScope() {
        scopes.push(new ArrayList<Integer>());
    }

    /**
     * 弹出作用域，按声明逆序为其中的局部变量发射 StorageDead。
     */
    public void popScope() {
        if (scopes.isEmpty()) {
            throw new IllegalStateException("作用域栈为空");
        }
        List<Integer> declared = scopes.pop();
        for (int i = declared.size() - 1; i >= 0; i--) {
            pushStatement(new MirStatement.StorageDead(declared.get(i)));
        }
    }

    /**
     * 结束构建并返回函数。未关闭的作用域视为构建错误。
     */
    public MirFunction finish() {
        MirFunction result = requireFunction();
        if (!scopes.isEmpty()) {
            throw new IllegalStateException("存在未关闭的作用域: " + scopes.size());
        }
        function = null;
        currentBlock = null;
        return result;
    }

    private MirFunction requireFunction() {
        if (function == null) {
            throw new IllegalStateException("尚未调用 startFunction");
        }
        return function;
    }

    private BasicBlock requireBlock() {
        requireFunction();
        if (currentBlock == null) {
            throw new IllegalStateException("没有活动的基本块");
        }
        return currentBlock;
    }
}
