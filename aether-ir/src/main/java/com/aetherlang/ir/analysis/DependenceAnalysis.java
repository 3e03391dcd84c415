package com.aetherlang.ir.analysis;

import com.aetherlang.ir.mir.BasicBlock;
import com.aetherlang.ir.mir.BinOp;
import com.aetherlang.ir.mir.Location;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirStatement;
import com.aetherlang.ir.mir.MirTerminator;
import com.aetherlang.ir.mir.Operand;
import com.aetherlang.ir.mir.Place;
import com.aetherlang.ir.mir.Projection;
import com.aetherlang.ir.mir.Rvalue;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 数据依赖分析。
 * <p>
 * 块内：对语句两两比较写入位置与读取位置是否可能重叠，得到 FLOW / ANTI / OUTPUT 依赖。
 * 循环携带：以归纳变量为下标的数组访问按偏移差计算迭代距离；
 * 下标无法表示为归纳变量加常量时保守地视为携带依赖；
 * 在循环头入口活跃且在循环内被写的标量构成距离为 1 的携带依赖。
 */
public final class DependenceAnalysis {

    private DependenceAnalysis() {}

    // ==================== 块内依赖 ====================

    public static List<Dependence> analyzeBlock(MirFunction function, int blockId, Set<Integer> addressTaken) {
        List<Dependence> result = new ArrayList<>();
        List<MirStatement> stmts = function.getBlock(blockId).getStatements();
        for (int i = 0; i < stmts.size(); i++) {
            if (!(stmts.get(i) instanceof MirStatement.Assign)) continue;
            MirStatement.Assign first = (MirStatement.Assign) stmts.get(i);
            List<Place> firstReads = readPlaces(first);
            for (int j = i + 1; j < stmts.size(); j++) {
                if (!(stmts.get(j) instanceof MirStatement.Assign)) continue;
                MirStatement.Assign second = (MirStatement.Assign) stmts.get(j);
                Location src = new Location(blockId, i);
                Location sink = new Location(blockId, j);
                int local = first.getPlace().getLocal();
                if (overlapsAny(first.getPlace(), readPlaces(second), addressTaken)) {
                    result.add(Dependence.intraIteration(Dependence.Kind.FLOW, local, src, sink));
                }
                if (overlapsAny(second.getPlace(), firstReads, addressTaken)) {
                    result.add(Dependence.intraIteration(Dependence.Kind.ANTI,
                            second.getPlace().getLocal(), src, sink));
                }
                if (mayOverlap(first.getPlace(), second.getPlace(), addressTaken)) {
                    result.add(Dependence.intraIteration(Dependence.Kind.OUTPUT, local, src, sink));
                }
            }
        }
        return result;
    }

    // ==================== 循环依赖 ====================

    /**
     * 循环内全部依赖：各块的块内依赖加上循环携带依赖。
     *
     * @param liveAtHeader 循环头入口处活跃的局部变量
     */
    public static List<Dependence> analyzeLoop(LoopForest forest, LoopInfo loop,
                                               Set<Integer> liveAtHeader, Set<Integer> addressTaken) {
        MirFunction function = forest.getFunction();
        List<Dependence> result = new ArrayList<>();
        for (int block : loop.getBlocks()) {
            result.addAll(analyzeBlock(function, block, addressTaken));
        }
        collectIndexedDependences(forest, loop, result);
        collectScalarDependences(function, loop, liveAtHeader, result);
        return result;
    }

    public static boolean hasLoopCarried(List<Dependence> deps, Set<Integer> ignoredLocals) {
        for (Dependence d : deps) {
            if (d.isLoopCarried() && !ignoredLocals.contains(d.getLocal())) return true;
        }
        return false;
    }

    private static final class Access {
        final Location location;
        final int base;
        final int index;
        final boolean write;

        Access(Location location, int base, int index, boolean write) {
            this.location = location;
            this.base = base;
            this.index = index;
            this.write = write;
        }
    }

    private static void collectIndexedDependences(LoopForest forest, LoopInfo loop, List<Dependence> out) {
        MirFunction function = forest.getFunction();
        InductionVariables ivs = forest.getInductionVariables(loop.getHeader());
        List<Access> accesses = new ArrayList<>();
        for (int blockId : loop.getBlocks()) {
            List<MirStatement> stmts = function.getBlock(blockId).getStatements();
            for (int i = 0; i < stmts.size(); i++) {
                if (!(stmts.get(i) instanceof MirStatement.Assign)) continue;
                MirStatement.Assign assign = (MirStatement.Assign) stmts.get(i);
                Location loc = new Location(blockId, i);
                addIndexed(accesses, loc, assign.getPlace(), true);
                for (Place p : readPlaces(assign)) addIndexed(accesses, loc, p, false);
            }
        }

        for (int a = 0; a < accesses.size(); a++) {
            Access p = accesses.get(a);
            BigInteger[] offP = affineOffset(forest, ivs, p.index, p.location);
            if (p.write && offP == null) {
                out.add(new Dependence(Dependence.Kind.OUTPUT, p.base, p.location, p.location,
                        Dependence.UNKNOWN_DISTANCE, Dependence.Direction.ANY, true));
            }
            for (int b = 0; b < accesses.size(); b++) {
                if (a == b) continue;
                Access q = accesses.get(b);
                if (q.base != p.base || (!p.write && !q.write)) continue;
                BigInteger[] offQ = affineOffset(forest, ivs, q.index, q.location);
                if (offP == null || offQ == null || !offP[0].equals(offQ[0])) {
                    // 下标关系未知，每个无序对只记录一次
                    if (a < b) {
                        out.add(new Dependence(kindOf(p, q), p.base, p.location, q.location,
                                Dependence.UNKNOWN_DISTANCE, Dependence.Direction.ANY, true));
                    }
                    continue;
                }
                BigInteger diff = offP[1].subtract(offQ[1]);
                BigInteger step = ivs.findBasic(offP[0].intValue()).getStep();
                if (diff.signum() == 0 || step.signum() == 0) continue;
                BigInteger[] qr = diff.divideAndRemainder(step);
                if (qr[1].signum() != 0 || qr[0].signum() <= 0) continue;
                // p 在第 t 次迭代访问的元素，q 在第 t + d 次迭代再次访问
                out.add(new Dependence(kindOf(p, q), p.base, p.location, q.location,
                        qr[0].longValue(), Dependence.Direction.LESS, true));
            }
        }
    }

    private static Dependence.Kind kindOf(Access source, Access sink) {
        if (source.write && sink.write) return Dependence.Kind.OUTPUT;
        return source.write ? Dependence.Kind.FLOW : Dependence.Kind.ANTI;
    }

    private static void addIndexed(List<Access> out, Location loc, Place place, boolean write) {
        List<Projection> proj = place.getProjection();
        for (int k = proj.size() - 1; k >= 0; k--) {
            if (proj.get(k) instanceof Projection.Index) {
                out.add(new Access(loc, place.getLocal(), ((Projection.Index) proj.get(k)).getLocal(), write));
                return;
            }
        }
    }

    /**
     * 下标局部变量相对本次迭代起始时基本归纳变量的偏移：{归纳变量 id, 常量偏移}，
     * 无法表示时返回 null。位于归纳变量更新之后的读取要额外加上一个步长。
     */
    private static BigInteger[] affineOffset(LoopForest forest, InductionVariables ivs, int index, Location at) {
        if (ivs == null) return null;
        InductionVariables.Basic basic = ivs.findBasic(index);
        if (basic != null) {
            BigInteger off = isAfter(forest, basic.getDefinition(), at) ? basic.getStep() : BigInteger.ZERO;
            return new BigInteger[]{BigInteger.valueOf(index), off};
        }
        for (InductionVariables.Derived d : ivs.getDerived()) {
            if (d.getLocal() != index || d.getOp() != BinOp.ADD) continue;
            InductionVariables.Basic base = ivs.findBasic(d.getBase());
            BigInteger off = InductionVariableAnalysis.intConstant(Operand.constant(d.getFactor()));
            if (isAfter(forest, base.getDefinition(), d.getDefinition())) off = off.add(base.getStep());
            return new BigInteger[]{BigInteger.valueOf(d.getBase()), off};
        }
        return null;
    }

    /** 在一次迭代内，at 是否在 def 执行之后。 */
    private static boolean isAfter(LoopForest forest, Location def, Location at) {
        if (def.getBlock() == at.getBlock()) return at.getStatementIndex() > def.getStatementIndex();
        return forest.getDominators().dominates(def.getBlock(), at.getBlock());
    }

    private static void collectScalarDependences(MirFunction function, LoopInfo loop, Set<Integer> liveAtHeader,
                                                 List<Dependence> out) {
        TreeMap<Integer, Location> firstWrite = new TreeMap<>();
        TreeMap<Integer, Location> firstRead = new TreeMap<>();
        for (int blockId : loop.getBlocks()) {
            BasicBlock block = function.getBlock(blockId);
            List<MirStatement> stmts = block.getStatements();
            for (int i = 0; i < stmts.size(); i++) {
                Location loc = new Location(blockId, i);
                MirStatement stmt = stmts.get(i);
                Set<Integer> reads = new TreeSet<>();
                stmt.collectReadLocals(reads);
                for (int r : reads) firstRead.putIfAbsent(r, loc);
                if (stmt instanceof MirStatement.Assign) {
                    int def = ((MirStatement.Assign) stmt).getDefinedLocal();
                    if (def >= 0) firstWrite.putIfAbsent(def, loc);
                }
            }
            Location termLoc = new Location(blockId, stmts.size());
            Set<Integer> reads = new TreeSet<>();
            block.getTerminator().collectReadLocals(reads);
            for (int r : reads) firstRead.putIfAbsent(r, termLoc);
            if (block.getTerminator() instanceof MirTerminator.Call) {
                Place dest = ((MirTerminator.Call) block.getTerminator()).getDestination();
                if (dest != null && !dest.hasProjection()) firstWrite.putIfAbsent(dest.getLocal(), termLoc);
            }
        }
        for (int local : firstWrite.keySet()) {
            if (!liveAtHeader.contains(local) || !firstRead.containsKey(local)) continue;
            out.add(new Dependence(Dependence.Kind.FLOW, local, firstWrite.get(local), firstRead.get(local),
                    1, Dependence.Direction.LESS, true));
        }
    }

    // ==================== 位置重叠 ====================

    /**
     * 两个位置是否可能指向同一存储。
     * 同一局部变量时，只有在某层字段投影明确不同才判定不重叠；
     * 不同局部变量时，只有经指针解引用且可能别名时才重叠。
     */
    public static boolean mayOverlap(Place a, Place b, Set<Integer> addressTaken) {
        if (a.getLocal() == b.getLocal()) {
            List<Projection> pa = a.getProjection();
            List<Projection> pb = b.getProjection();
            int n = Math.min(pa.size(), pb.size());
            for (int k = 0; k < n; k++) {
                Projection x = pa.get(k);
                Projection y = pb.get(k);
                if (x instanceof Projection.Field && y instanceof Projection.Field
                        && ((Projection.Field) x).getIndex() != ((Projection.Field) y).getIndex()) {
                    return false;
                }
            }
            return true;
        }
        if (a.hasDeref() && b.hasDeref()) return true;
        if (a.hasDeref()) return addressTaken.contains(b.getLocal());
        if (b.hasDeref()) return addressTaken.contains(a.getLocal());
        return false;
    }

    private static boolean overlapsAny(Place place, List<Place> others, Set<Integer> addressTaken) {
        for (Place o : others) {
            if (mayOverlap(place, o, addressTaken)) return true;
        }
        return false;
    }

    /**
     * 语句读取的位置：操作数、Ref/Len/Discriminant 的位置、下标局部变量，
     * 以及带投影写入时目标的基址局部变量。
     */
    static List<Place> readPlaces(MirStatement.Assign assign) {
        List<Place> result = new ArrayList<>();
        Rvalue rv = assign.getRvalue();
        for (Operand op : rv.getOperands()) {
            if (op.getPlace() != null) addWithIndices(result, op.getPlace());
        }
        if (rv instanceof Rvalue.Ref) addWithIndices(result, ((Rvalue.Ref) rv).getPlace());
        if (rv instanceof Rvalue.Len) addWithIndices(result, ((Rvalue.Len) rv).getPlace());
        if (rv instanceof Rvalue.Discriminant) addWithIndices(result, ((Rvalue.Discriminant) rv).getPlace());
        Place dest = assign.getPlace();
        if (dest.hasDeref()) result.add(Place.of(dest.getLocal()));
        Set<Integer> indices = new TreeSet<>();
        dest.collectIndexLocals(indices);
        for (int idx : indices) result.add(Place.of(idx));
        return result;
    }

    private static void addWithIndices(List<Place> out, Place place) {
        out.add(place);
        Set<Integer> indices = new TreeSet<>();
        place.collectIndexLocals(indices);
        for (int idx : indices) out.add(Place.of(idx));
    }
}
