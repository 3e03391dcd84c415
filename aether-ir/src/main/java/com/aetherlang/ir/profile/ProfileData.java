package com.aetherlang.ir.profile;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * 运行时剖析数据。
 * <p>
 * 文本格式，每行一条记录，字段以冒号分隔：
 * <pre>
 * FUNC:函数:次数
 * BLOCK:函数:块:次数
 * BRANCH:函数:块:总次数:跳转次数
 * CALL:调用者:被调者:次数
 * LOOP:函数:头块:进入次数:总迭代次数:最大迭代次数
 * </pre>
 * 空行与 # 开头的行被忽略；少于 3 个字段的行、字段不足的记录与未知记录类型被跳过；
 * 无法解析的数字按 0 处理。写出时各表按键排序。
 */
public class ProfileData {

    private static final Logger LOG = Logger.getLogger(ProfileData.class.getName());

    private static final Pattern COUNT = Pattern.compile("\\d{1,18}");
    private static final Pattern BLOCK_ID = Pattern.compile("\\d{1,9}");

    private final Map<String, Long> functionCounts = new TreeMap<>();
    private final Map<String, Map<Integer, Long>> blockCounts = new TreeMap<>();
    private final Map<String, Map<Integer, BranchProfile>> branches = new TreeMap<>();
    private final Map<String, Map<String, Long>> callCounts = new TreeMap<>();
    private final Map<String, Map<Integer, LoopProfile>> loops = new TreeMap<>();

    // ==================== 记录类型 ====================

    /** 分支剖析：total 次执行中 taken 次走向最可能的后继。 */
    public static class BranchProfile {
        private final long total;
        private final long taken;

        public BranchProfile(long total, long taken) {
            this.total = total;
            this.taken = taken;
        }

        public long getTotal() { return total; }
        public long getTaken() { return taken; }

        public double getProbability() {
            return total > 0 ? (double) taken / total : 0.0;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof BranchProfile)) return false;
            BranchProfile other = (BranchProfile) o;
            return total == other.total && taken == other.taken;
        }

        @Override
        public int hashCode() { return Objects.hash(total, taken); }

        @Override
        public String toString() { return taken + "/" + total; }
    }

    /** 循环剖析。 */
    public static class LoopProfile {
        private final long entries;
        private final long totalIterations;
        private final long maxIterations;

        public LoopProfile(long entries, long totalIterations, long maxIterations) {
            this.entries = entries;
            this.totalIterations = totalIterations;
            this.maxIterations = maxIterations;
        }

        public long getEntries() { return entries; }
        public long getTotalIterations() { return totalIterations; }
        public long getMaxIterations() { return maxIterations; }

        public double getAverageIterations() {
            return entries > 0 ? (double) totalIterations / entries : 0.0;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof LoopProfile)) return false;
            LoopProfile other = (LoopProfile) o;
            return entries == other.entries && totalIterations == other.totalIterations
                    && maxIterations == other.maxIterations;
        }

        @Override
        public int hashCode() { return Objects.hash(entries, totalIterations, maxIterations); }

        @Override
        public String toString() { return entries + " entries, " + totalIterations + " iterations, max " + maxIterations; }
    }

    // ==================== 读取 ====================

    public static ProfileData load(Path path) {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            ProfileData data = parse(reader);
            LOG.fine("读取剖析数据 " + path + ": " + data.getStatistics(Long.MAX_VALUE));
            return data;
        } catch (IOException e) {
            throw new ProfileException("无法读取剖析数据", path, e);
        }
    }

    public static ProfileData parse(Reader reader) throws IOException {
        BufferedReader buffered = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        List<String> lines = new ArrayList<>();
        String line;
        while ((line = buffered.readLine()) != null) {
            lines.add(line);
        }
        return parse(lines);
    }

    public static ProfileData parse(List<String> lines) {
        ProfileData data = new ProfileData();
        int lineNo = 0;
        for (String raw : lines) {
            lineNo++;
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            if (!data.parseLine(line)) {
                LOG.fine("跳过剖析数据第 " + lineNo + " 行: " + line);
            }
        }
        return data;
    }

    /**
     * @return 该行是否被接受
     */
    private boolean parseLine(String line) {
        String[] parts = line.split(":", -1);
        if (parts.length < 3) return false;
        switch (parts[0]) {
            case "FUNC":
                recordFunction(parts[1], count(parts[2]));
                return true;
            case "BLOCK":
                if (parts.length < 4) return false;
                recordBlock(parts[1], blockId(parts[2]), count(parts[3]));
                return true;
            case "BRANCH":
                if (parts.length < 5) return false;
                recordBranch(parts[1], blockId(parts[2]), count(parts[3]), count(parts[4]));
                return true;
            case "CALL":
                if (parts.length < 4) return false;
                recordCall(parts[1], parts[2], count(parts[3]));
                return true;
            case "LOOP":
                if (parts.length < 6) return false;
                recordLoop(parts[1], blockId(parts[2]), count(parts[3]), count(parts[4]), count(parts[5]));
                return true;
            default:
                return false;
        }
    }

    private static long count(String field) {
        String s = field.trim();
        return COUNT.matcher(s).matches() ? Long.parseLong(s) : 0L;
    }

    private static int blockId(String field) {
        String s = field.trim();
        return BLOCK_ID.matcher(s).matches() ? Integer.parseInt(s) : 0;
    }

    // ==================== 写出 ====================

    public void write(Writer writer) throws IOException {
        for (Map.Entry<String, Long> e : functionCounts.entrySet()) {
            writer.write("FUNC:" + e.getKey() + ":" + e.getValue() + "\n");
        }
        for (Map.Entry<String, Map<Integer, Long>> f : blockCounts.entrySet()) {
            for (Map.Entry<Integer, Long> e : f.getValue().entrySet()) {
                writer.write("BLOCK:" + f.getKey() + ":" + e.getKey() + ":" + e.getValue() + "\n");
            }
        }
        for (Map.Entry<String, Map<Integer, BranchProfile>> f : branches.entrySet()) {
            for (Map.Entry<Integer, BranchProfile> e : f.getValue().entrySet()) {
                writer.write("BRANCH:" + f.getKey() + ":" + e.getKey() + ":" + e.getValue().getTotal()
                        + ":" + e.getValue().getTaken() + "\n");
            }
        }
        for (Map.Entry<String, Map<String, Long>> f : callCounts.entrySet()) {
            for (Map.Entry<String, Long> e : f.getValue().entrySet()) {
                writer.write("CALL:" + f.getKey() + ":" + e.getKey() + ":" + e.getValue() + "\n");
            }
        }
        for (Map.Entry<String, Map<Integer, LoopProfile>> f : loops.entrySet()) {
            for (Map.Entry<Integer, LoopProfile> e : f.getValue().entrySet()) {
                LoopProfile lp = e.getValue();
                writer.write("LOOP:" + f.getKey() + ":" + e.getKey() + ":" + lp.getEntries() + ":"
                        + lp.getTotalIterations() + ":" + lp.getMaxIterations() + "\n");
            }
        }
        writer.flush();
    }

    public void save(Path path) {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(writer);
        } catch (IOException e) {
            throw new ProfileException("无法写入剖析数据", path, e);
        }
    }

    // ==================== 记录 ====================

    public void recordFunction(String function, long count) {
        functionCounts.put(function, count);
    }

    public void recordBlock(String function, int block, long count) {
        table(blockCounts, function).put(block, count);
    }

    public void recordBranch(String function, int block, long total, long taken) {
        table(branches, function).put(block, new BranchProfile(total, taken));
    }

    public void recordCall(String caller, String callee, long count) {
        table(callCounts, caller).put(callee, count);
    }

    public void recordLoop(String function, int header, long entries, long totalIterations, long maxIterations) {
        table(loops, function).put(header, new LoopProfile(entries, totalIterations, maxIterations));
    }

    private static <K, V> Map<K, V> table(Map<String, Map<K, V>> outer, String key) {
        Map<K, V> inner = outer.get(key);
        if (inner == null) {
            inner = new TreeMap<>();
            outer.put(key, inner);
        }
        return inner;
    }

    // ==================== 查询 ====================

    public boolean isEmpty() {
        return functionCounts.isEmpty() && blockCounts.isEmpty() && branches.isEmpty()
                && callCounts.isEmpty() && loops.isEmpty();
    }

    public Map<String, Long> getFunctionCounts() { return Collections.unmodifiableMap(functionCounts); }

    public long getFunctionCount(String function) {
        Long c = functionCounts.get(function);
        return c != null ? c : 0L;
    }

    /** 有块计数的函数名。 */
    public List<String> getProfiledFunctions() {
        return new ArrayList<>(blockCounts.keySet());
    }

    public Map<Integer, Long> getBlockCounts(String function) {
        Map<Integer, Long> m = blockCounts.get(function);
        return m != null ? Collections.unmodifiableMap(m) : Collections.<Integer, Long>emptyMap();
    }

    public long getBlockCount(String function, int block) {
        Long c = getBlockCounts(function).get(block);
        return c != null ? c : 0L;
    }

    public Map<Integer, BranchProfile> getBranches(String function) {
        Map<Integer, BranchProfile> m = branches.get(function);
        return m != null ? Collections.unmodifiableMap(m) : Collections.<Integer, BranchProfile>emptyMap();
    }

    public BranchProfile getBranch(String function, int block) {
        return getBranches(function).get(block);
    }

    /** 分支概率 taken/total，没有记录时为 0。 */
    public double branchProbability(String function, int block) {
        BranchProfile bp = getBranch(function, block);
        return bp != null ? bp.getProbability() : 0.0;
    }

    /** 调用者 → (被调者 → 次数)。 */
    public Map<String, Map<String, Long>> getCallCounts() {
        return Collections.unmodifiableMap(callCounts);
    }

    public long getCallCount(String caller, String callee) {
        Map<String, Long> m = callCounts.get(caller);
        Long c = m != null ? m.get(callee) : null;
        return c != null ? c : 0L;
    }

    public Map<Integer, LoopProfile> getLoops(String function) {
        Map<Integer, LoopProfile> m = loops.get(function);
        return m != null ? Collections.unmodifiableMap(m) : Collections.<Integer, LoopProfile>emptyMap();
    }

    public LoopProfile getLoop(String function, int header) {
        return getLoops(function).get(header);
    }

    /** 平均迭代次数 total_iters/entries，没有记录时为 0。 */
    public double averageTripCount(String function, int header) {
        LoopProfile lp = getLoop(function, header);
        return lp != null ? lp.getAverageIterations() : 0.0;
    }

    public ProfileStatistics getStatistics(long hotFunctionThreshold) {
        return ProfileStatistics.of(this, hotFunctionThreshold);
    }

    int blockRecordCount() { return nestedSize(blockCounts); }
    int branchRecordCount() { return nestedSize(branches); }
    int callRecordCount() { return nestedSize(callCounts); }
    int loopRecordCount() { return nestedSize(loops); }

    private static int nestedSize(Map<String, ? extends Map<?, ?>> table) {
        int n = 0;
        for (Map<?, ?> m : table.values()) n += m.size();
        return n;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ProfileData)) return false;
        ProfileData other = (ProfileData) o;
        return functionCounts.equals(other.functionCounts) && blockCounts.equals(other.blockCounts)
                && branches.equals(other.branches) && callCounts.equals(other.callCounts)
                && loops.equals(other.loops);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functionCounts, blockCounts, branches, callCounts, loops);
    }
}
