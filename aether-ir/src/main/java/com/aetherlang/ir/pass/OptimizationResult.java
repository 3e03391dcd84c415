package com.aetherlang.ir.pass;

import com.aetherlang.ir.validation.ValidationError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 管线运行结果：成功、带警告的成功或失败。校验失败总是 FAILURE。
 */
public class OptimizationResult {

    public enum Status { SUCCESS, SUCCESS_WITH_WARNINGS, FAILURE }

    private final Status status;
    private final List<String> warnings;
    private final List<ValidationError> validationErrors;
    private final int iterations;
    private final Map<String, Integer> passChanges;
    private final String failedPass;

    private OptimizationResult(Status status, List<String> warnings, List<ValidationError> validationErrors,
                               int iterations, Map<String, Integer> passChanges, String failedPass) {
        this.status = status;
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
        this.validationErrors = Collections.unmodifiableList(new ArrayList<>(validationErrors));
        this.iterations = iterations;
        this.passChanges = Collections.unmodifiableMap(new LinkedHashMap<>(passChanges));
        this.failedPass = failedPass;
    }

    static OptimizationResult success(List<String> warnings, int iterations, Map<String, Integer> passChanges) {
        Status status = warnings.isEmpty() ? Status.SUCCESS : Status.SUCCESS_WITH_WARNINGS;
        return new OptimizationResult(status, warnings, Collections.<ValidationError>emptyList(),
                iterations, passChanges, null);
    }

    /**
     * @param failedPass 引入错误的 pass，输入本身不合法时为 null
     */
    static OptimizationResult failure(List<ValidationError> errors, List<String> warnings, int iterations,
                                      Map<String, Integer> passChanges, String failedPass) {
        return new OptimizationResult(Status.FAILURE, warnings, errors, iterations, passChanges, failedPass);
    }

    public Status getStatus() { return status; }
    public List<String> getWarnings() { return warnings; }
    public List<ValidationError> getValidationErrors() { return validationErrors; }
    public int getIterations() { return iterations; }
    /** pass 名 → 报告修改的次数 */
    public Map<String, Integer> getPassChanges() { return passChanges; }
    public String getFailedPass() { return failedPass; }

    public boolean isSuccess() {
        return status != Status.FAILURE;
    }

    public boolean isChanged() {
        for (int count : passChanges.values()) {
            if (count > 0) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(status).append(" after ").append(iterations).append(" iteration(s)");
        if (failedPass != null) sb.append(", failed in ").append(failedPass);
        if (!warnings.isEmpty()) sb.append(", ").append(warnings.size()).append(" warning(s)");
        return sb.toString();
    }
}
