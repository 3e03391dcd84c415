package com.aetherlang.ir.validation;

import com.aetherlang.ir.mir.Location;

/**
 * 一条校验结果。ERROR 级别使校验失败，OBSERVATION 只是提示。
 */
public class ValidationError {

    public enum Severity { ERROR, OBSERVATION }

    public enum Kind {
        UNDEFINED_LOCAL(Severity.ERROR),
        TYPE_MISMATCH(Severity.ERROR),
        MISSING_TERMINATOR(Severity.ERROR),
        INVALID_EDGE(Severity.ERROR),
        UNREACHABLE_CODE(Severity.OBSERVATION),
        UNINITIALIZED_LOCAL(Severity.OBSERVATION),
        MULTIPLE_ASSIGNMENT(Severity.OBSERVATION);

        private final Severity severity;

        Kind(Severity severity) {
            this.severity = severity;
        }

        public Severity getSeverity() { return severity; }
    }

    private final Kind kind;
    private final String function;
    private final int block;
    private final int local;
    private final Location location;
    private final String message;

    public ValidationError(Kind kind, String function, int block, int local, Location location, String message) {
        this.kind = kind;
        this.function = function;
        this.block = block;
        this.local = local;
        this.location = location;
        this.message = message;
    }

    public Kind getKind() { return kind; }
    public Severity getSeverity() { return kind.getSeverity(); }
    public String getFunction() { return function; }
    /** 相关块，无关时为 -1。 */
    public int getBlock() { return block; }
    /** 相关局部变量，无关时为 -1。 */
    public int getLocal() { return local; }
    public Location getLocation() { return location; }
    public String getMessage() { return message; }

    public boolean isError() {
        return kind.getSeverity() == Severity.ERROR;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(isError() ? "error" : "note").append('[').append(kind).append("] ").append(function);
        if (location != null) {
            sb.append(" @").append(location);
        } else if (block >= 0) {
            sb.append(" @B").append(block);
        }
        return sb.append(": ").append(message).toString();
    }
}
