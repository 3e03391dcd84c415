package com.aetherlang.ir.mir;

import java.util.Objects;

/**
 * Assert 失败时的诊断信息。
 */
public class AssertMessage {

    public enum Kind { BOUNDS_CHECK, OVERFLOW, DIVISION_BY_ZERO, REMAINDER_BY_ZERO, CUSTOM }

    private final Kind kind;
    private final String text; // CUSTOM 时使用

    private AssertMessage(Kind kind, String text) {
        this.kind = kind;
        this.text = text;
    }

    public static AssertMessage of(Kind kind) {
        return new AssertMessage(kind, null);
    }

    public static AssertMessage custom(String text) {
        return new AssertMessage(Kind.CUSTOM, text);
    }

    public Kind getKind() { return kind; }
    public String getText() { return text; }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof AssertMessage)) return false;
        AssertMessage other = (AssertMessage) o;
        return kind == other.kind && Objects.equals(text, other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text);
    }

    @Override
    public String toString() {
        return kind == Kind.CUSTOM ? "\"" + text + "\"" : kind.name().toLowerCase();
    }
}
