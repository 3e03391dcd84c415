package com.aetherlang.ir.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次校验的全部结果。
 */
public class ValidationReport {

    private final List<ValidationError> entries = new ArrayList<>();

    void addAll(List<ValidationError> more) {
        entries.addAll(more);
    }

    public List<ValidationError> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public List<ValidationError> getErrors() {
        List<ValidationError> result = new ArrayList<>();
        for (ValidationError e : entries) {
            if (e.isError()) result.add(e);
        }
        return result;
    }

    public List<ValidationError> getObservations() {
        List<ValidationError> result = new ArrayList<>();
        for (ValidationError e : entries) {
            if (!e.isError()) result.add(e);
        }
        return result;
    }

    /** 没有 ERROR 级别的结果。 */
    public boolean isValid() {
        for (ValidationError e : entries) {
            if (e.isError()) return false;
        }
        return true;
    }

    @Override
    public String toString() {
        if (entries.isEmpty()) return "OK";
        StringBuilder sb = new StringBuilder();
        for (ValidationError e : entries) sb.append(e).append('\n');
        return sb.toString();
    }
}
