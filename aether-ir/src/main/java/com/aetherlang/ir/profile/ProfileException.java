package com.aetherlang.ir.profile;

import java.nio.file.Path;

/**
 * 剖析数据文件无法读取或写入
 */
public class ProfileException extends RuntimeException {
    private final Path path;

    public ProfileException(String message, Path path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (path != null) {
            sb.append(": ").append(path);
        }
        if (getCause() != null && getCause().getMessage() != null) {
            sb.append(" (").append(getCause().getMessage()).append(')');
        }
        return sb.toString();
    }
}
