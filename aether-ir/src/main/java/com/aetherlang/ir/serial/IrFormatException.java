package com.aetherlang.ir.serial;

/**
 * MIR 的 JSON 表示无法解析
 */
public class IrFormatException extends RuntimeException {
    private final String path;

    /**
     * @param path 出错的 JSON 路径，如 functions[0].blocks[2]，未知时为 null
     */
    public IrFormatException(String message, String path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public IrFormatException(String message, String path) {
        this(message, path, null);
    }

    public String getPath() {
        return path;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        if (path != null) {
            sb.append(path).append(": ");
        }
        sb.append(super.getMessage());
        if (getCause() != null && getCause().getMessage() != null) {
            sb.append(" (").append(getCause().getMessage()).append(')');
        }
        return sb.toString();
    }
}
