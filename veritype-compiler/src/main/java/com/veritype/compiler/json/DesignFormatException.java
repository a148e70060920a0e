package com.veritype.compiler.json;

/**
 * 设计描述 JSON 格式错误，path 指向出错的元素（如 members[2].type.dims[0]）
 */
public class DesignFormatException extends RuntimeException {

    private final String path;

    public DesignFormatException(String path, String message) {
        super(path + ": " + message);
        this.path = path;
    }

    public DesignFormatException(String path, String message, Throwable cause) {
        super(path + ": " + message, cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
