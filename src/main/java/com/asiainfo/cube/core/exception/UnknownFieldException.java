package com.asiainfo.cube.core.exception;

/**
 * 字段名（或 dimension.attribute 组合键）无法在模型中解析
 */
public class UnknownFieldException extends CubeException {

    private final String key;

    public UnknownFieldException(String key) {
        this(key, "Unknown field: " + key);
    }

    public UnknownFieldException(String key, String message) {
        super(message);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
