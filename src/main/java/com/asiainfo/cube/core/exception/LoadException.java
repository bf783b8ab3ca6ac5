package com.asiainfo.cube.core.exception;

/**
 * 单条记录转换/写入失败，不影响已提交的数据
 */
public class LoadException extends CubeException {

    private final String field;

    public LoadException(String field, String message) {
        super(message);
        this.field = field;
    }

    public LoadException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    public static LoadException missingField(String field) {
        return new LoadException(field, "Missing field in entry: " + field);
    }

    public String getField() {
        return field;
    }
}
