package com.asiainfo.cube.core.model;

import java.util.Arrays;

/**
 * mapping 中的字段类型标签
 */
public enum FieldType {
    MEASURE("measure"),
    VALUE("value"),
    COMPOUND("compound"),
    DATE("date");

    private final String code;

    FieldType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static FieldType fromCode(String code) {
        return Arrays.stream(values())
                .filter(t -> t.code.equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown field type: " + code));
    }
}
