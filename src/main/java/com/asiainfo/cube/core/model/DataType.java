package com.asiainfo.cube.core.model;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Arrays;

/**
 * 属性/字段的数据类型
 * 决定物理列类型以及原始值的转换方式
 */
public enum DataType {
    STRING("string", "TEXT"),
    ID("id", "TEXT"),
    FLOAT("float", "REAL"),
    INTEGER("integer", "INTEGER"),
    DATE("date", "TEXT");

    private final String code;
    private final String sqlType;

    DataType(String code, String sqlType) {
        this.code = code;
        this.sqlType = sqlType;
    }

    public String code() {
        return code;
    }

    public String sqlType() {
        return sqlType;
    }

    public static DataType fromCode(String code) {
        if (code == null || code.isEmpty()) {
            return STRING;
        }
        return Arrays.stream(values())
                .filter(t -> t.code.equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown datatype: " + code));
    }

    /**
     * 将原始值转换为存储值
     *
     * @throws IllegalArgumentException 值无法转换
     */
    public Object cast(Object raw) {
        if (raw == null) {
            return null;
        }
        return switch (this) {
            case STRING, ID -> raw instanceof String s ? s : String.valueOf(raw);
            case FLOAT -> toDouble(raw);
            case INTEGER -> toLong(raw);
            case DATE -> toDate(raw);
        };
    }

    private static Double toDouble(Object raw) {
        if (raw instanceof Number n) {
            return n.doubleValue();
        }
        String text = String.valueOf(raw).trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Double.valueOf(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a number: " + raw, e);
        }
    }

    private static Long toLong(Object raw) {
        if (raw instanceof Number n) {
            if (n.doubleValue() != Math.rint(n.doubleValue())) {
                throw new IllegalArgumentException("Not an integer: " + raw);
            }
            return n.longValue();
        }
        String text = String.valueOf(raw).trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Long.valueOf(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not an integer: " + raw, e);
        }
    }

    private static String toDate(Object raw) {
        if (raw instanceof LocalDate d) {
            return d.toString();
        }
        String text = String.valueOf(raw).trim();
        try {
            return LocalDate.parse(text).toString();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Not an ISO date: " + raw, e);
        }
    }
}
