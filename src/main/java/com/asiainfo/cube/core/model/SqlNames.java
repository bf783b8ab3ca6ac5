package com.asiainfo.cube.core.model;

/**
 * SQL 标识符工具
 * 所有表名、列名、别名统一加双引号（维度名如 to/from 本身是关键字）
 */
public final class SqlNames {

    private SqlNames() {}

    public static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    public static String qualified(String alias, String column) {
        return quote(alias) + "." + quote(column);
    }
}
