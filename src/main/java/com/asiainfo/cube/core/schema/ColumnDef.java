package com.asiainfo.cube.core.schema;

import com.asiainfo.cube.core.model.SqlNames;

/**
 * 物理列定义
 */
public record ColumnDef(
    String name,        // 列名
    String sqlType,     // TEXT / REAL / INTEGER
    boolean primaryKey
) {
    public static ColumnDef of(String name, String sqlType) {
        return new ColumnDef(name, sqlType, false);
    }

    public static ColumnDef primaryKey(String name) {
        return new ColumnDef(name, "TEXT", true);
    }

    public String toDdl() {
        return SqlNames.quote(name) + " " + sqlType + (primaryKey ? " PRIMARY KEY NOT NULL" : "");
    }
}
