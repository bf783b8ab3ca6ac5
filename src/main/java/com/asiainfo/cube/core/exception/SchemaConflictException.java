package com.asiainfo.cube.core.exception;

import java.util.Set;

/**
 * 已存在的物理表结构与当前模型不一致，需要人工迁移
 */
public class SchemaConflictException extends CubeException {

    private final String table;
    private final Set<String> expectedColumns;
    private final Set<String> actualColumns;

    public SchemaConflictException(String table, Set<String> expectedColumns, Set<String> actualColumns) {
        super(String.format("Table %s does not match the model: expected columns %s, found %s",
                table, expectedColumns, actualColumns));
        this.table = table;
        this.expectedColumns = expectedColumns;
        this.actualColumns = actualColumns;
    }

    public String getTable() {
        return table;
    }

    public Set<String> getExpectedColumns() {
        return expectedColumns;
    }

    public Set<String> getActualColumns() {
        return actualColumns;
    }
}
