package com.asiainfo.cube.core.schema;

import com.asiainfo.cube.core.model.SqlNames;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 物理表定义
 */
public record TableDef(String name, List<ColumnDef> columns, List<ForeignKeyDef> foreignKeys) {

    public TableDef {
        columns = List.copyOf(columns);
        foreignKeys = List.copyOf(foreignKeys);
    }

    public Set<String> columnNames() {
        return columns.stream().map(ColumnDef::name).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public String toCreateSql() {
        List<String> parts = new ArrayList<>();
        for (ColumnDef column : columns) {
            parts.add(column.toDdl());
        }
        for (ForeignKeyDef fk : foreignKeys) {
            parts.add(fk.toDdl());
        }
        return "CREATE TABLE IF NOT EXISTS " + SqlNames.quote(name) + " (\n  "
                + String.join(",\n  ", parts) + "\n)";
    }

    /**
     * 外键列索引，加速星型 JOIN
     */
    public List<String> toIndexSql() {
        List<String> ddl = new ArrayList<>();
        for (ForeignKeyDef fk : foreignKeys) {
            String index = name + "_" + fk.column() + "_idx";
            ddl.add(String.format("CREATE INDEX IF NOT EXISTS %s ON %s (%s)",
                    SqlNames.quote(index), SqlNames.quote(name), SqlNames.quote(fk.column())));
        }
        return ddl;
    }

    public String toDropSql() {
        return "DROP TABLE IF EXISTS " + SqlNames.quote(name);
    }

    public String toDeleteSql() {
        return "DELETE FROM " + SqlNames.quote(name);
    }
}
