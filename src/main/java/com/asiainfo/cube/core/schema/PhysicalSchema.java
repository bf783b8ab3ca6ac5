package com.asiainfo.cube.core.schema;

import com.asiainfo.cube.core.CubeConstants;
import com.asiainfo.cube.core.exception.InvalidModelException;
import com.asiainfo.cube.core.model.CompoundDimension;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 数据集的物理 schema：事实表 + 维度表 + JOIN 图
 * 由 SchemaCompiler 构建后只读
 */
public class PhysicalSchema {

    private final TableDef factTable;
    private final Map<String, TableDef> dimensionTables;
    private final Map<String, JoinEdge> joins;

    private PhysicalSchema(TableDef factTable, Map<String, TableDef> dimensionTables, Map<String, JoinEdge> joins) {
        this.factTable = factTable;
        this.dimensionTables = Collections.unmodifiableMap(dimensionTables);
        this.joins = Collections.unmodifiableMap(joins);
    }

    public TableDef factTable() {
        return factTable;
    }

    public Map<String, TableDef> dimensionTables() {
        return dimensionTables;
    }

    public JoinEdge join(String dimension) {
        JoinEdge edge = joins.get(dimension);
        if (edge == null) {
            throw new IllegalArgumentException("No join edge for dimension: " + dimension);
        }
        return edge;
    }

    public List<JoinEdge> joins() {
        return List.copyOf(joins.values());
    }

    /**
     * 维度表在前，事实表在后（事实表外键依赖维度表）
     */
    public List<TableDef> allTables() {
        List<TableDef> tables = new ArrayList<>(dimensionTables.values());
        tables.add(factTable);
        return tables;
    }

    public List<String> createStatements() {
        List<String> ddl = new ArrayList<>();
        for (TableDef table : allTables()) {
            ddl.add(table.toCreateSql());
        }
        ddl.addAll(factTable.toIndexSql());
        return ddl;
    }

    /**
     * 先删事实表，再删维度表
     */
    public List<String> dropStatements() {
        List<String> ddl = new ArrayList<>();
        ddl.add(factTable.toDropSql());
        for (TableDef table : dimensionTables.values()) {
            ddl.add(table.toDropSql());
        }
        return ddl;
    }

    public List<String> flushStatements() {
        List<String> dml = new ArrayList<>();
        dml.add(factTable.toDeleteSql());
        for (TableDef table : dimensionTables.values()) {
            dml.add(table.toDeleteSql());
        }
        return dml;
    }

    public static Builder builder(String dataset) {
        return new Builder(dataset);
    }

    /**
     * 字段 init() 时向其登记列与维度表
     */
    public static class Builder {

        private final String dataset;
        private final List<ColumnDef> factColumns = new ArrayList<>();
        private final List<ForeignKeyDef> foreignKeys = new ArrayList<>();
        private final Map<String, TableDef> dimensionTables = new LinkedHashMap<>();
        private final Map<String, JoinEdge> joins = new LinkedHashMap<>();

        private Builder(String dataset) {
            this.dataset = dataset;
            factColumns.add(ColumnDef.primaryKey(CubeConstants.ID_COLUMN));
        }

        public String tableName(String suffix) {
            return dataset + CubeConstants.TABLE_SEPARATOR + suffix;
        }

        public Builder addFactColumn(ColumnDef column) {
            for (ColumnDef existing : factColumns) {
                if (existing.name().equalsIgnoreCase(column.name())) {
                    throw new InvalidModelException(String.format(
                            "Dataset '%s' maps two fields to fact column '%s'", dataset, column.name()));
                }
            }
            factColumns.add(column);
            return this;
        }

        public Builder addForeignKey(ForeignKeyDef foreignKey) {
            foreignKeys.add(foreignKey);
            return this;
        }

        public Builder addDimensionTable(CompoundDimension dimension, TableDef table) {
            dimensionTables.put(dimension.name(), table);
            joins.put(dimension.name(), new JoinEdge(dimension,
                    dimension.name() + CubeConstants.FOREIGN_KEY_SUFFIX, table));
            return this;
        }

        public PhysicalSchema build() {
            TableDef fact = new TableDef(tableName(CubeConstants.FACT_TABLE_SUFFIX), factColumns, foreignKeys);
            for (TableDef table : dimensionTables.values()) {
                if (table.name().equalsIgnoreCase(fact.name())) {
                    throw new InvalidModelException("Dimension table name collides with fact table: " + fact.name());
                }
            }
            return new PhysicalSchema(fact, dimensionTables, joins);
        }
    }
}
