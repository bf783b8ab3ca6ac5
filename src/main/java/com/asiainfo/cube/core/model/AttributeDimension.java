package com.asiainfo.cube.core.model;

import com.asiainfo.cube.core.exception.LoadException;
import com.asiainfo.cube.core.schema.ColumnDef;
import com.asiainfo.cube.core.schema.PhysicalSchema;
import com.asiainfo.cube.infra.persistence.StorageSession;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * 简单维度：值直接存储在事实表列上，没有独立的维度表
 */
public class AttributeDimension extends Field {

    private final DataType datatype;

    public AttributeDimension(String name, String label, String description, boolean facet, DataType datatype) {
        super(name, label, description, facet);
        this.datatype = datatype;
    }

    @Override
    public FieldType type() {
        return FieldType.VALUE;
    }

    public DataType datatype() {
        return datatype;
    }

    @Override
    public void init(PhysicalSchema.Builder schema) {
        column = ColumnDef.of(name, datatype.sqlType());
        schema.addFactColumn(column);
    }

    @Override
    public Map<String, Object> load(StorageSession session, Object raw) {
        if (raw instanceof Map<?, ?> || raw instanceof Collection<?>) {
            throw new LoadException(name, "Dimension '" + name + "' expects a scalar value, got: " + raw);
        }
        Map<String, Object> values = new HashMap<>();
        try {
            // 允许 null（HashMap 而不是 Map.of）
            values.put(column().name(), datatype.cast(raw));
        } catch (IllegalArgumentException e) {
            throw new LoadException(name, "Invalid value for '" + name + "': " + e.getMessage(), e);
        }
        return values;
    }

    @Override
    public Map<String, Object> asMap() {
        Map<String, Object> map = super.asMap();
        map.put("datatype", datatype.code());
        return map;
    }
}
