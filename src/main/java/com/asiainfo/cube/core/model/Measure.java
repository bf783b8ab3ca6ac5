package com.asiainfo.cube.core.model;

import com.asiainfo.cube.core.exception.LoadException;
import com.asiainfo.cube.core.schema.ColumnDef;
import com.asiainfo.cube.core.schema.PhysicalSchema;
import com.asiainfo.cube.infra.persistence.StorageSession;

import java.util.Map;

/**
 * 度量：事实表上的一个数值列
 */
public class Measure extends Field {

    public Measure(String name, String label, String description) {
        super(name, label, description, false);
    }

    @Override
    public FieldType type() {
        return FieldType.MEASURE;
    }

    @Override
    public void init(PhysicalSchema.Builder schema) {
        column = ColumnDef.of(name, DataType.FLOAT.sqlType());
        schema.addFactColumn(column);
    }

    @Override
    public Map<String, Object> load(StorageSession session, Object raw) {
        Object value;
        try {
            value = DataType.FLOAT.cast(raw);
        } catch (IllegalArgumentException e) {
            throw new LoadException(name, "Measure '" + name + "' is not numeric: " + raw, e);
        }
        if (value == null) {
            throw new LoadException(name, "Measure '" + name + "' has no value");
        }
        return Map.of(column().name(), value);
    }
}
