package com.asiainfo.cube.core.model;

import com.asiainfo.cube.core.schema.ColumnDef;
import com.asiainfo.cube.core.schema.PhysicalSchema;
import com.asiainfo.cube.infra.persistence.StorageSession;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 字段（度量或维度）
 * 每个字段负责：声明物理列（init）、解析列（column）、转换输入值（load）
 */
public abstract class Field {

    protected final String name;
    protected final String label;
    protected final String description;
    protected final boolean facet;

    // init() 之后才有物理列
    protected ColumnDef column;

    protected Field(String name, String label, String description, boolean facet) {
        this.name = name;
        this.label = label == null ? name : label;
        this.description = description;
        this.facet = facet;
    }

    public abstract FieldType type();

    /**
     * 在物理 schema 中登记本字段需要的列/表
     */
    public abstract void init(PhysicalSchema.Builder schema);

    /**
     * 将原始输入值转换为事实表列值
     *
     * @return 物理列名 -> 存储值
     */
    public abstract Map<String, Object> load(StorageSession session, Object raw);

    public boolean isDimension() {
        return type() != FieldType.MEASURE;
    }

    public ColumnDef column() {
        if (column == null) {
            throw new IllegalStateException("Field '" + name + "' is not initialized, call init() first");
        }
        return column;
    }

    public boolean isInitialized() {
        return column != null;
    }

    public String name() {
        return name;
    }

    public String label() {
        return label;
    }

    public String description() {
        return description;
    }

    public boolean isFacet() {
        return facet;
    }

    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("label", label);
        map.put("type", type().code());
        if (description != null) {
            map.put("description", description);
        }
        map.put("facet", facet);
        return map;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + name + ")";
    }
}
