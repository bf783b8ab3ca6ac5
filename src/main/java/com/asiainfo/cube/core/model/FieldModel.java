package com.asiainfo.cube.core.model;

import com.asiainfo.cube.core.CubeConstants;
import com.asiainfo.cube.core.exception.UnknownFieldException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 数据集的字段模型：字段名 -> 字段对象
 */
public class FieldModel {

    private final Map<String, Field> fields;
    private final DateDimension timeDimension;

    public FieldModel(List<Field> fields, DateDimension timeDimension) {
        Map<String, Field> byName = new LinkedHashMap<>();
        for (Field field : fields) {
            byName.put(field.name(), field);
        }
        this.fields = Collections.unmodifiableMap(byName);
        this.timeDimension = timeDimension;
    }

    public List<Field> fields() {
        return List.copyOf(fields.values());
    }

    public List<Measure> measures() {
        return fields.values().stream()
                .filter(Measure.class::isInstance)
                .map(Measure.class::cast)
                .toList();
    }

    public List<Field> dimensions() {
        return fields.values().stream().filter(Field::isDimension).toList();
    }

    public List<CompoundDimension> compounds() {
        return fields.values().stream()
                .filter(CompoundDimension.class::isInstance)
                .map(CompoundDimension.class::cast)
                .toList();
    }

    public List<Field> facetDimensions() {
        return fields.values().stream()
                .filter(f -> f.isDimension() && f.isFacet())
                .toList();
    }

    public boolean contains(String name) {
        return fields.containsKey(name);
    }

    public Field field(String name) {
        Field field = fields.get(name);
        if (field == null) {
            throw new UnknownFieldException(name);
        }
        return field;
    }

    /**
     * 默认时间维度，可能为 null
     */
    public DateDimension timeDimension() {
        return timeDimension;
    }

    /**
     * 解析查询键
     * 1. "dim.attr"：按第一个 "." 拆分，先找组合维度，再找其属性（时间维度支持 year / yearmonth）
     * 2. 字段名：度量、简单维度 -> 事实表列；组合维度 -> 整行
     * 3. year / yearmonth：默认时间维度上的虚拟属性
     */
    public ResolvedKey resolve(String key) {
        if (key == null || key.isEmpty()) {
            throw new UnknownFieldException(String.valueOf(key), "Empty field key");
        }
        int dot = key.indexOf('.');
        if (dot >= 0) {
            String dimensionName = key.substring(0, dot);
            String attribute = key.substring(dot + 1);
            Field field = fields.get(dimensionName);
            if (!(field instanceof CompoundDimension dimension)) {
                throw new UnknownFieldException(key, "Not a compound dimension: " + dimensionName);
            }
            if (dimension.isDerived(attribute)) {
                return new ResolvedKey(key, ResolvedKey.Kind.DERIVED, dimension, attribute);
            }
            if (!dimension.hasAttribute(attribute)) {
                throw new UnknownFieldException(key,
                        String.format("Dimension '%s' has no attribute '%s'", dimensionName, attribute));
            }
            return new ResolvedKey(key, ResolvedKey.Kind.ATTRIBUTE, dimension, attribute);
        }

        Field field = fields.get(key);
        if (field instanceof CompoundDimension) {
            return new ResolvedKey(key, ResolvedKey.Kind.FULL_ROW, field, null);
        }
        if (field != null) {
            return new ResolvedKey(key, ResolvedKey.Kind.FACT_COLUMN, field, null);
        }
        if (CubeConstants.TIME_LABELS.contains(key) && timeDimension != null) {
            return new ResolvedKey(key, ResolvedKey.Kind.DERIVED, timeDimension, key);
        }
        throw new UnknownFieldException(key);
    }
}
