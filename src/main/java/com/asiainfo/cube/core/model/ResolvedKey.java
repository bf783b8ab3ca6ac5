package com.asiainfo.cube.core.model;

import com.asiainfo.cube.core.CubeConstants;
import com.asiainfo.cube.core.exception.InvalidQueryException;

/**
 * 字段键解析结果
 * 由 FieldModel.resolve() 生成，查询编译阶段不再做字符串拆分
 */
public record ResolvedKey(String key, Kind kind, Field field, String attribute) {

    public enum Kind {
        // 事实表上的列（度量、简单维度）
        FACT_COLUMN,
        // 组合维度的单个属性列，如 to.label
        ATTRIBUTE,
        // 时间维度的虚拟属性，如 year / time.yearmonth
        DERIVED,
        // 未指定属性的组合维度：按整行分组
        FULL_ROW
    }

    public boolean requiresJoin() {
        return kind != Kind.FACT_COLUMN;
    }

    public CompoundDimension dimension() {
        if (!(field instanceof CompoundDimension dimension)) {
            throw new IllegalStateException(key + " does not resolve to a compound dimension");
        }
        return dimension;
    }

    /**
     * 单列 SQL 表达式；FULL_ROW 没有单列表达式
     */
    public String expression() {
        return switch (kind) {
            case FACT_COLUMN -> SqlNames.qualified(CubeConstants.FACT_ALIAS, field.column().name());
            case ATTRIBUTE -> SqlNames.qualified(dimension().alias(), attribute);
            case DERIVED -> dimension().derivedExpression(attribute, dimension().alias());
            case FULL_ROW -> throw new IllegalStateException(key + " resolves to a full dimension row");
        };
    }

    /**
     * 比较值按列类型规范化，派生列统一按字符串比较
     */
    public Object normalizeValue(Object value) {
        if (value == null) {
            return null;
        }
        DataType datatype = switch (kind) {
            case FACT_COLUMN -> field instanceof AttributeDimension dim ? dim.datatype() : DataType.FLOAT;
            case ATTRIBUTE -> dimension().attribute(attribute).datatype();
            case DERIVED, FULL_ROW -> DataType.STRING;
        };
        try {
            return datatype.cast(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidQueryException(String.format("Value %s is not valid for %s: %s", value, key, e.getMessage()));
        }
    }
}
