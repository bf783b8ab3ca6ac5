package com.asiainfo.cube.core.generator;

import com.asiainfo.cube.core.CubeConstants;
import com.asiainfo.cube.core.model.AttributeDimension;
import com.asiainfo.cube.core.model.CompoundDimension;
import com.asiainfo.cube.core.model.DataType;
import com.asiainfo.cube.core.model.Field;
import com.asiainfo.cube.core.model.Measure;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 查询结果行解码：扁平列别名 -> 嵌套结构
 * 简单维度为标量，组合维度为 {属性: 值}，时间维度补充 year / yearmonth
 */
public final class ResultDecoder {

    private ResultDecoder() {}

    /**
     * 汇总行：{measure: sum, num_entries: n}
     */
    public static Map<String, Object> decodeTotals(Map<String, Object> row, AggregatePlan plan) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(plan.measure(), toDouble(row.get(AggregateSqlGenerator.TOTAL_ALIAS)));
        result.put(CubeConstants.NUM_ENTRIES, toLong(row.get(AggregateSqlGenerator.NUM_ENTRIES_ALIAS)));
        return result;
    }

    public static Map<String, Object> decodeAggregate(Map<String, Object> row, AggregatePlan plan) {
        Map<String, Object> result = decodeTotals(row, plan);
        decodeColumns(row, plan.outputs(), result);
        return result;
    }

    public static Map<String, Object> decodeEntry(Map<String, Object> row, List<OutputColumn> outputs) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(CubeConstants.ID_COLUMN, row.get(CubeConstants.ID_COLUMN));
        decodeColumns(row, outputs, result);
        return result;
    }

    private static void decodeColumns(Map<String, Object> row, List<OutputColumn> outputs, Map<String, Object> result) {
        Map<CompoundDimension, Map<String, Object>> nestedByDimension = new LinkedHashMap<>();
        for (OutputColumn output : outputs) {
            Field field = output.field();
            Object value = row.get(output.alias());
            if (output.attribute() == null) {
                result.put(field.name(), scalar(field, value));
            } else {
                CompoundDimension dimension = (CompoundDimension) field;
                nested(result, nestedByDimension, dimension)
                        .put(output.attribute(), attributeValue(dimension, output.attribute(), value));
            }
        }
        // 整行分组（包含全部存储属性）时补充派生属性
        nestedByDimension.forEach((dimension, nested) -> {
            if (dimension.attributes().stream().allMatch(a -> nested.containsKey(a.name()))) {
                dimension.decorate(nested);
            }
        });
    }

    private static Map<String, Object> nested(Map<String, Object> result,
                                              Map<CompoundDimension, Map<String, Object>> nestedByDimension,
                                              CompoundDimension dimension) {
        return nestedByDimension.computeIfAbsent(dimension, d -> {
            Map<String, Object> nested = new LinkedHashMap<>();
            result.put(d.name(), nested);
            return nested;
        });
    }

    private static Object scalar(Field field, Object value) {
        if (field instanceof Measure) {
            return toDouble(value);
        }
        if (field instanceof AttributeDimension dimension) {
            return dimension.datatype().cast(value);
        }
        return value;
    }

    private static Object attributeValue(CompoundDimension dimension, String attribute, Object value) {
        if (dimension.isDerived(attribute)) {
            return value == null ? null : String.valueOf(value);
        }
        DataType datatype = dimension.attribute(attribute).datatype();
        return datatype.cast(value);
    }

    // SQLite 对空集合 SUM 返回 NULL
    private static double toDouble(Object value) {
        return value instanceof Number n ? n.doubleValue() : 0.0;
    }

    private static long toLong(Object value) {
        return value instanceof Number n ? n.longValue() : 0L;
    }
}
