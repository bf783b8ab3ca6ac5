package com.asiainfo.cube.core.generator;

import com.asiainfo.cube.core.exception.InvalidQueryException;
import com.asiainfo.cube.core.model.AggregateRequest;
import com.asiainfo.cube.core.model.CompoundDimension;
import com.asiainfo.cube.core.model.DateDimension;
import com.asiainfo.cube.core.model.FieldModel;
import com.asiainfo.cube.core.model.ResolvedKey;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * cut 条件：同一列多个值 OR，不同列之间 AND
 */
final class CutConditions {

    private final Map<String, Set<Object>> filters = new LinkedHashMap<>();
    private final Set<CompoundDimension> dimensions = new LinkedHashSet<>();

    private CutConditions() {}

    static CutConditions resolve(FieldModel model, List<AggregateRequest.Cut> cuts) {
        CutConditions conditions = new CutConditions();
        for (AggregateRequest.Cut cut : cuts) {
            ResolvedKey key = model.resolve(cut.key());
            if (key.kind() == ResolvedKey.Kind.FULL_ROW) {
                key = nameAttribute(key);
            }
            if (key.requiresJoin()) {
                conditions.dimensions.add(key.dimension());
            }
            conditions.filters.computeIfAbsent(key.expression(), e -> new LinkedHashSet<>())
                    .add(key.normalizeValue(cut.value()));
        }
        return conditions;
    }

    /**
     * 未指定属性的组合维度按其 name 属性过滤
     */
    private static ResolvedKey nameAttribute(ResolvedKey key) {
        CompoundDimension dimension = key.dimension();
        if (!dimension.hasAttribute(DateDimension.NAME_ATTRIBUTE)) {
            throw new InvalidQueryException(String.format(
                    "Cut on dimension '%s' needs an attribute, e.g. %s.%s",
                    dimension.name(), dimension.name(), dimension.attributes().iterator().next().name()));
        }
        return new ResolvedKey(key.key(), ResolvedKey.Kind.ATTRIBUTE, dimension, DateDimension.NAME_ATTRIBUTE);
    }

    Set<CompoundDimension> dimensions() {
        return dimensions;
    }

    boolean isEmpty() {
        return filters.isEmpty();
    }

    /**
     * 追加 WHERE 子句并收集参数
     */
    String toSql(List<Object> params) {
        if (filters.isEmpty()) {
            return "";
        }
        List<String> clauses = new ArrayList<>();
        for (Map.Entry<String, Set<Object>> entry : filters.entrySet()) {
            List<String> alternatives = new ArrayList<>();
            for (Object value : entry.getValue()) {
                if (value == null) {
                    alternatives.add(entry.getKey() + " IS NULL");
                } else {
                    alternatives.add(entry.getKey() + " = ?");
                    params.add(value);
                }
            }
            clauses.add("(" + String.join(" OR ", alternatives) + ")");
        }
        return " WHERE " + String.join(" AND ", clauses);
    }
}
