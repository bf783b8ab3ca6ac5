package com.asiainfo.cube.core.generator;

import com.asiainfo.cube.core.CubeConstants;
import com.asiainfo.cube.core.model.Attribute;
import com.asiainfo.cube.core.model.CompoundDimension;
import com.asiainfo.cube.core.model.EntriesRequest;
import com.asiainfo.cube.core.model.Field;
import com.asiainfo.cube.core.model.FieldModel;
import com.asiainfo.cube.core.model.SqlRequest;
import com.asiainfo.cube.core.schema.PhysicalSchema;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.asiainfo.cube.core.model.SqlNames.qualified;
import static com.asiainfo.cube.core.model.SqlNames.quote;

/**
 * 明细查询编译器
 * 事实行 + 所有组合维度的属性（反范式展开），按 id 排序，分批拉取
 */
public class EntriesSqlGenerator {

    private final FieldModel model;
    private final PhysicalSchema schema;

    public EntriesSqlGenerator(FieldModel model, PhysicalSchema schema) {
        this.model = model;
        this.schema = schema;
    }

    public EntriesPlan compile(EntriesRequest request) {
        CutConditions cuts = CutConditions.resolve(model, request.cuts());

        List<String> selects = new ArrayList<>();
        List<OutputColumn> outputs = new ArrayList<>();
        selects.add(qualified(CubeConstants.FACT_ALIAS, CubeConstants.ID_COLUMN) + " AS " + quote(CubeConstants.ID_COLUMN));

        Set<CompoundDimension> joins = new LinkedHashSet<>();
        for (Field field : model.fields()) {
            if (field instanceof CompoundDimension dimension) {
                joins.add(dimension);
                for (Attribute attribute : dimension.attributes()) {
                    add(qualified(dimension.alias(), attribute.name()), dimension, attribute.name(), selects, outputs);
                }
            } else {
                add(qualified(CubeConstants.FACT_ALIAS, field.column().name()), field, null, selects, outputs);
            }
        }

        StringBuilder sql = new StringBuilder("SELECT ").append(String.join(", ", selects));
        sql.append(" FROM ").append(quote(schema.factTable().name()))
                .append(" AS ").append(quote(CubeConstants.FACT_ALIAS));
        for (CompoundDimension dimension : joins) {
            sql.append(" ").append(schema.join(dimension.name()).toSql(CubeConstants.FACT_ALIAS));
        }
        List<Object> params = new ArrayList<>();
        sql.append(cuts.toSql(params));
        sql.append(" ORDER BY ").append(qualified(CubeConstants.FACT_ALIAS, CubeConstants.ID_COLUMN));

        return new EntriesPlan(sql.toString(), List.copyOf(params), List.copyOf(outputs),
                request.limit(), request.offset());
    }

    /**
     * 事实表总行数
     */
    public SqlRequest count() {
        return new SqlRequest(String.format("SELECT COUNT(*) AS %s FROM %s",
                quote(CubeConstants.NUM_ENTRIES), quote(schema.factTable().name())));
    }

    private static void add(String expr, Field field, String attribute,
                            List<String> selects, List<OutputColumn> outputs) {
        String alias = "e" + outputs.size();
        selects.add(expr + " AS " + quote(alias));
        outputs.add(new OutputColumn(alias, field, attribute));
    }

    /**
     * 明细查询计划：同一 SQL 按批次追加 LIMIT / OFFSET
     *
     * @param limit  最多返回条数，null 表示不限
     * @param offset 起始偏移
     */
    public record EntriesPlan(String sql, List<Object> params, List<OutputColumn> outputs,
                              Integer limit, int offset) {

        public SqlRequest batch(int batchOffset, int batchSize) {
            List<Object> batchParams = new ArrayList<>(params);
            batchParams.add(batchSize);
            batchParams.add(batchOffset);
            return new SqlRequest(sql + " LIMIT ? OFFSET ?", batchParams);
        }
    }
}
