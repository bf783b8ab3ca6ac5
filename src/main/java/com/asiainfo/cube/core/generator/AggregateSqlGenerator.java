package com.asiainfo.cube.core.generator;

import com.asiainfo.cube.core.CubeConstants;
import com.asiainfo.cube.core.exception.InvalidQueryException;
import com.asiainfo.cube.core.model.AggregateRequest;
import com.asiainfo.cube.core.model.CompoundDimension;
import com.asiainfo.cube.core.model.Field;
import com.asiainfo.cube.core.model.FieldModel;
import com.asiainfo.cube.core.model.Measure;
import com.asiainfo.cube.core.model.ResolvedKey;
import com.asiainfo.cube.core.model.SqlRequest;
import com.asiainfo.cube.core.schema.ColumnDef;
import com.asiainfo.cube.core.schema.PhysicalSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import static com.asiainfo.cube.core.model.SqlNames.qualified;
import static com.asiainfo.cube.core.model.SqlNames.quote;

/**
 * 聚合查询编译器
 * 将 measure / drilldowns / cuts / order / 分页编译为三段 SQL：
 * 1. 汇总（SUM + COUNT，仅受 cut 约束）
 * 2. 分组数统计（用于分页元数据）
 * 3. 分组、排序、分页后的结果
 */
public class AggregateSqlGenerator {

    private static final Logger log = LoggerFactory.getLogger(AggregateSqlGenerator.class);

    public static final String TOTAL_ALIAS = "total";
    public static final String NUM_ENTRIES_ALIAS = CubeConstants.NUM_ENTRIES;
    public static final String NUM_DRILLDOWNS_ALIAS = "num_drilldowns";

    private final FieldModel model;
    private final PhysicalSchema schema;
    private final int maxPagesize;

    public AggregateSqlGenerator(FieldModel model, PhysicalSchema schema, int maxPagesize) {
        this.model = model;
        this.schema = schema;
        this.maxPagesize = maxPagesize;
    }

    public AggregatePlan compile(AggregateRequest request) {
        int page = request.page();
        int pagesize = request.pagesize() == null ? maxPagesize : request.pagesize();
        if (page < 1) {
            throw new InvalidQueryException("page must be >= 1, got " + page);
        }
        if (pagesize < 1 || pagesize > maxPagesize) {
            throw new InvalidQueryException(String.format("pagesize must be between 1 and %d, got %d",
                    maxPagesize, pagesize));
        }

        Measure measure = resolveMeasure(request.measure());
        String sumExpr = "SUM(" + qualified(CubeConstants.FACT_ALIAS, measure.column().name()) + ")";
        String countExpr = "COUNT(" + qualified(CubeConstants.FACT_ALIAS, CubeConstants.ID_COLUMN) + ")";

        // 1. 解析所有键（任何未知字段在执行前即失败）
        List<ResolvedKey> drilldowns = request.drilldowns().stream().map(model::resolve).toList();
        CutConditions cuts = CutConditions.resolve(model, request.cuts());

        Set<CompoundDimension> joins = new LinkedHashSet<>();
        for (ResolvedKey key : drilldowns) {
            if (key.requiresJoin()) {
                joins.add(key.dimension());
            }
        }
        joins.addAll(cuts.dimensions());

        // 2. GROUP BY 与输出列
        Set<String> groupBy = new LinkedHashSet<>();
        List<String> selects = new ArrayList<>();
        List<OutputColumn> outputs = new ArrayList<>();
        for (ResolvedKey key : drilldowns) {
            if (key.kind() == ResolvedKey.Kind.FULL_ROW) {
                // 未指定属性：按维度表整行分组
                CompoundDimension dimension = key.dimension();
                for (ColumnDef column : dimension.table().columns()) {
                    String expr = qualified(dimension.alias(), column.name());
                    groupBy.add(expr);
                    if (!column.primaryKey()) {
                        addOutput(expr, dimension, column.name(), selects, outputs);
                    }
                }
            } else {
                String expr = key.expression();
                groupBy.add(expr);
                String attribute = key.kind() == ResolvedKey.Kind.FACT_COLUMN ? null : key.attribute();
                addOutput(expr, key.field(), attribute, selects, outputs);
            }
        }

        // 3. 排序
        List<String> orderBy = orderBy(request, measure, sumExpr, groupBy);

        // 4. 组装 SQL
        String from = fromClause(joins);

        // 汇总只需 JOIN cut 涉及的维度
        List<Object> summaryParams = new ArrayList<>();
        String summarySql = String.format("SELECT %s AS %s, %s AS %s FROM %s%s",
                sumExpr, quote(TOTAL_ALIAS), countExpr, quote(NUM_ENTRIES_ALIAS),
                fromClause(cuts.dimensions()), cuts.toSql(summaryParams));

        SqlRequest countRequest = null;
        String groupByClause = groupBy.isEmpty() ? "" : " GROUP BY " + String.join(", ", groupBy);
        if (!groupBy.isEmpty()) {
            List<Object> countParams = new ArrayList<>();
            String countSql = String.format("SELECT COUNT(*) AS %s FROM (SELECT 1 FROM %s%s%s) AS q",
                    quote(NUM_DRILLDOWNS_ALIAS), from, cuts.toSql(countParams), groupByClause);
            countRequest = new SqlRequest(countSql, countParams);
        }

        List<Object> drilldownParams = new ArrayList<>();
        StringBuilder sql = new StringBuilder();
        sql.append("SELECT ").append(sumExpr).append(" AS ").append(quote(TOTAL_ALIAS))
                .append(", ").append(countExpr).append(" AS ").append(quote(NUM_ENTRIES_ALIAS));
        for (String select : selects) {
            sql.append(", ").append(select);
        }
        sql.append(" FROM ").append(from);
        sql.append(cuts.toSql(drilldownParams));
        sql.append(groupByClause);
        sql.append(" ORDER BY ").append(String.join(", ", orderBy));
        sql.append(" LIMIT ? OFFSET ?");
        drilldownParams.add(pagesize);
        drilldownParams.add((page - 1) * pagesize);

        log.debug("[SQL Generation] aggregate {} drilldowns={} joins={}: {}",
                measure.name(), request.drilldowns(), joins.size(), sql);

        return new AggregatePlan(measure.name(),
                new SqlRequest(summarySql, summaryParams),
                countRequest,
                new SqlRequest(sql.toString(), drilldownParams),
                List.copyOf(outputs), page, pagesize);
    }

    private Measure resolveMeasure(String name) {
        Field field = model.field(name);
        if (!(field instanceof Measure measure)) {
            throw new InvalidQueryException("Not a measure: " + name);
        }
        return measure;
    }

    private void addOutput(String expr, Field field, String attribute,
                           List<String> selects, List<OutputColumn> outputs) {
        for (OutputColumn existing : outputs) {
            if (existing.field() == field && Objects.equals(existing.attribute(), attribute)) {
                return;
            }
        }
        String alias = "d" + outputs.size();
        selects.add(expr + " AS " + quote(alias));
        outputs.add(new OutputColumn(alias, field, attribute));
    }

    /**
     * 度量键按 SUM 排序；其他键必须已在 GROUP BY 中。
     * 最后追加分组列升序，保证分页结果稳定、页间不重叠。
     */
    private List<String> orderBy(AggregateRequest request, Measure measure, String sumExpr, Set<String> groupBy) {
        List<AggregateRequest.Order> order = request.order().isEmpty()
                ? List.of(AggregateRequest.Order.desc(measure.name()))
                : request.order();

        List<String> orderBy = new ArrayList<>();
        Set<String> ordered = new LinkedHashSet<>();
        for (AggregateRequest.Order item : order) {
            String direction = item.descending() ? " DESC" : " ASC";
            if (measure.name().equals(item.key())) {
                orderBy.add(sumExpr + direction);
                continue;
            }
            ResolvedKey key = model.resolve(item.key());
            List<String> exprs = new ArrayList<>();
            if (key.kind() == ResolvedKey.Kind.FULL_ROW) {
                CompoundDimension dimension = key.dimension();
                dimension.attributes().forEach(a -> exprs.add(qualified(dimension.alias(), a.name())));
            } else {
                exprs.add(key.expression());
            }
            for (String expr : exprs) {
                if (!groupBy.contains(expr)) {
                    throw new InvalidQueryException(String.format(
                            "Cannot order by '%s': it is not part of the drilldowns %s",
                            item.key(), request.drilldowns()));
                }
                if (ordered.add(expr)) {
                    orderBy.add(expr + direction);
                }
            }
        }
        for (String expr : groupBy) {
            if (ordered.add(expr)) {
                orderBy.add(expr + " ASC");
            }
        }
        return orderBy;
    }

    private String fromClause(Set<CompoundDimension> joins) {
        StringBuilder from = new StringBuilder();
        from.append(quote(schema.factTable().name())).append(" AS ").append(quote(CubeConstants.FACT_ALIAS));
        for (CompoundDimension dimension : joins) {
            from.append(" ").append(schema.join(dimension.name()).toSql(CubeConstants.FACT_ALIAS));
        }
        return from.toString();
    }
}
