package com.asiainfo.cube.core.generator;

import com.asiainfo.cube.core.model.SqlRequest;

import java.util.List;

/**
 * 聚合查询的三段执行计划
 *
 * @param summary        汇总：SUM(measure)、COUNT(*)，仅受 cut 约束
 * @param drilldownCount 分组数统计；无分组时为 null（分组数恒为 1）
 * @param drilldown      分页后的分组结果
 */
public record AggregatePlan(
    String measure,
    SqlRequest summary,
    SqlRequest drilldownCount,
    SqlRequest drilldown,
    List<OutputColumn> outputs,
    int page,
    int pagesize
) {
    public boolean hasGroups() {
        return drilldownCount != null;
    }
}
