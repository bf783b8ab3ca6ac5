package com.asiainfo.cube.core.schema;

import com.asiainfo.cube.core.model.CompoundDimension;

/**
 * 星型 JOIN 图中的一条边：事实表外键 -> 维度表主键
 */
public record JoinEdge(CompoundDimension dimension, String factColumn, TableDef dimensionTable) {

    public String toSql(String factAlias) {
        return dimension.join(factAlias);
    }
}
