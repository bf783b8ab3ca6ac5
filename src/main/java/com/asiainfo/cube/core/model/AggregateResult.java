package com.asiainfo.cube.core.model;

import com.asiainfo.cube.core.CubeConstants;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 聚合查询结果：分组明细 + 汇总
 */
public record AggregateResult(List<Map<String, Object>> drilldown, Summary summary) {

    public record Summary(
        String measure,
        double total,
        long numEntries,
        String currency,
        long numDrilldowns,
        int page,
        int pages,
        int pagesize
    ) {
        public Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put(measure, total);
            map.put(CubeConstants.NUM_ENTRIES, numEntries);
            Map<String, Object> currencies = new LinkedHashMap<>();
            currencies.put(measure, currency);
            map.put("currency", currencies);
            map.put("num_drilldowns", numDrilldowns);
            map.put("page", page);
            map.put("pages", pages);
            map.put("pagesize", pagesize);
            return map;
        }
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("drilldown", drilldown);
        map.put("summary", summary.toMap());
        return map;
    }
}
