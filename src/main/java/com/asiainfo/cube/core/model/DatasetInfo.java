package com.asiainfo.cube.core.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 数据集描述（模型中的 dataset 段）
 */
public record DatasetInfo(
    String name,            // 唯一名称，用作物理表名前缀
    String label,
    String description,
    String currency,        // 货币代码，如 GBP
    String defaultTime,     // 默认时间维度
    String schemaVersion,
    String category,
    List<String> languages,
    List<String> territories
) {
    public DatasetInfo {
        languages = languages == null ? List.of() : List.copyOf(languages);
        territories = territories == null ? List.of() : List.copyOf(territories);
    }

    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("label", label);
        map.put("name", name);
        map.put("description", description);
        map.put("default_time", defaultTime);
        map.put("schema_version", schemaVersion);
        map.put("currency", currency);
        map.put("category", category);
        map.put("languages", languages);
        map.put("territories", territories);
        return map;
    }
}
