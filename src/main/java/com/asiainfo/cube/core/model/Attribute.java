package com.asiainfo.cube.core.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 组合维度的属性
 */
public record Attribute(
    String name,
    String label,
    DataType datatype,
    Object defaultValue,   // 输入缺失时使用
    boolean hasDefault
) {
    public static Attribute of(String name, DataType datatype) {
        return new Attribute(name, name, datatype, null, false);
    }

    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("label", label);
        map.put("datatype", datatype.code());
        if (hasDefault) {
            map.put("default_value", defaultValue);
        }
        return map;
    }
}
