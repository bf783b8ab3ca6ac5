package com.asiainfo.cube.core.parser;

import com.asiainfo.cube.core.model.DatasetInfo;
import com.asiainfo.cube.core.model.FieldModel;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * 解析后的模型：数据集描述 + 字段模型 + 原始描述
 */
public record CubeModel(DatasetInfo info, FieldModel fields, JsonNode description) {

    public String name() {
        return info.name();
    }
}
