package com.asiainfo.cube.core.schema;

import com.asiainfo.cube.core.model.DatasetInfo;
import com.asiainfo.cube.core.model.Field;
import com.asiainfo.cube.core.model.FieldModel;
import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Schema 编译器
 * 根据字段模型推导物理 schema：每个组合维度一张维度表，一张事实表
 */
@ApplicationScoped
public class SchemaCompiler {

    private static final Logger log = LoggerFactory.getLogger(SchemaCompiler.class);

    public PhysicalSchema compile(DatasetInfo info, FieldModel model) {
        PhysicalSchema.Builder builder = PhysicalSchema.builder(info.name());
        for (Field field : model.fields()) {
            field.init(builder);
        }
        PhysicalSchema schema = builder.build();
        log.debug("Compiled schema for {}: fact={}, dimensions={}",
                info.name(), schema.factTable().name(), schema.dimensionTables().keySet());
        return schema;
    }
}
