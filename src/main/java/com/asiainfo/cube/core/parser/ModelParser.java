package com.asiainfo.cube.core.parser;

import com.asiainfo.cube.core.CubeConstants;
import com.asiainfo.cube.core.exception.InvalidModelException;
import com.asiainfo.cube.core.model.Attribute;
import com.asiainfo.cube.core.model.AttributeDimension;
import com.asiainfo.cube.core.model.CompoundDimension;
import com.asiainfo.cube.core.model.DataType;
import com.asiainfo.cube.core.model.DatasetInfo;
import com.asiainfo.cube.core.model.DateDimension;
import com.asiainfo.cube.core.model.Field;
import com.asiainfo.cube.core.model.FieldModel;
import com.asiainfo.cube.core.model.FieldType;
import com.asiainfo.cube.core.model.Measure;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 模型描述解析器
 * {dataset: {...}, mapping: {字段名: {type, label, ...}}} -> CubeModel
 */
@ApplicationScoped
public class ModelParser {

    private static final Logger log = LoggerFactory.getLogger(ModelParser.class);

    // 与物理列/结果字段冲突的保留名
    private static final Set<String> RESERVED_NAMES = Set.of(CubeConstants.ID_COLUMN, CubeConstants.NUM_ENTRIES);

    private final ObjectMapper mapper;

    @Inject
    public ModelParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public CubeModel parse(String json) {
        try {
            return parse(mapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new InvalidModelException("Model description is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    public CubeModel parse(Map<String, ?> description) {
        return parse(mapper.<JsonNode>valueToTree(description));
    }

    public CubeModel parse(JsonNode description) {
        if (description == null || !description.isObject()) {
            throw new InvalidModelException("Model description must be an object");
        }
        JsonNode dataset = description.get("dataset");
        JsonNode mapping = description.get("mapping");
        if (dataset == null || !dataset.isObject()) {
            throw new InvalidModelException("Model description has no 'dataset' section");
        }
        if (mapping == null || !mapping.isObject() || mapping.isEmpty()) {
            throw new InvalidModelException("Model description has no 'mapping' section");
        }

        String name = text(dataset, "name");
        checkIdentifier("dataset", name);

        // 1. 字段
        List<Field> fields = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> it = mapping.fields();
        String defaultTime = text(dataset, "default_time");
        // 未指定 default_time 时，名为 time 的组合维度即时间维度
        if (defaultTime == null && isCompound(mapping.get(CubeConstants.TIME_DIMENSION))) {
            defaultTime = CubeConstants.TIME_DIMENSION;
        }
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            fields.add(parseField(entry.getKey(), entry.getValue(), entry.getKey().equals(defaultTime)));
        }

        // 2. 默认时间维度：显式指定或第一个日期维度
        DateDimension timeDimension = null;
        if (defaultTime != null) {
            final String defaultTimeName = defaultTime;
            Field field = fields.stream().filter(f -> f.name().equals(defaultTimeName)).findFirst()
                    .orElseThrow(() -> new InvalidModelException("default_time refers to unknown field: " + defaultTimeName));
            if (!(field instanceof DateDimension date)) {
                throw new InvalidModelException("default_time must be a date dimension: " + defaultTime);
            }
            timeDimension = date;
        } else {
            timeDimension = fields.stream()
                    .filter(DateDimension.class::isInstance)
                    .map(DateDimension.class::cast)
                    .findFirst().orElse(null);
        }

        DatasetInfo info = new DatasetInfo(
                name,
                textOr(dataset, "label", name),
                text(dataset, "description"),
                text(dataset, "currency"),
                timeDimension == null ? null : timeDimension.name(),
                text(dataset, "schema_version"),
                text(dataset, "category"),
                textList(dataset, "languages"),
                textList(dataset, "territories"));

        log.debug("Parsed model {}: fields={}, time={}", name,
                fields.stream().map(Field::name).toList(), info.defaultTime());
        return new CubeModel(info, new FieldModel(fields, timeDimension), description.deepCopy());
    }

    private Field parseField(String name, JsonNode node, boolean isDefaultTime) {
        checkIdentifier("field", name);
        if (RESERVED_NAMES.contains(name)) {
            throw new InvalidModelException("Field name is reserved: " + name);
        }
        if (node == null || !node.isObject()) {
            throw new InvalidModelException("Mapping of field '" + name + "' must be an object");
        }
        FieldType type = fieldType(name, node);
        // default_time 指向的组合维度按日期维度处理
        if (isDefaultTime && type == FieldType.COMPOUND) {
            type = FieldType.DATE;
        }

        String label = text(node, "label");
        String description = text(node, "description");
        boolean facet = node.path("facet").asBoolean(false);

        return switch (type) {
            case MEASURE -> new Measure(name, label, description);
            case VALUE -> new AttributeDimension(name, label, description, facet, dataType(name, node));
            case COMPOUND -> new CompoundDimension(name, label, description, facet, attributes(name, node, true));
            case DATE -> new DateDimension(name, label, description, facet, attributes(name, node, false));
        };
    }

    private boolean isCompound(JsonNode node) {
        if (node == null || !node.isObject()) {
            return false;
        }
        String code = text(node, "type");
        return FieldType.COMPOUND.code().equalsIgnoreCase(code) || FieldType.DATE.code().equalsIgnoreCase(code);
    }

    private FieldType fieldType(String name, JsonNode node) {
        String code = text(node, "type");
        if (code == null) {
            throw new InvalidModelException("Field '" + name + "' has no type");
        }
        try {
            return FieldType.fromCode(code);
        } catch (IllegalArgumentException e) {
            throw new InvalidModelException("Field '" + name + "' has unknown type: " + code, e);
        }
    }

    private DataType dataType(String owner, JsonNode node) {
        try {
            return DataType.fromCode(text(node, "datatype"));
        } catch (IllegalArgumentException e) {
            throw new InvalidModelException("'" + owner + "': " + e.getMessage(), e);
        }
    }

    private List<Attribute> attributes(String dimension, JsonNode node, boolean required) {
        JsonNode attrs = node.get("attributes");
        if (attrs == null || attrs.isNull()) {
            if (required) {
                throw new InvalidModelException("Compound dimension '" + dimension + "' has no attributes");
            }
            return List.of();
        }
        if (!attrs.isObject() || (required && attrs.isEmpty())) {
            throw new InvalidModelException("Attributes of '" + dimension + "' must be a non-empty mapping");
        }

        List<Attribute> attributes = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> it = attrs.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String attrName = entry.getKey();
            JsonNode attr = entry.getValue();
            String qualified = dimension + "." + attrName;
            checkIdentifier("attribute", attrName);
            if (CubeConstants.ID_COLUMN.equals(attrName)) {
                throw new InvalidModelException("Attribute name is reserved: " + qualified);
            }
            DataType datatype = dataType(qualified, attr);
            boolean hasDefault = attr.has("default_value");
            Object defaultValue = hasDefault ? defaultValue(qualified, datatype, attr.get("default_value")) : null;
            attributes.add(new Attribute(attrName, textOr(attr, "label", attrName), datatype, defaultValue, hasDefault));
        }
        return attributes;
    }

    private Object defaultValue(String qualified, DataType datatype, JsonNode value) {
        try {
            return datatype.cast(mapper.treeToValue(value, Object.class));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new InvalidModelException("Invalid default_value for '" + qualified + "': " + value, e);
        }
    }

    private static void checkIdentifier(String kind, String name) {
        if (name == null || !CubeConstants.IDENTIFIER_PATTERN.matcher(name).matches()) {
            throw new InvalidModelException(String.format("Invalid %s name '%s', expected %s",
                    kind, name, CubeConstants.IDENTIFIER_PATTERN.pattern()));
        }
    }

    private static String text(JsonNode node, String key) {
        JsonNode value = node.get(key);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String textOr(JsonNode node, String key, String fallback) {
        String value = text(node, key);
        return value == null ? fallback : value;
    }

    private static List<String> textList(JsonNode node, String key) {
        JsonNode value = node.get(key);
        List<String> list = new ArrayList<>();
        if (value != null && value.isArray()) {
            value.forEach(v -> list.add(v.asText()));
        }
        return list;
    }
}
