package com.asiainfo.cube.core.model;

import com.asiainfo.cube.core.CubeConstants;
import com.asiainfo.cube.core.exception.LoadException;
import com.asiainfo.cube.core.exception.UniqueViolationException;
import com.asiainfo.cube.core.exception.UnknownFieldException;
import com.asiainfo.cube.core.loader.ContentHasher;
import com.asiainfo.cube.core.schema.ColumnDef;
import com.asiainfo.cube.core.schema.ForeignKeyDef;
import com.asiainfo.cube.core.schema.PhysicalSchema;
import com.asiainfo.cube.core.schema.TableDef;
import com.asiainfo.cube.infra.persistence.StorageSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.asiainfo.cube.core.model.SqlNames.qualified;
import static com.asiainfo.cube.core.model.SqlNames.quote;

/**
 * 组合维度
 * 拥有独立维度表（每个属性一列，主键为属性值的内容哈希），事实表通过 {name}_id 外键引用
 */
public class CompoundDimension extends Field {

    private static final Logger log = LoggerFactory.getLogger(CompoundDimension.class);

    protected final Map<String, Attribute> attributes;
    protected TableDef table;

    public CompoundDimension(String name, String label, String description, boolean facet,
                             List<Attribute> attributes) {
        super(name, label, description, facet);
        Map<String, Attribute> byName = new LinkedHashMap<>();
        for (Attribute attribute : attributes) {
            byName.put(attribute.name(), attribute);
        }
        this.attributes = Collections.unmodifiableMap(byName);
    }

    @Override
    public FieldType type() {
        return FieldType.COMPOUND;
    }

    public Collection<Attribute> attributes() {
        return attributes.values();
    }

    public boolean hasAttribute(String attribute) {
        return attributes.containsKey(attribute);
    }

    public Attribute attribute(String attribute) {
        Attribute attr = attributes.get(attribute);
        if (attr == null) {
            throw new UnknownFieldException(name + "." + attribute,
                    String.format("Dimension '%s' has no attribute '%s'", name, attribute));
        }
        return attr;
    }

    /**
     * 查询时计算的虚拟属性（普通组合维度没有）
     */
    public boolean isDerived(String attribute) {
        return false;
    }

    public String derivedExpression(String attribute, String alias) {
        throw new UnknownFieldException(name + "." + attribute);
    }

    @Override
    public void init(PhysicalSchema.Builder schema) {
        List<ColumnDef> columns = new ArrayList<>();
        columns.add(ColumnDef.primaryKey(CubeConstants.ID_COLUMN));
        for (Attribute attribute : attributes.values()) {
            columns.add(ColumnDef.of(attribute.name(), attribute.datatype().sqlType()));
        }
        table = new TableDef(schema.tableName(name), columns, List.of());
        schema.addDimensionTable(this, table);

        column = ColumnDef.of(name + CubeConstants.FOREIGN_KEY_SUFFIX, "TEXT");
        schema.addFactColumn(column);
        schema.addForeignKey(new ForeignKeyDef(column.name(), table.name(), CubeConstants.ID_COLUMN));
    }

    public TableDef table() {
        if (table == null) {
            throw new IllegalStateException("Dimension '" + name + "' is not initialized, call init() first");
        }
        return table;
    }

    /**
     * 查询中维度表的别名即维度名
     */
    public String alias() {
        return name;
    }

    /**
     * 星型 JOIN 子句：事实表 -> 维度表
     */
    public String join(String factAlias) {
        return String.format("JOIN %s AS %s ON %s = %s",
                quote(table().name()), quote(alias()),
                qualified(alias(), CubeConstants.ID_COLUMN),
                qualified(factAlias, column().name()));
    }

    @Override
    public Map<String, Object> load(StorageSession session, Object raw) {
        Map<String, Object> values = extractAttributes(raw);
        String key = ContentHasher.hash(values);
        ensureMember(session, key, values);
        return Map.of(column().name(), key);
    }

    /**
     * 从原始输入中提取属性值（按声明顺序）
     */
    protected Map<String, Object> extractAttributes(Object raw) {
        Map<?, ?> data;
        if (raw instanceof Map<?, ?> map) {
            data = map;
        } else if (raw != null && attributes.size() == 1) {
            // 单属性维度允许直接给标量
            data = Map.of(attributes.keySet().iterator().next(), raw);
        } else {
            throw new LoadException(name, "Dimension '" + name + "' expects a mapping of attributes, got: " + raw);
        }

        Map<String, Object> values = new LinkedHashMap<>();
        for (Attribute attribute : attributes.values()) {
            values.put(attribute.name(), attributeValue(attribute, data));
        }
        return values;
    }

    protected Object attributeValue(Attribute attribute, Map<?, ?> data) {
        if (!data.containsKey(attribute.name())) {
            if (attribute.hasDefault()) {
                return attribute.defaultValue();
            }
            throw LoadException.missingField(name + "." + attribute.name());
        }
        try {
            return attribute.datatype().cast(data.get(attribute.name()));
        } catch (IllegalArgumentException e) {
            throw new LoadException(name + "." + attribute.name(),
                    "Invalid value for '" + name + "." + attribute.name() + "': " + e.getMessage(), e);
        }
    }

    /**
     * 维度成员 upsert：先按哈希查找，不存在则插入；
     * 并发插入导致主键冲突时回读一次
     */
    private void ensureMember(StorageSession session, String key, Map<String, Object> values) {
        if (memberExists(session, key)) {
            return;
        }
        try {
            session.update(insertRequest(key, values));
        } catch (UniqueViolationException e) {
            log.warn("Dimension member {} of '{}' inserted concurrently, re-reading", key, name);
            if (!memberExists(session, key)) {
                throw new LoadException(name, "Dimension member " + key + " of '" + name
                        + "' conflicted on insert but could not be read back", e);
            }
        }
    }

    private boolean memberExists(StorageSession session, String key) {
        SqlRequest request = new SqlRequest(
                String.format("SELECT %s FROM %s WHERE %s = ?",
                        quote(CubeConstants.ID_COLUMN), quote(table().name()), quote(CubeConstants.ID_COLUMN)),
                List.of(key));
        return !session.query(request).isEmpty();
    }

    private SqlRequest insertRequest(String key, Map<String, Object> values) {
        List<String> columns = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        columns.add(quote(CubeConstants.ID_COLUMN));
        params.add(key);
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            columns.add(quote(entry.getKey()));
            params.add(entry.getValue());
        }
        String placeholders = columns.stream().map(c -> "?").collect(Collectors.joining(", "));
        return new SqlRequest(String.format("INSERT INTO %s (%s) VALUES (%s)",
                quote(table().name()), String.join(", ", columns), placeholders), params);
    }

    /**
     * 解码后的属性集合补充（普通组合维度无需补充）
     */
    public Map<String, Object> decorate(Map<String, Object> decoded) {
        return decoded;
    }

    @Override
    public Map<String, Object> asMap() {
        Map<String, Object> map = super.asMap();
        Map<String, Object> attrs = new LinkedHashMap<>();
        for (Attribute attribute : attributes.values()) {
            attrs.put(attribute.name(), attribute.asMap());
        }
        map.put("attributes", attrs);
        return map;
    }
}
