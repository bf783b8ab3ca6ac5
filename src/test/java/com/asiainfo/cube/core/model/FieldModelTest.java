package com.asiainfo.cube.core.model;

import com.asiainfo.cube.TestModels;
import com.asiainfo.cube.core.exception.InvalidQueryException;
import com.asiainfo.cube.core.exception.UnknownFieldException;
import com.asiainfo.cube.core.parser.CubeModel;
import com.asiainfo.cube.core.parser.ModelParser;
import com.asiainfo.cube.core.schema.PhysicalSchema;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 字段键解析测试
 */
public class FieldModelTest {

    private FieldModel fields;

    @BeforeEach
    public void setUp() {
        CubeModel model = new ModelParser(new ObjectMapper()).parse(TestModels.full("resolve_ds"));
        fields = model.fields();
        PhysicalSchema.Builder builder = PhysicalSchema.builder("resolve_ds");
        fields.fields().forEach(f -> f.init(builder));
    }

    @Test
    public void testResolveKinds() {
        assertEquals(ResolvedKey.Kind.FACT_COLUMN, fields.resolve("amount").kind());
        assertEquals(ResolvedKey.Kind.FACT_COLUMN, fields.resolve("function").kind());
        assertEquals(ResolvedKey.Kind.FULL_ROW, fields.resolve("to").kind());
        assertEquals(ResolvedKey.Kind.ATTRIBUTE, fields.resolve("to.label").kind());
        assertEquals(ResolvedKey.Kind.DERIVED, fields.resolve("time.year").kind());

        // 裸 year / yearmonth 解析到默认时间维度
        ResolvedKey year = fields.resolve("yearmonth");
        assertEquals(ResolvedKey.Kind.DERIVED, year.kind());
        assertEquals("time", year.field().name());
    }

    @Test
    public void testExpressions() {
        assertEquals("\"entry\".\"amount\"", fields.resolve("amount").expression());
        assertEquals("\"to\".\"label\"", fields.resolve("to.label").expression());
        assertEquals("substr(\"time\".\"name\", 1, 4)", fields.resolve("year").expression());
        assertThrows(IllegalStateException.class, () -> fields.resolve("to").expression());
    }

    @Test
    public void testUnknownKeys() {
        UnknownFieldException e = assertThrows(UnknownFieldException.class, () -> fields.resolve("nope"));
        assertEquals("nope", e.getKey());
        assertThrows(UnknownFieldException.class, () -> fields.resolve("to.nope"));
        // 简单维度没有属性
        assertThrows(UnknownFieldException.class, () -> fields.resolve("function.label"));
        assertThrows(UnknownFieldException.class, () -> fields.field("missing"));
        // 只按第一个 "." 拆分
        assertThrows(UnknownFieldException.class, () -> fields.resolve("to.label.x"));
    }

    @Test
    public void testNormalizeValue() {
        assertEquals(12.5, fields.resolve("amount").normalizeValue("12.5"));
        assertEquals("2020", fields.resolve("year").normalizeValue(2020));
        assertThrows(InvalidQueryException.class, () -> fields.resolve("amount").normalizeValue("abc"));
    }

    @Test
    public void testColumnBeforeInit() {
        Measure measure = new Measure("amount", null, null);
        assertThrows(IllegalStateException.class, measure::column);
        assertEquals("amount", measure.label());
    }
}
