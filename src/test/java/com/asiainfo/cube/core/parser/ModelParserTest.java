package com.asiainfo.cube.core.parser;

import com.asiainfo.cube.TestModels;
import com.asiainfo.cube.core.exception.InvalidModelException;
import com.asiainfo.cube.core.model.AttributeDimension;
import com.asiainfo.cube.core.model.CompoundDimension;
import com.asiainfo.cube.core.model.DataType;
import com.asiainfo.cube.core.model.DateDimension;
import com.asiainfo.cube.core.model.Field;
import com.asiainfo.cube.core.model.Measure;
import com.asiainfo.cube.core.model.ResolvedKey;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 模型描述解析测试
 */
public class ModelParserTest {

    private final ModelParser parser = new ModelParser(new ObjectMapper());

    @Test
    public void testParseFullModel() {
        System.out.println("\n╔══════════════════════════════════════════════════════════════╗");
        System.out.println("║                  测试: 解析完整模型                          ║");
        System.out.println("╚══════════════════════════════════════════════════════════════╝");

        CubeModel model = parser.parse(TestModels.full("full_ds"));

        assertEquals("full_ds", model.name());
        assertEquals("EUR", model.info().currency());
        assertEquals(List.of("en"), model.info().languages());
        // 未指定 default_time：取第一个日期维度
        assertEquals("time", model.info().defaultTime());
        assertEquals("time", model.fields().timeDimension().name());

        assertEquals(List.of("amount", "time", "from", "to", "function"),
                model.fields().fields().stream().map(Field::name).toList());
        assertInstanceOf(Measure.class, model.fields().field("amount"));
        assertInstanceOf(DateDimension.class, model.fields().field("time"));
        assertInstanceOf(CompoundDimension.class, model.fields().field("from"));
        AttributeDimension function = (AttributeDimension) model.fields().field("function");
        assertEquals(DataType.STRING, function.datatype());

        CompoundDimension from = (CompoundDimension) model.fields().field("from");
        assertTrue(from.attribute("label").hasDefault());
        assertEquals("Unknown", from.attribute("label").defaultValue());
        assertEquals(DataType.ID, from.attribute("name").datatype());

        assertEquals(List.of("amount"), model.fields().measures().stream().map(Field::name).toList());
        assertEquals(List.of("time", "from", "to"),
                model.fields().compounds().stream().map(Field::name).toList());
        assertEquals(List.of("to", "function"),
                model.fields().facetDimensions().stream().map(Field::name).toList());
        System.out.println("✓ 字段: " + model.fields().fields());
    }

    @Test
    public void testDateDimensionDropsDerivedAttributes() {
        CubeModel model = parser.parse(TestModels.spending("spending_ds"));
        DateDimension time = (DateDimension) model.fields().field("time");

        // year / yearmonth 不存储，只保留 name
        assertEquals(List.of("name"), time.attributes().stream().map(a -> a.name()).toList());
        assertTrue(time.isDerived("year"));
        assertTrue(time.isDerived("yearmonth"));
    }

    @Test
    public void testDefaultTimeCompoundBecomesDateDimension() {
        CubeModel model = parser.parse(Map.of(
                "dataset", Map.of("name", "ds", "default_time", "period"),
                "mapping", Map.of(
                        "amount", Map.of("type", "measure"),
                        "period", Map.of("type", "compound", "attributes", Map.of("name", Map.of())))));

        assertInstanceOf(DateDimension.class, model.fields().field("period"));
        assertEquals("period", model.info().defaultTime());
    }

    @Test
    public void testCompoundNamedTimeIsTimeDimension() {
        // 只有 measure / compound 类型，没有 default_time
        CubeModel model = parser.parse(TestModels.spending("implicit_time"));

        assertInstanceOf(DateDimension.class, model.fields().field("time"));
        assertEquals("time", model.info().defaultTime());
        assertEquals("time", model.fields().resolve("year").field().name());
        assertEquals(ResolvedKey.Kind.DERIVED, model.fields().resolve("year").kind());

        // 显式 default_time 指向其他维度时，time 仍是普通组合维度
        CubeModel explicit = parser.parse(Map.of(
                "dataset", Map.of("name", "ds", "default_time", "period"),
                "mapping", Map.of(
                        "period", Map.of("type", "date"),
                        "time", Map.of("type", "compound", "attributes", Map.of("label", Map.of())))));
        assertFalse(explicit.fields().field("time") instanceof DateDimension);
        assertEquals("period", explicit.info().defaultTime());
    }

    @Test
    public void testInvalidModels() {
        assertThrows(InvalidModelException.class, () -> parser.parse("not json"));
        assertThrows(InvalidModelException.class, () -> parser.parse("{\"mapping\": {\"a\": {\"type\": \"measure\"}}}"));
        assertThrows(InvalidModelException.class, () -> parser.parse("{\"dataset\": {\"name\": \"ds\"}}"));
        assertThrows(InvalidModelException.class, () -> parser.parse(
                "{\"dataset\": {\"name\": \"bad.name\"}, \"mapping\": {\"a\": {\"type\": \"measure\"}}}"));
        // 未知类型
        InvalidModelException unknownType = assertThrows(InvalidModelException.class, () -> parser.parse(
                "{\"dataset\": {\"name\": \"ds\"}, \"mapping\": {\"a\": {\"type\": \"cube\"}}}"));
        assertTrue(unknownType.getMessage().contains("unknown type"));
        // 组合维度缺少属性
        assertThrows(InvalidModelException.class, () -> parser.parse(
                "{\"dataset\": {\"name\": \"ds\"}, \"mapping\": {\"to\": {\"type\": \"compound\"}}}"));
        // 保留字段名
        assertThrows(InvalidModelException.class, () -> parser.parse(
                "{\"dataset\": {\"name\": \"ds\"}, \"mapping\": {\"id\": {\"type\": \"value\"}}}"));
        // default_time 不是日期维度
        assertThrows(InvalidModelException.class, () -> parser.parse(
                "{\"dataset\": {\"name\": \"ds\", \"default_time\": \"a\"}, \"mapping\": {\"a\": {\"type\": \"measure\"}}}"));
        // 未知 datatype
        assertThrows(InvalidModelException.class, () -> parser.parse(
                "{\"dataset\": {\"name\": \"ds\"}, \"mapping\": {\"a\": {\"type\": \"value\", \"datatype\": \"blob\"}}}"));
        System.out.println("✓ 非法模型均被拒绝");
    }
}
