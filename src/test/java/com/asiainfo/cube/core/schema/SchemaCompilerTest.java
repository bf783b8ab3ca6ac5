package com.asiainfo.cube.core.schema;

import com.asiainfo.cube.TestModels;
import com.asiainfo.cube.core.exception.InvalidModelException;
import com.asiainfo.cube.core.model.DatasetInfo;
import com.asiainfo.cube.core.model.FieldModel;
import com.asiainfo.cube.core.parser.CubeModel;
import com.asiainfo.cube.core.parser.ModelParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 物理 schema 编译测试
 */
public class SchemaCompilerTest {

    private final ModelParser parser = new ModelParser(new ObjectMapper());
    private final SchemaCompiler compiler = new SchemaCompiler();

    @Test
    public void testStarSchema() {
        System.out.println("\n╔══════════════════════════════════════════════════════════════╗");
        System.out.println("║                  测试: 星型 schema 编译                      ║");
        System.out.println("╚══════════════════════════════════════════════════════════════╝");

        CubeModel model = parser.parse(TestModels.full("shop"));
        PhysicalSchema schema = compiler.compile(model.info(), model.fields());

        TableDef fact = schema.factTable();
        assertEquals("shop__entry", fact.name());
        assertEquals(List.of("id", "amount", "time_id", "from_id", "to_id", "function"),
                List.copyOf(fact.columnNames()));
        assertEquals(3, fact.foreignKeys().size());

        assertEquals(List.of("time", "from", "to"), List.copyOf(schema.dimensionTables().keySet()));
        assertEquals(List.of("id", "name"), List.copyOf(schema.dimensionTables().get("time").columnNames()));
        assertEquals(List.of("id", "name", "label"), List.copyOf(schema.dimensionTables().get("from").columnNames()));
        assertEquals("shop__to", schema.join("to").dimensionTable().name());
        assertEquals("JOIN \"shop__to\" AS \"to\" ON \"to\".\"id\" = \"entry\".\"to_id\"",
                schema.join("to").toSql("entry"));

        schema.createStatements().forEach(System.out::println);
    }

    @Test
    public void testStatementOrder() {
        CubeModel model = parser.parse(TestModels.spending("ord"));
        PhysicalSchema schema = compiler.compile(model.info(), model.fields());

        List<String> create = schema.createStatements();
        // 维度表 -> 事实表 -> 索引
        assertTrue(create.get(0).startsWith("CREATE TABLE IF NOT EXISTS \"ord__time\""));
        assertTrue(create.get(1).startsWith("CREATE TABLE IF NOT EXISTS \"ord__to\""));
        assertTrue(create.get(2).startsWith("CREATE TABLE IF NOT EXISTS \"ord__entry\""));
        assertTrue(create.get(2).contains("FOREIGN KEY (\"to_id\") REFERENCES \"ord__to\" (\"id\")"));
        assertTrue(create.get(3).startsWith("CREATE INDEX IF NOT EXISTS"));
        assertEquals(5, create.size());

        assertEquals(List.of(
                "DROP TABLE IF EXISTS \"ord__entry\"",
                "DROP TABLE IF EXISTS \"ord__time\"",
                "DROP TABLE IF EXISTS \"ord__to\""), schema.dropStatements());
        assertEquals("DELETE FROM \"ord__entry\"", schema.flushStatements().get(0));
    }

    @Test
    public void testDuplicatePhysicalColumn() {
        // 简单维度 to_id 与组合维度 to 的外键列冲突
        CubeModel model = parser.parse(Map.of(
                "dataset", Map.of("name", "dup"),
                "mapping", Map.of(
                        "to", Map.of("type", "compound", "attributes", Map.of("label", Map.of())),
                        "to_id", Map.of("type", "value"))));
        DatasetInfo info = model.info();
        FieldModel fields = model.fields();
        assertThrows(InvalidModelException.class, () -> compiler.compile(info, fields));
    }
}
