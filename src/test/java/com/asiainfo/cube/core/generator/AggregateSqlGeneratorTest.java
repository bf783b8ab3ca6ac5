package com.asiainfo.cube.core.generator;

import com.asiainfo.cube.TestModels;
import com.asiainfo.cube.core.exception.InvalidQueryException;
import com.asiainfo.cube.core.exception.UnknownFieldException;
import com.asiainfo.cube.core.model.AggregateRequest;
import com.asiainfo.cube.core.model.EntriesRequest;
import com.asiainfo.cube.core.parser.CubeModel;
import com.asiainfo.cube.core.parser.ModelParser;
import com.asiainfo.cube.core.schema.PhysicalSchema;
import com.asiainfo.cube.core.schema.SchemaCompiler;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 聚合查询编译测试（只校验生成的 SQL 与参数，不执行）
 */
public class AggregateSqlGeneratorTest {

    private AggregateSqlGenerator generator;
    private EntriesSqlGenerator entriesGenerator;

    @BeforeEach
    public void setUp() {
        CubeModel model = new ModelParser(new ObjectMapper()).parse(TestModels.full("gen"));
        PhysicalSchema schema = new SchemaCompiler().compile(model.info(), model.fields());
        generator = new AggregateSqlGenerator(model.fields(), schema, 100);
        entriesGenerator = new EntriesSqlGenerator(model.fields(), schema);
    }

    @Test
    public void testFullRowDrilldown() {
        System.out.println("\n╔══════════════════════════════════════════════════════════════╗");
        System.out.println("║                  测试: 整行分组                              ║");
        System.out.println("╚══════════════════════════════════════════════════════════════╝");

        AggregatePlan plan = generator.compile(AggregateRequest.builder().drilldown("to").pagesize(10).build());
        String sql = plan.drilldown().sql();
        System.out.println("Generated SQL:\n" + sql);

        assertTrue(sql.contains("JOIN \"gen__to\" AS \"to\" ON \"to\".\"id\" = \"entry\".\"to_id\""));
        assertTrue(sql.contains("GROUP BY \"to\".\"id\", \"to\".\"name\", \"to\".\"label\""));
        // 默认按度量降序，分组列升序兜底
        assertTrue(sql.contains("ORDER BY SUM(\"entry\".\"amount\") DESC, \"to\".\"id\" ASC"));
        assertTrue(sql.endsWith("LIMIT ? OFFSET ?"));
        assertEquals(List.of(10, 0), plan.drilldown().params());

        // 输出列不含哈希主键
        assertEquals(List.of("name", "label"), plan.outputs().stream().map(OutputColumn::attribute).toList());
        assertTrue(plan.hasGroups());
        assertTrue(plan.drilldownCount().sql().startsWith("SELECT COUNT(*) AS \"num_drilldowns\" FROM (SELECT 1 FROM"));
        // 汇总不分组、不分页
        assertFalse(plan.summary().sql().contains("GROUP BY"));
        assertFalse(plan.summary().sql().contains("JOIN"));
    }

    @Test
    public void testCutsAndPaging() {
        AggregateRequest request = AggregateRequest.builder()
                .drilldown("year", "function")
                .cut("to.label", "Health")
                .cut("to.label", "Education")
                .cut("year", 2020)
                .page(3)
                .pagesize(20)
                .build();
        AggregatePlan plan = generator.compile(request);
        String sql = plan.drilldown().sql();
        System.out.println("Generated SQL:\n" + sql);

        // 同列 OR，不同列 AND
        assertTrue(sql.contains("WHERE (\"to\".\"label\" = ? OR \"to\".\"label\" = ?) AND (substr(\"time\".\"name\", 1, 4) = ?)"));
        assertTrue(sql.contains("GROUP BY substr(\"time\".\"name\", 1, 4), \"entry\".\"function\""));
        assertEquals(List.of("Health", "Education", "2020", 20, 40), plan.drilldown().params());
        assertEquals(List.of("Health", "Education", "2020"), plan.summary().params());
        // cut 维度也需要 JOIN
        assertTrue(plan.summary().sql().contains("JOIN \"gen__to\""));
        assertTrue(plan.summary().sql().contains("JOIN \"gen__time\""));
    }

    @Test
    public void testNoDrilldowns() {
        AggregatePlan plan = generator.compile(AggregateRequest.builder().pagesize(5).build());
        assertFalse(plan.hasGroups());
        assertNull(plan.drilldownCount());
        assertFalse(plan.drilldown().sql().contains("GROUP BY"));
    }

    @Test
    public void testOrdering() {
        AggregatePlan plan = generator.compile(AggregateRequest.builder()
                .drilldown("function").order("function", false).order("amount", true).pagesize(5).build());
        assertTrue(plan.drilldown().sql().contains(
                "ORDER BY \"entry\".\"function\" ASC, SUM(\"entry\".\"amount\") DESC"));

        // 排序键必须在分组中
        AggregateRequest notGrouped = AggregateRequest.builder()
                .drilldown("function").order("to.label", false).pagesize(5).build();
        assertThrows(InvalidQueryException.class, () -> generator.compile(notGrouped));
    }

    @Test
    public void testInvalidRequests() {
        assertThrows(UnknownFieldException.class,
                () -> generator.compile(AggregateRequest.builder().drilldown("nope").pagesize(5).build()));
        assertThrows(UnknownFieldException.class,
                () -> generator.compile(AggregateRequest.builder().cut("to.nope", "x").pagesize(5).build()));
        assertThrows(InvalidQueryException.class,
                () -> generator.compile(AggregateRequest.builder().measure("function").pagesize(5).build()));
        assertThrows(InvalidQueryException.class,
                () -> generator.compile(AggregateRequest.builder().page(0).pagesize(5).build()));
        assertThrows(InvalidQueryException.class,
                () -> generator.compile(AggregateRequest.builder().pagesize(0).build()));
        assertThrows(InvalidQueryException.class,
                () -> generator.compile(AggregateRequest.builder().pagesize(101).build()));
    }

    @Test
    public void testEntriesQuery() {
        EntriesSqlGenerator.EntriesPlan plan = entriesGenerator.compile(
                new EntriesRequest(List.of(new AggregateRequest.Cut("function", "health")), 10, 0));
        System.out.println("Entries SQL:\n" + plan.sql());

        assertTrue(plan.sql().startsWith("SELECT \"entry\".\"id\" AS \"id\""));
        assertTrue(plan.sql().contains("WHERE (\"entry\".\"function\" = ?)"));
        assertTrue(plan.sql().endsWith("ORDER BY \"entry\".\"id\""));
        assertEquals(List.of("health", 2, 4), plan.batch(4, 2).params());

        // limit = 0 合法，负数拒绝
        assertEquals(0, EntriesRequest.page(0, 0).limit());
        assertThrows(InvalidQueryException.class, () -> EntriesRequest.page(-1, 0));
        assertThrows(InvalidQueryException.class, () -> EntriesRequest.page(10, -5));
        assertThrows(InvalidQueryException.class, () -> new EntriesRequest(List.of(), null, -1));
    }
}
