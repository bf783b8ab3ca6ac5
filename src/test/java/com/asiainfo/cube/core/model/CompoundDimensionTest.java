package com.asiainfo.cube.core.model;

import com.asiainfo.cube.core.exception.LoadException;
import com.asiainfo.cube.core.exception.UniqueViolationException;
import com.asiainfo.cube.core.loader.ContentHasher;
import com.asiainfo.cube.core.schema.PhysicalSchema;
import com.asiainfo.cube.infra.persistence.StorageSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * 组合维度成员 upsert 测试（存储层 mock）
 */
public class CompoundDimensionTest {

    private CompoundDimension to;
    private StorageSession session;

    @BeforeEach
    public void setUp() {
        to = new CompoundDimension("to", "Recipient", null, false, List.of(
                Attribute.of("name", DataType.ID),
                new Attribute("label", "Label", DataType.STRING, "Unknown", true)));
        to.init(PhysicalSchema.builder("ds"));
        session = Mockito.mock(StorageSession.class);
    }

    @Test
    public void testInsertNewMember() {
        when(session.query(any())).thenReturn(List.of());

        Map<String, Object> stored = to.load(session, Map.of("name", "health", "label", "Health"));

        String expected = ContentHasher.hash(Map.of("name", "health", "label", "Health"));
        assertEquals(Map.of("to_id", expected), stored);

        ArgumentCaptor<SqlRequest> insert = ArgumentCaptor.forClass(SqlRequest.class);
        verify(session).update(insert.capture());
        System.out.println("Insert SQL: " + insert.getValue().sql());
        assertEquals("INSERT INTO \"ds__to\" (\"id\", \"name\", \"label\") VALUES (?, ?, ?)", insert.getValue().sql());
        assertEquals(List.of(expected, "health", "Health"), insert.getValue().params());
    }

    @Test
    public void testExistingMemberIsReused() {
        when(session.query(any())).thenReturn(List.of(Map.of("id", "x")));

        to.load(session, Map.of("name", "health", "label", "Health"));

        verify(session, never()).update(any());
    }

    @Test
    public void testConflictThenFetch() {
        // 并发插入：第一次查不到，插入冲突，回读成功
        when(session.query(any())).thenReturn(List.of(), List.of(Map.of("id", "x")));
        when(session.update(any())).thenThrow(new UniqueViolationException("duplicate", null));

        Map<String, Object> stored = to.load(session, Map.of("name", "health", "label", "Health"));

        assertNotNull(stored.get("to_id"));
        verify(session, times(2)).query(any());
        verify(session, times(1)).update(any());
    }

    @Test
    public void testConflictWithoutRow() {
        when(session.query(any())).thenReturn(List.of());
        when(session.update(any())).thenThrow(new UniqueViolationException("duplicate", null));

        LoadException e = assertThrows(LoadException.class,
                () -> to.load(session, Map.of("name", "health", "label", "Health")));
        assertInstanceOf(UniqueViolationException.class, e.getCause());
    }

    @Test
    public void testDefaultAndMissingAttributes() {
        when(session.query(any())).thenReturn(List.of());

        // label 缺失使用默认值
        Map<String, Object> stored = to.load(session, Map.of("name", "health"));
        assertEquals(ContentHasher.hash(Map.of("name", "health", "label", "Unknown")), stored.get("to_id"));

        // name 没有默认值
        LoadException e = assertThrows(LoadException.class, () -> to.load(session, Map.of("label", "Health")));
        assertEquals("to.name", e.getField());

        // 多属性维度不接受标量
        assertThrows(LoadException.class, () -> to.load(session, "health"));
    }

    @Test
    public void testSingleAttributeAcceptsScalar() {
        CompoundDimension region = new CompoundDimension("region", null, null, false,
                List.of(Attribute.of("label", DataType.STRING)));
        region.init(PhysicalSchema.builder("ds"));
        when(session.query(any())).thenReturn(List.of());

        Map<String, Object> stored = region.load(session, "North");
        assertEquals(ContentHasher.hash(Map.of("label", "North")), stored.get("region_id"));
    }
}
