package com.asiainfo.cube.core.loader;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 内容哈希测试
 */
public class ContentHasherTest {

    @Test
    public void testKeyOrderDoesNotChangeHash() {
        Map<String, Object> a = new LinkedHashMap<>();
        a.put("amount", 100);
        a.put("to", Map.of("label", "Health", "name", "health"));
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("to", new LinkedHashMap<>(Map.of("name", "health", "label", "Health")));
        b.put("amount", 100);

        String hashA = ContentHasher.hash(a);
        String hashB = ContentHasher.hash(b);
        System.out.println("hash: " + hashA);

        assertEquals(hashA, hashB, "键顺序不同但内容相同，哈希应一致");
        assertEquals(40, hashA.length());
        assertTrue(hashA.matches("[0-9a-f]{40}"));
    }

    @Test
    public void testDifferentContentDifferentHash() {
        assertNotEquals(ContentHasher.hash(Map.of("label", "Health")), ContentHasher.hash(Map.of("label", "Education")));
        // 类型不同也视为不同内容
        assertNotEquals(ContentHasher.hash(Map.of("v", 1)), ContentHasher.hash(Map.of("v", "1")));
    }

    @Test
    public void testCanonicalEncodingIsVersioned() {
        String canonical = ContentHasher.canonical(Map.of("b", List.of(1, 2), "a", "x"));
        assertEquals("cube-hash-v1\n{\"a\":\"x\",\"b\":[1,2]}", canonical);
    }
}
