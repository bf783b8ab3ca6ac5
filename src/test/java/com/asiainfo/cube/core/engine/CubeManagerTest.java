package com.asiainfo.cube.core.engine;

import com.asiainfo.cube.TestModels;
import com.asiainfo.cube.core.exception.InvalidModelException;
import com.asiainfo.cube.core.exception.UnknownDatasetException;
import com.fasterxml.jackson.databind.JsonNode;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Cube 注册表测试
 */
@QuarkusTest
public class CubeManagerTest {

    @Inject
    CubeManager cubeManager;

    @Test
    public void testRegisterAndCache() {
        Cube registered = cubeManager.register(TestModels.spending("reg_cached"));

        assertTrue(cubeManager.contains("reg_cached"));
        assertTrue(cubeManager.names().contains("reg_cached"));
        assertNotEquals(Cube.State.UNINITIALIZED, registered.state());
        // 缓存命中返回同一实例
        assertSame(registered, cubeManager.get("reg_cached"));
        System.out.println("Registry stats: " + cubeManager.getStats());

        // 重新注册替换缓存
        Cube replaced = cubeManager.register(TestModels.spending("reg_cached"));
        assertNotSame(registered, replaced);
        assertSame(replaced, cubeManager.get("reg_cached"));
    }

    @Test
    public void testUnregister() {
        cubeManager.register(TestModels.spending("reg_removed"));
        cubeManager.unregister("reg_removed");

        assertFalse(cubeManager.contains("reg_removed"));
        UnknownDatasetException e = assertThrows(UnknownDatasetException.class,
                () -> cubeManager.get("reg_removed"));
        System.out.println("Expected: " + e.getMessage());
        // 重复注销不报错
        cubeManager.unregister("reg_removed");
    }

    @Test
    public void testInvalidModelNotRegistered() {
        assertThrows(InvalidModelException.class, () -> cubeManager.register(Map.of(
                "dataset", Map.of("name", "reg_invalid"),
                "mapping", Map.of("amount", Map.of("type", "bogus")))));
        assertFalse(cubeManager.contains("reg_invalid"));
        assertThrows(InvalidModelException.class, () -> cubeManager.register("{not json"));
    }

    @Test
    public void testModelDescription() {
        Cube cube = cubeManager.register(TestModels.full("reg_model"));

        JsonNode model = cube.model();
        assertEquals("reg_model", model.path("dataset").path("name").asText());
        // 未声明 default_time 时取第一个时间维度
        assertEquals("time", model.path("dataset").path("default_time").asText());
        assertEquals("EUR", model.path("dataset").path("currency").asText());
        assertEquals("measure", model.path("mapping").path("amount").path("type").asText());

        assertEquals("reg_model", cube.key());
        assertEquals(2, cube.facetDimensions().size());
        assertEquals(3, cube.compounds().size());
    }
}
