package com.asiainfo.cube.core.engine;

import com.asiainfo.cube.config.CubeConfig;
import com.asiainfo.cube.core.exception.UnknownDatasetException;
import com.asiainfo.cube.core.parser.CubeModel;
import com.asiainfo.cube.core.parser.ModelParser;
import com.asiainfo.cube.core.schema.SchemaCompiler;
import com.asiainfo.cube.infra.persistence.StorageExecutor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Cube 注册表
 * 注册的是模型描述；编译后的 Cube 放在 Caffeine 缓存中，淘汰后按描述重建并重新 init()
 */
@ApplicationScoped
public class CubeManager {

    private static final Logger log = LoggerFactory.getLogger(CubeManager.class);

    private final Map<String, JsonNode> descriptions = new ConcurrentHashMap<>();

    @Inject
    ModelParser parser;

    @Inject
    SchemaCompiler compiler;

    @Inject
    StorageExecutor executor;

    @Inject
    CubeConfig config;

    @Inject
    ObjectMapper mapper;

    @Inject
    MeterRegistry registry;

    private LoadingCache<String, Cube> cubes;

    @PostConstruct
    void init() {
        cubes = Caffeine.newBuilder()
                .maximumSize(config.getRegistryMaxSize())
                .expireAfterAccess(config.getRegistryExpireMinutes(), TimeUnit.MINUTES)
                .recordStats()
                .build(this::build);
        log.info("[Cube Registry] Initialized with MaxSize={}, ExpireAfterAccess={}min",
                config.getRegistryMaxSize(), config.getRegistryExpireMinutes());
    }

    /**
     * 注册（或替换）模型描述，返回已 init() 的 Cube
     */
    public Cube register(JsonNode description) {
        CubeModel model = parser.parse(description);
        descriptions.put(model.name(), model.description());
        cubes.invalidate(model.name());
        log.info("[Cube Registry] Registered {}", model.name());
        return get(model.name());
    }

    public Cube register(String description) {
        return register(parser.parse(description).description());
    }

    public Cube register(Map<String, ?> description) {
        return register(mapper.<JsonNode>valueToTree(description));
    }

    /**
     * @throws UnknownDatasetException 未注册
     */
    public Cube get(String name) {
        return cubes.get(name);
    }

    public boolean contains(String name) {
        return descriptions.containsKey(name);
    }

    public Set<String> names() {
        return Set.copyOf(descriptions.keySet());
    }

    /**
     * 注销模型；物理表保留，需要时先调用 drop()
     */
    public void unregister(String name) {
        if (descriptions.remove(name) != null) {
            log.info("[Cube Registry] Unregistered {}", name);
        }
        cubes.invalidate(name);
    }

    public String getStats() {
        var stats = cubes.stats();
        return String.format("hits=%d, misses=%d, evictions=%d, size=%d",
                stats.hitCount(), stats.missCount(), stats.evictionCount(), cubes.estimatedSize());
    }

    private Cube build(String name) {
        JsonNode description = descriptions.get(name);
        if (description == null) {
            throw new UnknownDatasetException(name);
        }
        log.debug("[Cube Registry] Miss: {}, compiling", name);
        // 字段对象绑定物理列，每次重建都重新解析
        CubeModel model = parser.parse(description);
        return new Cube(model, compiler, executor, config, mapper, registry).init();
    }
}
