package com.asiainfo.cube.config;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cube 引擎配置
 */
@ApplicationScoped
public class CubeConfig {

    private static final Logger log = LoggerFactory.getLogger(CubeConfig.class);

    // 查询分页
    @ConfigProperty(name = "cube.query.default-pagesize", defaultValue = "10000")
    int defaultPagesize;

    @ConfigProperty(name = "cube.query.max-pagesize", defaultValue = "100000")
    int maxPagesize;

    // 明细查询每批拉取行数
    @ConfigProperty(name = "cube.entries.batch-size", defaultValue = "500")
    int entriesBatchSize;

    // 已编译 Cube 缓存
    @ConfigProperty(name = "cube.registry.max-size", defaultValue = "100")
    int registryMaxSize;

    @ConfigProperty(name = "cube.registry.expire-after-access-minutes", defaultValue = "60")
    int registryExpireMinutes;

    @PostConstruct
    void init() {
        log.info("=== Cube Configuration ===");
        log.info("Query:    default pagesize {}, max pagesize {}", defaultPagesize, maxPagesize);
        log.info("Entries:  batch size {}", entriesBatchSize);
        log.info("Registry: max size {}, expire after access {}min", registryMaxSize, registryExpireMinutes);
        log.info("==========================");
    }

    public int getDefaultPagesize() {
        return defaultPagesize;
    }

    public int getMaxPagesize() {
        return maxPagesize;
    }

    public int getEntriesBatchSize() {
        return entriesBatchSize;
    }

    public int getRegistryMaxSize() {
        return registryMaxSize;
    }

    public int getRegistryExpireMinutes() {
        return registryExpireMinutes;
    }
}
