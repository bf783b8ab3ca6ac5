package com.asiainfo.cube.config;

import com.asiainfo.cube.core.exception.StorageException;
import io.agroal.api.AgroalDataSource;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * SQLite 启动检查
 * 连接参数（busy_timeout、foreign_keys、journal_mode、transaction_mode）通过 application.properties 中的 JDBC URL 配置
 */
@ApplicationScoped
public class SQLiteConfig {

    private static final Logger log = LoggerFactory.getLogger(SQLiteConfig.class);

    @Inject
    @io.quarkus.agroal.DataSource("cube")
    AgroalDataSource cubeDataSource;

    void onStart(@Observes StartupEvent event) {
        try (Connection conn = cubeDataSource.getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT sqlite_version()")) {
            rs.next();
            log.info("SQLite 版本: {}", rs.getString(1));
            log.info("Cube 存储连接正常: {}", conn.getMetaData().getURL());
        } catch (SQLException e) {
            log.error("SQLite 连接检查失败", e);
            throw new StorageException("SQLite 连接检查失败", e);
        }
    }
}
