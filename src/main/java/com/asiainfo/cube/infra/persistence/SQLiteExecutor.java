package com.asiainfo.cube.infra.persistence;

import com.asiainfo.cube.core.exception.StorageException;
import com.asiainfo.cube.core.exception.UniqueViolationException;
import com.asiainfo.cube.core.model.SqlRequest;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * 基于 SQLite 的存储执行器
 * 所有 SQL 都以参数化 SqlRequest 形式传入，本类只负责连接、事务与结果集映射
 */
@ApplicationScoped
public class SQLiteExecutor implements StorageExecutor {

    private static final Logger log = LoggerFactory.getLogger(SQLiteExecutor.class);

    // SQLITE_CONSTRAINT
    private static final int SQLITE_CONSTRAINT = 19;

    @Inject
    MeterRegistry registry;

    @Inject
    @io.quarkus.agroal.DataSource("cube")
    javax.sql.DataSource cubeDs;

    @Override
    public List<Map<String, Object>> query(SqlRequest request) {
        try (Connection conn = cubeDs.getConnection()) {
            return new ConnectionSession(conn).query(request);
        } catch (SQLException e) {
            throw translate("Query failed: " + request.sql(), e);
        }
    }

    @Override
    public int update(SqlRequest request) {
        try (Connection conn = cubeDs.getConnection()) {
            return new ConnectionSession(conn).update(request);
        } catch (SQLException e) {
            throw translate("Update failed: " + request.sql(), e);
        }
    }

    @Override
    public void executeAll(List<String> statements) {
        inTransaction(session -> {
            for (String sql : statements) {
                log.debug("[DDL] {}", sql);
                session.update(new SqlRequest(sql));
            }
            return statements.size();
        });
    }

    @Override
    public boolean tableExists(String table) {
        try (Connection conn = cubeDs.getConnection();
             ResultSet rs = conn.getMetaData().getTables(null, null, table, new String[]{"TABLE"})) {
            while (rs.next()) {
                // getTables 的 pattern 中 "_" 是通配符，需二次比较
                if (table.equalsIgnoreCase(rs.getString("TABLE_NAME"))) {
                    return true;
                }
            }
            return false;
        } catch (SQLException e) {
            throw translate("Cannot inspect table " + table, e);
        }
    }

    @Override
    public Set<String> columnsOf(String table) {
        Set<String> columns = new LinkedHashSet<>();
        try (Connection conn = cubeDs.getConnection()) {
            DatabaseMetaData metaData = conn.getMetaData();
            try (ResultSet rs = metaData.getColumns(null, null, table, null)) {
                while (rs.next()) {
                    if (table.equalsIgnoreCase(rs.getString("TABLE_NAME"))) {
                        columns.add(rs.getString("COLUMN_NAME").toLowerCase(Locale.ROOT));
                    }
                }
            }
            return columns;
        } catch (SQLException e) {
            throw translate("Cannot inspect columns of " + table, e);
        }
    }

    @Override
    public <T> T inTransaction(Function<StorageSession, T> work) {
        try (Connection conn = cubeDs.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                T result = work.apply(new ConnectionSession(conn));
                conn.commit();
                return result;
            } catch (RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw translate("Transaction failed", e);
        }
    }

    private StorageException translate(String message, SQLException e) {
        if (isUniqueViolation(e)) {
            return new UniqueViolationException(message, e);
        }
        log.error("{}: {}", message, e.getMessage());
        return new StorageException(message, e);
    }

    static boolean isUniqueViolation(SQLException e) {
        String state = e.getSQLState();
        if (state != null && state.startsWith("23")) {
            return true;
        }
        if (e.getErrorCode() == SQLITE_CONSTRAINT) {
            String message = e.getMessage() == null ? "" : e.getMessage();
            return message.contains("UNIQUE") || message.contains("PRIMARY KEY");
        }
        return false;
    }

    /**
     * 绑定单个连接的执行句柄
     */
    private class ConnectionSession implements StorageSession {

        private final Connection conn;

        ConnectionSession(Connection conn) {
            this.conn = conn;
        }

        @Override
        public List<Map<String, Object>> query(SqlRequest request) {
            try {
                // 【埋点】记录 SQL 执行耗时
                return Timer.builder("cube.query.time")
                        .description("Cube query execution time")
                        .register(registry)
                        .recordCallable(() -> {
                            long start = System.currentTimeMillis();
                            try (PreparedStatement stmt = prepare(request)) {
                                try (ResultSet rs = stmt.executeQuery()) {
                                    List<Map<String, Object>> results = resultSetToList(rs);
                                    log.debug("[SQL] {} params={} in {} ms, rows: {}", request.sql(), request.params(),
                                            System.currentTimeMillis() - start, results.size());
                                    return results;
                                }
                            }
                        });
            } catch (SQLException e) {
                throw translate("Query failed: " + request.sql(), e);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new StorageException("Query failed: " + request.sql(), e);
            }
        }

        @Override
        public int update(SqlRequest request) {
            try (PreparedStatement stmt = prepare(request)) {
                int count = stmt.executeUpdate();
                log.debug("[SQL] {} params={} -> {} rows", request.sql(), request.params(), count);
                return count;
            } catch (SQLException e) {
                throw translate("Update failed: " + request.sql(), e);
            }
        }

        private PreparedStatement prepare(SqlRequest request) throws SQLException {
            PreparedStatement stmt = conn.prepareStatement(request.sql());
            try {
                List<Object> params = request.params();
                for (int i = 0; i < params.size(); i++) {
                    stmt.setObject(i + 1, params.get(i));
                }
                return stmt;
            } catch (SQLException e) {
                stmt.close();
                throw e;
            }
        }
    }

    private static List<Map<String, Object>> resultSetToList(ResultSet rs) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        int columns = md.getColumnCount();
        List<Map<String, Object>> list = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columns; ++i) {
                row.put(md.getColumnLabel(i), rs.getObject(i));
            }
            list.add(row);
        }
        return list;
    }
}
