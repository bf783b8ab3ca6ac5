package com.asiainfo.cube.infra.persistence;

import com.asiainfo.cube.core.model.SqlRequest;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * 存储执行器
 * Cube 只通过该接口访问物理存储（DDL、DML、查询）
 */
public interface StorageExecutor {

    List<Map<String, Object>> query(SqlRequest request);

    int update(SqlRequest request);

    /**
     * 在同一事务内按顺序执行多条语句
     */
    void executeAll(List<String> statements);

    boolean tableExists(String table);

    /**
     * 表的物理列名（小写）；表不存在时返回空集合
     */
    Set<String> columnsOf(String table);

    /**
     * 在单个事务中执行，正常返回提交，抛异常回滚
     */
    <T> T inTransaction(Function<StorageSession, T> work);
}
