package com.asiainfo.cube.infra.persistence;

import com.asiainfo.cube.core.model.SqlRequest;

import java.util.List;
import java.util.Map;

/**
 * 绑定到单个连接/事务的执行句柄
 */
public interface StorageSession {

    List<Map<String, Object>> query(SqlRequest request);

    /**
     * @throws com.asiainfo.cube.core.exception.UniqueViolationException 主键冲突
     */
    int update(SqlRequest request);
}
