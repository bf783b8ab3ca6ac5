package com.asiainfo.cube.core.model;

import com.asiainfo.cube.core.exception.InvalidQueryException;

import java.util.List;

/**
 * 明细查询请求
 *
 * @param cuts   等值过滤，语义同聚合查询
 * @param limit  最多返回条数，null 表示不限
 * @param offset 跳过条数
 */
public record EntriesRequest(List<AggregateRequest.Cut> cuts, Integer limit, int offset) {

    public EntriesRequest {
        if (limit != null && limit < 0) {
            throw new InvalidQueryException("limit must not be negative: " + limit);
        }
        if (offset < 0) {
            throw new InvalidQueryException("offset must not be negative: " + offset);
        }
        cuts = cuts == null ? List.of() : List.copyOf(cuts);
    }

    public static EntriesRequest all() {
        return new EntriesRequest(List.of(), null, 0);
    }

    public static EntriesRequest page(int limit, int offset) {
        return new EntriesRequest(List.of(), limit, offset);
    }
}
