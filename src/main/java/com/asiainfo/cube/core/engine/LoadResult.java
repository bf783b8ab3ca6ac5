package com.asiainfo.cube.core.engine;

import java.util.List;

/**
 * 批量装载结果
 *
 * @param loaded 成功装载的记录数
 * @param failed 失败的记录数
 * @param errors 失败记录的错误信息（含记录序号）
 */
public record LoadResult(int loaded, int failed, List<String> errors) {

    public LoadResult {
        errors = List.copyOf(errors);
    }

    public boolean success() {
        return failed == 0;
    }
}
