package com.asiainfo.cube.core.exception;

/**
 * 主键/唯一约束冲突，供维度行 upsert 做 "冲突后回读" 处理
 */
public class UniqueViolationException extends StorageException {

    public UniqueViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
