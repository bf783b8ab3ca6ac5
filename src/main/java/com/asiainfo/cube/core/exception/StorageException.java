package com.asiainfo.cube.core.exception;

/**
 * 存储执行失败（包装 SQLException）
 */
public class StorageException extends CubeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
