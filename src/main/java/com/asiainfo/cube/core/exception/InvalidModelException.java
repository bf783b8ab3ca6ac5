package com.asiainfo.cube.core.exception;

/**
 * 模型描述结构非法（缺少 dataset/mapping、未知类型、非法标识符等）
 */
public class InvalidModelException extends CubeException {

    public InvalidModelException(String message) {
        super(message);
    }

    public InvalidModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
