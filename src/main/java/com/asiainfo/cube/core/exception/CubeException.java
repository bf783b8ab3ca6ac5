package com.asiainfo.cube.core.exception;

/**
 * Cube 引擎异常基类
 * 所有引擎错误均为非受检异常，直接向调用方传播
 */
public class CubeException extends RuntimeException {

    public CubeException(String message) {
        super(message);
    }

    public CubeException(String message, Throwable cause) {
        super(message, cause);
    }
}
