package com.asiainfo.cube.core.exception;

/**
 * drilldown / cut / order / 分页参数组合非法
 */
public class InvalidQueryException extends CubeException {

    public InvalidQueryException(String message) {
        super(message);
    }
}
