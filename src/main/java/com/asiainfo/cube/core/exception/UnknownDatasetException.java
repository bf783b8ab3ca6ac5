package com.asiainfo.cube.core.exception;

public class UnknownDatasetException extends CubeException {

    public UnknownDatasetException(String dataset) {
        super("Dataset not registered: " + dataset);
    }
}
