package com.asiainfo.cube.core.exception;

/**
 * 物理表尚未创建，调用 generate() 后可恢复
 */
public class NotGeneratedException extends CubeException {

    private final String dataset;

    public NotGeneratedException(String dataset, String operation) {
        super(String.format("Dataset '%s' is not generated, cannot %s", dataset, operation));
        this.dataset = dataset;
    }

    public String getDataset() {
        return dataset;
    }
}
