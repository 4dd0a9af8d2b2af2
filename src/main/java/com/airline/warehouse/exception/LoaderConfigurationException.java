package com.airline.warehouse.exception;

/**
 * Invalid or missing loader configuration. Raised at startup; the pipeline does not run.
 */
public class LoaderConfigurationException extends WarehouseLoadException {

    public LoaderConfigurationException(String message) {
        super(message);
    }
}
