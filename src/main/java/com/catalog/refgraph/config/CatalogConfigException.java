package com.catalog.refgraph.config;

/** Raised when catalog configuration cannot be read or parsed. */
public class CatalogConfigException extends RuntimeException {

    public CatalogConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
