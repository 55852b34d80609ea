package com.tsl.search.taxonomy;

public class TaxonomyConfigurationException extends IllegalStateException {
    public TaxonomyConfigurationException(String message) {
        super(message);
    }

    public TaxonomyConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
