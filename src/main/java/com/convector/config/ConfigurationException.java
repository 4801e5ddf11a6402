package com.convector.config;

import com.convector.ConvectorException;

/**
 * Raised before any I/O when the supplied profile cannot be executed.
 */
public class ConfigurationException extends ConvectorException {
    public ConfigurationException(String message) {
        super(message);
    }
}
