package com.darfledger.exception;

import java.util.Map;

/**
 * Tax rule configuration is missing or inconsistent for the requested computation.
 * The engine never falls back to a default rate.
 */
public class ConfigurationException extends BaseException {

    public ConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message);
    }

    public ConfigurationException(String message, Map<String, Object> details) {
        super(ErrorCode.CONFIGURATION_ERROR, message, details);
    }
}
