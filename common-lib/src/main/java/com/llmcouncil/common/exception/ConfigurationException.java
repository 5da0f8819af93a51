package com.llmcouncil.common.exception;

public class ConfigurationException extends CouncilException {

    public ConfigurationException(String message) {
        super(ErrorKind.CONFIGURATION, message);
    }
}
