package com.relaygate.api.exception;

public class ProviderNotFoundException extends RuntimeException {

    public ProviderNotFoundException(String providerName) {
        super("Provider '" + providerName + "' not found");
    }
}
