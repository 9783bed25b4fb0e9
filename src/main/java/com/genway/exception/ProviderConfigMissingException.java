package com.genway.exception;

public class ProviderConfigMissingException extends ConfigurationException {

    private final String provider;

    public ProviderConfigMissingException(String provider) {
        super("Provider '" + provider + "' configuration not found");
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
