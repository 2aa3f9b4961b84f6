package com.signalbot.core.exception;

/**
 * Provider cannot be initialized: missing key, invalid model, bad settings.
 */
public class ProviderConfigurationException extends SignalBotException {

    public ProviderConfigurationException(String message) {
        super(message);
    }
}
