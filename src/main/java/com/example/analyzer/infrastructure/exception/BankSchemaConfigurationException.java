package com.example.analyzer.infrastructure.exception;

/**
 * Infrastructure-layer exception that signals an unusable bank schema entry in the application configuration.
 */
public class BankSchemaConfigurationException extends InfrastructureException {

	/**
	 * @param message description of the broken configuration entry
	 */
    public BankSchemaConfigurationException(String message) {
        super(message);
    }

	/**
	 * @param message description of the broken configuration entry
	 * @param cause   parsing failure raised while reading the entry
	 */
    public BankSchemaConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
