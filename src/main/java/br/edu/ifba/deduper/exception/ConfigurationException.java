package br.edu.ifba.deduper.exception;

/**
 * Invalid detection configuration. Raised before any scan work begins.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(final String message) {
        super(message);
    }

    public ConfigurationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
