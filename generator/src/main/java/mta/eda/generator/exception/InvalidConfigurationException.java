package mta.eda.generator.exception;

import lombok.Getter;

/**
 * InvalidConfigurationException
 * Thrown at startup when the generator settings cannot produce a valid session.
 * The generator never starts its loop after this.
 */
@Getter
public class InvalidConfigurationException extends RuntimeException {

    private final String property;

    public InvalidConfigurationException(String property, String message) {
        super("Invalid configuration '" + property + "': " + message);
        this.property = property;
    }
}
