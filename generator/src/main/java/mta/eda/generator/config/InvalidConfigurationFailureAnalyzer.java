package mta.eda.generator.config;

import mta.eda.generator.exception.InvalidConfigurationException;
import org.springframework.boot.diagnostics.AbstractFailureAnalyzer;
import org.springframework.boot.diagnostics.FailureAnalysis;

/**
 * Turns a startup validation failure into a short report instead of a stack trace.
 */
public class InvalidConfigurationFailureAnalyzer extends AbstractFailureAnalyzer<InvalidConfigurationException> {

    @Override
    protected FailureAnalysis analyze(Throwable rootFailure, InvalidConfigurationException cause) {
        return new FailureAnalysis(
                cause.getMessage(),
                "Fix '" + cause.getProperty() + "' (application.properties, --" + cause.getProperty()
                        + "=..., or the matching environment variable) and start the generator again.",
                cause);
    }
}
