package defirange.config;

import defirange.RangeAnalysisError;

public class ConfigurationError extends RangeAnalysisError {

    public ConfigurationError(String message) {
        super(message);
    }
}
