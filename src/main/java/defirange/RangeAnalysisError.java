package defirange;

/**
 * Base class of all errors thrown by the analysis, detected defects of the analysed program
 * are never thrown but reported as {@link Violation}s
 */
public class RangeAnalysisError extends RuntimeException {

    public RangeAnalysisError(String message) {
        super(message);
    }

    public RangeAnalysisError(String message, Throwable cause) {
        super(message, cause);
    }
}
