package defirange;

/**
 * The front-end delivered a control flow graph that cannot be analysed, the function is skipped
 */
public class MalformedCfgError extends RangeAnalysisError {

    public MalformedCfgError(String function, String reason) {
        super(String.format("Malformed control flow graph of %s: %s", function, reason));
    }
}
