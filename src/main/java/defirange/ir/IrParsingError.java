package defirange.ir;

import defirange.RangeAnalysisError;

/**
 * Error in the text form of a program read by {@link IrReader}
 */
public class IrParsingError extends RangeAnalysisError {

    public final int line;

    public IrParsingError(int line, String message) {
        super(String.format("Line %d: %s", line, message));
        this.line = line;
    }
}
