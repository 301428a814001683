package defirange.ir;

import java.math.BigInteger;
import java.util.Objects;

import javax.annotation.Nullable;

import defirange.intervals.Intervals;

/**
 * Compile time constant, given by its literal text
 */
public final class Constant implements Operand {

    public final String literal;
    @Nullable
    private final BigInteger value;

    public Constant(String literal) {
        this.literal = Objects.requireNonNull(literal);
        this.value = Intervals.parseLiteral(literal);
    }

    public static Constant of(long value) {
        return new Constant(Long.toString(value));
    }

    public static Constant of(BigInteger value) {
        return new Constant(value.toString());
    }

    /**
     * Numeric value of decimal and hexadecimal literals, null for other literals (e.g. strings)
     */
    @Nullable
    public BigInteger value() {
        return value;
    }

    public boolean isNumeric() {
        return value != null;
    }

    @Override
    public String text() {
        return literal;
    }

    @Override
    public String toString() {
        return literal;
    }
}
