package defirange.intervals;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import javax.annotation.Nullable;

/**
 * Interval arithmetic of the binary operators.
 * <p/>
 * Every operation computes the exact (unclamped) result interval first and clamps it into
 * the machine window afterwards, the unclamped interval is kept so that the caller can
 * detect overflows and underflows.
 */
public class IntervalArithmetic {

    /**
     * Shift amounts beyond this push every non zero value out of the machine window
     */
    private static final int MAX_SHIFT = 512;

    /**
     * Exponents beyond this overflow for every base with an absolute value of at least two
     */
    private static final int MAX_EXPONENT = 256;

    private static final ExtendedInteger BEYOND_CEILING = ExtendedInteger.of(Intervals.MACHINE_CEILING.add(BigInteger.ONE));
    private static final ExtendedInteger BELOW_FLOOR = ExtendedInteger.of(Intervals.MACHINE_FLOOR.subtract(BigInteger.ONE));

    public static final class Result {
        /**
         * Result clamped into the machine window
         */
        public final Interval interval;
        /**
         * Result before clamping, equal to {@link #interval} for division by zero
         */
        public final Interval unclamped;
        public final boolean divisionByZero;

        private Result(Interval interval, Interval unclamped, boolean divisionByZero) {
            this.interval = interval;
            this.unclamped = unclamped;
            this.divisionByZero = divisionByZero;
        }

        static Result of(Interval unclamped) {
            return new Result(Intervals.clamp(unclamped), unclamped, false);
        }

        static Result exact(Interval interval) {
            return new Result(interval, interval, false);
        }

        static Result divisionByZero() {
            return new Result(Intervals.MACHINE, Intervals.MACHINE, true);
        }

        /**
         * Does the unclamped result exceed the machine ceiling?
         */
        public boolean overflows() {
            return !unclamped.isBottom() && unclamped.upper().isGreaterThan(Intervals.CEILING);
        }

        /**
         * Might the unclamped result be negative?
         */
        public boolean mightBeNegative() {
            return !unclamped.isBottom() && unclamped.lower().signum() < 0;
        }

        @Override
        public String toString() {
            return divisionByZero ? "division by zero" : interval.toString();
        }
    }

    private IntervalArithmetic() {
    }

    public static Result add(Interval left, Interval right) {
        if (left.isBottom() || right.isBottom()) {
            return Result.exact(Interval.bottom());
        }
        return Result.of(Interval.of(left.lower().add(right.lower()), left.upper().add(right.upper())));
    }

    public static Result subtract(Interval left, Interval right) {
        if (left.isBottom() || right.isBottom()) {
            return Result.exact(Interval.bottom());
        }
        return Result.of(Interval.of(left.lower().subtract(right.upper()), left.upper().subtract(right.lower())));
    }

    public static Result multiply(Interval left, Interval right) {
        if (left.isBottom() || right.isBottom()) {
            return Result.exact(Interval.bottom());
        }
        List<ExtendedInteger> corners = new ArrayList<>();
        for (ExtendedInteger l : bounds(left)) {
            for (ExtendedInteger r : bounds(right)) {
                corners.add(l.multiply(r));
            }
        }
        return Result.of(hull(corners));
    }

    /**
     * Truncating division, a divisor that might be zero yields the machine interval
     */
    public static Result divide(Interval left, Interval right) {
        if (!right.isBottom() && right.containsZero()) {
            return Result.divisionByZero();
        }
        if (left.isBottom() || right.isBottom()) {
            return Result.exact(Interval.bottom());
        }
        List<ExtendedInteger> corners = new ArrayList<>();
        for (ExtendedInteger l : bounds(left)) {
            for (ExtendedInteger r : bounds(right)) {
                corners.add(l.divide(r));
            }
        }
        return Result.of(hull(corners));
    }

    /**
     * Remainder with the sign of the dividend, its magnitude is below the magnitude of the divisor
     */
    public static Result remainder(Interval left, Interval right) {
        if (!right.isBottom() && right.containsZero()) {
            return Result.divisionByZero();
        }
        if (left.isBottom() || right.isBottom()) {
            return Result.exact(Interval.bottom());
        }
        if (left.isPoint() && right.isPoint()) {
            return Result.of(Interval.point(left.lower().value().remainder(right.lower().value())));
        }
        ExtendedInteger magnitude = ExtendedInteger.max(abs(right.lower()), abs(right.upper()));
        ExtendedInteger bound = magnitude.subtract(ExtendedInteger.ONE);
        if (left.lower().signum() >= 0) {
            return Result.of(Interval.of(ExtendedInteger.ZERO, ExtendedInteger.min(left.upper(), bound)));
        }
        if (left.upper().signum() <= 0) {
            return Result.of(Interval.of(ExtendedInteger.max(left.lower(), bound.negate()), ExtendedInteger.ZERO));
        }
        return Result.of(Interval.of(bound.negate(), bound));
    }

    public static Result power(Interval base, Interval exponent) {
        if (base.isBottom() || exponent.isBottom()) {
            return Result.exact(Interval.bottom());
        }
        if (isPoint(base, 0)) {
            if (exponent.lower().signum() > 0) {
                return Result.exact(Interval.point(0));
            }
            if (isPoint(exponent, 0)) {
                return Result.exact(Interval.point(1));
            }
            return Result.exact(Intervals.UINT256);
        }
        if (isPoint(base, 1) || isPoint(exponent, 0)) {
            return Result.exact(Interval.point(1));
        }
        if (isPoint(exponent, 1)) {
            return Result.of(base);
        }
        if (!base.isFinite() || !exponent.isFinite()) {
            return Result.of(Interval.top());
        }
        BigInteger expLow = exponent.lower().value();
        BigInteger expHigh = exponent.upper().value();
        List<BigInteger> exponents = new ArrayList<>();
        exponents.add(expLow);
        exponents.add(expHigh);
        if (expHigh.compareTo(expLow) > 0) {
            // both parities matter for negative bases
            exponents.add(expHigh.subtract(BigInteger.ONE));
        }
        List<ExtendedInteger> corners = new ArrayList<>();
        for (ExtendedInteger b : bounds(base)) {
            for (BigInteger e : exponents) {
                ExtendedInteger corner = power(b.value(), e);
                if (corner != null) {
                    corners.add(corner);
                }
            }
        }
        if (base.containsZero() && expHigh.signum() > 0) {
            // even powers of bases around zero reach 0
            corners.add(ExtendedInteger.ZERO);
        }
        if (corners.isEmpty()) {
            return Result.of(Intervals.MACHINE);
        }
        return Result.of(hull(corners));
    }

    /**
     * Integer power, results that leave the machine window are replaced by a value just outside of it
     *
     * @return null if undefined (zero to a negative power)
     */
    @Nullable
    private static ExtendedInteger power(BigInteger base, BigInteger exponent) {
        boolean odd = exponent.testBit(0);
        if (exponent.signum() < 0) {
            if (base.signum() == 0) {
                return null;
            }
            if (base.equals(BigInteger.ONE)) {
                return ExtendedInteger.ONE;
            }
            if (base.equals(BigInteger.ONE.negate())) {
                return ExtendedInteger.of(odd ? -1 : 1);
            }
            return ExtendedInteger.ZERO;
        }
        if (exponent.signum() == 0) {
            return ExtendedInteger.ONE;
        }
        if (base.abs().compareTo(BigInteger.ONE) <= 0) {
            return ExtendedInteger.of(base.signum() < 0 && !odd ? BigInteger.ONE : base);
        }
        if (exponent.compareTo(BigInteger.valueOf(MAX_EXPONENT)) > 0) {
            return base.signum() < 0 && odd ? BELOW_FLOOR : BEYOND_CEILING;
        }
        return ExtendedInteger.of(base.pow(exponent.intValueExact()));
    }

    public static Result shiftLeft(Interval left, Interval shift) {
        return shift(left, shift, 1);
    }

    public static Result shiftRight(Interval left, Interval shift) {
        return shift(left, shift, -1);
    }

    /**
     * Shifts by {@code direction * shift} bits to the left, negative amounts shift to the right
     */
    private static Result shift(Interval left, Interval shift, int direction) {
        if (left.isBottom() || shift.isBottom()) {
            return Result.exact(Interval.bottom());
        }
        if (!shift.isFinite()) {
            return Result.of(Interval.top());
        }
        List<ExtendedInteger> corners = new ArrayList<>();
        for (ExtendedInteger value : bounds(left)) {
            for (ExtendedInteger amount : bounds(shift)) {
                int bits = amount.value().max(BigInteger.valueOf(-MAX_SHIFT))
                        .min(BigInteger.valueOf(MAX_SHIFT)).intValueExact() * direction;
                corners.add(bits >= 0 ? value.shiftLeft(bits) : value.shiftRight(-bits));
            }
        }
        return Result.of(hull(corners));
    }

    /**
     * Result of comparisons and boolean connectives
     */
    public static Result bool() {
        return Result.exact(Intervals.BOOL);
    }

    /**
     * Result of operators without a dedicated rule
     */
    public static Result unknown() {
        return Result.exact(Intervals.MACHINE);
    }

    /**
     * {@code [min(lows), min(highs)]}
     */
    public static Interval min(Interval left, Interval right) {
        if (left.isBottom() || right.isBottom()) {
            return Interval.bottom();
        }
        return Interval.of(ExtendedInteger.min(left.lower(), right.lower()), ExtendedInteger.min(left.upper(), right.upper()));
    }

    /**
     * {@code [max(lows), max(highs)]}
     */
    public static Interval max(Interval left, Interval right) {
        if (left.isBottom() || right.isBottom()) {
            return Interval.bottom();
        }
        return Interval.of(ExtendedInteger.max(left.lower(), right.lower()), ExtendedInteger.max(left.upper(), right.upper()));
    }

    private static boolean isPoint(Interval interval, long value) {
        return interval.equals(Interval.point(value));
    }

    private static List<ExtendedInteger> bounds(Interval interval) {
        return List.of(interval.lower(), interval.upper());
    }

    private static ExtendedInteger abs(ExtendedInteger value) {
        return value.signum() < 0 ? value.negate() : value;
    }

    private static Interval hull(List<ExtendedInteger> values) {
        return Interval.of(Collections.min(values), Collections.max(values));
    }
}
