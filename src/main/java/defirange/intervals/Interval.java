package defirange.intervals;

import java.math.BigInteger;
import java.util.Objects;

import static defirange.intervals.ExtendedInteger.NEGATIVE_INFINITY;
import static defirange.intervals.ExtendedInteger.POSITIVE_INFINITY;

/**
 * Interval with inclusive boundaries, the bounds might be infinite.
 * <p/>
 * Intervals are immutable, every operation returns a new interval. The bottom element
 * (no possible value) has no bounds, every other interval satisfies {@code lower <= upper}.
 */
public final class Interval {

    private static final Interval BOTTOM = new Interval(null, null);
    private static final Interval TOP = new Interval(NEGATIVE_INFINITY, POSITIVE_INFINITY);

    private final ExtendedInteger lower;
    private final ExtendedInteger upper;

    private Interval(ExtendedInteger lower, ExtendedInteger upper) {
        this.lower = lower;
        this.upper = upper;
    }

    public static Interval bottom() {
        return BOTTOM;
    }

    public static Interval top() {
        return TOP;
    }

    /**
     * Creates {@code [lower, upper]}, returns bottom if the interval would be empty
     */
    public static Interval of(ExtendedInteger lower, ExtendedInteger upper) {
        Objects.requireNonNull(lower);
        Objects.requireNonNull(upper);
        if (lower.isPositiveInfinity() || upper.isNegativeInfinity() || lower.isGreaterThan(upper)) {
            return BOTTOM;
        }
        if (lower.isNegativeInfinity() && upper.isPositiveInfinity()) {
            return TOP;
        }
        return new Interval(lower, upper);
    }

    public static Interval of(BigInteger lower, BigInteger upper) {
        return of(ExtendedInteger.of(lower), ExtendedInteger.of(upper));
    }

    public static Interval of(long lower, long upper) {
        return of(ExtendedInteger.of(lower), ExtendedInteger.of(upper));
    }

    public static Interval point(BigInteger value) {
        return of(value, value);
    }

    public static Interval point(long value) {
        return of(value, value);
    }

    /**
     * {@code (-∞, upper]}
     */
    public static Interval atMost(BigInteger upper) {
        return of(NEGATIVE_INFINITY, ExtendedInteger.of(upper));
    }

    /**
     * {@code [lower, +∞)}
     */
    public static Interval atLeast(BigInteger lower) {
        return of(ExtendedInteger.of(lower), POSITIVE_INFINITY);
    }

    public boolean isBottom() {
        return lower == null;
    }

    public boolean isTop() {
        return !isBottom() && lower.isNegativeInfinity() && upper.isPositiveInfinity();
    }

    /**
     * @throws IllegalStateException for bottom
     */
    public ExtendedInteger lower() {
        checkNotBottom();
        return lower;
    }

    /**
     * @throws IllegalStateException for bottom
     */
    public ExtendedInteger upper() {
        checkNotBottom();
        return upper;
    }

    private void checkNotBottom() {
        if (isBottom()) {
            throw new IllegalStateException("bottom has no bounds");
        }
    }

    public boolean isFinite() {
        return !isBottom() && lower.isFinite() && upper.isFinite();
    }

    public boolean isPoint() {
        return isFinite() && lower.equals(upper);
    }

    public boolean contains(BigInteger value) {
        ExtendedInteger val = ExtendedInteger.of(value);
        return !isBottom() && !lower.isGreaterThan(val) && !upper.isLessThan(val);
    }

    public boolean containsZero() {
        return contains(BigInteger.ZERO);
    }

    /**
     * Smallest interval containing both intervals
     */
    public Interval join(Interval other) {
        if (isBottom()) {
            return other;
        }
        if (other.isBottom()) {
            return this;
        }
        return of(ExtendedInteger.min(lower, other.lower), ExtendedInteger.max(upper, other.upper));
    }

    /**
     * Largest interval contained in both intervals
     */
    public Interval meet(Interval other) {
        if (isBottom() || other.isBottom()) {
            return BOTTOM;
        }
        return of(ExtendedInteger.max(lower, other.lower), ExtendedInteger.min(upper, other.upper));
    }

    /**
     * Widening with the newer interval {@code other}: every bound of {@code other} that
     * lies outside of this interval is moved to the corresponding infinity
     */
    public Interval widen(Interval other) {
        if (isBottom()) {
            return other;
        }
        if (other.isBottom()) {
            return this;
        }
        return of(other.lower.isLessThan(lower) ? NEGATIVE_INFINITY : lower,
                other.upper.isGreaterThan(upper) ? POSITIVE_INFINITY : upper);
    }

    /**
     * Narrowing: replaces the infinite bounds of this interval by the bounds of {@code other}
     */
    public Interval narrow(Interval other) {
        if (isBottom() || other.isBottom()) {
            return BOTTOM;
        }
        return of(lower.isNegativeInfinity() ? other.lower : lower,
                upper.isPositiveInfinity() ? other.upper : upper);
    }

    /**
     * Is every value of this interval also a value of {@code other}?
     */
    public boolean isSubsetOf(Interval other) {
        if (isBottom()) {
            return true;
        }
        if (other.isBottom()) {
            return false;
        }
        return !lower.isLessThan(other.lower) && !upper.isGreaterThan(other.upper);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Interval)) {
            return false;
        }
        Interval other = (Interval) obj;
        if (isBottom() || other.isBottom()) {
            return isBottom() && other.isBottom();
        }
        return lower.equals(other.lower) && upper.equals(other.upper);
    }

    @Override
    public int hashCode() {
        return isBottom() ? 0 : Objects.hash(lower, upper);
    }

    @Override
    public String toString() {
        if (isBottom()) {
            return "⊥";
        }
        if (isTop()) {
            return "⊤";
        }
        return String.format("[%s, %s]", lower, upper);
    }
}
