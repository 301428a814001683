package defirange.intervals;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Arbitrary precision integer extended with the two infinities.
 * <p/>
 * The infinities are absorbing: adding a finite number to an infinity gives the same infinity,
 * multiplying by zero gives zero and dividing a finite number by an infinity gives zero.
 */
public final class ExtendedInteger implements Comparable<ExtendedInteger> {

    public static final ExtendedInteger NEGATIVE_INFINITY = new ExtendedInteger(-1, null);
    public static final ExtendedInteger POSITIVE_INFINITY = new ExtendedInteger(1, null);
    public static final ExtendedInteger ZERO = new ExtendedInteger(0, BigInteger.ZERO);
    public static final ExtendedInteger ONE = new ExtendedInteger(0, BigInteger.ONE);

    /**
     * -1 for -∞, 1 for +∞ and 0 for finite numbers
     */
    private final int infinity;
    private final BigInteger value;

    private ExtendedInteger(int infinity, BigInteger value) {
        this.infinity = infinity;
        this.value = value;
    }

    public static ExtendedInteger of(BigInteger value) {
        Objects.requireNonNull(value);
        if (value.signum() == 0) {
            return ZERO;
        }
        return new ExtendedInteger(0, value);
    }

    public static ExtendedInteger of(long value) {
        return of(BigInteger.valueOf(value));
    }

    public static ExtendedInteger infinity(int sign) {
        if (sign == 0) {
            throw new IllegalArgumentException("an infinity needs a sign");
        }
        return sign < 0 ? NEGATIVE_INFINITY : POSITIVE_INFINITY;
    }

    public boolean isFinite() {
        return infinity == 0;
    }

    public boolean isPositiveInfinity() {
        return infinity > 0;
    }

    public boolean isNegativeInfinity() {
        return infinity < 0;
    }

    /**
     * The finite value
     *
     * @throws ArithmeticException if this is an infinity
     */
    public BigInteger value() {
        if (!isFinite()) {
            throw new ArithmeticException(this + " has no finite value");
        }
        return value;
    }

    public int signum() {
        return isFinite() ? value.signum() : infinity;
    }

    public ExtendedInteger negate() {
        return isFinite() ? of(value.negate()) : infinity(-infinity);
    }

    public ExtendedInteger add(ExtendedInteger other) {
        if (isFinite() && other.isFinite()) {
            return of(value.add(other.value));
        }
        if (!isFinite() && !other.isFinite() && infinity != other.infinity) {
            throw new ArithmeticException(String.format("%s + %s is undefined", this, other));
        }
        return isFinite() ? other : this;
    }

    public ExtendedInteger subtract(ExtendedInteger other) {
        return add(other.negate());
    }

    public ExtendedInteger multiply(ExtendedInteger other) {
        if (signum() == 0 || other.signum() == 0) {
            return ZERO;
        }
        if (isFinite() && other.isFinite()) {
            return of(value.multiply(other.value));
        }
        return infinity(signum() * other.signum());
    }

    /**
     * Division that truncates towards zero, like the signed division of the virtual machine.
     * ∞ / ∞ is defined as zero, which lies between the values of every pair of corners
     * that produce it.
     *
     * @throws ArithmeticException on a division by zero
     */
    public ExtendedInteger divide(ExtendedInteger other) {
        if (other.signum() == 0) {
            throw new ArithmeticException("division by zero");
        }
        if (isFinite() && other.isFinite()) {
            return of(value.divide(other.value));
        }
        if (!other.isFinite()) {
            return ZERO;
        }
        return infinity(signum() * other.signum());
    }

    /**
     * Multiplies by {@code 2^shift}
     */
    public ExtendedInteger shiftLeft(int shift) {
        return isFinite() ? of(value.shiftLeft(shift)) : this;
    }

    /**
     * Floors the division by {@code 2^shift}
     */
    public ExtendedInteger shiftRight(int shift) {
        return isFinite() ? of(value.shiftRight(shift)) : this;
    }

    public static ExtendedInteger min(ExtendedInteger a, ExtendedInteger b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static ExtendedInteger max(ExtendedInteger a, ExtendedInteger b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public boolean isLessThan(ExtendedInteger other) {
        return compareTo(other) < 0;
    }

    public boolean isGreaterThan(ExtendedInteger other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(ExtendedInteger other) {
        if (infinity != other.infinity) {
            return Integer.compare(infinity, other.infinity);
        }
        if (!isFinite()) {
            return 0;
        }
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof ExtendedInteger && compareTo((ExtendedInteger) obj) == 0;
    }

    @Override
    public int hashCode() {
        return isFinite() ? value.hashCode() : infinity * 31;
    }

    @Override
    public String toString() {
        if (isFinite()) {
            return value.toString();
        }
        return infinity < 0 ? "-∞" : "+∞";
    }
}
