package defirange.intervals;

import java.math.BigInteger;

import javax.annotation.Nullable;

import defirange.typing.SemanticType;

/**
 * Machine bounds and the canonical intervals of the semantic types
 */
public class Intervals {

    /**
     * Lowest value of the 256 bit machine window, {@code -2^255}
     */
    public static final BigInteger MACHINE_FLOOR = BigInteger.ONE.shiftLeft(255).negate();
    /**
     * Highest value of the 256 bit machine window, {@code 2^256 - 1}
     */
    public static final BigInteger MACHINE_CEILING = powerOfTwo(256).subtract(BigInteger.ONE);

    public static final ExtendedInteger FLOOR = ExtendedInteger.of(MACHINE_FLOOR);
    public static final ExtendedInteger CEILING = ExtendedInteger.of(MACHINE_CEILING);

    /**
     * Every value that the analysis can represent, returned when nothing is known about a result
     */
    public static final Interval MACHINE = Interval.of(MACHINE_FLOOR, MACHINE_CEILING);

    public static final Interval UINT256 = unsigned(256);
    public static final Interval ADDRESS = unsigned(160);
    public static final Interval BOOL = Interval.of(0, 1);
    public static final Interval TRUE = Interval.point(1);
    public static final Interval FALSE = Interval.point(0);

    private Intervals() {
    }

    public static BigInteger powerOfTwo(int exponent) {
        return BigInteger.ONE.shiftLeft(exponent);
    }

    public static BigInteger powerOfTen(int exponent) {
        return BigInteger.TEN.pow(exponent);
    }

    /**
     * {@code [0, 2^width - 1]}
     */
    public static Interval unsigned(int width) {
        return Interval.of(BigInteger.ZERO, powerOfTwo(width).subtract(BigInteger.ONE));
    }

    /**
     * {@code [-2^(width-1), 2^(width-1) - 1]}
     */
    public static Interval signed(int width) {
        BigInteger half = powerOfTwo(width - 1);
        return Interval.of(half.negate(), half.subtract(BigInteger.ONE));
    }

    /**
     * Canonical interval of the type, the full unsigned machine interval for types without one
     */
    public static Interval canonical(SemanticType type) {
        switch (type.kind) {
            case UNSIGNED:
                return unsigned(type.width);
            case SIGNED:
                return signed(type.width);
            case ADDRESS:
                return ADDRESS;
            case BOOL:
                return BOOL;
            default:
                return UINT256;
        }
    }

    /**
     * Moves each bound into the machine window
     */
    public static Interval clamp(Interval interval) {
        if (interval.isBottom()) {
            return interval;
        }
        return Interval.of(clamp(interval.lower()), clamp(interval.upper()));
    }

    public static ExtendedInteger clamp(ExtendedInteger value) {
        return ExtendedInteger.max(FLOOR, ExtendedInteger.min(CEILING, value));
    }

    /**
     * Parses decimal (optionally negative) and {@code 0x} prefixed hexadecimal literals
     *
     * @return null if the literal is not an integer
     */
    @Nullable
    public static BigInteger parseLiteral(String literal) {
        String text = literal.trim().replace("_", "");
        boolean negative = text.startsWith("-");
        if (negative) {
            text = text.substring(1);
        }
        BigInteger value;
        try {
            if (text.startsWith("0x") || text.startsWith("0X")) {
                value = new BigInteger(text.substring(2), 16);
            } else if (!text.isEmpty() && text.chars().allMatch(Character::isDigit)) {
                value = new BigInteger(text);
            } else {
                return null;
            }
        } catch (NumberFormatException e) {
            return null;
        }
        return negative ? value.negate() : value;
    }
}
