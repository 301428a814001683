package defirange;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import defirange.config.ConfigurationError;
import defirange.intervals.Intervals;

/**
 * Bounds that every variable whose name contains the keyword should respect
 */
public final class DomainConstraint {

    private static final Pattern POWER = Pattern.compile("(\\d+)\\^(\\d+)(-1)?");

    public final String keyword;
    public final BigInteger min;
    public final BigInteger max;

    public DomainConstraint(String keyword, BigInteger min, BigInteger max) {
        this.keyword = keyword.toLowerCase(Locale.ROOT);
        this.min = Objects.requireNonNull(min);
        this.max = Objects.requireNonNull(max);
        if (this.keyword.isEmpty()) {
            throw new ConfigurationError("Constraint without keyword");
        }
        if (min.compareTo(max) > 0) {
            throw new ConfigurationError(String.format("Constraint %s has min %s > max %s", keyword, min, max));
        }
    }

    public DomainConstraint(String keyword, long min, long max) {
        this(keyword, BigInteger.valueOf(min), BigInteger.valueOf(max));
    }

    /**
     * Parses {@code keyword=min:max}, the bounds are integer literals or powers like {@code 10^18}
     * and {@code 2^256-1}
     */
    public static DomainConstraint parse(String text) {
        int eq = text.indexOf('=');
        int colon = text.indexOf(':', eq + 1);
        if (eq <= 0 || colon < 0) {
            throw new ConfigurationError(String.format("Invalid constraint '%s', expected keyword=min:max", text));
        }
        return new DomainConstraint(text.substring(0, eq).trim(), parseBound(text.substring(eq + 1, colon)),
                parseBound(text.substring(colon + 1)));
    }

    private static BigInteger parseBound(String text) {
        String trimmed = text.trim();
        Matcher matcher = POWER.matcher(trimmed);
        if (matcher.matches()) {
            int exponent;
            try {
                exponent = Integer.parseInt(matcher.group(2));
            } catch (NumberFormatException e) {
                throw new ConfigurationError(String.format("Exponent of constraint bound '%s' is too large", text));
            }
            BigInteger value = new BigInteger(matcher.group(1)).pow(exponent);
            return matcher.group(3) == null ? value : value.subtract(BigInteger.ONE);
        }
        BigInteger value = Intervals.parseLiteral(trimmed);
        if (value == null) {
            throw new ConfigurationError(String.format("Invalid constraint bound '%s'", text));
        }
        return value;
    }

    public boolean appliesTo(String variableName) {
        return variableName.toLowerCase(Locale.ROOT).contains(keyword);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DomainConstraint that = (DomainConstraint) o;
        return keyword.equals(that.keyword) && min.equals(that.min) && max.equals(that.max);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyword, min, max);
    }

    @Override
    public String toString() {
        return String.format("%s=%s:%s", keyword, min, max);
    }
}
