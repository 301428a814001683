package defirange.typing;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classification of a variable that determines its canonical bounds
 */
public final class SemanticType {

    public enum Kind {
        UNSIGNED,
        SIGNED,
        ADDRESS,
        BOOL,
        /**
         * Everything that carries no numeric information for the analysis (strings, structs, …)
         */
        OTHER
    }

    public static final int MAX_WIDTH = 256;

    private static final Pattern INTEGER = Pattern.compile("(u?)int(\\d{0,3})");

    public static final SemanticType UINT256 = new SemanticType(Kind.UNSIGNED, MAX_WIDTH, "uint256");
    public static final SemanticType INT256 = new SemanticType(Kind.SIGNED, MAX_WIDTH, "int256");
    public static final SemanticType ADDRESS = new SemanticType(Kind.ADDRESS, 160, "address");
    public static final SemanticType BOOL = new SemanticType(Kind.BOOL, 1, "bool");

    public final Kind kind;
    /**
     * Bit width, only meaningful for integer types
     */
    public final int width;
    /**
     * Name of the type as given by the front-end
     */
    public final String name;

    private SemanticType(Kind kind, int width, String name) {
        this.kind = kind;
        this.width = width;
        this.name = name;
    }

    public static SemanticType unsigned(int width) {
        checkWidth(width);
        return new SemanticType(Kind.UNSIGNED, width, "uint" + width);
    }

    public static SemanticType signed(int width) {
        checkWidth(width);
        return new SemanticType(Kind.SIGNED, width, "int" + width);
    }

    public static SemanticType other(String name) {
        return new SemanticType(Kind.OTHER, 0, name);
    }

    private static void checkWidth(int width) {
        if (width < 1 || width > MAX_WIDTH) {
            throw new IllegalArgumentException(String.format("Unsupported bit width %d, expected 1 to %d", width, MAX_WIDTH));
        }
    }

    /**
     * Parses type names like {@code uint8}, {@code int}, {@code address payable} or {@code bool}.
     * Every other name (e.g. {@code IERC20} or {@code string}) yields a type of kind {@link Kind#OTHER}.
     */
    public static SemanticType parse(String typeName) {
        String normalized = typeName.trim().toLowerCase(Locale.ROOT);
        Matcher matcher = INTEGER.matcher(normalized);
        if (matcher.matches()) {
            int width = matcher.group(2).isEmpty() ? MAX_WIDTH : Integer.parseInt(matcher.group(2));
            if (width >= 1 && width <= MAX_WIDTH) {
                return matcher.group(1).isEmpty() ? signed(width) : unsigned(width);
            }
            return other(typeName.trim());
        }
        if (normalized.equals("address") || normalized.equals("address payable")) {
            return ADDRESS;
        }
        if (normalized.equals("bool")) {
            return BOOL;
        }
        return other(typeName.trim());
    }

    public boolean isInteger() {
        return kind == Kind.UNSIGNED || kind == Kind.SIGNED;
    }

    public boolean isUnsigned() {
        return kind == Kind.UNSIGNED;
    }

    public boolean isNumeric() {
        return kind != Kind.OTHER;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SemanticType that = (SemanticType) o;
        return width == that.width && kind == that.kind && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, width, name);
    }

    @Override
    public String toString() {
        return name;
    }
}
