package defirange.ir;

import java.util.Arrays;

/**
 * Binary operators of the intermediate representation
 */
public enum BinaryOperator {
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    MODULO("%"),
    POWER("**"),
    SHIFT_LEFT("<<"),
    SHIFT_RIGHT(">>"),
    LESS("<"),
    LESS_EQUALS("<="),
    GREATER(">"),
    GREATER_EQUALS(">="),
    EQUALS("=="),
    UNEQUALS("!="),
    AND("&&"),
    OR("||"),
    BITWISE_AND("&"),
    BITWISE_OR("|"),
    BITWISE_XOR("^"),
    /**
     * Every operator without a dedicated rule
     */
    UNKNOWN("?");

    public final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Accepts the symbols and the words {@code and} and {@code or}
     */
    public static BinaryOperator fromSymbol(String symbol) {
        switch (symbol) {
            case "and":
                return AND;
            case "or":
                return OR;
        }
        return Arrays.stream(values()).filter(op -> op != UNKNOWN && op.symbol.equals(symbol))
                .findFirst().orElse(UNKNOWN);
    }

    public boolean isComparison() {
        switch (this) {
            case LESS:
            case LESS_EQUALS:
            case GREATER:
            case GREATER_EQUALS:
            case EQUALS:
            case UNEQUALS:
                return true;
            default:
                return false;
        }
    }

    /**
     * Operator of {@code b op a} that is equivalent to {@code a this b}
     */
    public BinaryOperator mirror() {
        switch (this) {
            case LESS:
                return GREATER;
            case LESS_EQUALS:
                return GREATER_EQUALS;
            case GREATER:
                return LESS;
            case GREATER_EQUALS:
                return LESS_EQUALS;
            default:
                return this;
        }
    }

    @Override
    public String toString() {
        return symbol;
    }
}
