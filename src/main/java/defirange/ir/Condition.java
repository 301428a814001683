package defirange.ir;

import java.util.Objects;

/**
 * Branch condition {@code left op right} of a node, {@code op} is a comparison
 */
public final class Condition {

    public final BinaryOperator operator;
    public final Operand left;
    public final Operand right;

    public Condition(BinaryOperator operator, Operand left, Operand right) {
        if (!operator.isComparison()) {
            throw new IllegalArgumentException(String.format("%s is not a comparison", operator));
        }
        this.operator = operator;
        this.left = Objects.requireNonNull(left);
        this.right = Objects.requireNonNull(right);
    }

    @Override
    public String toString() {
        return String.format("%s %s %s", left.text(), operator, right.text());
    }
}
