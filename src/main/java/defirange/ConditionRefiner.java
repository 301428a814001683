package defirange;

import java.math.BigInteger;

import defirange.intervals.ExtendedInteger;
import defirange.intervals.Interval;
import defirange.ir.BinaryOperator;
import defirange.ir.Condition;
import defirange.ir.Constant;
import defirange.ir.Operand;
import defirange.ir.Variable;

import static defirange.intervals.ExtendedInteger.NEGATIVE_INFINITY;
import static defirange.intervals.ExtendedInteger.ONE;
import static defirange.intervals.ExtendedInteger.POSITIVE_INFINITY;

/**
 * Narrows the intervals of the variables of a branch condition
 */
public class ConditionRefiner {

    private final AbstractState state;

    public ConditionRefiner(AbstractState state) {
        this.state = state;
    }

    public void refine(Condition condition) {
        Operand left = condition.left;
        Operand right = condition.right;
        if (left instanceof Variable && right instanceof Constant) {
            refine((Variable) left, condition.operator, (Constant) right);
        } else if (left instanceof Constant && right instanceof Variable) {
            refine((Variable) right, condition.operator.mirror(), (Constant) left);
        } else if (left instanceof Variable && right instanceof Variable) {
            refine((Variable) left, condition.operator, (Variable) right);
        }
    }

    /**
     * {@code variable op constant}
     */
    private void refine(Variable variable, BinaryOperator operator, Constant constant) {
        BigInteger value = constant.value();
        if (value == null || !state.isTracked(variable)) {
            return;
        }
        Interval current = state.get(variable);
        if (current.isBottom()) {
            return;
        }
        ExtendedInteger bound = ExtendedInteger.of(value);
        switch (operator) {
            case UNEQUALS:
                if (value.signum() == 0) {
                    state.set(variable, excludeZero(current));
                }
                return;
            case EQUALS:
                state.set(variable, current.meet(Interval.point(value)));
                return;
            default:
                state.set(variable, current.meet(implied(operator, bound)));
        }
    }

    /**
     * Values {@code x} with {@code x op bound}
     */
    private static Interval implied(BinaryOperator operator, ExtendedInteger bound) {
        switch (operator) {
            case LESS:
                return Interval.of(NEGATIVE_INFINITY, bound.subtract(ONE));
            case LESS_EQUALS:
                return Interval.of(NEGATIVE_INFINITY, bound);
            case GREATER:
                return Interval.of(bound.add(ONE), POSITIVE_INFINITY);
            case GREATER_EQUALS:
                return Interval.of(bound, POSITIVE_INFINITY);
            default:
                return Interval.top();
        }
    }

    /**
     * Removes zero from the interval if it is one of its bounds. The union of the negative and
     * the positive part of an interval that contains zero in its inside is again the whole interval.
     */
    static Interval excludeZero(Interval interval) {
        if (interval.isBottom() || !interval.containsZero()) {
            return interval;
        }
        if (interval.isPoint()) {
            return Interval.bottom();
        }
        if (interval.lower().signum() == 0) {
            return Interval.of(ONE, interval.upper());
        }
        if (interval.upper().signum() == 0) {
            return Interval.of(interval.lower(), ONE.negate());
        }
        return interval;
    }

    /**
     * Values {@code x} with {@code x op y} for some {@code y} of {@code other}
     */
    private static Interval implied(BinaryOperator operator, Interval other) {
        boolean upperBound = operator == BinaryOperator.LESS || operator == BinaryOperator.LESS_EQUALS;
        return implied(operator, upperBound ? other.upper() : other.lower());
    }

    /**
     * {@code left op right}, both variables have to be tracked
     */
    private void refine(Variable left, BinaryOperator operator, Variable right) {
        if (!state.isTracked(left) || !state.isTracked(right)) {
            return;
        }
        Interval l = state.get(left);
        Interval r = state.get(right);
        if (l.isBottom() || r.isBottom()) {
            return;
        }
        switch (operator) {
            case EQUALS:
                Interval shared = l.meet(r);
                state.set(left, shared);
                state.set(right, shared);
                break;
            case LESS:
            case LESS_EQUALS:
            case GREATER:
            case GREATER_EQUALS:
                state.set(left, l.meet(implied(operator, r)));
                state.set(right, r.meet(implied(operator.mirror(), l)));
                break;
            default:
        }
    }
}
