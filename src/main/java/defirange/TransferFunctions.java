package defirange;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

import defirange.intervals.Interval;
import defirange.intervals.IntervalArithmetic;
import defirange.intervals.Intervals;
import defirange.ir.BinaryOperator;
import defirange.ir.Constant;
import defirange.ir.Instruction;
import defirange.ir.Operand;
import defirange.ir.Variable;
import defirange.typing.SemanticType;

import static defirange.intervals.Intervals.powerOfTen;

/**
 * Abstract semantics of the instructions: each visit reads the intervals of the operands from
 * the state and writes the interval of the target, returns whether the state was written.
 */
public class TransferFunctions implements Instruction.Visitor<Boolean> {

    private static final Logger LOG = Logger.getLogger("Analysis");

    private static final Map<String, BinaryOperator> ARITHMETIC_CALLS = Map.of(
            "add", BinaryOperator.ADD,
            "sub", BinaryOperator.SUBTRACT,
            "mul", BinaryOperator.MULTIPLY,
            "div", BinaryOperator.DIVIDE,
            "mod", BinaryOperator.MODULO);

    static final Interval PRICE = Interval.of(BigInteger.ZERO, powerOfTen(36));
    static final Interval DECIMALS = Interval.of(0, 18);

    private final AbstractState state;
    private final Heuristics heuristics;
    private final ViolationCandidates candidates;
    /**
     * Results of checked math library calls, their overflows and underflows are not reported
     */
    private final Set<Variable> libraryVerified;

    public TransferFunctions(AbstractState state, Heuristics heuristics, ViolationCandidates candidates,
                             Set<Variable> libraryVerified) {
        this.state = state;
        this.heuristics = heuristics;
        this.candidates = candidates;
        this.libraryVerified = libraryVerified;
    }

    public void apply(Instruction instruction) {
        instruction.accept(this);
    }

    /**
     * Interval of a numeric constant or a tracked variable
     */
    Optional<Interval> known(Operand operand) {
        if (operand instanceof Constant) {
            BigInteger value = ((Constant) operand).value();
            return value == null ? Optional.empty() : Optional.of(Interval.point(value));
        }
        Variable variable = (Variable) operand;
        return state.isTracked(variable) ? Optional.of(state.get(variable)) : Optional.empty();
    }

    /**
     * Interval of the operand, bottom if nothing is known about it yet
     */
    Interval valueOf(Operand operand) {
        return known(operand).orElse(Interval.bottom());
    }

    @Override
    public Boolean visit(Instruction.Assignment assignment) {
        Optional<Interval> source = known(assignment.source);
        if (source.isPresent()) {
            state.set(assignment.target, source.get());
            return true;
        }
        if (assignment.source instanceof Variable) {
            SemanticType type = ((Variable) assignment.source).type;
            if (type.kind == SemanticType.Kind.ADDRESS || type.kind == SemanticType.Kind.BOOL) {
                state.set(assignment.target, Intervals.canonical(type));
                return true;
            }
        }
        return false;
    }

    @Override
    public Boolean visit(Instruction.TypeConversion conversion) {
        Optional<Interval> known = known(conversion.source);
        if (!known.isPresent()) {
            return false;
        }
        Interval source = known.get();
        SemanticType type = conversion.targetType();
        switch (type.kind) {
            case UNSIGNED:
            case SIGNED:
                Interval canonical = Intervals.canonical(type);
                Interval converted = source.meet(canonical);
                // values outside of the target range wrap around
                state.set(conversion.target, converted.isBottom() && !source.isBottom() ? canonical : converted);
                return true;
            case ADDRESS:
                state.set(conversion.target, Intervals.ADDRESS);
                return true;
            case BOOL:
                state.set(conversion.target, toBool(source));
                return true;
            default:
                return false;
        }
    }

    private static Interval toBool(Interval source) {
        if (!source.isBottom()) {
            if (source.lower().signum() > 0) {
                return Intervals.TRUE;
            }
            if (source.upper().signum() <= 0) {
                return Intervals.FALSE;
            }
        }
        return Intervals.BOOL;
    }

    @Override
    public Boolean visit(Instruction.MemberAccess access) {
        Optional<EnvironmentField> field = EnvironmentField.lookup(access.base, access.member);
        field.ifPresent(f -> state.set(access.target, f.interval));
        return field.isPresent();
    }

    @Override
    public Boolean visit(Instruction.Call call) {
        String name = call.callee.name.toLowerCase(Locale.ROOT);
        if (call.arguments.size() >= 2 && (ARITHMETIC_CALLS.containsKey(name) || name.equals("min") || name.equals("max"))) {
            Optional<Interval> left = known(call.arguments.get(0));
            Optional<Interval> right = known(call.arguments.get(1));
            if (left.isPresent() && right.isPresent()) {
                if (heuristics.isMathLibrary(call.callee.scope)) {
                    libraryVerified.add(call.target);
                }
                switch (name) {
                    case "min":
                        state.set(call.target, IntervalArithmetic.min(left.get(), right.get()));
                        break;
                    case "max":
                        state.set(call.target, IntervalArithmetic.max(left.get(), right.get()));
                        break;
                    default:
                        state.set(call.target, binary(call, ARITHMETIC_CALLS.get(name), left.get(), right.get(),
                                call.arguments.get(0), call.arguments.get(1)));
                }
                return true;
            }
        }
        Optional<Interval> returned = returnInterval(call);
        returned.ifPresent(i -> state.set(call.target, i));
        return returned.isPresent();
    }

    /**
     * Interval implied by the name or the declared return type of the callee
     */
    private Optional<Interval> returnInterval(Instruction.Call call) {
        String name = call.callee.name.toLowerCase(Locale.ROOT);
        SemanticType returnType = call.callee.returnType;
        if (name.contains("balance") || (name.contains("total") && name.contains("supply")) || name.contains("allowance")) {
            return Optional.of(Intervals.UINT256);
        }
        if (name.contains("price") || name.contains("rate")) {
            return Optional.of(PRICE);
        }
        if (name.contains("decimals")) {
            return Optional.of(DECIMALS);
        }
        if (returnType != null && returnType.kind == SemanticType.Kind.BOOL) {
            return Optional.of(Intervals.BOOL);
        }
        if (returnType != null && returnType.kind == SemanticType.Kind.ADDRESS) {
            return Optional.of(Intervals.ADDRESS);
        }
        if (heuristics.isCritical(call.target)) {
            return Optional.of(Intervals.UINT256);
        }
        return Optional.empty();
    }

    @Override
    public Boolean visit(Instruction.BinaryOp binaryOp) {
        state.set(binaryOp.target, binary(binaryOp, binaryOp.operator, valueOf(binaryOp.left), valueOf(binaryOp.right),
                binaryOp.left, binaryOp.right));
        return true;
    }

    /**
     * Computes {@code left op right} and records the overflow, underflow and division by zero issues
     * of the operation
     */
    private Interval binary(Instruction instruction, BinaryOperator operator, Interval left, Interval right,
                            Operand leftOperand, Operand rightOperand) {
        IntervalArithmetic.Result result;
        switch (operator) {
            case ADD:
                result = IntervalArithmetic.add(left, right);
                break;
            case SUBTRACT:
                result = IntervalArithmetic.subtract(left, right);
                break;
            case MULTIPLY:
                result = IntervalArithmetic.multiply(left, right);
                break;
            case DIVIDE:
                result = IntervalArithmetic.divide(left, right);
                break;
            case MODULO:
                result = IntervalArithmetic.remainder(left, right);
                break;
            case POWER:
                result = IntervalArithmetic.power(left, right);
                break;
            case SHIFT_LEFT:
                result = IntervalArithmetic.shiftLeft(left, right);
                break;
            case SHIFT_RIGHT:
                result = IntervalArithmetic.shiftRight(left, right);
                break;
            case LESS:
            case LESS_EQUALS:
            case GREATER:
            case GREATER_EQUALS:
            case EQUALS:
            case UNEQUALS:
            case AND:
            case OR:
                return IntervalArithmetic.bool().interval;
            default:
                LOG.finer(() -> String.format("No rule for operator %s in '%s'", operator, instruction));
                return IntervalArithmetic.unknown().interval;
        }
        Variable target = instruction.target;
        String operation = String.format("%s = %s %s %s", target, leftOperand.text(), operator, rightOperand.text());
        if (result.divisionByZero) {
            String what = operator == BinaryOperator.MODULO ? "modulo" : "division";
            String message = right.equals(Intervals.FALSE)
                    ? String.format("%s by zero in %s, the divisor is always zero", what, operation)
                    : String.format("potential %s by zero in %s, the divisor %s contains zero", what, operation, right);
            candidates.record(instruction, Violation.Kind.DIVISION_BY_ZERO, message, right);
        }
        if (!libraryVerified.contains(target)) {
            switch (operator) {
                case ADD:
                case MULTIPLY:
                case POWER:
                case SHIFT_LEFT:
                    if (result.overflows()) {
                        candidates.record(instruction, Violation.Kind.OVERFLOW, String.format("potential overflow in %s with %s %s %s",
                                operation, left, operator, right), result.unclamped);
                    }
                    break;
                case SUBTRACT:
                    if (target.type.isUnsigned() && result.mightBeNegative()) {
                        candidates.record(instruction, Violation.Kind.UNDERFLOW, String.format("potential underflow in %s with %s - %s",
                                operation, left, right), result.unclamped);
                    }
                    break;
                default:
            }
        }
        return result.interval;
    }
}
