package defirange;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import defirange.intervals.Interval;
import defirange.ir.Function;
import defirange.ir.Instruction;

/**
 * Issues detected at single operations while iterating a function: overflows, underflows and
 * divisions by zero.
 * <p/>
 * An operation is evaluated many times during the fixpoint iteration, each evaluation replaces
 * the issue of the same kind that an earlier evaluation recorded for the operation.
 */
public class ViolationCandidates {

    private final Function function;
    private final Map<Instruction, Map<Violation.Kind, Violation>> perInstruction = new IdentityHashMap<>();
    /**
     * Instructions in the order of their first issue
     */
    private final List<Instruction> order = new ArrayList<>();

    public ViolationCandidates(Function function) {
        this.function = function;
    }

    public void record(Instruction instruction, Violation.Kind kind, String message, Interval interval) {
        Map<Violation.Kind, Violation> issues = perInstruction.computeIfAbsent(instruction, i -> {
            order.add(i);
            return new LinkedHashMap<>();
        });
        issues.put(kind, new Violation(kind,
                new Violation.Location(function.contractName(), function.name, instruction.target.name),
                message, interval, true));
    }

    public List<Violation> violations() {
        List<Violation> violations = new ArrayList<>();
        for (Instruction instruction : order) {
            violations.addAll(perInstruction.get(instruction).values());
        }
        return violations;
    }

    public boolean isEmpty() {
        return order.isEmpty();
    }
}
