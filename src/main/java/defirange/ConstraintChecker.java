package defirange;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import defirange.intervals.ExtendedInteger;
import defirange.intervals.Interval;
import defirange.intervals.Intervals;
import defirange.ir.Function;
import defirange.ir.Variable;

/**
 * Checks the final intervals of a function for overflows, underflows and violated domain
 * constraints, the issues detected at single operations during the iteration are appended
 */
public class ConstraintChecker {

    private final AnalysisConfig config;

    public ConstraintChecker(AnalysisConfig config) {
        this.config = config;
    }

    public List<Violation> check(Function function, WorklistAnalysis analysis) {
        return check(function, analysis.state(), analysis.libraryVerified(), analysis.candidates());
    }

    public List<Violation> check(Function function, AbstractState state, Set<Variable> libraryVerified,
                                 ViolationCandidates candidates) {
        List<Violation> violations = new ArrayList<>();
        for (Map.Entry<Variable, Interval> entry : state.asMap().entrySet()) {
            Variable variable = entry.getKey();
            Interval interval = entry.getValue();
            if (interval.isBottom()) {
                continue;
            }
            Violation.Location location = new Violation.Location(function.contractName(), function.name, variable.name);
            if (!libraryVerified.contains(variable)) {
                if (interval.upper().isGreaterThan(Intervals.CEILING)) {
                    violations.add(new Violation(Violation.Kind.OVERFLOW, location,
                            String.format("%s might exceed the maximum value %s", variable, Intervals.MACHINE_CEILING),
                            interval, false));
                }
                if (interval.lower().signum() < 0 && variable.type.isUnsigned()) {
                    violations.add(new Violation(Violation.Kind.UNDERFLOW, location,
                            String.format("unsigned %s might be negative", variable), interval, false));
                }
            }
            for (DomainConstraint constraint : config.constraints) {
                if (!constraint.appliesTo(variable.name)) {
                    continue;
                }
                if (interval.lower().isLessThan(ExtendedInteger.of(constraint.min))) {
                    violations.add(new Violation(Violation.Kind.MIN_BOUND, location,
                            String.format("%s might be below the minimum %s of %s", variable, constraint.min, constraint.keyword),
                            interval, false));
                }
                if (interval.upper().isGreaterThan(ExtendedInteger.of(constraint.max))) {
                    violations.add(new Violation(Violation.Kind.MAX_BOUND, location,
                            String.format("%s might exceed the maximum %s of %s", variable, constraint.max, constraint.keyword),
                            interval, false));
                }
            }
        }
        violations.addAll(candidates.violations());
        return violations;
    }
}
