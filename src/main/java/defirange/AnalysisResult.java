package defirange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Violations and function summaries of an analysis run, in program order
 */
public final class AnalysisResult {

    /**
     * Function that was not analysed
     */
    public static final class Skipped {
        public final String function;
        public final String reason;

        public Skipped(String function, String reason) {
            this.function = function;
            this.reason = reason;
        }

        @Override
        public String toString() {
            return function + ": " + reason;
        }
    }

    private final List<Violation> violations = new ArrayList<>();
    private final Map<String, FunctionSummary> summaries = new LinkedHashMap<>();
    private final List<Skipped> skipped = new ArrayList<>();

    void add(FunctionSummary summary, List<Violation> functionViolations) {
        summaries.put(summary.qualifiedName, summary);
        violations.addAll(functionViolations);
    }

    void skip(String function, String reason) {
        skipped.add(new Skipped(function, reason));
    }

    public List<Violation> violations() {
        return Collections.unmodifiableList(violations);
    }

    public Map<String, FunctionSummary> summaries() {
        return Collections.unmodifiableMap(summaries);
    }

    public Optional<FunctionSummary> summary(String qualifiedName) {
        return Optional.ofNullable(summaries.get(qualifiedName));
    }

    /**
     * Functions that were skipped because of malformed input or an internal error
     */
    public List<Skipped> skipped() {
        return Collections.unmodifiableList(skipped);
    }

    public Map<Violation.Kind, Integer> countsPerKind() {
        Map<Violation.Kind, Integer> counts = new EnumMap<>(Violation.Kind.class);
        violations.forEach(v -> counts.merge(v.kind, 1, Integer::sum));
        return counts;
    }

    public Map<String, Integer> countsPerContract() {
        Map<String, Integer> counts = new TreeMap<>();
        violations.forEach(v -> counts.merge(v.location.contract, 1, Integer::sum));
        return counts;
    }

    public boolean hasViolations() {
        return !violations.isEmpty();
    }
}
