package defirange;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import defirange.intervals.Interval;
import defirange.ir.Function;
import defirange.ir.Variable;

/**
 * Final intervals of the parameters and return variables of an analysed function
 */
public final class FunctionSummary {

    public final String qualifiedName;
    private final Map<Variable, Interval> parameters;
    private final Map<Variable, Interval> returns;

    private FunctionSummary(String qualifiedName, Map<Variable, Interval> parameters, Map<Variable, Interval> returns) {
        this.qualifiedName = qualifiedName;
        this.parameters = Collections.unmodifiableMap(parameters);
        this.returns = Collections.unmodifiableMap(returns);
    }

    static FunctionSummary of(Function function, AbstractState state) {
        Map<Variable, Interval> parameters = new LinkedHashMap<>();
        function.parameters().forEach(p -> parameters.put(p, state.get(p)));
        Map<Variable, Interval> returns = new LinkedHashMap<>();
        function.returns().forEach(r -> returns.put(r, state.get(r)));
        return new FunctionSummary(function.qualifiedName(), parameters, returns);
    }

    public Map<Variable, Interval> parameters() {
        return parameters;
    }

    public Map<Variable, Interval> returns() {
        return returns;
    }

    public Optional<Interval> parameter(String name) {
        return lookup(parameters, name);
    }

    public Optional<Interval> returnValue(String name) {
        return lookup(returns, name);
    }

    private static Optional<Interval> lookup(Map<Variable, Interval> intervals, String name) {
        return intervals.entrySet().stream().filter(e -> e.getKey().name.equals(name))
                .map(Map.Entry::getValue).findFirst();
    }

    @Override
    public String toString() {
        return String.format("%s(%s) returns (%s)", qualifiedName, format(parameters), format(returns));
    }

    private static String format(Map<Variable, Interval> intervals) {
        StringBuilder builder = new StringBuilder();
        intervals.forEach((v, i) -> {
            if (builder.length() > 0) {
                builder.append(", ");
            }
            builder.append(v.name).append(": ").append(i);
        });
        return builder.toString();
    }
}
