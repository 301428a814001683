package defirange;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import defirange.intervals.ExtendedInteger;
import defirange.intervals.Interval;
import defirange.ir.Variable;

/**
 * Intervals of the tracked variables of a single function, keyed by variable identity.
 * <p/>
 * Variables that are not tracked have the interval bottom. The iteration order is the order
 * in which the variables were first tracked.
 */
public final class AbstractState {

    private final Map<Variable, Interval> intervals;

    public AbstractState() {
        this.intervals = new LinkedHashMap<>();
    }

    private AbstractState(Map<Variable, Interval> intervals) {
        this.intervals = new LinkedHashMap<>(intervals);
    }

    public Interval get(Variable variable) {
        return intervals.getOrDefault(variable, Interval.bottom());
    }

    public boolean isTracked(Variable variable) {
        return intervals.containsKey(variable);
    }

    public void set(Variable variable, Interval interval) {
        intervals.put(variable, interval);
    }

    public Set<Variable> variables() {
        return Collections.unmodifiableSet(intervals.keySet());
    }

    public Map<Variable, Interval> asMap() {
        return Collections.unmodifiableMap(intervals);
    }

    public int size() {
        return intervals.size();
    }

    /**
     * Copy that is not affected by later changes of this state, intervals are immutable
     */
    public AbstractState copy() {
        return new AbstractState(intervals);
    }

    /**
     * Did the state change compared to the {@code old} state? A variable that appeared or
     * disappeared, a change of the bottom or top status or of the finiteness of a bound
     * and bound changes larger than the tolerance count as changes.
     */
    public boolean differsFrom(AbstractState old, BigInteger tolerance) {
        if (!old.intervals.keySet().equals(intervals.keySet())) {
            return true;
        }
        for (Map.Entry<Variable, Interval> entry : intervals.entrySet()) {
            if (differs(old.intervals.get(entry.getKey()), entry.getValue(), tolerance)) {
                return true;
            }
        }
        return false;
    }

    private static boolean differs(Interval old, Interval current, BigInteger tolerance) {
        if (old.isBottom() || current.isBottom() || old.isTop() || current.isTop()) {
            return !old.equals(current);
        }
        return differs(old.lower(), current.lower(), tolerance) || differs(old.upper(), current.upper(), tolerance);
    }

    private static boolean differs(ExtendedInteger old, ExtendedInteger current, BigInteger tolerance) {
        if (old.isFinite() != current.isFinite()) {
            return true;
        }
        if (!old.isFinite()) {
            return !old.equals(current);
        }
        return old.value().subtract(current.value()).abs().compareTo(tolerance) > 0;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof AbstractState && ((AbstractState) obj).intervals.equals(intervals);
    }

    @Override
    public int hashCode() {
        return intervals.hashCode();
    }

    @Override
    public String toString() {
        return intervals.entrySet().stream()
                .map(e -> String.format("%s = %s", e.getKey(), e.getValue()))
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
