package defirange;

import java.util.Objects;

import defirange.intervals.Interval;

/**
 * Detected numeric safety or domain bound violation
 */
public final class Violation {

    public enum Kind {
        OVERFLOW("overflow"),
        UNDERFLOW("underflow"),
        DIVISION_BY_ZERO("division by zero"),
        MIN_BOUND("minimum bound violation"),
        MAX_BOUND("maximum bound violation");

        public final String description;

        Kind(String description) {
            this.description = description;
        }

        @Override
        public String toString() {
            return description;
        }
    }

    public static final class Location {
        public final String contract;
        public final String function;
        public final String variable;

        public Location(String contract, String function, String variable) {
            this.contract = contract;
            this.function = function;
            this.variable = variable;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Location location = (Location) o;
            return contract.equals(location.contract) && function.equals(location.function) && variable.equals(location.variable);
        }

        @Override
        public int hashCode() {
            return Objects.hash(contract, function, variable);
        }

        @Override
        public String toString() {
            return String.format("%s%s:%s", contract.isEmpty() ? "" : contract + ".", function, variable);
        }
    }

    public final Kind kind;
    public final Location location;
    public final String message;
    /**
     * Interval of the variable (final bounds) or of the offending operation (standalone issues)
     */
    public final Interval interval;
    /**
     * Detected at an operation during the fixpoint iteration instead of on the final bounds of a variable
     */
    public final boolean standalone;

    public Violation(Kind kind, Location location, String message, Interval interval, boolean standalone) {
        this.kind = Objects.requireNonNull(kind);
        this.location = Objects.requireNonNull(location);
        this.message = Objects.requireNonNull(message);
        this.interval = Objects.requireNonNull(interval);
        this.standalone = standalone;
    }

    public String intervalText() {
        return interval.toString();
    }

    @Override
    public String toString() {
        return String.format("%s at %s: %s %s", kind, location, message, interval);
    }
}
