package defirange.ir;

import java.util.Objects;

import defirange.typing.SemanticType;

/**
 * Variable handle of the front-end.
 * <p/>
 * Variables are compared by identity: two variables with the same name in different
 * scopes are different variables.
 */
public final class Variable implements Operand {

    public enum Kind {
        PARAMETER,
        RETURN,
        LOCAL,
        /**
         * Introduced by the front-end for intermediate results
         */
        TEMPORARY,
        STATE
    }

    public final String name;
    public final SemanticType type;
    public final Kind kind;

    public Variable(String name, SemanticType type, Kind kind) {
        this.name = Objects.requireNonNull(name);
        this.type = Objects.requireNonNull(type);
        this.kind = Objects.requireNonNull(kind);
    }

    public Variable(String name, String typeName, Kind kind) {
        this(name, SemanticType.parse(typeName), kind);
    }

    public boolean isState() {
        return kind == Kind.STATE;
    }

    @Override
    public String text() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
