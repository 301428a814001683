package defirange.ir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import javax.annotation.Nullable;

import defirange.typing.SemanticType;

/**
 * Instruction of the intermediate representation, every instruction writes a single target variable.
 * <p/>
 * The set of instructions is closed, consumers handle all of them by implementing a {@link Visitor}.
 */
public abstract class Instruction {

    public interface Visitor<R> {

        R visit(Assignment assignment);

        R visit(BinaryOp binaryOp);

        R visit(TypeConversion conversion);

        R visit(MemberAccess access);

        R visit(Call call);
    }

    public final Variable target;

    private Instruction(Variable target) {
        this.target = target;
    }

    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * Operands read by this instruction
     */
    public abstract List<Operand> operands();

    /**
     * {@code target := source}
     */
    public static class Assignment extends Instruction {
        public final Operand source;

        public Assignment(Variable target, Operand source) {
            super(target);
            this.source = source;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }

        @Override
        public List<Operand> operands() {
            return Collections.singletonList(source);
        }

        @Override
        public String toString() {
            return String.format("%s := %s", target, source.text());
        }
    }

    /**
     * {@code target := left op right}
     */
    public static class BinaryOp extends Instruction {
        public final BinaryOperator operator;
        public final Operand left;
        public final Operand right;

        public BinaryOp(Variable target, BinaryOperator operator, Operand left, Operand right) {
            super(target);
            this.operator = Objects.requireNonNull(operator);
            this.left = left;
            this.right = right;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }

        @Override
        public List<Operand> operands() {
            return Arrays.asList(left, right);
        }

        @Override
        public String toString() {
            return String.format("%s := %s %s %s", target, left.text(), operator, right.text());
        }
    }

    /**
     * {@code target := T(source)}, the type {@code T} is the type of the target
     */
    public static class TypeConversion extends Instruction {
        public final Operand source;

        public TypeConversion(Variable target, Operand source) {
            super(target);
            this.source = source;
        }

        public SemanticType targetType() {
            return target.type;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }

        @Override
        public List<Operand> operands() {
            return Collections.singletonList(source);
        }

        @Override
        public String toString() {
            return String.format("%s := %s(%s)", target, target.type, source.text());
        }
    }

    /**
     * {@code target := base.member}, used for the environment built-ins like {@code msg.value}
     */
    public static class MemberAccess extends Instruction {
        public final String base;
        public final String member;

        public MemberAccess(Variable target, String base, String member) {
            super(target);
            this.base = Objects.requireNonNull(base);
            this.member = Objects.requireNonNull(member);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }

        @Override
        public List<Operand> operands() {
            return Collections.emptyList();
        }

        @Override
        public String toString() {
            return String.format("%s := %s.%s", target, base, member);
        }
    }

    /**
     * Function called by a {@link Call}
     */
    public static class Callee {
        /**
         * Simple name of the function
         */
        public final String name;
        /**
         * Name of the contract or library that declares the function, might be empty
         */
        public final String scope;
        /**
         * Declared return type, null if unknown
         */
        @Nullable
        public final SemanticType returnType;

        public Callee(String name, String scope, @Nullable SemanticType returnType) {
            this.name = Objects.requireNonNull(name);
            this.scope = Objects.requireNonNull(scope);
            this.returnType = returnType;
        }

        public Callee(String name) {
            this(name, "", null);
        }

        @Override
        public String toString() {
            return scope.isEmpty() ? name : scope + "." + name;
        }
    }

    /**
     * {@code target := callee(arguments)}
     */
    public static class Call extends Instruction {
        public final Callee callee;
        public final List<Operand> arguments;

        public Call(Variable target, Callee callee, List<Operand> arguments) {
            super(target);
            this.callee = Objects.requireNonNull(callee);
            this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }

        @Override
        public List<Operand> operands() {
            return arguments;
        }

        @Override
        public String toString() {
            return String.format("%s := %s(%s)", target, callee,
                    arguments.stream().map(Operand::text).collect(Collectors.joining(", ")));
        }
    }
}
