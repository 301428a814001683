package defirange.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import javax.annotation.Nullable;

/**
 * Node of a control flow graph: a straight line sequence of instructions with an optional
 * branch condition at its end
 */
public final class Node {

    public final int id;
    private final List<Instruction> instructions = new ArrayList<>();
    private final List<Node> successors = new ArrayList<>();
    @Nullable
    private Condition condition;

    public Node(int id) {
        this.id = id;
    }

    public Node add(Instruction instruction) {
        instructions.add(instruction);
        return this;
    }

    public Node addSuccessor(Node successor) {
        if (!successors.contains(successor)) {
            successors.add(successor);
        }
        return this;
    }

    public Node condition(@Nullable Condition condition) {
        this.condition = condition;
        return this;
    }

    public List<Instruction> instructions() {
        return Collections.unmodifiableList(instructions);
    }

    /**
     * Successors in the order in which they were added
     */
    public List<Node> successors() {
        return Collections.unmodifiableList(successors);
    }

    public Optional<Condition> condition() {
        return Optional.ofNullable(condition);
    }

    @Override
    public String toString() {
        return "node " + id;
    }
}
