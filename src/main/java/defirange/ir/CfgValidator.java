package defirange.ir;

import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Objects;
import java.util.Set;

import defirange.MalformedCfgError;

/**
 * Checks the structural sanity of the control flow graph that the front-end delivered
 */
public class CfgValidator {

    private CfgValidator() {
    }

    /**
     * @throws MalformedCfgError if the graph of the function cannot be analysed
     */
    public static void validate(Function function) {
        Set<Node> nodes = Collections.newSetFromMap(new IdentityHashMap<>());
        Set<Integer> ids = new HashSet<>();
        for (Node node : function.nodes()) {
            if (node == null) {
                throw new MalformedCfgError(function.qualifiedName(), "null node");
            }
            if (!ids.add(node.id)) {
                throw new MalformedCfgError(function.qualifiedName(), String.format("node id %d is used twice", node.id));
            }
            nodes.add(node);
        }
        for (Node node : function.nodes()) {
            for (Node successor : node.successors()) {
                if (!nodes.contains(successor)) {
                    throw new MalformedCfgError(function.qualifiedName(),
                            String.format("%s has the successor %s that is not part of the function", node, successor));
                }
            }
            for (Instruction instruction : node.instructions()) {
                if (instruction == null) {
                    throw new MalformedCfgError(function.qualifiedName(), String.format("%s contains a null instruction", node));
                }
                if (instruction.target == null) {
                    throw new MalformedCfgError(function.qualifiedName(),
                            String.format("instruction '%s' in %s has no target", instruction.getClass().getSimpleName(), node));
                }
                if (instruction.operands().stream().anyMatch(Objects::isNull)) {
                    throw new MalformedCfgError(function.qualifiedName(),
                            String.format("instruction of %s in %s has a missing operand", instruction.target, node));
                }
            }
        }
    }
}
