package defirange.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Function with its control flow graph, the nodes are kept in declaration order
 */
public final class Function {

    /**
     * Name that the front-end gives the synthetic initializer of the state variables
     */
    public static final String SYNTHETIC_CONSTRUCTOR = "slitherConstructorVariables";

    public final String name;
    public final boolean isConstructor;
    private final List<Variable> parameters = new ArrayList<>();
    private final List<Variable> returns = new ArrayList<>();
    private final List<Node> nodes = new ArrayList<>();
    private Contract contract;

    public Function(String name, boolean isConstructor) {
        this.name = name;
        this.isConstructor = isConstructor;
    }

    public Function(String name) {
        this(name, false);
    }

    public Function addParameter(Variable parameter) {
        parameters.add(parameter);
        return this;
    }

    public Function addReturn(Variable returnVariable) {
        returns.add(returnVariable);
        return this;
    }

    public Function addNode(Node node) {
        nodes.add(node);
        return this;
    }

    void contract(Contract contract) {
        this.contract = contract;
    }

    /**
     * Name of the declaring contract, empty for functions that are analysed on their own
     */
    public String contractName() {
        return contract == null ? "" : contract.name;
    }

    /**
     * {@code Contract.function}
     */
    public String qualifiedName() {
        return contract == null ? name : contract.name + "." + name;
    }

    public List<Variable> parameters() {
        return Collections.unmodifiableList(parameters);
    }

    public List<Variable> returns() {
        return Collections.unmodifiableList(returns);
    }

    public List<Node> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public Optional<Node> node(int id) {
        return nodes.stream().filter(n -> n.id == id).findFirst();
    }

    /**
     * Constructors and the synthetic state variable initializer
     */
    public boolean isConstructorLike() {
        return isConstructor || name.equals(SYNTHETIC_CONSTRUCTOR);
    }

    @Override
    public String toString() {
        return qualifiedName();
    }
}
