package defirange.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

public final class Contract {

    public final String name;
    private final List<String> baseContracts = new ArrayList<>();
    private final List<Variable> stateVariables = new ArrayList<>();
    private final List<Function> functions = new ArrayList<>();

    public Contract(String name) {
        this.name = name;
    }

    public Contract addBaseContract(String baseName) {
        baseContracts.add(baseName);
        return this;
    }

    public Contract addStateVariable(Variable variable) {
        if (!variable.isState()) {
            throw new IllegalArgumentException(String.format("%s is not a state variable", variable));
        }
        stateVariables.add(variable);
        return this;
    }

    public Contract addFunction(Function function) {
        function.contract(this);
        functions.add(function);
        return this;
    }

    public List<String> baseContracts() {
        return Collections.unmodifiableList(baseContracts);
    }

    public List<Variable> stateVariables() {
        return Collections.unmodifiableList(stateVariables);
    }

    public List<Function> functions() {
        return Collections.unmodifiableList(functions);
    }

    public Optional<Function> function(String name) {
        return functions.stream().filter(f -> f.name.equals(name)).findFirst();
    }

    public Optional<Variable> stateVariable(String name) {
        return stateVariables.stream().filter(v -> v.name.equals(name)).findFirst();
    }

    @Override
    public String toString() {
        return name;
    }
}
