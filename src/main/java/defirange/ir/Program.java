package defirange.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * All contracts delivered by the front-end for one analysis run
 */
public final class Program {

    private final List<Contract> contracts = new ArrayList<>();

    public Program add(Contract contract) {
        contracts.add(contract);
        return this;
    }

    public List<Contract> contracts() {
        return Collections.unmodifiableList(contracts);
    }

    public Optional<Contract> contract(String name) {
        return contracts.stream().filter(c -> c.name.equals(name)).findFirst();
    }

    /**
     * Looks up {@code Contract.function}
     */
    public Optional<Function> function(String qualifiedName) {
        int dot = qualifiedName.indexOf('.');
        if (dot < 0) {
            return Optional.empty();
        }
        return contract(qualifiedName.substring(0, dot))
                .flatMap(c -> c.function(qualifiedName.substring(dot + 1)));
    }
}
