package defirange;

import java.util.List;

import org.apache.commons.lang3.StringUtils;

import defirange.ir.Contract;
import defirange.ir.Function;
import defirange.ir.Variable;
import defirange.typing.SemanticType;

/**
 * Name based heuristics that decide which variables are tracked and which contracts are analysed
 */
public class Heuristics {

    private final AnalysisConfig config;

    public Heuristics(AnalysisConfig config) {
        this.config = config;
    }

    /**
     * A variable is critical if its name contains a DeFi keyword, its type looks like a DeFi
     * interface or its type is an integer or address type
     */
    public boolean isCritical(Variable variable) {
        if (containsAny(variable.name, config.criticalNameKeywords)) {
            return true;
        }
        SemanticType type = variable.type;
        if (type.kind == SemanticType.Kind.OTHER) {
            return containsAny(type.name, config.criticalTypeKeywords);
        }
        return type.isInteger() || type.kind == SemanticType.Kind.ADDRESS;
    }

    /**
     * Does the contract look like a DeFi contract?
     */
    public boolean isRelevant(Contract contract) {
        if (containsAny(contract.name, config.relevanceKeywords)) {
            return true;
        }
        if (contract.functions().stream().anyMatch(f -> containsAny(f.name, config.relevanceKeywords))) {
            return true;
        }
        if (contract.baseContracts().stream().anyMatch(b -> containsAny(b, config.relevanceKeywords))) {
            return true;
        }
        if (contract.stateVariables().stream().anyMatch(v -> containsAny(v.name, config.relevanceKeywords))) {
            return true;
        }
        long erc20Functions = contract.functions().stream()
                .map(f -> f.name).filter(config.erc20Functions::contains).distinct().count();
        return erc20Functions >= config.erc20FunctionThreshold;
    }

    /**
     * Is the scope of a callee a checked math library like {@code SafeMath}?
     */
    public boolean isMathLibrary(String scope) {
        return containsAny(scope, config.mathLibraryKeywords);
    }

    public boolean isAnalysed(Function function) {
        return !function.isConstructorLike();
    }

    static boolean containsAny(String text, List<String> keywords) {
        return keywords.stream().anyMatch(k -> StringUtils.containsIgnoreCase(text, k));
    }
}
