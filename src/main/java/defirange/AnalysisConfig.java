package defirange;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import org.apache.commons.lang3.Validate;

import defirange.config.ConfigurationError;
import defirange.config.PropertyScheme;
import defirange.intervals.Intervals;

import static defirange.intervals.Intervals.powerOfTen;
import static defirange.intervals.Intervals.powerOfTwo;

/**
 * Immutable configuration of an analysis run: the tunables of the fixpoint iteration,
 * the keyword tables of the heuristics and the domain constraint table.
 * <p/>
 * A configuration is shared read-only between all functions of a run.
 */
public final class AnalysisConfig {

    /**
     * Option string properties, see {@link #withOptions(String)}
     */
    public static final PropertyScheme OPTIONS = new PropertyScheme()
            .add("widen", "3")
            .add("narrow", "2")
            .add("maxiter", "20")
            .add("batch", "5")
            .add("tolerance", "0")
            .add("threads", "1")
            .add("filter", "true")
            .add("seedlocals", "true");

    public static final List<String> CRITICAL_NAME_KEYWORDS = List.of(
            "balance", "price", "ratio", "debt", "supply", "reserve",
            "liquidity", "amount", "fee", "rate", "swap", "pool",
            "collateral", "token", "share", "yield", "reward",
            "slippage", "impermanent", "apy", "tvl", "borrow", "lend",
            "stake", "unstake", "mint", "burn", "redeem", "oracle",
            "margin", "leverage", "flash", "loan", "liquidat");

    public static final List<String> CRITICAL_TYPE_KEYWORDS = List.of(
            "erc20", "erc721", "erc1155", "ierc20", "ierc721", "ierc1155",
            "uniswap", "sushiswap", "pancakeswap", "balancer", "curve",
            "pair", "router", "factory", "amm", "dex",
            "compound", "aave", "makerdao", "cream", "lending", "ctoken",
            "vault", "pool", "strategy", "yearn", "harvest",
            "chainlink", "oracle", "price", "feed");

    public static final List<String> RELEVANCE_KEYWORDS = List.of(
            "swap", "borrow", "lend", "stake", "deposit", "withdraw", "mint", "burn",
            "redeem", "claim", "liquidate", "flash", "provide", "purchase", "sell",
            "dex", "pool", "amm", "vault", "yield", "farm", "lending", "staking",
            "oracle", "router", "factory", "exchange", "pair", "token", "erc20", "erc721");

    public static final List<String> ERC20_FUNCTIONS = List.of(
            "transfer", "approve", "transferFrom", "balanceOf", "totalSupply", "allowance");

    public static final List<String> MATH_LIBRARY_KEYWORDS = List.of("safemath", "math");

    public static final List<DomainConstraint> DEFAULT_CONSTRAINTS = List.of(
            new DomainConstraint("token_balance", BigInteger.ZERO, Intervals.MACHINE_CEILING),
            new DomainConstraint("price_oracle", BigInteger.ZERO, powerOfTen(36)),
            new DomainConstraint("leverage_ratio", 1, 100),
            new DomainConstraint("fee", BigInteger.ZERO, powerOfTen(18)),
            new DomainConstraint("liquidity", BigInteger.ZERO, Intervals.MACHINE_CEILING),
            new DomainConstraint("time_lock", BigInteger.ZERO, powerOfTwo(64).subtract(BigInteger.ONE)),
            new DomainConstraint("slippage", BigInteger.ZERO, powerOfTen(18)),
            new DomainConstraint("apy", BigInteger.ZERO, powerOfTen(20)),
            new DomainConstraint("interest_rate", BigInteger.ZERO, powerOfTen(20)),
            new DomainConstraint("collateral_ratio", BigInteger.ZERO, powerOfTen(20)));

    /**
     * Number of visits of a node after which its results are widened
     */
    public final int wideningThreshold;
    /**
     * Number of narrowing passes after the main loop
     */
    public final int narrowingPasses;
    /**
     * Maximum number of batches processed in the main loop
     */
    public final int maxIterations;
    public final int batchSize;
    /**
     * Bound changes up to this value do not count as a change of the state
     */
    public final BigInteger changeTolerance;
    /**
     * Number of functions analysed in parallel
     */
    public final int threads;
    /**
     * Only analyse contracts that look like DeFi contracts
     */
    public final boolean relevanceFilter;
    /**
     * Seed critical local and temporary variables with their canonical interval
     */
    public final boolean seedLocals;

    public final List<String> criticalNameKeywords;
    public final List<String> criticalTypeKeywords;
    public final List<String> relevanceKeywords;
    public final List<String> erc20Functions;
    /**
     * A contract that declares at least this many ERC-20 functions is relevant
     */
    public final int erc20FunctionThreshold;
    public final List<String> mathLibraryKeywords;
    public final List<DomainConstraint> constraints;

    private AnalysisConfig(Builder builder) {
        this.wideningThreshold = builder.wideningThreshold;
        this.narrowingPasses = builder.narrowingPasses;
        this.maxIterations = builder.maxIterations;
        this.batchSize = builder.batchSize;
        this.changeTolerance = builder.changeTolerance;
        this.threads = builder.threads;
        this.relevanceFilter = builder.relevanceFilter;
        this.seedLocals = builder.seedLocals;
        this.criticalNameKeywords = List.copyOf(builder.criticalNameKeywords);
        this.criticalTypeKeywords = List.copyOf(builder.criticalTypeKeywords);
        this.relevanceKeywords = List.copyOf(builder.relevanceKeywords);
        this.erc20Functions = List.copyOf(builder.erc20Functions);
        this.erc20FunctionThreshold = builder.erc20FunctionThreshold;
        this.mathLibraryKeywords = List.copyOf(builder.mathLibraryKeywords);
        this.constraints = Collections.unmodifiableList(new ArrayList<>(builder.constraints));
    }

    public static AnalysisConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Overrides the tunables with the properties of an option string like
     * {@code widen=3;narrow=2;maxiter=20;batch=5;tolerance=0;threads=1;filter=true;seedlocals=true}
     *
     * @throws ConfigurationError for unknown properties or invalid values
     */
    public AnalysisConfig withOptions(String options) {
        Properties props = OPTIONS.parse(options);
        try {
            return toBuilder()
                    .wideningThreshold(Integer.parseInt(props.getProperty("widen")))
                    .narrowingPasses(Integer.parseInt(props.getProperty("narrow")))
                    .maxIterations(Integer.parseInt(props.getProperty("maxiter")))
                    .batchSize(Integer.parseInt(props.getProperty("batch")))
                    .changeTolerance(new BigInteger(props.getProperty("tolerance")))
                    .threads(Integer.parseInt(props.getProperty("threads")))
                    .relevanceFilter(parseBoolean(props.getProperty("filter")))
                    .seedLocals(parseBoolean(props.getProperty("seedlocals")))
                    .build();
        } catch (NumberFormatException e) {
            throw new ConfigurationError(String.format("Invalid number in options \"%s\": %s", options, e.getMessage()));
        }
    }

    /**
     * Adds the constraint, replacing a constraint with the same keyword
     */
    public AnalysisConfig withConstraint(DomainConstraint constraint) {
        return toBuilder().constraint(constraint).build();
    }

    private static boolean parseBoolean(String value) {
        switch (value.toLowerCase()) {
            case "true":
                return true;
            case "false":
                return false;
            default:
                throw new ConfigurationError(String.format("Invalid boolean '%s'", value));
        }
    }

    @Override
    public String toString() {
        return String.format("widen=%d;narrow=%d;maxiter=%d;batch=%d;tolerance=%s;threads=%d;filter=%s;seedlocals=%s",
                wideningThreshold, narrowingPasses, maxIterations, batchSize, changeTolerance, threads,
                relevanceFilter, seedLocals);
    }

    public static final class Builder {
        private int wideningThreshold = 3;
        private int narrowingPasses = 2;
        private int maxIterations = 20;
        private int batchSize = 5;
        private BigInteger changeTolerance = BigInteger.ZERO;
        private int threads = 1;
        private boolean relevanceFilter = true;
        private boolean seedLocals = true;
        private List<String> criticalNameKeywords = CRITICAL_NAME_KEYWORDS;
        private List<String> criticalTypeKeywords = CRITICAL_TYPE_KEYWORDS;
        private List<String> relevanceKeywords = RELEVANCE_KEYWORDS;
        private List<String> erc20Functions = ERC20_FUNCTIONS;
        private int erc20FunctionThreshold = 3;
        private List<String> mathLibraryKeywords = MATH_LIBRARY_KEYWORDS;
        private final List<DomainConstraint> constraints = new ArrayList<>(DEFAULT_CONSTRAINTS);

        private Builder() {
        }

        private Builder(AnalysisConfig config) {
            wideningThreshold = config.wideningThreshold;
            narrowingPasses = config.narrowingPasses;
            maxIterations = config.maxIterations;
            batchSize = config.batchSize;
            changeTolerance = config.changeTolerance;
            threads = config.threads;
            relevanceFilter = config.relevanceFilter;
            seedLocals = config.seedLocals;
            criticalNameKeywords = config.criticalNameKeywords;
            criticalTypeKeywords = config.criticalTypeKeywords;
            relevanceKeywords = config.relevanceKeywords;
            erc20Functions = config.erc20Functions;
            erc20FunctionThreshold = config.erc20FunctionThreshold;
            mathLibraryKeywords = config.mathLibraryKeywords;
            constraints.clear();
            constraints.addAll(config.constraints);
        }

        public Builder wideningThreshold(int wideningThreshold) {
            this.wideningThreshold = wideningThreshold;
            return this;
        }

        public Builder narrowingPasses(int narrowingPasses) {
            this.narrowingPasses = narrowingPasses;
            return this;
        }

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder changeTolerance(BigInteger changeTolerance) {
            this.changeTolerance = changeTolerance;
            return this;
        }

        public Builder threads(int threads) {
            this.threads = threads;
            return this;
        }

        public Builder relevanceFilter(boolean relevanceFilter) {
            this.relevanceFilter = relevanceFilter;
            return this;
        }

        public Builder seedLocals(boolean seedLocals) {
            this.seedLocals = seedLocals;
            return this;
        }

        public Builder criticalNameKeywords(String... keywords) {
            this.criticalNameKeywords = Arrays.asList(keywords);
            return this;
        }

        public Builder criticalTypeKeywords(String... keywords) {
            this.criticalTypeKeywords = Arrays.asList(keywords);
            return this;
        }

        public Builder relevanceKeywords(String... keywords) {
            this.relevanceKeywords = Arrays.asList(keywords);
            return this;
        }

        public Builder erc20Functions(int threshold, String... functions) {
            this.erc20FunctionThreshold = threshold;
            this.erc20Functions = Arrays.asList(functions);
            return this;
        }

        public Builder mathLibraryKeywords(String... keywords) {
            this.mathLibraryKeywords = Arrays.asList(keywords);
            return this;
        }

        /**
         * Adds the constraint, replacing a constraint with the same keyword
         */
        public Builder constraint(DomainConstraint constraint) {
            constraints.removeIf(c -> c.keyword.equals(constraint.keyword));
            constraints.add(constraint);
            return this;
        }

        public Builder clearConstraints() {
            constraints.clear();
            return this;
        }

        public AnalysisConfig build() {
            try {
                Validate.isTrue(wideningThreshold >= 1, "widening threshold must be at least 1, got %d", wideningThreshold);
                Validate.isTrue(narrowingPasses >= 0, "narrowing passes must not be negative, got %d", narrowingPasses);
                Validate.isTrue(maxIterations >= 1, "iteration cap must be at least 1, got %d", maxIterations);
                Validate.isTrue(batchSize >= 1, "batch size must be at least 1, got %d", batchSize);
                Validate.isTrue(changeTolerance.signum() >= 0, "change tolerance must not be negative");
                Validate.isTrue(threads >= 1, "threads must be at least 1, got %d", threads);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationError(e.getMessage());
            }
            return new AnalysisConfig(this);
        }
    }
}
