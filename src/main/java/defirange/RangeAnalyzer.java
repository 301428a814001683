package defirange;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

import defirange.ir.CfgValidator;
import defirange.ir.Contract;
import defirange.ir.Function;
import defirange.ir.Program;

/**
 * Entry point of the analysis: analyses every function of the relevant contracts of a program
 * and checks the results.
 * <p/>
 * A function that cannot be analysed is logged and skipped, it never aborts the run.
 */
public class RangeAnalyzer {

    public static final Logger LOG = Logger.getLogger("Analysis");
    static {
        LOG.setLevel(Level.INFO);
    }

    /**
     * Result of the analysis of a single function
     */
    public static final class Outcome {
        public final Function function;
        /**
         * null if the function was skipped
         */
        final FunctionSummary summary;
        final List<Violation> violations;
        final String skipReason;

        private Outcome(Function function, FunctionSummary summary, List<Violation> violations, String skipReason) {
            this.function = function;
            this.summary = summary;
            this.violations = violations;
            this.skipReason = skipReason;
        }

        static Outcome analysed(Function function, FunctionSummary summary, List<Violation> violations) {
            return new Outcome(function, summary, violations, null);
        }

        static Outcome skipped(Function function, String reason) {
            return new Outcome(function, null, List.of(), reason);
        }

        public boolean isSkipped() {
            return skipReason != null;
        }

        public Optional<FunctionSummary> summary() {
            return Optional.ofNullable(summary);
        }

        public List<Violation> violations() {
            return violations;
        }
    }

    private final AnalysisConfig config;
    private final Heuristics heuristics;
    private final ConstraintChecker checker;

    public RangeAnalyzer(AnalysisConfig config) {
        this.config = config;
        this.heuristics = new Heuristics(config);
        this.checker = new ConstraintChecker(config);
    }

    public RangeAnalyzer() {
        this(AnalysisConfig.defaults());
    }

    public AnalysisResult analyze(Program program) {
        List<Function> functions = new ArrayList<>();
        for (Contract contract : program.contracts()) {
            if (config.relevanceFilter && !heuristics.isRelevant(contract)) {
                LOG.fine(() -> String.format("Skipping contract %s, it does not look like a DeFi contract", contract.name));
                continue;
            }
            for (Function function : contract.functions()) {
                if (!heuristics.isAnalysed(function)) {
                    LOG.finer(() -> String.format("Skipping constructor %s", function));
                } else if (function.nodes().isEmpty()) {
                    LOG.finer(() -> String.format("Skipping %s without body", function));
                } else {
                    functions.add(function);
                }
            }
        }
        AnalysisResult result = new AnalysisResult();
        for (Outcome outcome : analyzeAll(functions)) {
            if (outcome.isSkipped()) {
                result.skip(outcome.function.qualifiedName(), outcome.skipReason);
            } else {
                result.add(outcome.summary, outcome.violations);
            }
        }
        LOG.info(() -> String.format("Analysed %d functions, skipped %d, found %d violations",
                result.summaries().size(), result.skipped().size(), result.violations().size()));
        return result;
    }

    private List<Outcome> analyzeAll(List<Function> functions) {
        List<Outcome> outcomes = new ArrayList<>();
        if (config.threads == 1 || functions.size() < 2) {
            functions.forEach(f -> outcomes.add(analyze(f)));
            return outcomes;
        }
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(config.threads, functions.size()));
        try {
            List<Future<Outcome>> futures = new ArrayList<>();
            for (Function function : functions) {
                futures.add(executor.submit(() -> analyze(function)));
            }
            for (int i = 0; i < futures.size(); i++) {
                try {
                    outcomes.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    outcomes.add(skip(functions.get(i), e.getCause()));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RangeAnalysisError("Interrupted while analysing functions", e);
        } finally {
            executor.shutdownNow();
        }
        return outcomes;
    }

    /**
     * Analyses a single function, the function is skipped if its graph is malformed or the
     * analysis fails
     */
    public Outcome analyze(Function function) {
        try {
            CfgValidator.validate(function);
            WorklistAnalysis analysis = new WorklistAnalysis(function, config);
            FunctionSummary summary = analysis.run();
            LOG.fine(() -> String.format("Analysed %s in %d batches", function, analysis.iterations()));
            return Outcome.analysed(function, summary, checker.check(function, analysis));
        } catch (RuntimeException e) {
            return skip(function, e);
        }
    }

    private Outcome skip(Function function, Throwable cause) {
        String reason = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        if (cause instanceof MalformedCfgError) {
            LOG.warning(() -> String.format("Skipping %s: %s", function, reason));
        } else {
            LOG.log(Level.WARNING, String.format("Skipping %s after an internal error", function), cause);
        }
        return Outcome.skipped(function, reason);
    }
}
