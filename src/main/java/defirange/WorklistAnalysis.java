package defirange;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import defirange.intervals.Interval;
import defirange.intervals.Intervals;
import defirange.ir.Function;
import defirange.ir.Instruction;
import defirange.ir.Node;
import defirange.ir.Operand;
import defirange.ir.Variable;

/**
 * Fixpoint iteration over the control flow graph of a single function.
 * <p/>
 * All nodes start in the work queue, they are processed in batches in declaration order.
 * A node whose processing changed the state enqueues its successors. Nodes that were visited
 * often enough are widened, the main loop stops when the queue is empty or after
 * {@link AnalysisConfig#maxIterations} batches. Narrowing passes over all nodes recover
 * precision afterwards.
 * <p/>
 * An instance analyses one function once, it is not thread safe.
 */
public class WorklistAnalysis {

    private static final Logger LOG = Logger.getLogger("Analysis");

    public enum Phase {
        INITIALIZING,
        ITERATING,
        /**
         * Iterating, at least one node has been widened
         */
        WIDENED,
        NARROWING,
        DONE
    }

    private final Function function;
    private final AnalysisConfig config;
    private final Heuristics heuristics;
    private final AbstractState state = new AbstractState();
    private final ViolationCandidates candidates;
    private final Set<Variable> libraryVerified = Collections.newSetFromMap(new IdentityHashMap<>());
    private final TransferFunctions transferFunctions;
    private final ConditionRefiner refiner;
    private final Map<Node, Integer> visits = new IdentityHashMap<>();
    /**
     * State before the last processing of each node
     */
    private final Map<Node, AbstractState> lastPre = new IdentityHashMap<>();
    private Phase phase = Phase.INITIALIZING;
    private int iterations = 0;

    public WorklistAnalysis(Function function, AnalysisConfig config) {
        this.function = function;
        this.config = config;
        this.heuristics = new Heuristics(config);
        this.candidates = new ViolationCandidates(function);
        this.transferFunctions = new TransferFunctions(state, heuristics, candidates, libraryVerified);
        this.refiner = new ConditionRefiner(state);
    }

    /**
     * Runs all phases and returns the summary of the function
     */
    public FunctionSummary run() {
        if (phase != Phase.INITIALIZING) {
            throw new IllegalStateException(String.format("Analysis of %s already ran", function));
        }
        seed();
        iterate();
        narrow();
        phase = Phase.DONE;
        LOG.fine(() -> String.format("Final state of %s: %s", function, state));
        return FunctionSummary.of(function, state);
    }

    /**
     * Seeds the parameters, the state variables used by the function and, if enabled, the
     * critical locals and temporaries with the canonical intervals of their types
     */
    void seed() {
        for (Variable parameter : function.parameters()) {
            if (heuristics.isCritical(parameter)) {
                state.set(parameter, Intervals.canonical(parameter.type));
            }
        }
        for (Node node : function.nodes()) {
            for (Instruction instruction : node.instructions()) {
                seedIfCritical(instruction.target, true);
                for (Operand operand : instruction.operands()) {
                    if (operand instanceof Variable) {
                        seedIfCritical((Variable) operand, false);
                    }
                }
            }
        }
        LOG.finer(() -> String.format("Seeded %d variables of %s", state.size(), function));
    }

    private void seedIfCritical(Variable variable, boolean assigned) {
        if (state.isTracked(variable) || !heuristics.isCritical(variable)) {
            return;
        }
        boolean local = variable.kind == Variable.Kind.LOCAL || variable.kind == Variable.Kind.TEMPORARY;
        if (variable.isState() || (local && assigned && config.seedLocals)) {
            state.set(variable, Intervals.canonical(variable.type));
        }
    }

    void iterate() {
        phase = Phase.ITERATING;
        List<Node> nodes = function.nodes();
        Queue<Node> queue = new ArrayDeque<>(nodes);
        Set<Node> queued = Collections.newSetFromMap(new IdentityHashMap<>());
        queued.addAll(nodes);
        while (!queue.isEmpty() && iterations < config.maxIterations) {
            iterations++;
            List<Node> batch = new ArrayList<>();
            while (batch.size() < config.batchSize && !queue.isEmpty()) {
                Node node = queue.poll();
                queued.remove(node);
                batch.add(node);
            }
            for (Node node : batch) {
                if (process(node)) {
                    for (Node successor : node.successors()) {
                        if (queued.add(successor)) {
                            queue.add(successor);
                        }
                    }
                }
            }
        }
        if (!queue.isEmpty()) {
            LOG.fine(() -> String.format("Reached the iteration cap of %d batches for %s with %d queued nodes",
                    config.maxIterations, function, queue.size()));
        }
    }

    /**
     * Processes the node and returns whether the state changed
     */
    private boolean process(Node node) {
        AbstractState pre = state.copy();
        lastPre.put(node, pre);
        node.condition().ifPresent(refiner::refine);
        node.instructions().forEach(transferFunctions::apply);
        int visitCount = visits.merge(node, 1, Integer::sum);
        if (visitCount >= config.wideningThreshold) {
            for (Variable variable : pre.variables()) {
                state.set(variable, pre.get(variable).widen(state.get(variable)));
            }
            phase = Phase.WIDENED;
        }
        boolean changed = state.differsFrom(pre, config.changeTolerance);
        if (changed && LOG.isLoggable(Level.FINEST)) {
            LOG.finest(String.format("%s changed the state to %s", node, state));
        }
        return changed;
    }

    /**
     * Replays the processed nodes in declaration order, narrowing each result with the state
     * before the last processing of the node
     */
    void narrow() {
        phase = Phase.NARROWING;
        for (int pass = 0; pass < config.narrowingPasses; pass++) {
            for (Node node : function.nodes()) {
                AbstractState pre = lastPre.get(node);
                if (pre == null) {
                    continue;
                }
                node.condition().ifPresent(refiner::refine);
                node.instructions().forEach(transferFunctions::apply);
                for (Variable variable : pre.variables()) {
                    Interval before = pre.get(variable);
                    Interval current = state.get(variable);
                    if (!before.isBottom() && !current.isBottom()) {
                        state.set(variable, current.narrow(before));
                    }
                }
            }
        }
    }

    public Phase phase() {
        return phase;
    }

    /**
     * Number of batches processed in the main loop
     */
    public int iterations() {
        return iterations;
    }

    public AbstractState state() {
        return state;
    }

    public ViolationCandidates candidates() {
        return candidates;
    }

    /**
     * Targets of checked math library calls
     */
    public Set<Variable> libraryVerified() {
        return Collections.unmodifiableSet(libraryVerified);
    }

    /**
     * How often each node was processed in the main loop, by node id
     */
    public Map<Integer, Integer> visits() {
        Map<Integer, Integer> byId = new HashMap<>();
        visits.forEach((n, c) -> byId.put(n.id, c));
        return byId;
    }
}
