package io.surfworks.foldforge.rewrite;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.surfworks.foldforge.config.RewriteConfig;
import io.surfworks.foldforge.tensor.TensorIr.Function;
import io.surfworks.foldforge.tensor.TensorIr.OpKind;
import io.surfworks.foldforge.tensor.TensorIr.Operation;
import io.surfworks.foldforge.tensor.TensorIrVerifier;

/**
 * Applies a set of rewrite patterns to a function until none of them fires.
 *
 * <p>Each sweep visits the body in program order and, for every operation still in the
 * graph, tries the patterns rooted at its kind (highest benefit first) and applies the first
 * one that matches. After a sweep, side-effect free operations left without uses are erased
 * when {@link RewriteConfig#removeDeadOps()} is set. The driver stops after a sweep that
 * changed nothing, or after {@link RewriteConfig#maxIterations()} sweeps.
 *
 * <p>Example usage:
 * <pre>{@code
 * RewritePatternSet patterns = new RewritePatternSet();
 * ReshapePatterns.populateAll(patterns);
 *
 * GreedyRewriteDriver driver = new GreedyRewriteDriver(patterns, RewriteConfig.defaults());
 * Function simplified = driver.apply(function);
 *
 * System.out.println("Rewrites applied: " + driver.lastRewriteCount());
 * }</pre>
 *
 * <p>A driver instance is not thread-safe; run one function at a time.
 */
public final class GreedyRewriteDriver {

    private static final Logger LOG = Logger.getLogger(GreedyRewriteDriver.class.getName());

    private final RewriteConfig config;
    private final List<RewritePattern<?>> patterns;
    private final Map<OpKind, List<RewritePattern<?>>> patternsByKind;

    private int lastIterations;
    private int lastRewriteCount;
    private int lastErasedCount;
    private boolean lastConverged;
    private final Map<String, Integer> lastCountsByPattern = new LinkedHashMap<>();
    private final List<RewriteDiagnostic> lastDiagnostics = new ArrayList<>();

    /**
     * Creates a driver with the default configuration.
     *
     * @param patterns the patterns to apply
     */
    public GreedyRewriteDriver(RewritePatternSet patterns) {
        this(patterns, RewriteConfig.defaults());
    }

    /**
     * Creates a driver. Patterns named in {@link RewriteConfig#disabledPatterns()} are dropped.
     *
     * @param patterns the patterns to apply
     * @param config the driver configuration
     */
    public GreedyRewriteDriver(RewritePatternSet patterns, RewriteConfig config) {
        this.config = config;
        this.patterns = patterns.patterns().stream()
                .filter(p -> config.isEnabled(p.name()))
                .toList();
        this.patternsByKind = new EnumMap<>(OpKind.class);
        for (OpKind kind : OpKind.values()) {
            List<RewritePattern<?>> rooted = patterns.patternsFor(kind).stream()
                    .filter(p -> config.isEnabled(p.name()))
                    .toList();
            if (!rooted.isEmpty()) {
                patternsByKind.put(kind, rooted);
            }
        }
    }

    /**
     * Rewrites a function to a fixpoint.
     *
     * @param func the function to simplify
     * @return a new function with the rewritten body
     */
    public Function apply(Function func) {
        OperationGraph graph = OperationGraph.build(func);
        run(graph);
        return graph.toFunction();
    }

    /**
     * Rewrites a live graph to a fixpoint.
     *
     * @param graph the graph to mutate
     * @return true if anything changed
     */
    public boolean run(OperationGraph graph) {
        resetStatistics();
        GraphRewriter rewriter = new GraphRewriter(graph, new DriverListener());
        TensorIrVerifier verifier = config.verifyAfterEachSweep() ? new TensorIrVerifier() : null;

        boolean changedAny = false;
        for (int iteration = 1; iteration <= config.maxIterations(); iteration++) {
            lastIterations = iteration;
            boolean changed = sweep(graph, rewriter);
            if (config.removeDeadOps()) {
                changed |= removeDeadOps(graph, rewriter);
            }
            if (verifier != null) {
                verifier.check(graph.toFunction());
            }
            if (!changed) {
                lastConverged = true;
                break;
            }
            changedAny = true;
        }

        if (!lastConverged) {
            LOG.warning(String.format("@%s did not converge after %d iterations (%d rewrites)",
                    graph.functionName(), lastIterations, lastRewriteCount));
        } else if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(String.format("@%s converged after %d iterations: %d rewrites, %d ops erased %s",
                    graph.functionName(), lastIterations, lastRewriteCount, lastErasedCount,
                    lastCountsByPattern));
        }
        return changedAny;
    }

    private boolean sweep(OperationGraph graph, GraphRewriter rewriter) {
        boolean changed = false;
        for (Operation op : graph.operations()) {
            if (!graph.contains(op)) {
                continue;
            }
            for (RewritePattern<?> pattern : patternsByKind.getOrDefault(op.kind(), List.of())) {
                String before = LOG.isLoggable(Level.FINE) ? op.toMlirString() : null;
                if (pattern.matchAndRewrite(op, rewriter)) {
                    changed = true;
                    lastRewriteCount++;
                    lastCountsByPattern.merge(pattern.name(), 1, Integer::sum);
                    if (before != null) {
                        LOG.fine(pattern.name() + " rewrote: " + before);
                    }
                    break;
                }
            }
        }
        return changed;
    }

    private boolean removeDeadOps(OperationGraph graph, GraphRewriter rewriter) {
        List<Operation> ops = new ArrayList<>(graph.operations());
        Collections.reverse(ops);
        boolean erased = false;
        for (Operation op : ops) {
            if (!op.results().isEmpty() && rewriter.eraseIfUnused(op)) {
                lastErasedCount++;
                erased = true;
            }
        }
        return erased;
    }

    private void resetStatistics() {
        lastIterations = 0;
        lastRewriteCount = 0;
        lastErasedCount = 0;
        lastConverged = false;
        lastCountsByPattern.clear();
        lastDiagnostics.clear();
    }

    /**
     * Returns the number of sweeps in the last run.
     */
    public int lastIterations() {
        return lastIterations;
    }

    /**
     * Returns the number of pattern applications in the last run.
     */
    public int lastRewriteCount() {
        return lastRewriteCount;
    }

    /**
     * Returns the number of dead operations erased by the driver in the last run.
     */
    public int lastErasedCount() {
        return lastErasedCount;
    }

    /**
     * Returns true if the last run reached a sweep with no changes.
     */
    public boolean lastConverged() {
        return lastConverged;
    }

    /**
     * Returns pattern name to application count for the last run.
     */
    public Map<String, Integer> lastCountsByPattern() {
        return Map.copyOf(lastCountsByPattern);
    }

    /**
     * Returns the declines of the last run, if {@link RewriteConfig#recordDiagnostics()} is set.
     */
    public List<RewriteDiagnostic> lastDiagnostics() {
        return List.copyOf(lastDiagnostics);
    }

    /**
     * Returns the enabled patterns in registration order.
     */
    public List<RewritePattern<?>> patterns() {
        return patterns;
    }

    @Override
    public String toString() {
        return String.format("GreedyRewriteDriver[patterns=%d, lastRewrites=%d]",
                patterns.size(), lastRewriteCount);
    }

    private final class DriverListener implements RewriteListener {
        @Override
        public void matchFailed(String patternName, Operation op, String reason) {
            if (LOG.isLoggable(Level.FINER)) {
                LOG.finer(patternName + " declined on " + op.opName() + ": " + reason);
            }
            if (config.recordDiagnostics()) {
                lastDiagnostics.add(new RewriteDiagnostic(patternName, op.toMlirString(), reason));
            }
        }
    }
}
