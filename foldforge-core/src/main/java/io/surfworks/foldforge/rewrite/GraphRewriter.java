package io.surfworks.foldforge.rewrite;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

import io.surfworks.foldforge.tensor.TensorIr.Operation;
import io.surfworks.foldforge.tensor.TensorIr.Type;
import io.surfworks.foldforge.tensor.TensorIr.Value;

/**
 * The mutation surface handed to patterns.
 *
 * <p>Two primitives change the graph:
 * <ul>
 *   <li>{@link #replaceOp} - a new operation takes over every use of an old one and the old
 *       one is erased; node identity changes</li>
 *   <li>{@link #replaceOperandInPlace} - one operand slot of an operation is redirected; the
 *       operation stays the same object</li>
 * </ul>
 * Everything else ({@link #create}, {@link #eraseIfUnused}) supports those two.
 *
 * <p>Every mutation is reported to the {@link RewriteListener}.
 */
public final class GraphRewriter {

    private static final Logger LOG = Logger.getLogger(GraphRewriter.class.getName());

    private final OperationGraph graph;
    private final RewriteListener listener;
    private Operation insertionPoint;

    public GraphRewriter(OperationGraph graph) {
        this(graph, RewriteListener.NONE);
    }

    public GraphRewriter(OperationGraph graph, RewriteListener listener) {
        this.graph = Objects.requireNonNull(graph, "graph cannot be null");
        this.listener = Objects.requireNonNull(listener, "listener cannot be null");
    }

    public OperationGraph graph() {
        return graph;
    }

    /**
     * Sets the operation before which {@link #create} inserts.
     */
    public void setInsertionPoint(Operation op) {
        if (!graph.contains(op)) {
            throw new IllegalArgumentException("insertion point not in graph: " + op.opName());
        }
        this.insertionPoint = op;
    }

    public Value freshValue(Type type) {
        return graph.freshValue(type);
    }

    /**
     * Creates fresh values with the same types as the results of {@code op}.
     */
    public List<Value> freshResultsLike(Operation op) {
        List<Value> values = new ArrayList<>(op.results().size());
        for (Value result : op.results()) {
            values.add(graph.freshValue(result.type()));
        }
        return values;
    }

    /**
     * Inserts a new operation before the current insertion point.
     *
     * @return the inserted operation
     */
    public <T extends Operation> T create(T op) {
        if (insertionPoint == null || !graph.contains(insertionPoint)) {
            throw new IllegalStateException("no valid insertion point for " + op.opName());
        }
        graph.insertBefore(insertionPoint, op);
        listener.operationInserted(op);
        return op;
    }

    /**
     * Replaces {@code op} with {@code replacement}: inserts the replacement before {@code op}
     * if it is not in the graph yet, redirects every use of each result of {@code op} to the
     * corresponding result of the replacement, and erases {@code op}.
     *
     * @throws IllegalArgumentException if result counts or types differ
     */
    public void replaceOp(Operation op, Operation replacement) {
        if (op.results().size() != replacement.results().size()) {
            throw new IllegalArgumentException(String.format(
                    "%s has %d results but replacement %s has %d",
                    op.opName(), op.results().size(), replacement.opName(), replacement.results().size()));
        }
        for (int i = 0; i < op.results().size(); i++) {
            Type expected = op.results().get(i).type();
            Type actual = replacement.results().get(i).type();
            if (!expected.equals(actual)) {
                throw new IllegalArgumentException(String.format(
                        "result %d type mismatch replacing %s: %s vs %s",
                        i, op.opName(), expected.toMlirString(), actual.toMlirString()));
            }
        }
        if (!graph.contains(replacement)) {
            graph.insertBefore(op, replacement);
            listener.operationInserted(replacement);
        }
        for (int i = 0; i < op.results().size(); i++) {
            graph.replaceAllUsesWith(op.results().get(i), replacement.results().get(i));
        }
        listener.operationReplaced(op, replacement);
        graph.erase(op);
        listener.operationErased(op);
        LOG.finest(() -> "replaced " + op.opName() + " with " + replacement.toMlirString());
    }

    /**
     * Redirects every use of the single result of {@code op} to {@code value} and erases
     * {@code op}.
     */
    public void replaceAllUses(Operation op, Value value) {
        Value result = op.result();
        if (!result.type().equals(value.type())) {
            throw new IllegalArgumentException(String.format(
                    "cannot replace %s with %s", result, value));
        }
        graph.replaceAllUsesWith(result, value);
        graph.erase(op);
        listener.operationErased(op);
    }

    /**
     * Substitutes one operand of {@code op} in place. The operation keeps its identity.
     */
    public void replaceOperandInPlace(Operation op, int operandIndex, Value value) {
        graph.setOperand(op, operandIndex, value);
        listener.operationModified(op);
        LOG.finest(() -> "modified " + op.opName() + " operand " + operandIndex + " in place");
    }

    /**
     * Erases {@code op} if it is still in the graph, side-effect free, and unused.
     *
     * @return true if the operation was erased
     */
    public boolean eraseIfUnused(Operation op) {
        if (!graph.contains(op) || !op.isPure() || !graph.isTriviallyDead(op)) {
            return false;
        }
        graph.erase(op);
        listener.operationErased(op);
        return true;
    }

    /**
     * Reports that a pattern declined at {@code op}. Never affects control flow.
     */
    public void notifyMatchFailure(String patternName, Operation op, String reason) {
        listener.matchFailed(patternName, op, reason);
    }
}
