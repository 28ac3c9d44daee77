package io.surfworks.foldforge.rewrite;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.surfworks.foldforge.tensor.TensorIr.Argument;
import io.surfworks.foldforge.tensor.TensorIr.Function;
import io.surfworks.foldforge.tensor.TensorIr.Operation;
import io.surfworks.foldforge.tensor.TensorIr.Type;
import io.surfworks.foldforge.tensor.TensorIr.Value;

/**
 * Mutable def-use graph over the body of a tensor IR function.
 *
 * <p>OperationGraph keeps, in step with every mutation:
 * <ul>
 *   <li>Value → Operation that produces it (producer)</li>
 *   <li>Value → Operations that consume it, once per operand slot (consumers)</li>
 *   <li>the body in program order</li>
 * </ul>
 *
 * <p>Queries are public. Mutations are package-private and reached through
 * {@link GraphRewriter}, which owns the two rewrite primitives.
 *
 * <p>Example:
 * <pre>{@code
 * OperationGraph graph = OperationGraph.build(function);
 *
 * Operation producer = graph.producer(value);
 * boolean foldable = graph.hasSingleUse(value);
 * }</pre>
 *
 * <p>Not thread-safe; a graph is mutated by one driver at a time.
 */
public final class OperationGraph {

    private static final String FRESH_PREFIX = "fold";

    private final String functionName;
    private final List<Argument> arguments;
    private final List<Operation> body;
    private final Set<Operation> members;
    private final Map<Value, Operation> producers;
    private final Map<Value, List<Operation>> consumers;
    private final Map<String, Value> valuesByName;
    private int nextFreshId;

    private OperationGraph(String functionName, List<Argument> arguments) {
        this.functionName = functionName;
        this.arguments = arguments;
        this.body = new ArrayList<>();
        this.members = Collections.newSetFromMap(new IdentityHashMap<>());
        this.producers = new HashMap<>();
        this.consumers = new HashMap<>();
        this.valuesByName = new HashMap<>();
    }

    /**
     * Builds an OperationGraph from a function's body.
     *
     * @param func the function to analyze
     * @return the operation graph
     * @throws IllegalArgumentException if a value name is defined twice
     */
    public static OperationGraph build(Function func) {
        OperationGraph graph = new OperationGraph(func.name(), func.arguments());

        for (Argument arg : func.arguments()) {
            graph.defineName(arg.toValue());
        }
        for (Operation op : func.body()) {
            graph.register(op);
            graph.body.add(op);
        }
        return graph;
    }

    /**
     * Returns the operation that produces the given value.
     *
     * @param value the value to look up
     * @return the producing operation, or null if the value is a function argument
     */
    public Operation producer(Value value) {
        return producers.get(value);
    }

    /**
     * Returns all operations that consume the given value. An operation using the value in
     * two operand slots appears twice.
     *
     * @param value the value to look up
     * @return list of consuming operations (empty if none)
     */
    public List<Operation> consumers(Value value) {
        List<Operation> users = consumers.get(value);
        return users == null ? List.of() : Collections.unmodifiableList(users);
    }

    /**
     * Returns true if the value has exactly one use.
     *
     * <p>Folding a producer with several consumers would require duplicating it.
     *
     * @param value the value to check
     * @return true if the value has exactly one use
     */
    public boolean hasSingleUse(Value value) {
        return useCount(value) == 1;
    }

    /**
     * Returns true if the value has no consumers (dead code).
     */
    public boolean isUnused(Value value) {
        return useCount(value) == 0;
    }

    /**
     * Returns the number of operand slots reading the value.
     */
    public int useCount(Value value) {
        List<Operation> users = consumers.get(value);
        return users == null ? 0 : users.size();
    }

    /**
     * Returns true if every result of the operation is unused.
     */
    public boolean isTriviallyDead(Operation op) {
        for (Value result : op.results()) {
            if (!isUnused(result)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Looks up a value by its SSA name.
     *
     * @param name the SSA name (without % prefix)
     * @return the value, or null if not found
     */
    public Value valueByName(String name) {
        return valuesByName.get(name);
    }

    /**
     * Returns true if the given value is a function argument (not produced by any op).
     */
    public boolean isFunctionArgument(Value value) {
        return value.equals(valuesByName.get(value.name())) && !producers.containsKey(value);
    }

    /**
     * Returns true if the operation is currently part of the body.
     */
    public boolean contains(Operation op) {
        return members.contains(op);
    }

    /**
     * Returns a snapshot of the body in program order.
     */
    public List<Operation> operations() {
        return List.copyOf(body);
    }

    public int size() {
        return body.size();
    }

    public String functionName() {
        return functionName;
    }

    /**
     * Returns an immutable function with the current body.
     */
    public Function toFunction() {
        return new Function(functionName, arguments, body);
    }

    /**
     * Creates a value with a name not yet used in this function.
     */
    public Value freshValue(Type type) {
        String name;
        do {
            name = FRESH_PREFIX + nextFreshId++;
        } while (valuesByName.containsKey(name));
        return new Value(name, type);
    }

    // ==================== Mutation (via GraphRewriter) ====================

    void insertBefore(Operation anchor, Operation op) {
        if (members.contains(op)) {
            throw new IllegalStateException("operation already in graph: " + op.opName());
        }
        int index = indexOf(anchor);
        register(op);
        body.add(index, op);
    }

    void erase(Operation op) {
        int index = indexOf(op);
        for (Value result : op.results()) {
            if (!isUnused(result)) {
                throw new IllegalStateException(String.format(
                        "cannot erase %s: result %s still has %d uses",
                        op.opName(), result.toMlirString(), useCount(result)));
            }
        }
        for (Value operand : op.operands()) {
            removeConsumer(operand, op);
        }
        for (Value result : op.results()) {
            producers.remove(result);
            consumers.remove(result);
            valuesByName.remove(result.name());
        }
        body.remove(index);
        members.remove(op);
    }

    void setOperand(Operation op, int index, Value value) {
        if (!members.contains(op)) {
            throw new IllegalStateException("operation not in graph: " + op.opName());
        }
        Value previous = op.operand(index);
        removeConsumer(previous, op);
        op.setOperand(index, value);
        consumers.computeIfAbsent(value, k -> new ArrayList<>()).add(op);
    }

    void replaceAllUsesWith(Value from, Value to) {
        for (Operation user : new ArrayList<>(consumers(from))) {
            for (int i = 0; i < user.operands().size(); i++) {
                if (user.operand(i).equals(from)) {
                    setOperand(user, i, to);
                }
            }
        }
    }

    private void register(Operation op) {
        for (Value result : op.results()) {
            defineName(result);
            producers.put(result, op);
        }
        for (Value operand : op.operands()) {
            consumers.computeIfAbsent(operand, k -> new ArrayList<>()).add(op);
        }
        members.add(op);
    }

    private void defineName(Value value) {
        if (valuesByName.putIfAbsent(value.name(), value) != null) {
            throw new IllegalArgumentException("value defined twice: " + value.toMlirString());
        }
    }

    private void removeConsumer(Value value, Operation op) {
        List<Operation> users = consumers.get(value);
        if (users != null) {
            users.remove(op);
            if (users.isEmpty()) {
                consumers.remove(value);
            }
        }
    }

    private int indexOf(Operation op) {
        for (int i = 0; i < body.size(); i++) {
            if (body.get(i) == op) {
                return i;
            }
        }
        throw new IllegalStateException("operation not in graph: " + op.opName());
    }

    @Override
    public String toString() {
        return String.format("OperationGraph[function=%s, ops=%d, values=%d]",
                functionName, body.size(), valuesByName.size());
    }
}
