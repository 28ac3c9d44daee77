package io.surfworks.foldforge.tensor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * In-memory model of the tensor dialect operated on by the reshape folding rewrites.
 *
 * <p>Types, values and attributes are immutable records. Operations are identity objects
 * with mutable operand slots so that a rewrite can either replace an operation (a new node
 * takes over its uses) or substitute one operand in place (the node stays the same object).
 *
 * <p>Slice parameters and expand output shapes use the "mixed" encoding: a static list in
 * which {@link #DYNAMIC} marks a position whose value is supplied by the next index-typed
 * SSA operand.
 */
public final class TensorIr {

    /**
     * Marker for a dimension extent or index that is only known at execution time.
     */
    public static final long DYNAMIC = Long.MIN_VALUE;

    private TensorIr() {}

    public static boolean isDynamic(long value) {
        return value == DYNAMIC;
    }

    // ==================== Types ====================

    /**
     * Base interface for value types.
     */
    public sealed interface Type permits TensorType, IndexType {
        String toMlirString();
    }

    /**
     * Element types: f32, f64, i32, i64, etc.
     */
    public record ScalarType(String name) {
        public static final ScalarType F16 = new ScalarType("f16");
        public static final ScalarType F32 = new ScalarType("f32");
        public static final ScalarType F64 = new ScalarType("f64");
        public static final ScalarType BF16 = new ScalarType("bf16");
        public static final ScalarType I1 = new ScalarType("i1");
        public static final ScalarType I8 = new ScalarType("i8");
        public static final ScalarType I32 = new ScalarType("i32");
        public static final ScalarType I64 = new ScalarType("i64");

        public ScalarType {
            Objects.requireNonNull(name, "name cannot be null");
            if (name.isBlank()) {
                throw new IllegalArgumentException("element type name cannot be blank");
            }
        }


        public String toMlirString() {
            return name;
        }
    }

    /**
     * Ranked tensor type: tensor&lt;4x?x8xf32&gt;. Dynamic extents are stored as {@link #DYNAMIC}.
     */
    public record TensorType(List<Long> shape, ScalarType elementType) implements Type {

        public TensorType {
            Objects.requireNonNull(shape, "shape cannot be null");
            Objects.requireNonNull(elementType, "elementType cannot be null");
            shape = List.copyOf(shape);
            for (long extent : shape) {
                if (extent < 0 && !isDynamic(extent)) {
                    throw new IllegalArgumentException("negative extent in shape " + shape);
                }
            }
        }

        public static TensorType of(ScalarType elementType, long... shape) {
            List<Long> dims = new ArrayList<>(shape.length);
            for (long d : shape) {
                dims.add(d);
            }
            return new TensorType(dims, elementType);
        }

        public int rank() {
            return shape.size();
        }

        public long dim(int i) {
            return shape.get(i);
        }

        public boolean isDynamicDim(int i) {
            return isDynamic(shape.get(i));
        }

        public boolean hasStaticShape() {
            return shape.stream().noneMatch(TensorIr::isDynamic);
        }


        public TensorType withShape(List<Long> newShape) {
            return new TensorType(newShape, elementType);
        }

        @Override
        public String toMlirString() {
            StringBuilder sb = new StringBuilder("tensor<");
            for (long d : shape) {
                sb.append(isDynamic(d) ? "?" : String.valueOf(d)).append("x");
            }
            return sb.append(elementType.toMlirString()).append(">").toString();
        }
    }

    /**
     * Scalar index type used for dynamic offsets, sizes, strides and extents.
     */
    public record IndexType() implements Type {
        public static final IndexType INSTANCE = new IndexType();

        @Override
        public String toMlirString() {
            return "index";
        }
    }

    // ==================== Values ====================

    /**
     * An SSA value reference: %arg0, %1, %slice.
     */
    public record Value(String name, Type type) {

        public Value {
            Objects.requireNonNull(name, "name cannot be null");
            Objects.requireNonNull(type, "type cannot be null");
        }

        public TensorType tensorType() {
            if (type instanceof TensorType tensor) {
                return tensor;
            }
            throw new IllegalStateException("%" + name + " is not a tensor: " + type.toMlirString());
        }

        public boolean isIndex() {
            return type instanceof IndexType;
        }

        public String toMlirString() {
            return "%" + name;
        }

        @Override
        public String toString() {
            return "%" + name + " : " + type.toMlirString();
        }
    }

    // ==================== Mixed static/dynamic indices ====================

    /**
     * One offset, size, stride or extent that is either a constant or an index-typed value.
     */
    public sealed interface MixedIndex permits StaticIndex, DynamicIndex {

        static MixedIndex of(long value) {
            return new StaticIndex(value);
        }

        static MixedIndex of(Value value) {
            return new DynamicIndex(value);
        }

        boolean isStatic();

        String toMlirString();
    }

    public record StaticIndex(long value) implements MixedIndex {
        public StaticIndex {
            if (isDynamic(value)) {
                throw new IllegalArgumentException("static index cannot hold the dynamic marker");
            }
        }

        @Override
        public boolean isStatic() {
            return true;
        }

        @Override
        public String toMlirString() {
            return String.valueOf(value);
        }
    }

    public record DynamicIndex(Value value) implements MixedIndex {
        public DynamicIndex {
            Objects.requireNonNull(value, "value cannot be null");
            if (!value.isIndex()) {
                throw new IllegalArgumentException("dynamic index must be index-typed: " + value);
            }
        }

        @Override
        public boolean isStatic() {
            return false;
        }

        @Override
        public String toMlirString() {
            return value.toMlirString();
        }
    }

    public static List<MixedIndex> staticIndices(long... values) {
        List<MixedIndex> result = new ArrayList<>(values.length);
        for (long v : values) {
            result.add(new StaticIndex(v));
        }
        return List.copyOf(result);
    }

    static List<Long> staticPart(List<MixedIndex> mixed) {
        return mixed.stream()
                .map(m -> m instanceof StaticIndex s ? s.value() : DYNAMIC)
                .toList();
    }

    static List<Value> dynamicPart(List<MixedIndex> mixed) {
        List<Value> values = new ArrayList<>();
        for (MixedIndex m : mixed) {
            if (m instanceof DynamicIndex d) {
                values.add(d.value());
            }
        }
        return values;
    }

    static List<MixedIndex> mix(List<Long> statics, List<Value> dynamics) {
        List<MixedIndex> result = new ArrayList<>(statics.size());
        int next = 0;
        for (long s : statics) {
            if (isDynamic(s)) {
                if (next >= dynamics.size()) {
                    throw new IllegalArgumentException("missing dynamic operand for " + statics);
                }
                result.add(new DynamicIndex(dynamics.get(next++)));
            } else {
                result.add(new StaticIndex(s));
            }
        }
        if (next != dynamics.size()) {
            throw new IllegalArgumentException("too many dynamic operands for " + statics);
        }
        return Collections.unmodifiableList(result);
    }

    static int dynamicCount(List<Long> statics) {
        return (int) statics.stream().filter(TensorIr::isDynamic).count();
    }

    private static String formatMixed(List<MixedIndex> mixed) {
        return mixed.stream().map(MixedIndex::toMlirString).collect(Collectors.joining(", ", "[", "]"));
    }

    private static String formatReassociation(List<List<Integer>> reassociation) {
        return reassociation.stream()
                .map(g -> g.stream().map(String::valueOf).collect(Collectors.joining(", ", "[", "]")))
                .collect(Collectors.joining(", ", "[", "]"));
    }

    private static List<List<Integer>> copyReassociation(List<List<Integer>> reassociation) {
        Objects.requireNonNull(reassociation, "reassociation cannot be null");
        return reassociation.stream().map(List::copyOf).toList();
    }

    // ==================== Slice parameters ====================

    /**
     * Static halves of the per-dimension (offset, size, stride) triples of a slice operation.
     */
    public record SliceParameters(List<Long> staticOffsets, List<Long> staticSizes, List<Long> staticStrides) {

        public SliceParameters {
            staticOffsets = List.copyOf(staticOffsets);
            staticSizes = List.copyOf(staticSizes);
            staticStrides = List.copyOf(staticStrides);
            if (staticOffsets.size() != staticSizes.size() || staticSizes.size() != staticStrides.size()) {
                throw new IllegalArgumentException(String.format(
                        "offsets/sizes/strides must have the same length: %d/%d/%d",
                        staticOffsets.size(), staticSizes.size(), staticStrides.size()));
            }
        }

        public static SliceParameters of(List<MixedIndex> offsets, List<MixedIndex> sizes,
                                         List<MixedIndex> strides) {
            return new SliceParameters(staticPart(offsets), staticPart(sizes), staticPart(strides));
        }

        public int rank() {
            return staticSizes.size();
        }

        int dynamicOperandCount() {
            return dynamicCount(staticOffsets) + dynamicCount(staticSizes) + dynamicCount(staticStrides);
        }

        static List<Value> dynamicOperands(List<MixedIndex> offsets, List<MixedIndex> sizes,
                                           List<MixedIndex> strides) {
            List<Value> values = new ArrayList<>(dynamicPart(offsets));
            values.addAll(dynamicPart(sizes));
            values.addAll(dynamicPart(strides));
            return values;
        }
    }

    // ==================== Operations ====================

    public enum OpKind {
        EXPAND_SHAPE("tensor.expand_shape"),
        COLLAPSE_SHAPE("tensor.collapse_shape"),
        EXTRACT_SLICE("tensor.extract_slice"),
        INSERT_SLICE("tensor.insert_slice"),
        PARALLEL_INSERT_SLICE("tensor.parallel_insert_slice"),
        DIM("tensor.dim"),
        OPAQUE("");

        private final String mnemonic;

        OpKind(String mnemonic) {
            this.mnemonic = mnemonic;
        }

        public String mnemonic() {
            return mnemonic;
        }
    }

    /**
     * Base class for all operations. Equality is identity.
     */
    public abstract static sealed class Operation permits
            ExpandShapeOp, CollapseShapeOp, ExtractSliceOp, InsertSliceOp,
            ParallelInsertSliceOp, DimOp, OpaqueOp {

        private final List<Value> operands;
        private final List<Value> results;

        protected Operation(List<Value> operands, List<Value> results) {
            for (Value v : operands) {
                Objects.requireNonNull(v, "operand cannot be null");
            }
            this.operands = new ArrayList<>(operands);
            this.results = List.copyOf(results);
        }

        public abstract OpKind kind();

        public String opName() {
            return kind().mnemonic();
        }

        public List<Value> operands() {
            return Collections.unmodifiableList(operands);
        }

        public Value operand(int index) {
            return operands.get(index);
        }

        public List<Value> results() {
            return results;
        }

        /**
         * Returns the single result of this operation.
         *
         * @throws IllegalStateException if the operation does not have exactly one result
         */
        public Value result() {
            if (results.size() != 1) {
                throw new IllegalStateException(opName() + " has " + results.size() + " results");
            }
            return results.get(0);
        }

        /**
         * Overwrites one operand slot. The operation keeps its identity; def-use bookkeeping
         * is the caller's responsibility (see {@code OperationGraph}).
         */
        public void setOperand(int index, Value value) {
            Objects.requireNonNull(value, "operand cannot be null");
            operands.set(index, value);
        }

        /**
         * Returns true if the operation can be erased once its results are unused.
         */
        public boolean isPure() {
            return true;
        }

        protected List<Value> operandRange(int from, int count) {
            return Collections.unmodifiableList(operands.subList(from, from + count));
        }

        protected String resultPrefix() {
            if (results.isEmpty()) {
                return "";
            }
            return results.stream().map(Value::toMlirString).collect(Collectors.joining(", ")) + " = ";
        }

        public abstract String toMlirString();

        @Override
        public String toString() {
            return toMlirString();
        }
    }

    /**
     * tensor.expand_shape - splits each source dimension into one or more result dimensions.
     */
    public static final class ExpandShapeOp extends Operation {

        private final List<List<Integer>> reassociation;
        private final List<Long> staticOutputShape;

        public ExpandShapeOp(Value result, Value source, List<List<Integer>> reassociation,
                             List<MixedIndex> outputShape) {
            super(prepend(source, dynamicPart(outputShape)), List.of(result));
            this.reassociation = copyReassociation(reassociation);
            this.staticOutputShape = staticPart(outputShape);
        }

        /**
         * Creates an expand whose output shape is fully described by a static result type.
         */
        public ExpandShapeOp(Value result, Value source, List<List<Integer>> reassociation) {
            this(result, source, reassociation, staticOutputShapeOf(result));
        }

        private static List<MixedIndex> staticOutputShapeOf(Value result) {
            TensorType type = result.tensorType();
            if (!type.hasStaticShape()) {
                throw new IllegalArgumentException(
                        "dynamic expand result requires an explicit output shape: " + type.toMlirString());
            }
            return type.shape().stream().map(d -> (MixedIndex) new StaticIndex(d)).toList();
        }

        @Override
        public OpKind kind() {
            return OpKind.EXPAND_SHAPE;
        }

        public Value source() {
            return operand(0);
        }

        public TensorType sourceType() {
            return source().tensorType();
        }

        public TensorType resultType() {
            return result().tensorType();
        }

        public List<List<Integer>> reassociation() {
            return reassociation;
        }

        public List<Long> staticOutputShape() {
            return staticOutputShape;
        }

        public List<MixedIndex> mixedOutputShape() {
            return mix(staticOutputShape, operandRange(1, operands().size() - 1));
        }

        @Override
        public String toMlirString() {
            return String.format("%s%s %s %s output_shape %s : %s into %s",
                    resultPrefix(), opName(), source().toMlirString(), formatReassociation(reassociation),
                    formatMixed(mixedOutputShape()), sourceType().toMlirString(), resultType().toMlirString());
        }
    }

    /**
     * tensor.collapse_shape - merges groups of source dimensions into single result dimensions.
     */
    public static final class CollapseShapeOp extends Operation {

        private final List<List<Integer>> reassociation;

        public CollapseShapeOp(Value result, Value source, List<List<Integer>> reassociation) {
            super(List.of(source), List.of(result));
            this.reassociation = copyReassociation(reassociation);
        }

        /**
         * Computes the collapsed type: a group is dynamic if any member is, otherwise the product.
         */
        public static TensorType inferResultType(TensorType sourceType, List<List<Integer>> reassociation) {
            List<Long> shape = new ArrayList<>(reassociation.size());
            for (List<Integer> group : reassociation) {
                long product = 1;
                for (int d : group) {
                    long extent = sourceType.dim(d);
                    if (isDynamic(extent)) {
                        product = DYNAMIC;
                        break;
                    }
                    product *= extent;
                }
                shape.add(product);
            }
            return sourceType.withShape(shape);
        }

        @Override
        public OpKind kind() {
            return OpKind.COLLAPSE_SHAPE;
        }

        public Value source() {
            return operand(0);
        }

        public TensorType sourceType() {
            return source().tensorType();
        }

        public TensorType resultType() {
            return result().tensorType();
        }

        public List<List<Integer>> reassociation() {
            return reassociation;
        }

        @Override
        public String toMlirString() {
            return String.format("%s%s %s %s : %s into %s",
                    resultPrefix(), opName(), source().toMlirString(), formatReassociation(reassociation),
                    sourceType().toMlirString(), resultType().toMlirString());
        }
    }

    /**
     * tensor.extract_slice - reads a strided sub-region, optionally dropping unit dimensions.
     */
    public static final class ExtractSliceOp extends Operation {

        private final SliceParameters parameters;

        public ExtractSliceOp(Value result, Value source, List<MixedIndex> offsets,
                              List<MixedIndex> sizes, List<MixedIndex> strides) {
            super(prepend(source, SliceParameters.dynamicOperands(offsets, sizes, strides)), List.of(result));
            this.parameters = SliceParameters.of(offsets, sizes, strides);
        }

        @Override
        public OpKind kind() {
            return OpKind.EXTRACT_SLICE;
        }

        public Value source() {
            return operand(0);
        }

        public TensorType sourceType() {
            return source().tensorType();
        }

        public TensorType resultType() {
            return result().tensorType();
        }

        public SliceParameters parameters() {
            return parameters;
        }

        public List<MixedIndex> mixedOffsets() {
            int n = dynamicCount(parameters.staticOffsets());
            return mix(parameters.staticOffsets(), operandRange(1, n));
        }

        public List<MixedIndex> mixedSizes() {
            int skip = dynamicCount(parameters.staticOffsets());
            int n = dynamicCount(parameters.staticSizes());
            return mix(parameters.staticSizes(), operandRange(1 + skip, n));
        }

        public List<MixedIndex> mixedStrides() {
            int skip = dynamicCount(parameters.staticOffsets()) + dynamicCount(parameters.staticSizes());
            int n = dynamicCount(parameters.staticStrides());
            return mix(parameters.staticStrides(), operandRange(1 + skip, n));
        }

        /**
         * The result type this slice would have without dropping any dimension.
         */
        public TensorType nonRankReducedType() {
            return new TensorType(parameters.staticSizes(), sourceType().elementType());
        }

        @Override
        public String toMlirString() {
            return String.format("%s%s %s%s%s%s : %s to %s",
                    resultPrefix(), opName(), source().toMlirString(), formatMixed(mixedOffsets()),
                    formatMixed(mixedSizes()), formatMixed(mixedStrides()),
                    sourceType().toMlirString(), resultType().toMlirString());
        }
    }

    /**
     * Common view of the two insert operations, which share their shape semantics.
     */
    public sealed interface InsertLikeOp permits InsertSliceOp, ParallelInsertSliceOp {

        /** Operand slot holding the inserted tensor. */
        int SOURCE_OPERAND = 0;

        Value source();

        Value dest();

        SliceParameters parameters();

        List<MixedIndex> mixedOffsets();

        List<MixedIndex> mixedSizes();

        List<MixedIndex> mixedStrides();

        Operation asOperation();

        /**
         * Creates a new operation of the same kind with everything but the source unchanged.
         *
         * @param newSource the tensor to insert
         * @param newResults fresh result values, one per result of this operation
         */
        InsertLikeOp withSource(Value newSource, List<Value> newResults);

        /**
         * The source type this insert would accept without implicit unit-dimension expansion.
         */
        default TensorType nonRankReducedSourceType() {
            return new TensorType(parameters().staticSizes(), dest().tensorType().elementType());
        }
    }

    /**
     * tensor.insert_slice - writes a tensor into a strided region of a destination.
     */
    public static final class InsertSliceOp extends Operation implements InsertLikeOp {

        private final SliceParameters parameters;

        public InsertSliceOp(Value result, Value source, Value dest, List<MixedIndex> offsets,
                             List<MixedIndex> sizes, List<MixedIndex> strides) {
            super(concat(List.of(source, dest), SliceParameters.dynamicOperands(offsets, sizes, strides)),
                    List.of(result));
            this.parameters = SliceParameters.of(offsets, sizes, strides);
        }

        @Override
        public OpKind kind() {
            return OpKind.INSERT_SLICE;
        }

        @Override
        public Value source() {
            return operand(SOURCE_OPERAND);
        }

        @Override
        public Value dest() {
            return operand(1);
        }

        @Override
        public SliceParameters parameters() {
            return parameters;
        }

        @Override
        public List<MixedIndex> mixedOffsets() {
            return insertMixed(this, parameters, 0);
        }

        @Override
        public List<MixedIndex> mixedSizes() {
            return insertMixed(this, parameters, 1);
        }

        @Override
        public List<MixedIndex> mixedStrides() {
            return insertMixed(this, parameters, 2);
        }

        @Override
        public Operation asOperation() {
            return this;
        }

        @Override
        public InsertSliceOp withSource(Value newSource, List<Value> newResults) {
            if (newResults.size() != 1) {
                throw new IllegalArgumentException("insert_slice expects one result, got " + newResults.size());
            }
            return new InsertSliceOp(newResults.get(0), newSource, dest(),
                    mixedOffsets(), mixedSizes(), mixedStrides());
        }

        @Override
        public String toMlirString() {
            return String.format("%s%s %s into %s%s%s%s : %s into %s",
                    resultPrefix(), opName(), source().toMlirString(), dest().toMlirString(),
                    formatMixed(mixedOffsets()), formatMixed(mixedSizes()), formatMixed(mixedStrides()),
                    source().type().toMlirString(), dest().type().toMlirString());
        }
    }

    /**
     * tensor.parallel_insert_slice - the insert form used in parallel loop terminators.
     * It produces no SSA result and is never erased as dead code.
     */
    public static final class ParallelInsertSliceOp extends Operation implements InsertLikeOp {

        private final SliceParameters parameters;

        public ParallelInsertSliceOp(Value source, Value dest, List<MixedIndex> offsets,
                                     List<MixedIndex> sizes, List<MixedIndex> strides) {
            super(concat(List.of(source, dest), SliceParameters.dynamicOperands(offsets, sizes, strides)),
                    List.of());
            this.parameters = SliceParameters.of(offsets, sizes, strides);
        }

        @Override
        public OpKind kind() {
            return OpKind.PARALLEL_INSERT_SLICE;
        }

        @Override
        public Value source() {
            return operand(SOURCE_OPERAND);
        }

        @Override
        public Value dest() {
            return operand(1);
        }

        @Override
        public SliceParameters parameters() {
            return parameters;
        }

        @Override
        public List<MixedIndex> mixedOffsets() {
            return insertMixed(this, parameters, 0);
        }

        @Override
        public List<MixedIndex> mixedSizes() {
            return insertMixed(this, parameters, 1);
        }

        @Override
        public List<MixedIndex> mixedStrides() {
            return insertMixed(this, parameters, 2);
        }

        @Override
        public Operation asOperation() {
            return this;
        }

        @Override
        public boolean isPure() {
            return false;
        }

        @Override
        public ParallelInsertSliceOp withSource(Value newSource, List<Value> newResults) {
            if (!newResults.isEmpty()) {
                throw new IllegalArgumentException("parallel_insert_slice has no results");
            }
            return new ParallelInsertSliceOp(newSource, dest(), mixedOffsets(), mixedSizes(), mixedStrides());
        }

        @Override
        public String toMlirString() {
            return String.format("%s %s into %s%s%s%s : %s into %s",
                    opName(), source().toMlirString(), dest().toMlirString(),
                    formatMixed(mixedOffsets()), formatMixed(mixedSizes()), formatMixed(mixedStrides()),
                    source().type().toMlirString(), dest().type().toMlirString());
        }
    }

    // Insert operands are [source, dest, dynamic offsets, dynamic sizes, dynamic strides].
    private static List<MixedIndex> insertMixed(Operation op, SliceParameters parameters, int which) {
        List<List<Long>> lists = List.of(parameters.staticOffsets(), parameters.staticSizes(),
                parameters.staticStrides());
        int start = 2;
        for (int i = 0; i < which; i++) {
            start += dynamicCount(lists.get(i));
        }
        List<Long> statics = lists.get(which);
        return mix(statics, op.operandRange(start, dynamicCount(statics)));
    }

    /**
     * tensor.dim - reads one extent of a tensor as an index value.
     */
    public static final class DimOp extends Operation {

        private final int index;

        public DimOp(Value result, Value source, int index) {
            super(List.of(source), List.of(result));
            if (!result.isIndex()) {
                throw new IllegalArgumentException("tensor.dim result must be index-typed: " + result);
            }
            this.index = index;
        }

        @Override
        public OpKind kind() {
            return OpKind.DIM;
        }

        public Value source() {
            return operand(0);
        }

        public int index() {
            return index;
        }

        @Override
        public String toMlirString() {
            return String.format("%s%s %s, %d : %s", resultPrefix(), opName(), source().toMlirString(),
                    index, source().type().toMlirString());
        }
    }

    /**
     * Any operation outside the reshape family (func.return, arithmetic, calls). Opaque
     * operations are assumed to have side effects.
     */
    public static final class OpaqueOp extends Operation {

        private final String name;

        public OpaqueOp(String name, List<Value> operands, List<Value> results) {
            super(operands, results);
            this.name = Objects.requireNonNull(name, "name cannot be null");
        }

        @Override
        public OpKind kind() {
            return OpKind.OPAQUE;
        }

        @Override
        public String opName() {
            return name;
        }

        @Override
        public boolean isPure() {
            return false;
        }

        @Override
        public String toMlirString() {
            return resultPrefix() + name + " "
                    + operands().stream().map(Value::toMlirString).collect(Collectors.joining(", "));
        }
    }

    private static List<Value> prepend(Value first, List<Value> rest) {
        return concat(List.of(first), rest);
    }

    private static List<Value> concat(List<Value> head, List<Value> tail) {
        List<Value> all = new ArrayList<>(head.size() + tail.size());
        all.addAll(head);
        all.addAll(tail);
        return all;
    }

    // ==================== Function ====================

    /**
     * Function argument.
     */
    public record Argument(String name, Type type) {
        public Value toValue() {
            return new Value(name, type);
        }
    }

    /**
     * A single-block function body in SSA form.
     */
    public record Function(String name, List<Argument> arguments, List<Operation> body) {

        public Function {
            Objects.requireNonNull(name, "name cannot be null");
            arguments = List.copyOf(arguments);
            body = List.copyOf(body);
        }

        public String toMlirString() {
            StringBuilder sb = new StringBuilder("func.func @").append(name).append("(");
            sb.append(arguments.stream()
                    .map(a -> "%" + a.name() + ": " + a.type().toMlirString())
                    .collect(Collectors.joining(", ")));
            sb.append(") {\n");
            for (Operation op : body) {
                sb.append("  ").append(op.toMlirString()).append("\n");
            }
            return sb.append("}").toString();
        }
    }
}
