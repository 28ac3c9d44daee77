package io.surfworks.foldforge.tensor;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import io.surfworks.foldforge.tensor.TensorIr.Argument;
import io.surfworks.foldforge.tensor.TensorIr.CollapseShapeOp;
import io.surfworks.foldforge.tensor.TensorIr.DimOp;
import io.surfworks.foldforge.tensor.TensorIr.ExpandShapeOp;
import io.surfworks.foldforge.tensor.TensorIr.ExtractSliceOp;
import io.surfworks.foldforge.tensor.TensorIr.Function;
import io.surfworks.foldforge.tensor.TensorIr.InsertLikeOp;
import io.surfworks.foldforge.tensor.TensorIr.InsertSliceOp;
import io.surfworks.foldforge.tensor.TensorIr.Operation;
import io.surfworks.foldforge.tensor.TensorIr.SliceParameters;
import io.surfworks.foldforge.tensor.TensorIr.TensorType;
import io.surfworks.foldforge.tensor.TensorIr.Value;

/**
 * Verifier for tensor IR functions.
 *
 * Performs structural and shape validation including:
 * - Value availability: operands must be defined before use, results defined once
 * - Reassociation: groups partition the expanded dimensions contiguously and in order
 * - Extent consistency: expand/collapse groups agree on static products and dynamism
 * - Slices: parameter arity, rank reduction by unit dimensions only, static bounds
 */
public final class TensorIrVerifier {

    private final List<String> errors = new ArrayList<>();
    private final Set<String> definedValues = new HashSet<>();

    public TensorIrVerifier() {}

    /**
     * Validates a function and returns a list of errors.
     * Returns empty list if validation passes.
     */
    public List<String> validate(Function function) {
        errors.clear();
        definedValues.clear();

        for (Argument arg : function.arguments()) {
            if (!definedValues.add(arg.name())) {
                error("Argument '%%%s' declared twice", arg.name());
            }
        }
        for (Operation op : function.body()) {
            validateOperation(op);
        }
        return new ArrayList<>(errors);
    }

    /**
     * Validates a function and throws if any errors are found.
     */
    public void check(Function function) {
        List<String> validationErrors = validate(function);
        if (!validationErrors.isEmpty()) {
            StringBuilder sb = new StringBuilder("Tensor IR verification failed for @")
                    .append(function.name()).append(":\n");
            for (String error : validationErrors) {
                sb.append("  - ").append(error).append("\n");
            }
            throw new TensorIrException(sb.toString(), validationErrors);
        }
    }

    private void validateOperation(Operation op) {
        for (Value operand : op.operands()) {
            if (!definedValues.contains(operand.name())) {
                error("Undefined value '%%%s' used in %s", operand.name(), op.opName());
            }
        }
        for (Value result : op.results()) {
            if (!definedValues.add(result.name())) {
                error("Value '%%%s' redefined in %s", result.name(), op.opName());
            }
        }

        if (op instanceof ExpandShapeOp expand) {
            validateExpand(expand);
        } else if (op instanceof CollapseShapeOp collapse) {
            validateCollapse(collapse);
        } else if (op instanceof ExtractSliceOp extract) {
            validateExtract(extract);
        } else if (op instanceof InsertLikeOp insert) {
            validateInsert(insert);
        } else if (op instanceof DimOp dim) {
            validateDim(dim);
        }
        // Opaque operations carry no verifiable structure
    }

    private void validateExpand(ExpandShapeOp op) {
        TensorType source = tensorOf(op, op.source(), "source");
        TensorType result = tensorOf(op, op.result(), "result");
        if (source == null || result == null) {
            return;
        }
        for (int i = 1; i < op.operands().size(); i++) {
            if (!op.operand(i).isIndex()) {
                error("%s output_shape operand %s must be index-typed", op.opName(), op.operand(i));
            }
        }
        if (!op.staticOutputShape().equals(result.shape())) {
            error("%s output_shape %s does not match result type %s",
                    op.opName(), op.staticOutputShape(), result.toMlirString());
        }
        validateReshape(op, result, source, op.reassociation());
    }

    private void validateCollapse(CollapseShapeOp op) {
        TensorType source = tensorOf(op, op.source(), "source");
        TensorType result = tensorOf(op, op.result(), "result");
        if (source == null || result == null) {
            return;
        }
        validateReshape(op, source, result, op.reassociation());
    }

    private void validateReshape(Operation op, TensorType expanded, TensorType collapsed,
                                 List<List<Integer>> reassociation) {
        if (!expanded.elementType().equals(collapsed.elementType())) {
            error("%s must preserve the element type: %s vs %s", op.opName(),
                    expanded.elementType().toMlirString(), collapsed.elementType().toMlirString());
        }
        if (collapsed.rank() > expanded.rank()) {
            error("%s collapsed rank %d exceeds expanded rank %d",
                    op.opName(), collapsed.rank(), expanded.rank());
            return;
        }
        if (!validateReassociation(op, reassociation, expanded.rank(), collapsed.rank())) {
            return;
        }

        if (collapsed.rank() == 0) {
            for (int d = 0; d < expanded.rank(); d++) {
                if (expanded.dim(d) != 1) {
                    error("%s to rank 0 requires unit extents, got %s",
                            op.opName(), expanded.toMlirString());
                    return;
                }
            }
            return;
        }

        for (int i = 0; i < reassociation.size(); i++) {
            List<Integer> group = reassociation.get(i);
            boolean anyDynamic = false;
            long product = 1;
            for (int d : group) {
                if (expanded.isDynamicDim(d)) {
                    anyDynamic = true;
                } else {
                    product *= expanded.dim(d);
                }
            }
            if (anyDynamic != collapsed.isDynamicDim(i)) {
                error("%s dimension %d of %s must be dynamic iff group %s of %s has a dynamic extent",
                        op.opName(), i, collapsed.toMlirString(), group, expanded.toMlirString());
            } else if (!anyDynamic && product != collapsed.dim(i)) {
                error("%s group %s of %s has %d elements, expected %d",
                        op.opName(), group, expanded.toMlirString(), product, collapsed.dim(i));
            }
        }
    }

    private boolean validateReassociation(Operation op, List<List<Integer>> reassociation,
                                          int expandedRank, int collapsedRank) {
        if (reassociation.size() != collapsedRank) {
            error("%s expects %d reassociation groups, got %d",
                    op.opName(), collapsedRank, reassociation.size());
            return false;
        }
        if (collapsedRank == 0) {
            // Collapsing to a scalar uses no groups at all
            return true;
        }
        int next = 0;
        for (List<Integer> group : reassociation) {
            if (group.isEmpty()) {
                error("%s has an empty reassociation group", op.opName());
                return false;
            }
            for (int index : group) {
                if (index != next) {
                    error("%s reassociation %s is not a contiguous ordered partition",
                            op.opName(), reassociation);
                    return false;
                }
                next++;
            }
        }
        if (next != expandedRank) {
            error("%s reassociation %s covers %d of %d dimensions",
                    op.opName(), reassociation, next, expandedRank);
            return false;
        }
        return true;
    }

    private void validateExtract(ExtractSliceOp op) {
        TensorType source = tensorOf(op, op.source(), "source");
        TensorType result = tensorOf(op, op.result(), "result");
        if (source == null || result == null) {
            return;
        }
        if (!validateSlice(op, op.parameters(), source)) {
            return;
        }
        if (!ShapeRelation.classify(op.nonRankReducedType(), result).isSingletonReduction()) {
            error("%s result %s is not %s with unit dimensions dropped",
                    op.opName(), result.toMlirString(), op.nonRankReducedType().toMlirString());
        }
    }

    private void validateInsert(InsertLikeOp insert) {
        Operation op = insert.asOperation();
        TensorType source = tensorOf(op, insert.source(), "source");
        TensorType dest = tensorOf(op, insert.dest(), "dest");
        if (source == null || dest == null) {
            return;
        }
        if (insert instanceof InsertSliceOp insertSlice && !insertSlice.result().type().equals(dest)) {
            error("%s result type %s must equal destination type %s", op.opName(),
                    insertSlice.result().type().toMlirString(), dest.toMlirString());
        }
        if (!validateSlice(op, insert.parameters(), dest)) {
            return;
        }
        if (!ShapeRelation.classify(insert.nonRankReducedSourceType(), source).isSingletonReduction()) {
            error("%s source %s is not %s with unit dimensions dropped",
                    op.opName(), source.toMlirString(), insert.nonRankReducedSourceType().toMlirString());
        }
    }

    private boolean validateSlice(Operation op, SliceParameters parameters, TensorType addressed) {
        if (parameters.rank() != addressed.rank()) {
            error("%s expects %d offsets/sizes/strides for %s, got %d",
                    op.opName(), addressed.rank(), addressed.toMlirString(), parameters.rank());
            return false;
        }
        boolean valid = true;
        for (int d = 0; d < parameters.rank(); d++) {
            long offset = parameters.staticOffsets().get(d);
            long size = parameters.staticSizes().get(d);
            long stride = parameters.staticStrides().get(d);
            if (!TensorIr.isDynamic(size) && size < 0) {
                error("%s has negative size %d in dimension %d", op.opName(), size, d);
                valid = false;
                continue;
            }
            if (!TensorIr.isDynamic(offset) && offset < 0) {
                error("%s has negative offset %d in dimension %d", op.opName(), offset, d);
                valid = false;
                continue;
            }
            boolean allStatic = !TensorIr.isDynamic(offset) && !TensorIr.isDynamic(size)
                    && !TensorIr.isDynamic(stride) && !addressed.isDynamicDim(d);
            if (allStatic && size > 0 && offset + (size - 1) * stride >= addressed.dim(d)) {
                error("%s dimension %d runs out of bounds: offset %d, size %d, stride %d, extent %d",
                        op.opName(), d, offset, size, stride, addressed.dim(d));
                valid = false;
            }
        }
        return valid;
    }

    private void validateDim(DimOp op) {
        TensorType source = tensorOf(op, op.source(), "source");
        if (source != null && (op.index() < 0 || op.index() >= source.rank())) {
            error("%s index %d out of range for %s", op.opName(), op.index(), source.toMlirString());
        }
    }

    private TensorType tensorOf(Operation op, Value value, String role) {
        if (value.type() instanceof TensorType tensor) {
            return tensor;
        }
        error("%s %s must be a tensor, got %s", op.opName(), role, value.type().toMlirString());
        return null;
    }

    private void error(String format, Object... args) {
        errors.add(String.format(format, args));
    }
}
