package io.surfworks.foldforge.rewrite.reshape;

import java.util.ArrayList;
import java.util.List;

import io.surfworks.foldforge.rewrite.GraphRewriter;
import io.surfworks.foldforge.rewrite.MatchResult;
import io.surfworks.foldforge.rewrite.OperationGraph;
import io.surfworks.foldforge.rewrite.RewritePattern;
import io.surfworks.foldforge.rewrite.reshape.ReassociationRecombiner.ExtentOrigin;
import io.surfworks.foldforge.rewrite.reshape.ReassociationRecombiner.FromCollapseSource;
import io.surfworks.foldforge.rewrite.reshape.ReassociationRecombiner.FromExpandOutput;
import io.surfworks.foldforge.rewrite.reshape.ReassociationRecombiner.SwappedReshapes;
import io.surfworks.foldforge.tensor.TensorIr;
import io.surfworks.foldforge.tensor.TensorIr.CollapseShapeOp;
import io.surfworks.foldforge.tensor.TensorIr.DimOp;
import io.surfworks.foldforge.tensor.TensorIr.ExpandShapeOp;
import io.surfworks.foldforge.tensor.TensorIr.IndexType;
import io.surfworks.foldforge.tensor.TensorIr.MixedIndex;
import io.surfworks.foldforge.tensor.TensorIr.OpKind;
import io.surfworks.foldforge.tensor.TensorIr.Operation;
import io.surfworks.foldforge.tensor.TensorIr.StaticIndex;
import io.surfworks.foldforge.tensor.TensorIr.TensorType;

/**
 * Moves an expand_shape above the collapse_shape producing its source when the two reshapes
 * do not touch the same dimensions.
 *
 * <p>Matches:
 * <pre>
 * %c = tensor.collapse_shape %t [[0, 1], [2]] : tensor&lt;2x3x4xf32&gt; into tensor&lt;6x4xf32&gt;
 * %r = tensor.expand_shape %c [[0], [1, 2]] output_shape [6, 2, 2] : tensor&lt;6x4xf32&gt; into tensor&lt;6x2x2xf32&gt;
 * </pre>
 * and produces:
 * <pre>
 * %e = tensor.expand_shape %t [[0], [1], [2, 3]] output_shape [2, 3, 2, 2] : tensor&lt;2x3x4xf32&gt; into tensor&lt;2x3x2x2xf32&gt;
 * %r = tensor.collapse_shape %e [[0, 1], [2], [3]] : tensor&lt;2x3x2x2xf32&gt; into tensor&lt;6x2x2xf32&gt;
 * </pre>
 *
 * <p>Dynamic extents of the collapse's source are read with tensor.dim; dynamic extents of
 * the expand's output shape are reused as they are.
 */
public final class ParallelCollapseExpandBubbleUp implements RewritePattern<ParallelCollapseExpandBubbleUp.Match> {

    public static final String NAME = "bubble-up-expand";

    /**
     * @param expand the root
     * @param collapse the producer of the expand's source
     * @param swapped the reassociations of the reordered pair
     */
    public record Match(ExpandShapeOp expand, CollapseShapeOp collapse, SwappedReshapes swapped) {}

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Bubbles expand_shape up through a collapse_shape with non-intersecting reassociation";
    }

    @Override
    public OpKind rootKind() {
        return OpKind.EXPAND_SHAPE;
    }

    @Override
    public MatchResult<Match> match(Operation op, OperationGraph graph) {
        if (!(op instanceof ExpandShapeOp expand)) {
            return MatchResult.failure("root is not an expand_shape");
        }
        if (!(graph.producer(expand.source()) instanceof CollapseShapeOp collapse)) {
            return MatchResult.failure("source is not produced by a collapse_shape");
        }

        List<List<Integer>> expandGroups = expand.reassociation();
        List<List<Integer>> collapseGroups = collapse.reassociation();
        if (expandGroups.isEmpty()) {
            return MatchResult.failure("rank-0 intermediate");
        }
        if (expandGroups.size() != collapseGroups.size()) {
            return MatchResult.failure(String.format("group counts differ: expand %d, collapse %d",
                    expandGroups.size(), collapseGroups.size()));
        }
        if (!ReassociationRecombiner.areParallel(expandGroups, collapseGroups)) {
            return MatchResult.failure("a dimension is both merged by " + collapseGroups
                    + " and split by " + expandGroups);
        }
        return MatchResult.success(new Match(expand, collapse,
                ReassociationRecombiner.recombine(expandGroups, collapseGroups)));
    }

    @Override
    public void rewrite(Match match, GraphRewriter rewriter) {
        ExpandShapeOp expand = match.expand();
        CollapseShapeOp collapse = match.collapse();
        TensorType sourceType = collapse.sourceType();
        List<MixedIndex> expandOutput = expand.mixedOutputShape();

        List<MixedIndex> sizes = new ArrayList<>(match.swapped().expandedRank());
        List<Long> shape = new ArrayList<>(match.swapped().expandedRank());
        for (ExtentOrigin origin : match.swapped().expandedExtents()) {
            MixedIndex size;
            if (origin instanceof FromCollapseSource fromSource) {
                int dim = fromSource.dim();
                if (sourceType.isDynamicDim(dim)) {
                    DimOp read = rewriter.create(new DimOp(
                            rewriter.freshValue(IndexType.INSTANCE), collapse.source(), dim));
                    size = MixedIndex.of(read.result());
                } else {
                    size = MixedIndex.of(sourceType.dim(dim));
                }
            } else {
                size = expandOutput.get(((FromExpandOutput) origin).dim());
            }
            sizes.add(size);
            shape.add(size instanceof StaticIndex s ? s.value() : TensorIr.DYNAMIC);
        }

        ExpandShapeOp newExpand = rewriter.create(new ExpandShapeOp(
                rewriter.freshValue(sourceType.withShape(shape)),
                collapse.source(),
                match.swapped().expandReassociation(),
                sizes));
        CollapseShapeOp newCollapse = new CollapseShapeOp(
                rewriter.freshValue(expand.resultType()),
                newExpand.result(),
                match.swapped().collapseReassociation());
        rewriter.replaceOp(expand, newCollapse);
    }
}
