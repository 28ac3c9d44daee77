package io.surfworks.foldforge.rewrite.reshape;

import static io.surfworks.foldforge.tensor.TensorIr.DYNAMIC;
import static io.surfworks.foldforge.tensor.TensorIrFixtures.arguments;
import static io.surfworks.foldforge.tensor.TensorIrFixtures.f32;
import static io.surfworks.foldforge.tensor.TensorIrFixtures.function;
import static io.surfworks.foldforge.tensor.TensorIrFixtures.index;
import static io.surfworks.foldforge.tensor.TensorIrFixtures.ret;
import static io.surfworks.foldforge.tensor.TensorIrFixtures.tensor;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.surfworks.foldforge.rewrite.GraphRewriter;
import io.surfworks.foldforge.rewrite.MatchResult;
import io.surfworks.foldforge.rewrite.OperationGraph;
import io.surfworks.foldforge.tensor.TensorIr.Argument;
import io.surfworks.foldforge.tensor.TensorIr.CollapseShapeOp;
import io.surfworks.foldforge.tensor.TensorIr.DimOp;
import io.surfworks.foldforge.tensor.TensorIr.DynamicIndex;
import io.surfworks.foldforge.tensor.TensorIr.ExpandShapeOp;
import io.surfworks.foldforge.tensor.TensorIr.Function;
import io.surfworks.foldforge.tensor.TensorIr.MixedIndex;
import io.surfworks.foldforge.tensor.TensorIr.OpaqueOp;
import io.surfworks.foldforge.tensor.TensorIr.Operation;
import io.surfworks.foldforge.tensor.TensorIr.StaticIndex;
import io.surfworks.foldforge.tensor.TensorIr.Value;
import io.surfworks.foldforge.tensor.TensorIrVerifier;

@DisplayName("ParallelCollapseExpandBubbleUp")
class ParallelCollapseExpandBubbleUpTest {

    private final ParallelCollapseExpandBubbleUp pattern = new ParallelCollapseExpandBubbleUp();

    @Test
    @DisplayName("swaps a static collapse/expand pair")
    void swapsStaticPair() {
        Value t = tensor("t", 2, 3, 4);
        Value c = tensor("c", 6, 4);
        Value r = tensor("r", 6, 2, 2);
        CollapseShapeOp collapse = new CollapseShapeOp(c, t, List.of(List.of(0, 1), List.of(2)));
        ExpandShapeOp expand = new ExpandShapeOp(r, c, List.of(List.of(0), List.of(1, 2)));
        OpaqueOp ret = ret(r);
        Function before = function(arguments(t), collapse, expand, ret);
        OperationGraph graph = OperationGraph.build(before);

        assertTrue(pattern.matchAndRewrite(expand, new GraphRewriter(graph)));

        CollapseShapeOp newCollapse = assertInstanceOf(CollapseShapeOp.class, graph.producer(ret.operand(0)));
        assertEquals(f32(6, 2, 2), newCollapse.resultType());
        assertEquals(List.of(List.of(0, 1), List.of(2), List.of(3)), newCollapse.reassociation());

        ExpandShapeOp newExpand = assertInstanceOf(ExpandShapeOp.class, graph.producer(newCollapse.source()));
        assertSame(t, newExpand.source());
        assertEquals(f32(2, 3, 2, 2), newExpand.resultType());
        assertEquals(List.of(List.of(0), List.of(1), List.of(2, 3)), newExpand.reassociation());
        assertEquals(List.of(2L, 3L, 2L, 2L), newExpand.staticOutputShape());

        assertFalse(graph.contains(expand));
        assertTrue(graph.isUnused(c));
        assertEquals(List.of(), new TensorIrVerifier().validate(graph.toFunction()));
        assertEquals(resultShape(before, Map.of()), resultShape(graph.toFunction(), Map.of()));
    }

    @Test
    @DisplayName("reads dynamic collapse source extents with tensor.dim")
    void materializesDynamicSourceExtent() {
        Value t = new Value("t", f32(DYNAMIC, 3, 4));
        Value n = index("n");
        Value c = new Value("c", f32(DYNAMIC, 4));
        Value r = new Value("r", f32(DYNAMIC, 2, 2));
        CollapseShapeOp collapse = new CollapseShapeOp(c, t, List.of(List.of(0, 1), List.of(2)));
        ExpandShapeOp expand = new ExpandShapeOp(r, c, List.of(List.of(0), List.of(1, 2)),
                List.of(MixedIndex.of(n), MixedIndex.of(2), MixedIndex.of(2)));
        OpaqueOp ret = ret(r);
        Function before = function(arguments(t, n), collapse, expand, ret);
        OperationGraph graph = OperationGraph.build(before);

        assertTrue(pattern.matchAndRewrite(expand, new GraphRewriter(graph)));

        CollapseShapeOp newCollapse = assertInstanceOf(CollapseShapeOp.class, graph.producer(ret.operand(0)));
        ExpandShapeOp newExpand = assertInstanceOf(ExpandShapeOp.class, graph.producer(newCollapse.source()));
        assertEquals(f32(DYNAMIC, 3, 2, 2), newExpand.resultType());

        DynamicIndex leading = assertInstanceOf(DynamicIndex.class, newExpand.mixedOutputShape().get(0));
        DimOp dim = assertInstanceOf(DimOp.class, graph.producer(leading.value()));
        assertSame(t, dim.source());
        assertEquals(0, dim.index());
        assertEquals(List.of(), new TensorIrVerifier().validate(graph.toFunction()));

        // t is 5x3x4 at run time, so the collapsed leading extent n is 15
        Map<String, Long> runtime = Map.of("t", 5L, "n", 15L);
        assertEquals(List.of(15L, 2L, 2L), resultShape(graph.toFunction(), runtime));
        assertEquals(resultShape(before, runtime), resultShape(graph.toFunction(), runtime));
    }

    @Test
    @DisplayName("reuses dynamic output extents of the expand")
    void reusesDynamicExpandExtent() {
        Value t = new Value("t", f32(2, 3, DYNAMIC));
        Value n = index("n");
        Value c = new Value("c", f32(6, DYNAMIC));
        Value r = new Value("r", f32(6, DYNAMIC, 4));
        CollapseShapeOp collapse = new CollapseShapeOp(c, t, List.of(List.of(0, 1), List.of(2)));
        ExpandShapeOp expand = new ExpandShapeOp(r, c, List.of(List.of(0), List.of(1, 2)),
                List.of(MixedIndex.of(6), MixedIndex.of(n), MixedIndex.of(4)));
        OperationGraph graph = OperationGraph.build(function(arguments(t, n), collapse, expand, ret(r)));

        assertTrue(pattern.matchAndRewrite(expand, new GraphRewriter(graph)));

        ExpandShapeOp newExpand = graph.operations().stream()
                .filter(ExpandShapeOp.class::isInstance)
                .map(ExpandShapeOp.class::cast)
                .findFirst()
                .orElseThrow();
        assertEquals(f32(2, 3, DYNAMIC, 4), newExpand.resultType());
        assertEquals(List.of(MixedIndex.of(2), MixedIndex.of(3), MixedIndex.of(n), MixedIndex.of(4)),
                newExpand.mixedOutputShape());
        assertTrue(graph.operations().stream().noneMatch(DimOp.class::isInstance));
        assertEquals(List.of(), new TensorIrVerifier().validate(graph.toFunction()));
    }

    @Test
    @DisplayName("declines when a dimension is merged and then split")
    void declinesOnIntersectingGroups() {
        Value t = tensor("t", 2, 3, 4);
        Value c = tensor("c", 6, 4);
        Value r = tensor("r", 3, 2, 4);
        CollapseShapeOp collapse = new CollapseShapeOp(c, t, List.of(List.of(0, 1), List.of(2)));
        ExpandShapeOp expand = new ExpandShapeOp(r, c, List.of(List.of(0, 1), List.of(2)));
        OperationGraph graph = OperationGraph.build(function(arguments(t), collapse, expand, ret(r)));

        MatchResult<ParallelCollapseExpandBubbleUp.Match> result = pattern.match(expand, graph);

        assertFalse(result.isSuccess());
        assertTrue(((MatchResult.Failure<?>) result).reason().contains("both merged"));
    }

    @Test
    @DisplayName("declines when the intermediate is rank 0")
    void declinesOnRankZeroIntermediate() {
        Value t = tensor("t", 1, 1);
        Value c = tensor("c");
        Value r = tensor("r", 1, 1, 1);
        CollapseShapeOp collapse = new CollapseShapeOp(c, t, List.of());
        ExpandShapeOp expand = new ExpandShapeOp(r, c, List.of());
        Function func = function(arguments(t), collapse, expand, ret(r));
        assertEquals(List.of(), new TensorIrVerifier().validate(func));
        OperationGraph graph = OperationGraph.build(func);

        MatchResult<ParallelCollapseExpandBubbleUp.Match> result = pattern.match(expand, graph);

        assertFalse(result.isSuccess());
        assertEquals("rank-0 intermediate", ((MatchResult.Failure<?>) result).reason());
        assertFalse(pattern.matchAndRewrite(expand, new GraphRewriter(graph)));
        assertTrue(graph.contains(expand));
    }

    @Test
    @DisplayName("declines when the source is not a collapse")
    void declinesWithoutCollapse() {
        Value c = tensor("c", 6, 4);
        Value r = tensor("r", 6, 2, 2);
        ExpandShapeOp expand = new ExpandShapeOp(r, c, List.of(List.of(0), List.of(1, 2)));
        OperationGraph graph = OperationGraph.build(function(arguments(c), expand, ret(r)));

        assertFalse(pattern.match(expand, graph).isSuccess());
    }

    /**
     * Evaluates the concrete shape of the first operand of the final op. Runtime supplies the
     * value of index arguments by name and the leading extent of dynamic tensor arguments.
     */
    private static List<Long> resultShape(Function func, Map<String, Long> runtime) {
        Map<String, List<Long>> shapes = new HashMap<>();
        Map<String, Long> indices = new HashMap<>();
        for (Argument arg : func.arguments()) {
            Value v = arg.toValue();
            if (v.isIndex()) {
                indices.put(v.name(), runtime.get(v.name()));
            } else {
                List<Long> shape = new ArrayList<>(v.tensorType().shape());
                for (int d = 0; d < shape.size(); d++) {
                    if (shape.get(d) == DYNAMIC) {
                        shape.set(d, runtime.get(v.name()));
                    }
                }
                shapes.put(v.name(), shape);
            }
        }
        for (Operation op : func.body()) {
            if (op instanceof DimOp dim) {
                indices.put(dim.result().name(), shapes.get(dim.source().name()).get(dim.index()));
            } else if (op instanceof CollapseShapeOp collapse) {
                List<Long> source = shapes.get(collapse.source().name());
                List<Long> shape = new ArrayList<>();
                for (List<Integer> group : collapse.reassociation()) {
                    long product = 1;
                    for (int d : group) {
                        product *= source.get(d);
                    }
                    shape.add(product);
                }
                shapes.put(collapse.result().name(), shape);
            } else if (op instanceof ExpandShapeOp expand) {
                List<Long> shape = new ArrayList<>();
                for (MixedIndex extent : expand.mixedOutputShape()) {
                    shape.add(extent instanceof StaticIndex s
                            ? s.value()
                            : indices.get(((DynamicIndex) extent).value().name()));
                }
                shapes.put(expand.result().name(), shape);
            }
        }
        Operation last = func.body().get(func.body().size() - 1);
        return shapes.get(last.operand(0).name());
    }
}
