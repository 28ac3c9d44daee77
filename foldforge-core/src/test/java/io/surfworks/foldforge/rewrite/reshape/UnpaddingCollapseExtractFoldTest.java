package io.surfworks.foldforge.rewrite.reshape;

import static io.surfworks.foldforge.tensor.TensorIrFixtures.arguments;
import static io.surfworks.foldforge.tensor.TensorIrFixtures.f32;
import static io.surfworks.foldforge.tensor.TensorIrFixtures.function;
import static io.surfworks.foldforge.tensor.TensorIrFixtures.indices;
import static io.surfworks.foldforge.tensor.TensorIrFixtures.ones;
import static io.surfworks.foldforge.tensor.TensorIrFixtures.ret;
import static io.surfworks.foldforge.tensor.TensorIrFixtures.tensor;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.surfworks.foldforge.rewrite.GraphRewriter;
import io.surfworks.foldforge.rewrite.MatchResult;
import io.surfworks.foldforge.rewrite.OperationGraph;
import io.surfworks.foldforge.tensor.TensorIr.CollapseShapeOp;
import io.surfworks.foldforge.tensor.TensorIr.ExtractSliceOp;
import io.surfworks.foldforge.tensor.TensorIr.OpaqueOp;
import io.surfworks.foldforge.tensor.TensorIr.Operation;
import io.surfworks.foldforge.tensor.TensorIr.Value;
import io.surfworks.foldforge.tensor.TensorIrVerifier;

@DisplayName("UnpaddingCollapseExtractFold")
class UnpaddingCollapseExtractFoldTest {

    private final UnpaddingCollapseExtractFold pattern = new UnpaddingCollapseExtractFold();
    private final Value src = tensor("src", 10, 1, 8);

    private static String reason(MatchResult<?> result) {
        return ((MatchResult.Failure<?>) result).reason();
    }

    @Test
    @DisplayName("collapsing away unit dims of a slice becomes a rank-reducing slice")
    void foldsUnitCollapse() {
        Value x = tensor("x", 8, 1, 4);
        Value y = tensor("y", 8, 4);
        ExtractSliceOp extract = new ExtractSliceOp(x, src, indices(2, 0, 4), indices(8, 1, 4), ones(3));
        CollapseShapeOp collapse = new CollapseShapeOp(y, x, List.of(List.of(0), List.of(1, 2)));
        OpaqueOp ret = ret(y);
        OperationGraph graph = OperationGraph.build(function(arguments(src), extract, collapse, ret));

        assertTrue(pattern.matchAndRewrite(collapse, new GraphRewriter(graph)));

        ExtractSliceOp folded = assertInstanceOf(ExtractSliceOp.class, graph.producer(ret.operand(0)));
        assertEquals(f32(8, 4), folded.resultType());
        assertEquals(List.of(8L, 1L, 4L), folded.parameters().staticSizes());
        assertEquals(List.of(2L, 0L, 4L), folded.parameters().staticOffsets());
        assertFalse(graph.contains(extract));
        assertFalse(graph.contains(collapse));
        assertEquals(List.of(folded, ret), graph.operations());
        assertEquals(List.of(), new TensorIrVerifier().validate(graph.toFunction()));
    }

    @Test
    @DisplayName("declines when the slice has another user")
    void declinesOnSharedExtract() {
        Value x = tensor("x", 8, 1, 4);
        Value y = tensor("y", 8, 4);
        ExtractSliceOp extract = new ExtractSliceOp(x, src, indices(2, 0, 4), indices(8, 1, 4), ones(3));
        CollapseShapeOp collapse = new CollapseShapeOp(y, x, List.of(List.of(0), List.of(1, 2)));
        OperationGraph graph = OperationGraph.build(function(arguments(src), extract, collapse, ret(y, x)));

        MatchResult<UnpaddingCollapseExtractFold.Match> result = pattern.match(collapse, graph);

        assertFalse(result.isSuccess());
        assertEquals("extract_slice has 2 uses", reason(result));
        List<Operation> before = graph.operations();
        assertFalse(pattern.matchAndRewrite(collapse, new GraphRewriter(graph)));
        assertEquals(before, graph.operations());
        assertSame(x, collapse.source());
    }

    @Test
    @DisplayName("declines when the collapse merges non-unit dims")
    void declinesOnRealCollapse() {
        Value x = tensor("x", 2, 1, 4);
        Value y = tensor("y", 8);
        ExtractSliceOp extract = new ExtractSliceOp(x, src, indices(0, 0, 0), indices(2, 1, 4), ones(3));
        CollapseShapeOp collapse = new CollapseShapeOp(y, x, List.of(List.of(0, 1, 2)));
        OperationGraph graph = OperationGraph.build(function(arguments(src), extract, collapse, ret(y)));

        MatchResult<UnpaddingCollapseExtractFold.Match> result = pattern.match(collapse, graph);

        assertFalse(result.isSuccess());
        assertTrue(reason(result).contains("MISMATCH"));
    }

    @Test
    @DisplayName("declines when the source is an argument")
    void declinesOnArgument() {
        Value x = tensor("x", 8, 1, 4);
        Value y = tensor("y", 8, 4);
        CollapseShapeOp collapse = new CollapseShapeOp(y, x, List.of(List.of(0), List.of(1, 2)));
        OperationGraph graph = OperationGraph.build(function(arguments(x), collapse, ret(y)));

        assertFalse(pattern.match(collapse, graph).isSuccess());
    }
}
