package io.surfworks.foldforge.rewrite.reshape;

import static io.surfworks.foldforge.tensor.TensorIrFixtures.arguments;
import static io.surfworks.foldforge.tensor.TensorIrFixtures.function;
import static io.surfworks.foldforge.tensor.TensorIrFixtures.indices;
import static io.surfworks.foldforge.tensor.TensorIrFixtures.ones;
import static io.surfworks.foldforge.tensor.TensorIrFixtures.ret;
import static io.surfworks.foldforge.tensor.TensorIrFixtures.tensor;
import static io.surfworks.foldforge.tensor.TensorIrFixtures.zeros;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.surfworks.foldforge.rewrite.GraphRewriter;
import io.surfworks.foldforge.rewrite.OperationGraph;
import io.surfworks.foldforge.tensor.TensorIr.CollapseShapeOp;
import io.surfworks.foldforge.tensor.TensorIr.InsertSliceOp;
import io.surfworks.foldforge.tensor.TensorIr.OpKind;
import io.surfworks.foldforge.tensor.TensorIr.OpaqueOp;
import io.surfworks.foldforge.tensor.TensorIr.Operation;
import io.surfworks.foldforge.tensor.TensorIr.ParallelInsertSliceOp;
import io.surfworks.foldforge.tensor.TensorIr.Value;
import io.surfworks.foldforge.tensor.TensorIrVerifier;

@DisplayName("CollapsedSourceInsertFold")
class CollapsedSourceInsertFoldTest {

    // %c = collapse %t [[0, 1], [2]] : 1x4x8 -> 4x8
    private final Value t = tensor("t", 1, 4, 8);
    private final Value c = tensor("c", 4, 8);
    private final Value dest = tensor("dest", 2, 4, 8);
    private final CollapseShapeOp collapse = new CollapseShapeOp(c, t, List.of(List.of(0, 1), List.of(2)));

    @Test
    @DisplayName("variant names are distinct")
    void variantNames() {
        assertEquals("fold-insert-of-collapse", new CollapsedSourceInsertFold(OpKind.INSERT_SLICE).name());
        assertEquals("fold-parallel-insert-of-collapse",
                new CollapsedSourceInsertFold(OpKind.PARALLEL_INSERT_SLICE).name());
        assertThrows(IllegalArgumentException.class, () -> new CollapsedSourceInsertFold(OpKind.DIM));
    }

    @Nested
    @DisplayName("insert_slice")
    class Insert {

        private final CollapsedSourceInsertFold pattern = new CollapsedSourceInsertFold(OpKind.INSERT_SLICE);

        @Test
        @DisplayName("inserts the uncollapsed tensor directly")
        void foldsCollapse() {
            Value r = tensor("r", 2, 4, 8);
            InsertSliceOp insert = new InsertSliceOp(r, c, dest, indices(1, 0, 0), indices(1, 4, 8), ones(3));
            OpaqueOp ret = ret(r);
            OperationGraph graph = OperationGraph.build(function(arguments(t, dest), collapse, insert, ret));

            assertTrue(pattern.matchAndRewrite(insert, new GraphRewriter(graph)));

            InsertSliceOp folded = assertInstanceOf(InsertSliceOp.class, graph.producer(ret.operand(0)));
            assertNotSame(insert, folded);
            assertSame(t, folded.source());
            assertSame(dest, folded.dest());
            assertEquals(insert.parameters(), folded.parameters());
            assertEquals(r.type(), folded.result().type());
            assertFalse(graph.contains(insert));
            assertTrue(graph.isUnused(c));
            assertEquals(List.of(), new TensorIrVerifier().validate(graph.toFunction()));
        }

        @Test
        @DisplayName("declines when the insert sizes are not the uncollapsed type")
        void declinesOnDifferentSizes() {
            Value small = tensor("small", 4, 8);
            Value r = tensor("r", 4, 8);
            InsertSliceOp insert = new InsertSliceOp(r, c, small, zeros(2), indices(4, 8), ones(2));
            OperationGraph graph = OperationGraph.build(function(arguments(t, small), collapse, insert, ret(r)));

            assertFalse(pattern.match(insert, graph).isSuccess());
        }

        @Test
        @DisplayName("ignores the parallel variant")
        void wrongKind() {
            ParallelInsertSliceOp parallel = new ParallelInsertSliceOp(c, dest, zeros(3), indices(1, 4, 8), ones(3));
            OperationGraph graph = OperationGraph.build(function(arguments(t, dest), collapse, parallel));

            assertFalse(pattern.matchAndRewrite(parallel, new GraphRewriter(graph)));
        }
    }

    @Nested
    @DisplayName("parallel_insert_slice")
    class ParallelInsert {

        private final CollapsedSourceInsertFold pattern = new CollapsedSourceInsertFold(OpKind.PARALLEL_INSERT_SLICE);

        @Test
        @DisplayName("replaces the terminator insert with one reading the uncollapsed tensor")
        void foldsCollapse() {
            ParallelInsertSliceOp insert = new ParallelInsertSliceOp(c, dest, indices(1, 0, 0), indices(1, 4, 8), ones(3));
            OperationGraph graph = OperationGraph.build(function(arguments(t, dest), collapse, insert));

            assertTrue(pattern.matchAndRewrite(insert, new GraphRewriter(graph)));

            assertFalse(graph.contains(insert));
            assertEquals(2, graph.size());
            Operation last = graph.operations().get(1);
            ParallelInsertSliceOp folded = assertInstanceOf(ParallelInsertSliceOp.class, last);
            assertSame(t, folded.source());
            assertEquals(insert.parameters(), folded.parameters());
            assertTrue(folded.results().isEmpty());
        }
    }
}
