package io.surfworks.foldforge.rewrite.reshape;

import io.surfworks.foldforge.tensor.TensorIr.OpKind;

final class InsertVariants {

    private InsertVariants() {}

    static OpKind requireInsertKind(OpKind kind) {
        if (kind != OpKind.INSERT_SLICE && kind != OpKind.PARALLEL_INSERT_SLICE) {
            throw new IllegalArgumentException("not an insert kind: " + kind);
        }
        return kind;
    }

    /**
     * Pattern names carry the variant so each can be disabled on its own.
     */
    static String patternName(String base, OpKind kind) {
        return kind == OpKind.PARALLEL_INSERT_SLICE ? base.replace("insert", "parallel-insert") : base;
    }
}
