package io.surfworks.foldforge.tensor;

import java.util.List;

import io.surfworks.foldforge.tensor.TensorIr.TensorType;

/**
 * How one ranked shape relates to another when only static unit dimensions may differ.
 *
 * <p>{@code classify(a, b)} reads as "b relative to a":
 * <ul>
 *   <li>{@link #IDENTICAL} - same rank and same extents</li>
 *   <li>{@link #RANK_REDUCED_BY_SINGLETONS} - b is a with some static-1 dimensions removed</li>
 *   <li>{@link #RANK_INCREASED_BY_SINGLETONS} - b is a with some static-1 dimensions inserted</li>
 *   <li>{@link #MISMATCH} - anything else</li>
 * </ul>
 *
 * <p>The smaller shape is aligned into the larger one left to right; aligned extents must be
 * equal (a dynamic extent only aligns with another dynamic extent) and every skipped extent of
 * the larger shape must be exactly 1. Greedy alignment is sufficient because a skipped
 * dimension is always a 1, so matching an equal 1 early never blocks a later match.
 */
public enum ShapeRelation {
    IDENTICAL,
    RANK_REDUCED_BY_SINGLETONS,
    RANK_INCREASED_BY_SINGLETONS,
    MISMATCH;

    /**
     * Classifies two tensor types. Differing element types always mismatch.
     */
    public static ShapeRelation classify(TensorType a, TensorType b) {
        if (!a.elementType().equals(b.elementType())) {
            return MISMATCH;
        }
        return classify(a.shape(), b.shape());
    }

    /**
     * Classifies two shapes, using {@link TensorIr#DYNAMIC} for dynamic extents.
     */
    public static ShapeRelation classify(List<Long> a, List<Long> b) {
        if (a.equals(b)) {
            return IDENTICAL;
        }
        if (a.size() > b.size()) {
            return dropsOnlyUnitDims(a, b) ? RANK_REDUCED_BY_SINGLETONS : MISMATCH;
        }
        if (a.size() < b.size()) {
            return dropsOnlyUnitDims(b, a) ? RANK_INCREASED_BY_SINGLETONS : MISMATCH;
        }
        return MISMATCH;
    }

    /**
     * Returns true if {@code reduced} is {@code original} with only static-1 extents dropped.
     */
    private static boolean dropsOnlyUnitDims(List<Long> original, List<Long> reduced) {
        int reducedIdx = 0;
        for (long extent : original) {
            if (reducedIdx < reduced.size() && extent == reduced.get(reducedIdx)) {
                reducedIdx++;
                continue;
            }
            if (extent != 1) {
                return false;
            }
        }
        return reducedIdx == reduced.size();
    }

    /**
     * True for the relations a rank-reducing slice accepts between its sizes and its type.
     */
    public boolean isSingletonReduction() {
        return this == IDENTICAL || this == RANK_REDUCED_BY_SINGLETONS;
    }

    public boolean isSingletonExpansion() {
        return this == IDENTICAL || this == RANK_INCREASED_BY_SINGLETONS;
    }
}
