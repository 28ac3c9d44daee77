package io.surfworks.foldforge.rewrite.reshape;

import io.surfworks.foldforge.config.RewriteConfig;
import io.surfworks.foldforge.rewrite.GreedyRewriteDriver;
import io.surfworks.foldforge.rewrite.RewritePatternSet;
import io.surfworks.foldforge.tensor.TensorIr.OpKind;

/**
 * Registration entry points for the reshape folding patterns.
 *
 * <p>The folding group removes reshapes that only add or drop unit dimensions around slice
 * operations. The bubble-up group reorders parallel collapse/expand pairs and is kept
 * separate because it moves reshapes rather than eliminating them.
 *
 * <p>Example usage:
 * <pre>{@code
 * RewriteConfig config = RewriteConfigLoader.load();
 * Function folded = ReshapePatterns.createDriver(config).apply(function);
 * }</pre>
 */
public final class ReshapePatterns {

    private ReshapePatterns() {}

    /**
     * Adds the slice/reshape folding patterns: expand of extract, unpadding collapse, and
     * both insert variants of the collapsed-source and padding-expand folds.
     *
     * @param patterns the set to add to
     * @return the same set
     */
    public static RewritePatternSet populateReassociativeReshapeFoldingPatterns(RewritePatternSet patterns) {
        patterns.add(new RankReducingExtractExpandFold());
        patterns.add(new UnpaddingCollapseExtractFold());
        for (OpKind insertKind : new OpKind[] {OpKind.INSERT_SLICE, OpKind.PARALLEL_INSERT_SLICE}) {
            patterns.add(new CollapsedSourceInsertFold(insertKind));
            patterns.add(new PaddingExpandInsertFold(insertKind));
        }
        return patterns;
    }

    /**
     * Adds the pattern that moves expand_shape above a parallel collapse_shape.
     *
     * @param patterns the set to add to
     * @return the same set
     */
    public static RewritePatternSet populateBubbleUpExpandShapePatterns(RewritePatternSet patterns) {
        patterns.add(new ParallelCollapseExpandBubbleUp());
        return patterns;
    }

    public static RewritePatternSet populateAll(RewritePatternSet patterns) {
        populateReassociativeReshapeFoldingPatterns(patterns);
        return populateBubbleUpExpandShapePatterns(patterns);
    }

    /**
     * Builds a pattern set honoring {@link RewriteConfig#enableBubbleUpExpand()}.
     */
    public static RewritePatternSet forConfig(RewriteConfig config) {
        RewritePatternSet patterns = populateReassociativeReshapeFoldingPatterns(new RewritePatternSet());
        if (config.enableBubbleUpExpand()) {
            populateBubbleUpExpandShapePatterns(patterns);
        }
        return patterns;
    }

    /**
     * Builds a driver over {@link #forConfig(RewriteConfig)}.
     */
    public static GreedyRewriteDriver createDriver(RewriteConfig config) {
        return new GreedyRewriteDriver(forConfig(config), config);
    }
}
