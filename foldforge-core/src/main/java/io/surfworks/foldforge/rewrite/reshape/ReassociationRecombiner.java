package io.surfworks.foldforge.rewrite.reshape;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes the reassociations for swapping a collapse followed by an expand into an expand
 * followed by a collapse.
 *
 * <p>The two reshapes are parallel when, pairing the expand's i-th group with the collapse's
 * i-th group, no pair has both groups larger than one: no dimension of the intermediate
 * tensor is both merged by the collapse and split by the expand. Walking the pairs left to
 * right with a running dimension counter:
 * <ul>
 *   <li>a collapse group of k &gt; 1 source dims becomes k singleton expand groups, each
 *       keeping its own source extent, and one collapse group over those k dims</li>
 *   <li>otherwise the expand group of k dims becomes one expand group of k dims keeping the
 *       expand's declared extents, and k singleton collapse groups</li>
 * </ul>
 *
 * <p>Example: collapse {@code [[0, 1], [2]]} then expand {@code [[0], [1, 2]]} becomes expand
 * {@code [[0], [1], [2, 3]]} then collapse {@code [[0, 1], [2], [3]]}.
 */
public final class ReassociationRecombiner {

    private ReassociationRecombiner() {}

    /**
     * Where an extent of the new expand's result comes from.
     */
    public sealed interface ExtentOrigin permits FromCollapseSource, FromExpandOutput {}

    /**
     * The extent of dimension {@code dim} of the original collapse's source.
     */
    public record FromCollapseSource(int dim) implements ExtentOrigin {}

    /**
     * The declared output extent {@code dim} of the original expand.
     */
    public record FromExpandOutput(int dim) implements ExtentOrigin {}

    /**
     * Reassociations of the reordered pair, plus the origin of every new expand extent.
     */
    public record SwappedReshapes(
            List<List<Integer>> expandReassociation,
            List<List<Integer>> collapseReassociation,
            List<ExtentOrigin> expandedExtents
    ) {
        public SwappedReshapes {
            expandReassociation = expandReassociation.stream().map(List::copyOf).toList();
            collapseReassociation = collapseReassociation.stream().map(List::copyOf).toList();
            expandedExtents = List.copyOf(expandedExtents);
        }

        /**
         * Rank of the intermediate tensor between the new expand and the new collapse.
         */
        public int expandedRank() {
            return expandedExtents.size();
        }
    }

    /**
     * Returns true if no paired group is larger than one on both sides. A pair through a rank-0
     * tensor has no groups and is never parallel.
     */
    public static boolean areParallel(List<List<Integer>> expandGroups, List<List<Integer>> collapseGroups) {
        if (expandGroups.isEmpty() || expandGroups.size() != collapseGroups.size()) {
            return false;
        }
        for (int i = 0; i < expandGroups.size(); i++) {
            if (expandGroups.get(i).size() != 1 && collapseGroups.get(i).size() != 1) {
                return false;
            }
        }
        return true;
    }

    /**
     * Recombines the groups of a parallel collapse/expand pair.
     *
     * @param expandGroups the expand's reassociation (over its result dims)
     * @param collapseGroups the collapse's reassociation (over its source dims)
     * @return the reassociations for expand-then-collapse
     * @throws IllegalArgumentException if the pair is not parallel
     */
    public static SwappedReshapes recombine(List<List<Integer>> expandGroups, List<List<Integer>> collapseGroups) {
        if (!areParallel(expandGroups, collapseGroups)) {
            throw new IllegalArgumentException(String.format(
                    "reshapes are not parallel: expand %s, collapse %s", expandGroups, collapseGroups));
        }

        List<List<Integer>> newExpand = new ArrayList<>();
        List<List<Integer>> newCollapse = new ArrayList<>();
        List<ExtentOrigin> extents = new ArrayList<>();
        int index = 0;
        int expandIndex = 0;
        int collapseIndex = 0;

        for (int i = 0; i < collapseGroups.size(); i++) {
            int collapseSize = collapseGroups.get(i).size();
            if (collapseSize != 1) {
                List<Integer> merged = new ArrayList<>(collapseSize);
                for (int k = 0; k < collapseSize; k++) {
                    merged.add(index);
                    newExpand.add(List.of(index));
                    extents.add(new FromCollapseSource(collapseIndex++));
                    index++;
                }
                newCollapse.add(merged);
                expandIndex++;
                continue;
            }

            int expandSize = expandGroups.get(i).size();
            List<Integer> split = new ArrayList<>(expandSize);
            for (int k = 0; k < expandSize; k++) {
                split.add(index);
                newCollapse.add(List.of(index));
                extents.add(new FromExpandOutput(expandIndex++));
                index++;
            }
            newExpand.add(split);
            collapseIndex++;
        }

        return new SwappedReshapes(newExpand, newCollapse, extents);
    }
}
