package com.github.micycle1.fastkdtree;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Branch-and-bound k-nearest-neighbour search over a tree of {@link KDNode}s,
 * driven by an explicit stack rather than recursion.
 * <p>
 * At each branch the child on the query's side of the split is explored first.
 * The other child is pushed underneath it and, by the time it is popped, is
 * skipped if its bounding box lies further away than the current k-th best
 * candidate. All distances are squared.
 */
final class NearestNeighborSearch {

	private NearestNeighborSearch() {
	}

	static <T> BoundedCandidateList<KDPoint<T>> search(KDNode<T> root, double[] query, int k) {
		BoundedCandidateList<KDPoint<T>> candidates = new BoundedCandidateList<>(k);
		Deque<StackEntry<T>> stack = new ArrayDeque<>();

		if (k > 0 && !root.isEmpty()) {
			stack.push(new StackEntry<>(root, false));
		}

		while (!stack.isEmpty()) {
			StackEntry<T> entry = stack.pop();
			KDNode<T> node = entry.node;
			if (entry.needsBoundsCheck && candidates.isFull()) {
				double d = node.bounds.minDistanceSq(query);
				if (d > candidates.worstDistance()) {
					continue; // prune
				}
			}

			switch (node.type()) {
				case BRANCH:
					searchBranch(node.branch(), query, stack);
					break;
				case LEAF:
					searchLeaf(node.leaf(), query, candidates);
					break;
				default:
					throw new IllegalStateException("Unknown node type " + node.type());
			}
		}

		return candidates;
	}

	private static <T> void searchBranch(KDNode.Branch<T> branch, double[] query, Deque<StackEntry<T>> stack) {
		KDNode<T> near = branch.left;
		KDNode<T> far = branch.right;
		if (query[branch.splitDim] > branch.splitValue) {
			near = branch.right;
			far = branch.left;
		}

		// far goes underneath so that near is popped first
		if (!far.isEmpty()) {
			stack.push(new StackEntry<>(far, true));
		}
		if (!near.isEmpty()) {
			stack.push(new StackEntry<>(near, false));
		}
	}

	private static <T> void searchLeaf(KDNode.Leaf<T> leaf, double[] query, BoundedCandidateList<KDPoint<T>> candidates) {
		double dist = Double.NaN;
		boolean computed = false;
		for (KDPoint<T> point : leaf.points) {
			// all points of a singular leaf are at the same distance
			if (!leaf.singular || !computed) {
				dist = KDPoint.distanceSq(query, point.coords);
				computed = true;
			}

			if (!candidates.isFull() || dist < candidates.worstDistance()) {
				candidates.offer(point, dist);
			}
		}
	}

	private static final class StackEntry<T> {
		final KDNode<T> node;
		final boolean needsBoundsCheck;

		StackEntry(KDNode<T> node, boolean needsBoundsCheck) {
			this.node = node;
			this.needsBoundsCheck = needsBoundsCheck;
		}
	}
}
