package com.github.micycle1.fastkdtree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * A node of a {@link FastKDTree}. A node starts out as a leaf holding a bucket of
 * points and is converted, at most once, into a branch with two children when
 * the bucket overflows.
 * <p>
 * Every node keeps the bounding box of all points ever inserted below it. The
 * box is created by the first insertion and only grows.
 *
 * @param <T> the type of item stored.
 */
class KDNode<T> {

	private static final Logger log = LoggerFactory.getLogger(KDNode.class);

	/**
	 * Which of the two states a node is in.
	 */
	enum NodeType {
		LEAF, BRANCH
	}

	final int bucketSize;
	/**
	 * Box over every point inserted into this subtree; null while the node is
	 * empty.
	 */
	BoundingBox bounds;
	State<T> state;

	KDNode(int bucketSize) {
		this.bucketSize = bucketSize;
		this.state = new Leaf<>();
	}

	NodeType type() {
		return state.type();
	}

	boolean isLeaf() {
		return state.type() == NodeType.LEAF;
	}

	boolean isEmpty() {
		return bounds == null;
	}

	Leaf<T> leaf() {
		if (state.type() != NodeType.LEAF) {
			throw new IllegalStateException("Internal invariant violated: node is not a leaf.");
		}
		return (Leaf<T>) state;
	}

	Branch<T> branch() {
		if (state.type() != NodeType.BRANCH) {
			throw new IllegalStateException("Internal invariant violated: node is not a branch.");
		}
		return (Branch<T>) state;
	}

	/**
	 * Inserts the points one by one and then splits every distinct leaf that
	 * received points and has overflowed.
	 */
	void addAll(Collection<? extends KDPoint<T>> points, Random random, int maxSplitAttempts) {
		// nodes do not override equals, so this set dedupes by identity
		Set<KDNode<T>> touched = new LinkedHashSet<>();
		for (KDPoint<T> point : points) {
			touched.add(addNoSplit(point));
		}

		for (KDNode<T> leaf : touched) {
			if (leaf.shouldSplit()) {
				leaf.split(random, maxSplitAttempts);
			}
		}
	}

	/**
	 * Walks from this node down to the leaf the point belongs in, widening the
	 * bounds of every node on the way, and appends the point to that leaf. Never
	 * splits.
	 *
	 * @return the leaf the point was added to.
	 */
	KDNode<T> addNoSplit(KDPoint<T> point) {
		KDNode<T> cursor = this;
		while (cursor != null) {
			cursor.updateBounds(point.coords);
			switch (cursor.state.type()) {
				case BRANCH:
					cursor = cursor.branch().childFor(point.coords);
					break;
				case LEAF:
					cursor.leaf().add(point);
					return cursor;
				default:
					throw new IllegalStateException("Unknown node type " + cursor.state.type());
			}
		}
		throw new IllegalStateException("Internal invariant violated: walked the tree without reaching a leaf.");
	}

	private void updateBounds(double[] coords) {
		if (bounds == null) {
			bounds = new BoundingBox(coords);
		} else {
			bounds.expandToInclude(coords);
		}
	}

	/**
	 * A leaf splits when it holds more points than the bucket size, unless all of
	 * its points share the same coordinates.
	 */
	boolean shouldSplit() {
		if (!isLeaf()) {
			return false;
		}
		Leaf<T> leaf = leaf();
		return leaf.points.size() > bucketSize && !leaf.singular;
	}

	/**
	 * Converts this leaf into a branch. The split dimension is the one with the
	 * largest sum of squared deviations (first one wins ties) and the split value
	 * is the running mean on that dimension.
	 */
	void split(Random random, int maxSplitAttempts) {
		Leaf<T> leaf = leaf();
		if (leaf.singular) {
			throw new IllegalStateException("Internal invariant violated: cannot split a singular leaf.");
		}

		double largestVariance = -1;
		int splitDim = 0;
		for (int d = 0; d < leaf.sumSqDev.length; d++) {
			double variance = leaf.sumSqDev[d];
			if (variance > largestVariance) {
				largestVariance = variance;
				splitDim = d;
			}
		}

		splitOn(splitDim, leaf.mean[splitDim], random, maxSplitAttempts);
	}

	/**
	 * Partitions this leaf on the given dimension and value. If every point lands
	 * on one side, a random dimension and the coordinate of a random point in the
	 * leaf are tried instead, up to {@code maxSplitAttempts} times. If those run
	 * out, the leaf is cut just below its maximum on the first dimension where its
	 * points differ, which always separates a non-singular leaf.
	 *
	 * @throws SplitFailureException if even that cut leaves one side empty.
	 */
	void splitOn(int splitDim, double splitValue, Random random, int maxSplitAttempts) {
		Leaf<T> leaf = leaf();
		if (leaf.singular) {
			throw new IllegalStateException("Internal invariant violated: cannot split a singular leaf.");
		}
		List<KDPoint<T>> points = leaf.points;
		int dims = leaf.mean.length;

		List<KDPoint<T>> left = new ArrayList<>();
		List<KDPoint<T>> right = new ArrayList<>();
		partition(points, splitDim, splitValue, left, right);

		int attempts = 0;
		while ((left.isEmpty() || right.isEmpty()) && attempts < maxSplitAttempts) {
			attempts++;
			splitDim = random.nextInt(dims);
			splitValue = points.get(random.nextInt(points.size())).coords[splitDim];
			if (log.isTraceEnabled()) {
				log.trace("Degenerate partition, retry " + attempts + " on dimension " + splitDim + " at " + splitValue);
			}
			partition(points, splitDim, splitValue, left, right);
		}

		for (int d = 0; d < dims && (left.isEmpty() || right.isEmpty()); d++) {
			double max = bounds.getMax(d);
			if (bounds.getMin(d) == max) {
				continue;
			}
			double below = Double.NEGATIVE_INFINITY;
			for (KDPoint<T> p : points) {
				double v = p.coords[d];
				if (v < max && v > below) {
					below = v;
				}
			}
			if (log.isDebugEnabled()) {
				log.debug("Random retries exhausted after " + attempts + " attempts, cutting dimension " + d + " at " + below);
			}
			splitDim = d;
			splitValue = below;
			partition(points, splitDim, splitValue, left, right);
		}

		if (left.isEmpty() || right.isEmpty()) {
			throw new SplitFailureException(attempts, points.size());
		}

		KDNode<T> leftChild = new KDNode<>(bucketSize);
		KDNode<T> rightChild = new KDNode<>(bucketSize);
		leftChild.addAll(left, random, maxSplitAttempts);
		rightChild.addAll(right, random, maxSplitAttempts);

		if (log.isDebugEnabled()) {
			log.debug("Split leaf of " + points.size() + " points on dimension " + splitDim + " at " + splitValue + " (left "
					+ left.size() + ", right " + right.size() + ")");
		}

		// the leaf state is dropped here
		state = new Branch<>(splitDim, splitValue, leftChild, rightChild);
	}

	private static <T> void partition(List<KDPoint<T>> points, int splitDim, double splitValue, List<KDPoint<T>> left,
			List<KDPoint<T>> right) {
		left.clear();
		right.clear();
		for (KDPoint<T> p : points) {
			if (p.coords[splitDim] <= splitValue) {
				left.add(p);
			} else {
				right.add(p);
			}
		}
	}

	/* ===================== Node states ==================== */

	abstract static class State<T> {
		abstract NodeType type();
	}

	/**
	 * Leaf state: the bucket of points plus one-pass (Welford) statistics used to
	 * choose the split dimension.
	 */
	static final class Leaf<T> extends State<T> {
		final List<KDPoint<T>> points = new ArrayList<>();
		double[] mean;
		/** Running sum of squared deviations from the mean, per dimension. */
		double[] sumSqDev;
		/** True while every point has the coordinates of the first one. */
		boolean singular = true;

		@Override
		NodeType type() {
			return NodeType.LEAF;
		}

		void add(KDPoint<T> point) {
			points.add(point);
			int n = points.size();
			double[] coords = point.coords;
			if (n == 1) {
				mean = coords.clone();
				sumSqDev = new double[coords.length];
			} else {
				for (int d = 0; d < mean.length; d++) {
					double coord = coords[d];
					double oldMean = mean[d];
					double newMean = oldMean + (coord - oldMean) / n;
					mean[d] = newMean;
					sumSqDev[d] += (coord - oldMean) * (coord - newMean);
				}
			}

			if (singular && !point.sameCoords(points.get(0))) {
				singular = false;
			}
		}
	}

	/**
	 * Branch state. Points with {@code coords[splitDim] <= splitValue} live in
	 * {@code left}, all others in {@code right}.
	 */
	static final class Branch<T> extends State<T> {
		final int splitDim;
		final double splitValue;
		final KDNode<T> left;
		final KDNode<T> right;

		Branch(int splitDim, double splitValue, KDNode<T> left, KDNode<T> right) {
			this.splitDim = splitDim;
			this.splitValue = splitValue;
			this.left = left;
			this.right = right;
		}

		@Override
		NodeType type() {
			return NodeType.BRANCH;
		}

		KDNode<T> childFor(double[] coords) {
			return coords[splitDim] <= splitValue ? left : right;
		}
	}
}
