package com.github.micycle1.fastkdtree;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.Random;

/**
 * An incrementally built k-d tree over points of a fixed dimensionality, with
 * exact k-nearest-neighbour search under (squared) Euclidean distance.
 * <p>
 * Points are added to leaf buckets. When a bucket holds more than
 * {@code bucketSize} points it is split on the dimension of greatest variance,
 * at the mean of that dimension. Buckets whose points all share the same
 * coordinates never split. Each node tracks the bounding box of its subtree,
 * which the search uses to skip subtrees that cannot hold a closer point.
 * <p>
 * The first point inserted fixes the dimensionality of the tree; points and
 * queries of any other length are rejected with a
 * {@link DimensionMismatchException}.
 * <p>
 * This class is not thread-safe. Concurrent queries are safe only while no
 * insertion is running.
 *
 * @param <T> the type of item stored in the tree.
 * @author Michael Carleton
 */
public class FastKDTree<T> {

	private static final Logger log = LoggerFactory.getLogger(FastKDTree.class);

	static final int DEFAULT_BUCKET_SIZE = 10;
	static final int DEFAULT_MAX_SPLIT_ATTEMPTS = 1000;

	final KDNode<T> root;
	private final int bucketSize;
	private final int maxSplitAttempts;
	private final Random random;
	private int dimensions = 0;
	private int size = 0;

	/**
	 * Creates a tree with the default bucket size of 10.
	 */
	public FastKDTree() {
		this(DEFAULT_BUCKET_SIZE);
	}

	public FastKDTree(int bucketSize) {
		this(bucketSize, new Random());
	}

	/**
	 * @param bucketSize the number of points a leaf may hold before it is split.
	 * @param random     source of randomness for the fallback split strategy; pass
	 *                   a seeded instance for reproducible trees.
	 */
	public FastKDTree(int bucketSize, Random random) {
		this(bucketSize, DEFAULT_MAX_SPLIT_ATTEMPTS, random);
	}

	FastKDTree(int bucketSize, int maxSplitAttempts, Random random) {
		if (bucketSize < 1) {
			throw new IllegalArgumentException("Unexpected bucketSize value: " + bucketSize);
		}
		if (maxSplitAttempts < 1) {
			throw new IllegalArgumentException("Unexpected maxSplitAttempts value: " + maxSplitAttempts);
		}
		this.bucketSize = bucketSize;
		this.maxSplitAttempts = maxSplitAttempts;
		this.random = Objects.requireNonNull(random, "random");
		this.root = new KDNode<>(bucketSize);
	}

	/**
	 * Creates a tree configured from properties. Recognised properties are:
	 * <ul>
	 * <li>BucketSize: the number of points a leaf may hold before it is split.
	 * Defaults to 10, which is also used if the value is less than 1.</li>
	 * <li>MaxSplitAttempts: how many random split attempts are made for a leaf
	 * whose variance-based split puts every point on one side. Defaults to
	 * 1000, which is also used if the value is less than 1.</li>
	 * <li>Seed: seed for the random split attempts. Unseeded if absent.</li>
	 * </ul>
	 * A null argument selects all defaults.
	 */
	public FastKDTree(Properties props) {
		this(bucketSize(props), maxSplitAttempts(props), random(props));
		log.debug("init() BucketSize = " + bucketSize + ", MaxSplitAttempts = " + maxSplitAttempts);
	}

	private static int bucketSize(Properties props) {
		if (props == null) {
			return DEFAULT_BUCKET_SIZE;
		}
		int value = Integer.parseInt(props.getProperty("BucketSize", String.valueOf(DEFAULT_BUCKET_SIZE)).trim());
		if (value < 1) {
			log.warn("Invalid BucketSize = " + value + " Resetting to default value of " + DEFAULT_BUCKET_SIZE);
			value = DEFAULT_BUCKET_SIZE;
		}
		return value;
	}

	private static int maxSplitAttempts(Properties props) {
		if (props == null) {
			return DEFAULT_MAX_SPLIT_ATTEMPTS;
		}
		int value = Integer.parseInt(props.getProperty("MaxSplitAttempts", String.valueOf(DEFAULT_MAX_SPLIT_ATTEMPTS)).trim());
		if (value < 1) {
			log.warn("Invalid MaxSplitAttempts = " + value + " Resetting to default value of " + DEFAULT_MAX_SPLIT_ATTEMPTS);
			value = DEFAULT_MAX_SPLIT_ATTEMPTS;
		}
		return value;
	}

	private static Random random(Properties props) {
		String seed = props == null ? null : props.getProperty("Seed");
		return seed == null ? new Random() : new Random(Long.parseLong(seed.trim()));
	}

	/**
	 * Inserts an item at the given coordinates.
	 */
	public void insert(T item, double... coords) {
		insert(new KDPoint<>(item, coords));
	}

	/**
	 * Inserts an item at the (x, y) position of a JTS coordinate.
	 */
	public void insert(T item, Coordinate coordinate) {
		insert(new KDPoint<>(item, coordinate));
	}

	public void insert(KDPoint<? extends T> point) {
		insertAll(Collections.singletonList(point));
	}

	/**
	 * Inserts a batch of points. Leaves are only split after the whole batch has
	 * been placed. The batch is validated before anything is inserted, so an
	 * invalid point leaves the tree unchanged.
	 * <p>
	 * Splits of non-singular leaves always succeed. Should one still fail with a
	 * {@link SplitFailureException}, the batch stays in the tree, is counted by
	 * {@link #size()}, and the leaf is split again by the next insertion that
	 * reaches it.
	 *
	 * @throws DimensionMismatchException if a point's dimensionality differs from
	 *                                    the tree's (or, for an empty tree, from
	 *                                    the first point of the batch).
	 */
	public void insertAll(Collection<? extends KDPoint<? extends T>> points) {
		if (points.isEmpty()) {
			return;
		}
		int dims = dimensions;
		List<KDPoint<T>> batch = new ArrayList<>(points.size());
		for (KDPoint<? extends T> p : points) {
			Objects.requireNonNull(p, "point");
			if (dims == 0) {
				dims = p.getDimensions();
			} else if (p.getDimensions() != dims) {
				throw new DimensionMismatchException(dims, p.getDimensions());
			}
			batch.add(KDPoint.<T>widen(p));
		}
		if (dims == 0) {
			throw new IllegalArgumentException("Points must have at least one dimension.");
		}

		dimensions = dims;
		size += batch.size();
		root.addAll(batch, random, maxSplitAttempts);
	}

	/**
	 * Finds the k items nearest to the query point.
	 *
	 * @param query the query coordinates.
	 * @param k     the number of neighbours wanted; may be zero.
	 * @return at most k items, nearest first. Empty if the tree is empty.
	 */
	public List<T> knnSearch(double[] query, int k) {
		List<KDPoint<T>> points = nearestPoints(query, k);
		List<T> result = new ArrayList<>(points.size());
		for (KDPoint<T> p : points) {
			result.add(p.item);
		}
		return result;
	}

	/**
	 * Finds the k items nearest to the (x, y) position of a JTS coordinate.
	 */
	public List<T> knnSearch(Coordinate query, int k) {
		return knnSearch(new double[] { query.x, query.y }, k);
	}

	/**
	 * As {@link #knnSearch(double[], int)}, but returns the stored points.
	 */
	public List<KDPoint<T>> nearestPoints(double[] query, int k) {
		return search(query, k).results();
	}

	/**
	 * @return the item nearest to the query point, or null if the tree is empty.
	 */
	public T nearest(double... query) {
		List<T> result = knnSearch(query, 1);
		return result.isEmpty() ? null : result.get(0);
	}

	BoundedCandidateList<KDPoint<T>> search(double[] query, int k) {
		Objects.requireNonNull(query, "query");
		if (k < 0) {
			throw new IllegalArgumentException("k must not be negative: " + k);
		}
		if (isEmpty()) {
			return new BoundedCandidateList<>(k);
		}
		if (query.length != dimensions) {
			throw new DimensionMismatchException(dimensions, query.length);
		}
		for (int d = 0; d < query.length; d++) {
			if (Double.isNaN(query[d])) {
				throw new IllegalArgumentException("Query coordinate " + d + " is NaN.");
			}
		}
		return NearestNeighborSearch.search(root, query, k);
	}

	public boolean isEmpty() {
		return root.isEmpty();
	}

	/**
	 * @return the number of points inserted.
	 */
	public int size() {
		return size;
	}

	/**
	 * @return the dimensionality of the tree, or 0 if nothing has been inserted.
	 */
	public int dimensions() {
		return dimensions;
	}

	public int getBucketSize() {
		return bucketSize;
	}

	int getMaxSplitAttempts() {
		return maxSplitAttempts;
	}

	/**
	 * @return a copy of the bounding box of all points, or null if the tree is
	 *         empty.
	 */
	public BoundingBox getBounds() {
		return root.bounds == null ? null : new BoundingBox(root.bounds);
	}

	/**
	 * @return the bounds of the tree in its first two dimensions as a JTS envelope
	 *         (a null envelope if the tree is empty).
	 */
	public Envelope getEnvelope() {
		return root.bounds == null ? new Envelope() : root.bounds.toEnvelope();
	}
}
