package com.github.micycle1.fastkdtree;

import java.util.ArrayList;
import java.util.List;

/**
 * A list of at most {@code capacity} candidates kept in ascending order of
 * distance. Used by the k-NN search to hold the best points found so far; once
 * full, the last (worst) candidate is the pruning radius.
 * <p>
 * Candidates with equal distances keep their offer order reversed: a new
 * candidate is placed before the first existing candidate whose distance is
 * greater than or equal to its own.
 *
 * @param <T> the type of object held.
 */
public class BoundedCandidateList<T> {

	private final int capacity;
	private final List<Candidate<T>> candidates;

	/**
	 * @param capacity the maximum number of candidates retained (k); zero is
	 *                 allowed and retains nothing.
	 */
	public BoundedCandidateList(int capacity) {
		if (capacity < 0) {
			throw new IllegalArgumentException("Capacity must not be negative: " + capacity);
		}
		this.capacity = capacity;
		this.candidates = new ArrayList<>(Math.min(capacity, 64) + 1);
	}

	/**
	 * Offers an object at the given distance. The object is inserted at its sorted
	 * position; if that pushes the list over capacity the largest-distance
	 * candidates are dropped.
	 *
	 * @param obj      the object.
	 * @param distance its (squared) distance from the query.
	 */
	public void offer(T obj, double distance) {
		boolean inserted = false;
		for (int i = 0; i < candidates.size(); i++) {
			if (distance <= candidates.get(i).distance) {
				candidates.add(i, new Candidate<>(obj, distance));
				inserted = true;
				break;
			}
		}

		if (!inserted && candidates.size() < capacity) {
			candidates.add(new Candidate<>(obj, distance));
		}

		while (candidates.size() > capacity) {
			candidates.remove(candidates.size() - 1);
		}
	}

	/**
	 * @return the object with the largest distance, or null if the list is empty.
	 */
	public T worst() {
		return candidates.isEmpty() ? null : candidates.get(candidates.size() - 1).obj;
	}

	/**
	 * @return the largest distance held, or {@link Double#POSITIVE_INFINITY} if the
	 *         list is empty.
	 */
	public double worstDistance() {
		return candidates.isEmpty() ? Double.POSITIVE_INFINITY : candidates.get(candidates.size() - 1).distance;
	}

	/**
	 * @return the object with the smallest distance, or null if the list is empty.
	 */
	public T first() {
		return candidates.isEmpty() ? null : candidates.get(0).obj;
	}

	public int size() {
		return candidates.size();
	}

	public int capacity() {
		return capacity;
	}

	public boolean isEmpty() {
		return candidates.isEmpty();
	}

	public boolean isFull() {
		return candidates.size() >= capacity;
	}

	/**
	 * @return the held objects, nearest first.
	 */
	public List<T> results() {
		List<T> result = new ArrayList<>(candidates.size());
		for (Candidate<T> c : candidates) {
			result.add(c.obj);
		}
		return result;
	}

	/**
	 * @return the held distances, ascending.
	 */
	public double[] distances() {
		double[] result = new double[candidates.size()];
		for (int i = 0; i < result.length; i++) {
			result[i] = candidates.get(i).distance;
		}
		return result;
	}

	private static class Candidate<T> {
		final T obj;
		final double distance;

		Candidate(T obj, double distance) {
			this.obj = obj;
			this.distance = distance;
		}

		@Override
		public String toString() {
			return "Candidate[" + obj + ", " + distance + "]";
		}
	}
}
