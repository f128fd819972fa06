package com.github.micycle1.fastkdtree;

/**
 * Thrown when a non-singular leaf could not be partitioned into two non-empty
 * halves, neither by its randomized attempts nor by the cut below its maximum.
 * This means the leaf's bounds or singularity flag are wrong. The leaf is left
 * unsplit.
 */
public class SplitFailureException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	public SplitFailureException(int attempts, int points) {
		super("Could not split a leaf of " + points + " points after " + attempts + " randomized attempts and a bounds cut.");
	}
}
