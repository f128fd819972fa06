package com.github.micycle1.fastkdtree;

/**
 * Thrown when a point or query vector does not have the dimensionality fixed by
 * the first point inserted into a tree.
 */
public class DimensionMismatchException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	private final int expected;
	private final int actual;

	public DimensionMismatchException(int expected, int actual) {
		super("Expected " + expected + " dimensions but got " + actual + ".");
		this.expected = expected;
		this.actual = actual;
	}

	public int getExpected() {
		return expected;
	}

	public int getActual() {
		return actual;
	}
}
