package com.github.micycle1.fastkdtree;

import org.locationtech.jts.geom.Coordinate;

import java.util.Arrays;
import java.util.Objects;

/**
 * A point stored in a {@link FastKDTree}: an opaque item together with the
 * coordinate vector it is indexed by.
 *
 * @param <T> the type of the item.
 */
public final class KDPoint<T> {

	final T item; // may be null
	final double[] coords;

	/**
	 * Creates a point. The coordinate array is copied.
	 *
	 * @param item   the item to store (may be null).
	 * @param coords the coordinates of the item; must not contain NaN.
	 */
	public KDPoint(T item, double... coords) {
		Objects.requireNonNull(coords, "coords");
		for (int d = 0; d < coords.length; d++) {
			if (Double.isNaN(coords[d])) {
				throw new IllegalArgumentException("Coordinate " + d + " is NaN.");
			}
		}
		this.item = item;
		this.coords = coords.clone();
	}

	/**
	 * Creates a two-dimensional point (x, y) from a JTS coordinate. The z ordinate
	 * is ignored.
	 */
	public KDPoint(T item, Coordinate coordinate) {
		this(item, coordinate.x, coordinate.y);
	}

	public T getItem() {
		return item;
	}

	/**
	 * @return a copy of the coordinate vector.
	 */
	public double[] getCoords() {
		return coords.clone();
	}

	public double getCoord(int dimension) {
		return coords[dimension];
	}

	public int getDimensions() {
		return coords.length;
	}

	/**
	 * Componentwise equality of coordinates (0.0 and -0.0 are equal).
	 */
	boolean sameCoords(KDPoint<?> other) {
		double[] o = other.coords;
		if (o.length != coords.length) {
			return false;
		}
		for (int d = 0; d < coords.length; d++) {
			if (coords[d] != o[d]) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Points are immutable, so a point of a subtype can stand in for its supertype.
	 */
	@SuppressWarnings("unchecked")
	static <T> KDPoint<T> widen(KDPoint<? extends T> point) {
		return (KDPoint<T>) point;
	}

	/**
	 * Squared Euclidean distance between two coordinate vectors of equal length.
	 */
	static double distanceSq(double[] a, double[] b) {
		double sumSq = 0.0;
		for (int d = 0; d < a.length; d++) {
			double delta = a[d] - b[d];
			if (delta != 0) {
				sumSq += delta * delta;
			}
		}
		return sumSq;
	}

	@Override
	public String toString() {
		return "KDPoint[" + item + " @ " + Arrays.toString(coords) + "]";
	}
}
