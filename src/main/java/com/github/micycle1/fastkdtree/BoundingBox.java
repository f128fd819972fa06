package com.github.micycle1.fastkdtree;

import org.locationtech.jts.geom.Envelope;

/**
 * Axis-aligned bounding box over an arbitrary number of dimensions. Like a JTS
 * {@link Envelope}, it only ever grows: {@link #expandToInclude(double[])}
 * widens it and nothing shrinks it.
 */
public class BoundingBox {

	final double[] min;
	final double[] max;

	/**
	 * Creates a degenerate box containing exactly the given point.
	 */
	public BoundingBox(double[] point) {
		this.min = point.clone();
		this.max = point.clone();
	}

	/**
	 * Copy constructor.
	 */
	public BoundingBox(BoundingBox other) {
		this.min = other.min.clone();
		this.max = other.max.clone();
	}

	public int getDimensions() {
		return min.length;
	}

	public double getMin(int dimension) {
		return min[dimension];
	}

	public double getMax(int dimension) {
		return max[dimension];
	}

	/**
	 * Enlarges this box so that it contains the given point.
	 */
	public void expandToInclude(double[] point) {
		for (int d = 0; d < min.length; d++) {
			double v = point[d];
			if (v > max[d]) {
				max[d] = v;
			}
			if (v < min[d]) {
				min[d] = v;
			}
		}
	}

	public boolean contains(double[] point) {
		for (int d = 0; d < min.length; d++) {
			if (point[d] < min[d] || point[d] > max[d]) {
				return false;
			}
		}
		return true;
	}

	public boolean contains(BoundingBox other) {
		return contains(other.min) && contains(other.max);
	}

	/**
	 * Smallest squared Euclidean distance from a point to any point of this box.
	 * Zero when the point lies inside the box.
	 */
	public double minDistanceSq(double[] point) {
		double distSq = 0.0;
		for (int d = 0; d < min.length; d++) {
			double v = point[d];
			if (v < min[d]) {
				double delta = min[d] - v;
				distSq += delta * delta;
			} else if (v > max[d]) {
				double delta = v - max[d];
				distSq += delta * delta;
			}
		}
		return distSq;
	}

	/**
	 * Projects this box onto its first two dimensions. A one-dimensional box maps
	 * to an envelope of zero height at y = 0.
	 */
	public Envelope toEnvelope() {
		if (min.length == 0) {
			return new Envelope();
		}
		double minY = min.length > 1 ? min[1] : 0;
		double maxY = max.length > 1 ? max[1] : 0;
		return new Envelope(min[0], max[0], minY, maxY);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("BoundingBox[");
		for (int d = 0; d < min.length; d++) {
			if (d > 0) {
				sb.append(", ");
			}
			sb.append(min[d]).append(':').append(max[d]);
		}
		return sb.append(']').toString();
	}
}
