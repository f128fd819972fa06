package com.github.micycle1.fastkdtree;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;

public class BoundingBoxTest {

	@Test
	public void testExpandToInclude() {
		BoundingBox box = new BoundingBox(new double[] { 1, 1, 1 });
		box.expandToInclude(new double[] { 3, -2, 1 });
		box.expandToInclude(new double[] { 0, 0, 5 });

		assertEquals(0, box.getMin(0));
		assertEquals(3, box.getMax(0));
		assertEquals(-2, box.getMin(1));
		assertEquals(1, box.getMax(1));
		assertEquals(1, box.getMin(2));
		assertEquals(5, box.getMax(2));
		assertEquals(3, box.getDimensions());
	}

	@Test
	public void testMinDistanceSq() {
		BoundingBox box = new BoundingBox(new double[] { 0, 0 });
		box.expandToInclude(new double[] { 2, 2 });

		assertEquals(0, box.minDistanceSq(new double[] { 1, 1 }));
		assertEquals(0, box.minDistanceSq(new double[] { 2, 0 })); // on a face
		assertEquals(1, box.minDistanceSq(new double[] { 3, 1 }));
		assertEquals(4, box.minDistanceSq(new double[] { 1, -2 }));
		assertEquals(2, box.minDistanceSq(new double[] { -1, 3 })); // corner
	}

	@Test
	public void testContains() {
		BoundingBox outer = new BoundingBox(new double[] { 0, 0 });
		outer.expandToInclude(new double[] { 10, 10 });
		BoundingBox inner = new BoundingBox(new double[] { 2, 2 });
		inner.expandToInclude(new double[] { 5, 10 });

		assertTrue(outer.contains(inner));
		assertFalse(inner.contains(outer));
		assertTrue(outer.contains(new double[] { 10, 0 }));
		assertFalse(outer.contains(new double[] { 10.5, 0 }));
	}

	@Test
	public void testCopyIsIndependent() {
		BoundingBox box = new BoundingBox(new double[] { 0, 0 });
		BoundingBox copy = new BoundingBox(box);
		copy.expandToInclude(new double[] { 4, 4 });
		assertEquals(0, box.getMax(0));
		assertEquals(4, copy.getMax(0));
	}

	@Test
	public void testToEnvelope() {
		BoundingBox box = new BoundingBox(new double[] { 1, 2, 3 });
		box.expandToInclude(new double[] { 4, 6, -3 });
		assertEquals(new Envelope(1, 4, 2, 6), box.toEnvelope());

		BoundingBox line = new BoundingBox(new double[] { -1 });
		line.expandToInclude(new double[] { 7 });
		assertEquals(new Envelope(-1, 7, 0, 0), line.toEnvelope());
	}
}
