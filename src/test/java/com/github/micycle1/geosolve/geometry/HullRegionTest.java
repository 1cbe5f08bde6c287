package com.github.micycle1.geosolve.geometry;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

public class HullRegionTest {

	private static final double TOL = 1e-6;

	@Test
	public void testSquareWithInteriorPoint() {
		// clockwise input, interior point is not a hull corner
		HullRegion hull = new HullRegion(List.of(new Vector(0, 0), new Vector(0, 4), new Vector(2, 2), new Vector(4, 4), new Vector(4, 0)));

		assertTrue(hull.contains(new Vector(1, 3), TOL));
		assertTrue(hull.contains(new Vector(2, 2), TOL));
		assertTrue(hull.contains(new Vector(4, 2), TOL), "boundary counts as inside");
		assertTrue(hull.contains(new Vector(4 + TOL / 2, 2), TOL));
		assertTrue(hull.contains(new Vector(0, 0), TOL));

		assertFalse(hull.contains(new Vector(5, 2), TOL));
		assertFalse(hull.contains(new Vector(-0.1, 2), TOL));
		assertFalse(hull.contains(new Vector(2, 4.1), TOL));
	}

	@Test
	public void testTriangleSlantedEdge() {
		HullRegion hull = new HullRegion(List.of(new Vector(0, 0), new Vector(4, 0), new Vector(0, 4)));
		assertTrue(hull.contains(new Vector(2, 2), TOL));
		assertFalse(hull.contains(new Vector(2.1, 2.1), TOL));
	}

	@Test
	public void testCollinearPointsAreDegenerate() {
		assertThrows(DegenerateGeometryException.class, () -> new HullRegion(List.of(new Vector(0, 0), new Vector(1, 1), new Vector(3, 3))));
	}

	@Test
	public void testTooFewPoints() {
		assertThrows(IllegalArgumentException.class, () -> new HullRegion(List.of(new Vector(0, 0), new Vector(1, 0))));
	}

}
