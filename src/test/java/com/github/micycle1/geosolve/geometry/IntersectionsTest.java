package com.github.micycle1.geosolve.geometry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

public class IntersectionsTest {

	private static final double EPS = 1e-9;
	private static final double TOL = 1e-6;

	@Test
	public void testCircleCircleTwoPoints() {
		List<Vector> pts = Intersections.intersect(new Circle(Vector.ZERO, 5), new Circle(new Vector(5, 0), 5), EPS);
		assertEquals(2, pts.size());
		double h = Math.sqrt(25 - 6.25);
		// +perp side first
		assertTrue(pts.get(0).aboutEquals(new Vector(2.5, h), TOL), pts.toString());
		assertTrue(pts.get(1).aboutEquals(new Vector(2.5, -h), TOL), pts.toString());
	}

	@Test
	public void testCircleCircleTangent() {
		List<Vector> pts = Intersections.intersect(new Circle(Vector.ZERO, 1), new Circle(new Vector(2, 0), 1), EPS);
		assertEquals(1, pts.size());
		assertTrue(pts.get(0).aboutEquals(new Vector(1, 0), TOL));
	}

	@Test
	public void testCircleCircleSeparatedAndNested() {
		assertTrue(Intersections.intersect(new Circle(Vector.ZERO, 1), new Circle(new Vector(5, 0), 1), EPS).isEmpty());
		assertTrue(Intersections.intersect(new Circle(Vector.ZERO, 5), new Circle(new Vector(1, 0), 1), EPS).isEmpty());
	}

	@Test
	public void testConcentricCirclesAreEmptyNotDegenerate() {
		assertTrue(Intersections.intersect(new Circle(Vector.ZERO, 5), new Circle(Vector.ZERO, 3), EPS).isEmpty());
	}

	@Test
	public void testIdenticalCirclesAreDegenerate() {
		assertThrows(DegenerateGeometryException.class,
				() -> Intersections.intersect(new Circle(new Vector(1, 1), 2), new Circle(new Vector(1, 1), 2), EPS));
	}

	@Test
	public void testCircleRay() {
		Circle c = new Circle(Vector.ZERO, 1);
		List<Vector> through = Intersections.intersect(c, Line.ray(new Vector(-2, 0), Vector.POSX), EPS);
		assertEquals(2, through.size());
		assertTrue(through.get(0).aboutEquals(new Vector(1, 0), TOL));
		assertTrue(through.get(1).aboutEquals(new Vector(-1, 0), TOL));

		// ray starting at the centre only leaves through one side
		List<Vector> inside = Intersections.intersect(Line.ray(Vector.ZERO, Vector.POSX), c, EPS);
		assertEquals(1, inside.size());
		assertTrue(inside.get(0).aboutEquals(new Vector(1, 0), TOL));

		// pointing away
		assertTrue(Intersections.intersect(c, Line.ray(new Vector(2, 0), Vector.POSX), EPS).isEmpty());
	}

	@Test
	public void testCircleLineTangent() {
		List<Vector> pts = Intersections.intersect(new Circle(Vector.ZERO, 1), Line.through(new Vector(0, 1), Vector.POSX), EPS);
		assertEquals(1, pts.size());
		assertTrue(pts.get(0).aboutEquals(new Vector(0, 1), TOL));
	}

	@Test
	public void testLineLine() {
		List<Vector> pts = Intersections.intersect(Line.through(Vector.ZERO, new Vector(1, 1)), Line.through(new Vector(0, 2), new Vector(1, -1)), EPS);
		assertEquals(1, pts.size());
		assertTrue(pts.get(0).aboutEquals(new Vector(1, 1), TOL));
	}

	@Test
	public void testRaysCrossingBehindStart() {
		// the lines meet at (0, 0), behind the second ray's origin
		List<Vector> pts = Intersections.intersect(Line.ray(Vector.ZERO, new Vector(1, 1)), Line.ray(new Vector(2, 0), Vector.POSX), EPS);
		assertTrue(pts.isEmpty());
	}

	@Test
	public void testParallelLines() {
		assertTrue(Intersections.intersect(Line.through(Vector.ZERO, Vector.POSX), Line.through(Vector.POSY, Vector.POSX), EPS).isEmpty());
		assertThrows(DegenerateGeometryException.class,
				() -> Intersections.intersect(Line.through(Vector.ZERO, Vector.POSX), Line.through(new Vector(3, 0), Vector.POSX.negate()), EPS));
	}

	@Test
	public void testCollinearRays() {
		// same direction: overlap
		assertThrows(DegenerateGeometryException.class,
				() -> Intersections.intersect(Line.ray(Vector.ZERO, Vector.POSX), Line.ray(new Vector(1, 0), Vector.POSX), EPS));
		// facing each other: overlap on a segment
		assertThrows(DegenerateGeometryException.class,
				() -> Intersections.intersect(Line.ray(Vector.ZERO, Vector.POSX), Line.ray(new Vector(1, 0), Vector.POSX.negate()), EPS));
		// back to back
		assertTrue(Intersections.intersect(Line.ray(Vector.ZERO, Vector.POSX), Line.ray(new Vector(-1, 0), Vector.POSX.negate()), EPS).isEmpty());
		// back to back from one shared origin
		List<Vector> pts = Intersections.intersect(Line.ray(Vector.ZERO, Vector.POSX), Line.ray(Vector.ZERO, Vector.POSX.negate()), EPS);
		assertEquals(List.of(Vector.ZERO), pts);
	}

	@Test
	public void testThreeCirclesShareOnePoint() {
		Vector target = new Vector(3, 4);
		List<PossibilitySpace> spaces = List.of(curve(Vector.ZERO, 5), curve(new Vector(6, 0), 5), curve(new Vector(3, 8), 4));
		List<Vector> pts = Intersections.intersect(spaces, EPS, TOL);
		assertEquals(1, pts.size());
		assertTrue(pts.get(0).aboutEquals(target, TOL));
	}

	@Test
	public void testRegionFiltersCandidates() {
		List<PossibilitySpace> spaces = List.of(curve(Vector.ZERO, 5), curve(new Vector(6, 0), 5),
				PossibilitySpace.region(new HalfPlane(Vector.ZERO, new Vector(6, 0), false)));
		List<Vector> pts = Intersections.intersect(spaces, EPS, TOL);
		assertEquals(1, pts.size());
		assertTrue(pts.get(0).aboutEquals(new Vector(3, -4), TOL));
	}

	@Test
	public void testCoincidentPairIsSkippedWhenAnotherPairIsFinite() {
		List<PossibilitySpace> spaces = List.of(curve(Vector.ZERO, 5), curve(Vector.ZERO, 5), curve(new Vector(6, 0), 5));
		assertEquals(2, Intersections.intersect(spaces, EPS, TOL).size());
	}

	@Test
	public void testInfiniteIntersectionsAreDegenerate() {
		assertThrows(DegenerateGeometryException.class, () -> Intersections.intersect(List.of(curve(Vector.ZERO, 5)), EPS, TOL));
		assertThrows(DegenerateGeometryException.class,
				() -> Intersections.intersect(List.of(curve(Vector.ZERO, 5), curve(Vector.ZERO, 5)), EPS, TOL));
		assertThrows(DegenerateGeometryException.class,
				() -> Intersections.intersect(List.of(PossibilitySpace.region(new Disk(Vector.ZERO, 1))), EPS, TOL));
	}

	@Test
	public void testPointSetIsFilteredByCurves() {
		PossibilitySpace pts = PossibilitySpace.points(List.of(new Vector(5, 0), new Vector(1, 1)));
		List<Vector> out = Intersections.intersect(List.of(curve(Vector.ZERO, 5), pts), EPS, TOL);
		assertEquals(List.of(new Vector(5, 0)), out);
	}

	private static PossibilitySpace curve(Vector c, double r) {
		return PossibilitySpace.curve(new Circle(c, r));
	}
}
