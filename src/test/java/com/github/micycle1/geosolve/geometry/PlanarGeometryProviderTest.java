package com.github.micycle1.geosolve.geometry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.github.micycle1.geosolve.geometry.PossibilitySpace.Dimension;
import com.github.micycle1.geosolve.graph.ConstraintGraph;
import com.github.micycle1.geosolve.graph.Figure;

public class PlanarGeometryProviderTest {

	private static final double TOL = 1e-6;

	private final PlanarGeometryProvider provider = new PlanarGeometryProvider(1e-9, TOL);
	private Figure figure;
	private int a, b, c, d;

	@BeforeEach
	void setUp() {
		figure = new Figure();
		a = figure.addOrigin(0, 0);
		b = figure.addOrigin(4, 0);
		c = figure.addPoint();
		d = figure.addPoint();
	}

	@Test
	public void testDimensions() {
		figure.addConstraint(PlanarKind.DISTANCE, 5, a, c);
		figure.addConstraint(PlanarKind.ANGLE, Math.PI / 2, a, b, c);
		figure.addConstraint(PlanarKind.SIDE, 1, a, b, c);
		figure.addConstraint(PlanarKind.WITHIN, 2, c, d);
		ConstraintGraph g = figure.toGraph();

		assertEquals(Dimension.CURVE, provider.dimension(g.constraint(0), c));
		assertEquals(Dimension.CURVE, provider.dimension(g.constraint(1), c));
		assertNull(provider.dimension(g.constraint(1), b), "vertex of an angle cannot be placed");
		assertEquals(Dimension.REGION, provider.dimension(g.constraint(2), c));
		assertNull(provider.dimension(g.constraint(2), a));
		assertEquals(Dimension.REGION, provider.dimension(g.constraint(3), d));
		assertNull(provider.dimension(g.constraint(0), d), "not referenced");
	}

	@Test
	public void testDuplicateDistancesCoincide() {
		figure.addConstraint(PlanarKind.DISTANCE, 5, a, c);
		figure.addConstraint(PlanarKind.DISTANCE, 5, c, a);
		figure.addConstraint(PlanarKind.DISTANCE, 3, a, c);
		figure.addConstraint(PlanarKind.DISTANCE, 5, b, c);
		ConstraintGraph g = figure.toGraph();

		assertTrue(provider.coincident(g.constraint(0), g.constraint(1), c));
		assertFalse(provider.coincident(g.constraint(0), g.constraint(2), c), "concentric circles are empty, not degenerate");
		assertFalse(provider.coincident(g.constraint(0), g.constraint(3), c));
	}

	@Test
	public void testOppositeOrientationsDescribeOneRay() {
		figure.addConstraint(PlanarKind.ORIENTATION, 0.3, a, c);
		figure.addConstraint(PlanarKind.ORIENTATION, 0.3 + Math.PI, c, a);
		figure.addConstraint(PlanarKind.ORIENTATION, 0.3 + Math.PI, a, c);
		ConstraintGraph g = figure.toGraph();

		assertTrue(provider.coincident(g.constraint(0), g.constraint(1), c));
		assertFalse(provider.coincident(g.constraint(0), g.constraint(2), c));
	}

	@Test
	public void testCollinearAndParallelCoincidence() {
		figure.addConstraint(PlanarKind.COLLINEAR, 0, a, b, c);
		figure.addConstraint(PlanarKind.COLLINEAR, 0, c, b, a);
		figure.addConstraint(PlanarKind.PARALLEL, 0, a, b, d, c);
		figure.addConstraint(PlanarKind.PARALLEL, 0, b, a, c, d);
		ConstraintGraph g = figure.toGraph();

		assertTrue(provider.coincident(g.constraint(0), g.constraint(1), c));
		assertTrue(provider.coincident(g.constraint(2), g.constraint(3), c));
		assertFalse(provider.coincident(g.constraint(0), g.constraint(2), c), "different kinds");
	}

	@Test
	public void testLoci() {
		figure.addConstraint(PlanarKind.ORIENTATION, Math.PI / 2, a, c);
		figure.addConstraint(PlanarKind.ANGLE, Math.PI / 2, b, a, c);
		figure.addConstraint(PlanarKind.PARALLEL, 0, a, b, c, d);
		ConstraintGraph g = figure.toGraph();
		Vector[] pos = { new Vector(0, 0), new Vector(4, 0), null, new Vector(1, 3) };

		Curve up = provider.possibilitySpace(g.constraint(0), c, pos).curve();
		assertTrue(up.contains(new Vector(0, 7), TOL));
		assertFalse(up.contains(new Vector(0, -7), TOL), "ray, not a line");

		// (b - a) rotated by 90 degrees from a points up
		Curve arm = provider.possibilitySpace(g.constraint(1), c, pos).curve();
		assertTrue(arm.contains(new Vector(0, 2), TOL));

		// through d, along a->b
		Curve parallel = provider.possibilitySpace(g.constraint(2), c, pos).curve();
		assertTrue(parallel.contains(new Vector(-10, 3), TOL));
		assertFalse(parallel.contains(new Vector(1, 0), TOL));
	}

	@Test
	public void testUndefinedLocusIsDegenerate() {
		figure.addConstraint(PlanarKind.COLLINEAR, 0, a, d, c);
		ConstraintGraph g = figure.toGraph();
		Vector[] pos = { new Vector(0, 0), new Vector(4, 0), null, new Vector(0, 0) };
		assertThrows(DegenerateGeometryException.class, () -> provider.possibilitySpace(g.constraint(0), c, pos));
	}

	@Test
	public void testInsideHull() {
		int e = figure.addOrigin(0, 4);
		figure.addConstraint(PlanarKind.INSIDE, 0, a, b, e, c);
		ConstraintGraph g = figure.toGraph();
		Vector[] pos = { new Vector(0, 0), new Vector(4, 0), null, null, new Vector(0, 4) };

		Region hull = provider.possibilitySpace(g.constraint(0), c, pos).region();
		assertTrue(hull.contains(new Vector(1, 1), TOL));
		assertTrue(hull.contains(new Vector(2, 0), TOL), "boundary counts as inside");
		assertFalse(hull.contains(new Vector(3, 3), TOL));
		assertFalse(hull.contains(new Vector(-1, 1), TOL));
	}

	@Test
	public void testValidate() {
		figure.addConstraint(PlanarKind.DISTANCE, -1, a, c);
		figure.addConstraint(PlanarKind.SIDE, 0, a, b, c);
		figure.addConstraint(PlanarKind.DISTANCE, Double.NaN, a, c);
		figure.addConstraint(PlanarKind.WITHIN, 0, a, c);
		ConstraintGraph g = figure.toGraph();
		assertThrows(IllegalArgumentException.class, () -> provider.validate(g.constraint(0)));
		assertThrows(IllegalArgumentException.class, () -> provider.validate(g.constraint(1)));
		assertThrows(IllegalArgumentException.class, () -> provider.validate(g.constraint(2)));
		provider.validate(g.constraint(3));
	}

	@Test
	public void testIsSatisfied() {
		figure.addConstraint(PlanarKind.DISTANCE, 5, a, c);
		figure.addConstraint(PlanarKind.SIDE, -1, a, b, c);
		figure.addConstraint(PlanarKind.ANGLE, -Math.PI / 2, b, a, c);
		ConstraintGraph g = figure.toGraph();
		Vector[] pos = { new Vector(0, 0), new Vector(4, 0), new Vector(0, -5), new Vector(9, 9) };
		assertTrue(provider.isSatisfied(g.constraint(0), pos));
		assertTrue(provider.isSatisfied(g.constraint(1), pos));
		assertTrue(provider.isSatisfied(g.constraint(2), pos));

		pos[2] = new Vector(3, 4);
		assertTrue(provider.isSatisfied(g.constraint(0), pos));
		assertFalse(provider.isSatisfied(g.constraint(1), pos));
		assertFalse(provider.isSatisfied(g.constraint(2), pos));
	}
}
