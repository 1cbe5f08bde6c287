package com.github.micycle1.geosolve.order;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.github.micycle1.geosolve.RandomFigures;
import com.github.micycle1.geosolve.geometry.PlanarGeometryProvider;
import com.github.micycle1.geosolve.geometry.PlanarKind;
import com.github.micycle1.geosolve.geometry.PossibilitySpace.Dimension;
import com.github.micycle1.geosolve.graph.Constraint;
import com.github.micycle1.geosolve.graph.ConstraintGraph;
import com.github.micycle1.geosolve.graph.Figure;

public class OrderPlannerTest {

	private final PlanarGeometryProvider provider = new PlanarGeometryProvider(1e-9, 1e-6);
	private final OrderPlanner planner = new OrderPlanner(provider);

	@Test
	public void testTriangleNeedsAnOrbiter() {
		ConstraintGraph g = triangle();
		assertNull(planner.explore(g, null), "one origin alone discretizes nothing");

		List<OrderPlan> plans = collect(g);
		assertEquals(1, plans.size());
		OrderPlan plan = plans.get(0);
		assertEquals(0, plan.root());
		assertEquals(1, plan.orbiter());
		assertEquals(0, plan.seedConstraint());
		// C is discrete from A and the provisional B; B then settles on A and C
		assertEquals(List.of(2, 1), plan.points());
		assertEquals(List.of(1, 2), plan.step(0).counted());
		assertEquals(List.of(0, 2), plan.step(1).counted());
		assertEquals(List.of(0, 2), plan.step(1).active());
	}

	@Test
	public void testRedundantPairIsSkipped() {
		ConstraintGraph g = triangle();
		List<OrderPlanner.Seed> seeds = planner.seeds(g);
		assertEquals(2, seeds.size());
		assertEquals(1, seeds.get(0).orbiter);
		assertEquals(2, seeds.get(1).orbiter);
		// (A, C) alone would give a plan too, but C was already discretized by (A, B)
		assertNotNull(planner.explore(g, seeds.get(1)));
		assertEquals(1, collect(g).size());
	}

	@Test
	public void testTwoOriginsNeedNoOrbiter() {
		Figure f = new Figure();
		int a = f.addOrigin(0, 0);
		int b = f.addOrigin(4, 0);
		int c = f.addPoint();
		f.addConstraint(PlanarKind.DISTANCE, 3, a, c);
		f.addConstraint(PlanarKind.DISTANCE, 3, b, c);
		f.addConstraint(PlanarKind.SIDE, 1, a, b, c);

		OrderPlan plan = planner.plans(f.toGraph()).iterator().next();
		assertFalse(plan.hasOrbiter());
		assertEquals(-1, plan.orbiter());
		assertEquals(List.of(c), plan.points());
		assertEquals(List.of(0, 1), plan.step(0).counted());
		assertEquals(List.of(0, 1, 2), plan.step(0).active(), "areal filters are active but never counted");
	}

	@Test
	public void testVertexAngleIsCheckedNotActive() {
		Figure f = new Figure();
		int a = f.addOrigin(0, 0);
		int b = f.addOrigin(10, 0);
		int c = f.addPoint();
		f.addConstraint(PlanarKind.DISTANCE, 6, a, c);
		f.addConstraint(PlanarKind.DISTANCE, 8, b, c);
		f.addConstraint(PlanarKind.ANGLE, -Math.PI / 2, a, c, b);

		OrderPlan plan = planner.plans(f.toGraph()).iterator().next();
		assertEquals(List.of(0, 1), plan.step(0).active());
		assertEquals(List.of(2), plan.step(0).checked());
	}

	@Test
	public void testStopIsPolledBeforeEachExploration() {
		AtomicInteger polls = new AtomicInteger();
		// seedless closure runs, the first pair is never explored
		Iterator<OrderPlan> plans = planner.plans(triangle(), () -> polls.incrementAndGet() > 1).iterator();
		assertFalse(plans.hasNext());
		assertEquals(2, polls.get());

		assertFalse(planner.plans(triangle(), () -> true).iterator().hasNext());
	}

	@Test
	public void testUnderConstrainedPointFailsOrdering() {
		Figure f = new Figure();
		int a = f.addOrigin(0, 0);
		int b = f.addPoint();
		f.addConstraint(PlanarKind.DISTANCE, 5, a, b);
		assertFalse(planner.plans(f.toGraph()).iterator().hasNext());
	}

	@Test
	public void testArealConstraintsNeverDiscretize() {
		Figure f = new Figure();
		int a = f.addOrigin(0, 0);
		int b = f.addOrigin(4, 0);
		int c = f.addPoint();
		f.addConstraint(PlanarKind.DISTANCE, 3, a, c);
		f.addConstraint(PlanarKind.WITHIN, 3, b, c);
		f.addConstraint(PlanarKind.SIDE, -1, a, b, c);
		assertFalse(planner.plans(f.toGraph()).iterator().hasNext());
	}

	@Test
	public void testCoincidentConstraintsCountOnce() {
		Figure same = new Figure();
		int a = same.addOrigin(0, 0);
		int b = same.addPoint();
		same.addConstraint(PlanarKind.DISTANCE, 5, a, b);
		same.addConstraint(PlanarKind.DISTANCE, 5, b, a);
		assertFalse(planner.plans(same.toGraph()).iterator().hasNext());

		// different radii are not coincident: the point is (inconsistently) discrete
		Figure concentric = new Figure();
		a = concentric.addOrigin(0, 0);
		b = concentric.addPoint();
		concentric.addConstraint(PlanarKind.DISTANCE, 5, a, b);
		concentric.addConstraint(PlanarKind.DISTANCE, 3, a, b);
		OrderPlan plan = planner.plans(concentric.toGraph()).iterator().next();
		assertEquals(List.of(b), plan.points());
		assertFalse(plan.hasOrbiter());
	}

	@Test
	public void testIterationRestarts() {
		ConstraintGraph g = RandomFigures.henneberg(7, 8, 2).toGraph();
		Iterable<OrderPlan> plans = planner.plans(g);
		List<String> first = new ArrayList<>();
		plans.forEach(p -> first.add(p.toString()));
		List<String> second = new ArrayList<>();
		plans.forEach(p -> second.add(p.toString()));
		assertFalse(first.isEmpty());
		assertEquals(first, second);
	}

	@ParameterizedTest
	@ValueSource(longs = { 1, 2, 3, 42, 1337 })
	void testPlansCoverEveryUnknownPointOnce(long seed) {
		ConstraintGraph g = RandomFigures.henneberg(seed, 10, 4).toGraph();
		int count = 0;
		for (OrderPlan plan : planner.plans(g)) {
			checkPlan(g, plan);
			count++;
		}
		assertTrue(count > 0);
	}

	// every unknown point exactly once, each on two non-coincident 1D constraints
	// whose other points were known when it was reached
	private void checkPlan(ConstraintGraph g, OrderPlan plan) {
		BitSet settled = g.originSet();
		assertEquals(g.getUnknownCount(), plan.size());
		for (OrderPlan.Step step : plan.steps()) {
			int p = step.point();
			assertFalse(settled.get(p), "P" + p + " visited twice");
			assertEquals(2, step.counted().size());
			Constraint c0 = g.constraint(step.counted().get(0));
			Constraint c1 = g.constraint(step.counted().get(1));
			assertFalse(provider.coincident(c0, c1, p));
			BitSet known = (BitSet) settled.clone();
			if (plan.hasOrbiter() && p != plan.orbiter()) {
				known.set(plan.orbiter());
			}
			for (int c : step.counted()) {
				assertEquals(Dimension.CURVE, provider.dimension(g.constraint(c), p));
				assertTrue(g.othersKnown(c, p, known), "C" + c + " counted for P" + p + " too early");
				assertTrue(step.active().contains(c));
			}
			settled.set(p);
		}
		assertEquals(g.getPointCount(), settled.cardinality());
	}

	private static ConstraintGraph triangle() {
		Figure f = new Figure();
		int a = f.addOrigin(0, 0);
		int b = f.addPoint();
		int c = f.addPoint();
		f.addConstraint(PlanarKind.DISTANCE, 5, a, b);
		f.addConstraint(PlanarKind.DISTANCE, 5, a, c);
		f.addConstraint(PlanarKind.DISTANCE, 5, b, c);
		return f.toGraph();
	}

	private List<OrderPlan> collect(ConstraintGraph g) {
		List<OrderPlan> out = new ArrayList<>();
		planner.plans(g).forEach(out::add);
		return out;
	}
}
