package com.github.micycle1.geosolve.order;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Queue;
import java.util.function.BooleanSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.geosolve.geometry.GeometryProvider;
import com.github.micycle1.geosolve.geometry.PossibilitySpace.Dimension;
import com.github.micycle1.geosolve.graph.Constraint;
import com.github.micycle1.geosolve.graph.ConstraintGraph;

/**
 * <p>
 * Breadth-first search for orders in which every unknown point is discrete by
 * the time it is reached.
 * </p>
 *
 * <p>
 * What:
 * </p>
 * <ul>
 * <li>A point becomes discrete the moment two non-coincident constraints with
 * a 1D locus apply to it, using only points known at that moment. Areal (2D)
 * constraints never count; they are only recorded as filters.</li>
 * <li>Origins start known. The first candidate order uses nothing else (the
 * seedless closure).</li>
 * <li>Then each (root, orbiter) pair is explored: the orbiter is a non-origin
 * point one 1D constraint away from the root, treated as provisionally known so
 * its neighbours can become discrete. It settles like any other point, on two
 * counted constraints of its own.</li>
 * <li>A pair is skipped before exploring when its orbiter was already
 * discretized (not seeded) by an earlier plan: everything it can reach is then
 * reachable in that plan.</li>
 * <li>Explorations that leave a point unsettled are discarded.</li>
 * <li>A settled point's step lists the constraints it completes: those that
 * give it a locus as active, the rest (e.g. an angle at its vertex) as checks
 * on its candidates.</li>
 * </ul>
 *
 * <p>
 * Scan order is fully deterministic: the BFS visits the root, then the orbiter,
 * then the remaining origins by id, and each point's constraints by id. Ties in
 * which constraints count are broken by that discovery order.
 * </p>
 */
public class OrderPlanner {

	private static final Logger LOGGER = LoggerFactory.getLogger(OrderPlanner.class);

	private final GeometryProvider provider;

	public OrderPlanner(GeometryProvider provider) {
		this.provider = Objects.requireNonNull(provider, "provider must not be null");
	}

	/**
	 * Lazily enumerates complete plans, earlier (root, orbiter) pairs first. Each
	 * call to {@code iterator()} restarts the search from scratch.
	 */
	public Iterable<OrderPlan> plans(ConstraintGraph graph) {
		return plans(graph, () -> false);
	}

	/**
	 * As {@link #plans(ConstraintGraph)}, but {@code stop} is polled before each
	 * exploration; once it returns true the iterator reports no further plans.
	 */
	public Iterable<OrderPlan> plans(ConstraintGraph graph, BooleanSupplier stop) {
		Objects.requireNonNull(graph, "graph must not be null");
		Objects.requireNonNull(stop, "stop must not be null");
		warnUncheckable(graph);
		return () -> new PlanIterator(graph, stop);
	}

	/** Candidate (root, orbiter) pairs in exploration order. */
	List<Seed> seeds(ConstraintGraph graph) {
		BitSet origins = graph.originSet();
		List<Seed> seeds = new ArrayList<>();
		BitSet seenPairs = new BitSet();
		int n = graph.getPointCount();
		for (int root : graph.origins()) {
			for (int c : graph.constraintsOf(root)) {
				int orbiter = graph.target(c, origins);
				if (orbiter < 0 || provider.dimension(graph.constraint(c), orbiter) != Dimension.CURVE) {
					continue;
				}
				int key = root * n + orbiter;
				if (seenPairs.get(key)) {
					continue;
				}
				seenPairs.set(key);
				seeds.add(new Seed(root, orbiter, c));
			}
		}
		return seeds;
	}

	/**
	 * Runs the discretization closure from the origins, plus the orbiter when
	 * {@code seed} is non-null.
	 *
	 * @return the complete plan, or null if some point never became discrete
	 */
	OrderPlan explore(ConstraintGraph graph, Seed seed) {
		return new Exploration(graph, seed).run();
	}

	private void warnUncheckable(ConstraintGraph graph) {
		BitSet origins = graph.originSet();
		for (Constraint c : graph.constraints()) {
			boolean allOrigins = true;
			for (int p : c.points()) {
				allOrigins &= origins.get(p);
			}
			if (allOrigins) {
				LOGGER.warn("{} only references origins; it is never used to place a point", c);
			}
		}
	}

	/** A (root, orbiter) pair and the constraint linking them. */
	static final class Seed {
		final int root;
		final int orbiter;
		final int constraint;

		Seed(int root, int orbiter, int constraint) {
			this.root = root;
			this.orbiter = orbiter;
			this.constraint = constraint;
		}

		@Override
		public String toString() {
			return "(P" + root + ", P" + orbiter + " via C" + constraint + ")";
		}
	}

	private final class Exploration {

		private final ConstraintGraph graph;
		private final int orbiter;
		private final BitSet settled;
		private final BitSet known;
		private final List<List<Integer>> counted;
		// constraint already offered to its (non-orbiter) target
		private final boolean[] offered;
		// constraint already offered to the orbiter
		private final boolean[] offeredToOrbiter;
		private final Queue<Integer> queue = new ArrayDeque<>();
		private final List<OrderPlan.Step> steps = new ArrayList<>();
		private final Seed seed;

		Exploration(ConstraintGraph graph, Seed seed) {
			this.graph = graph;
			this.seed = seed;
			this.orbiter = seed != null ? seed.orbiter : -1;
			settled = graph.originSet();
			known = graph.originSet();
			counted = new ArrayList<>(graph.getPointCount());
			for (int i = 0; i < graph.getPointCount(); i++) {
				counted.add(new ArrayList<>(2));
			}
			offered = new boolean[graph.getConstraintCount()];
			offeredToOrbiter = new boolean[graph.getConstraintCount()];

			if (seed != null) {
				known.set(orbiter);
				queue.add(seed.root);
				queue.add(orbiter);
			}
			for (int o : graph.origins()) {
				if (seed == null || o != seed.root) {
					queue.add(o);
				}
			}
		}

		OrderPlan run() {
			while (!queue.isEmpty()) {
				int p = queue.poll();
				for (int c : graph.constraintsOf(p)) {
					consider(c);
				}
			}
			if (settled.cardinality() < graph.getPointCount()) {
				if (LOGGER.isDebugEnabled()) {
					BitSet missing = (BitSet) settled.clone();
					missing.flip(0, graph.getPointCount());
					LOGGER.debug("Exploration {} incomplete; never discrete: {}", seed == null ? "(seedless)" : seed, missing);
				}
				return null;
			}
			if (seed == null) {
				return new OrderPlan(steps, -1, -1, -1);
			}
			return new OrderPlan(steps, seed.root, orbiter, seed.constraint);
		}

		private void consider(int c) {
			int t = graph.target(c, known);
			if (t >= 0 && !offered[c]) {
				offered[c] = true;
				offer(c, t);
			}
			if (orbiter >= 0 && !settled.get(orbiter) && !offeredToOrbiter[c] && graph.constraint(c).references(orbiter)
					&& graph.othersKnown(c, orbiter, settled)) {
				offeredToOrbiter[c] = true;
				offer(c, orbiter);
			}
		}

		private void offer(int c, int t) {
			Constraint constraint = graph.constraint(c);
			if (provider.dimension(constraint, t) != Dimension.CURVE) {
				return;
			}
			List<Integer> prior = counted.get(t);
			for (int q : prior) {
				if (provider.coincident(graph.constraint(q), constraint, t)) {
					LOGGER.debug("C{} coincides with C{} for P{}; not counted", c, q, t);
					return;
				}
			}
			prior.add(c);
			if (prior.size() == 2) {
				settle(t);
			}
		}

		private void settle(int t) {
			settled.set(t);
			known.set(t);
			BitSet reference = t == orbiter ? settled : known;
			List<Integer> active = new ArrayList<>();
			List<Integer> checked = new ArrayList<>();
			for (int c : graph.constraintsOf(t)) {
				if (!graph.othersKnown(c, t, reference)) {
					continue;
				}
				if (provider.dimension(graph.constraint(c), t) != null) {
					active.add(c);
				} else {
					checked.add(c);
				}
			}
			steps.add(new OrderPlan.Step(t, counted.get(t), active, checked));
			if (t != orbiter) {
				queue.add(t);
			}
		}
	}

	private final class PlanIterator implements Iterator<OrderPlan> {

		private final ConstraintGraph graph;
		private final BooleanSupplier stop;
		private final List<Seed> seeds;
		private final List<OrderPlan> emitted = new ArrayList<>();
		private int cursor = -1; // -1: seedless closure not tried yet
		private OrderPlan next;

		PlanIterator(ConstraintGraph graph, BooleanSupplier stop) {
			this.graph = graph;
			this.stop = stop;
			this.seeds = seeds(graph);
		}

		@Override
		public boolean hasNext() {
			while (next == null && cursor < seeds.size()) {
				if (stop.getAsBoolean()) {
					LOGGER.debug("Plan search stopped before candidate {} of {}", cursor + 2, seeds.size() + 1);
					return false;
				}
				Seed seed = cursor < 0 ? null : seeds.get(cursor);
				cursor++;
				if (seed != null && isRedundant(seed)) {
					LOGGER.debug("Skipping {}: orbiter already discretized by an earlier plan", seed);
					continue;
				}
				next = explore(graph, seed);
			}
			return next != null;
		}

		@Override
		public OrderPlan next() {
			if (!hasNext()) {
				throw new NoSuchElementException();
			}
			OrderPlan plan = next;
			next = null;
			emitted.add(plan);
			LOGGER.debug("Emitting {}", plan);
			return plan;
		}

		private boolean isRedundant(Seed seed) {
			for (OrderPlan plan : emitted) {
				if (plan.orbiter() != seed.orbiter && plan.points().contains(seed.orbiter)) {
					return true;
				}
			}
			return false;
		}
	}
}
