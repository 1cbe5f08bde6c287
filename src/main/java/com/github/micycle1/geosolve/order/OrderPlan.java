package com.github.micycle1.geosolve.order;

import java.util.ArrayList;
import java.util.List;

/**
 * A total order over the unknown points of a graph, with the constraints the
 * solver applies at each point.
 * <p>
 * A plan may carry an <i>orbiter</i>: a point placed provisionally on the locus
 * of its single seed constraint from the root before the first step, fixing
 * the figure's remaining rotational freedom. The orbiter still gets its own
 * step, where its provisional position is checked against every constraint
 * that applies to it by then.
 */
public final class OrderPlan {

	/** One entry of the order. */
	public static final class Step {

		private final int point;
		private final List<Integer> counted;
		private final List<Integer> active;
		private final List<Integer> checked;

		Step(int point, List<Integer> counted, List<Integer> active, List<Integer> checked) {
			this.point = point;
			this.counted = List.copyOf(counted);
			this.active = List.copyOf(active);
			this.checked = List.copyOf(checked);
		}

		public int point() {
			return point;
		}

		/** The 1D constraints that made the point discrete, in discovery order. */
		public List<Integer> counted() {
			return counted;
		}

		/**
		 * Every constraint the solver intersects for this point: all constraints
		 * referencing it whose other points are known by the time it is reached,
		 * areal ones included.
		 */
		public List<Integer> active() {
			return active;
		}

		/**
		 * Constraints completed by this point that give it no locus (an angle at
		 * its vertex, a side or hull test where it is not the tested point). They
		 * cannot be intersected, so each candidate is checked against them
		 * directly.
		 */
		public List<Integer> checked() {
			return checked;
		}

		@Override
		public String toString() {
			return checked.isEmpty() ? "P" + point + active : "P" + point + active + "?" + checked;
		}
	}

	private final List<Step> steps;
	private final int root;
	private final int orbiter;
	private final int seedConstraint;

	OrderPlan(List<Step> steps, int root, int orbiter, int seedConstraint) {
		this.steps = List.copyOf(steps);
		this.root = root;
		this.orbiter = orbiter;
		this.seedConstraint = seedConstraint;
	}

	public List<Step> steps() {
		return steps;
	}

	public Step step(int index) {
		return steps.get(index);
	}

	public int size() {
		return steps.size();
	}

	/** Point ids in resolution order. */
	public List<Integer> points() {
		List<Integer> out = new ArrayList<>(steps.size());
		for (Step s : steps) {
			out.add(s.point);
		}
		return out;
	}

	public boolean hasOrbiter() {
		return orbiter >= 0;
	}

	/** @return the root the orbiter is seeded from, or -1 */
	public int root() {
		return root;
	}

	/** @return the orbiter point, or -1 */
	public int orbiter() {
		return orbiter;
	}

	/** @return the constraint placing the orbiter relative to the root, or -1 */
	public int seedConstraint() {
		return seedConstraint;
	}

	@Override
	public String toString() {
		String head = hasOrbiter() ? "OrderPlan[root=P" + root + ", orbiter=P" + orbiter + " via C" + seedConstraint + "] " : "OrderPlan ";
		return head + steps;
	}
}
