package com.github.micycle1.geosolve.solve;

import java.util.ArrayList;
import java.util.List;

import com.github.micycle1.geosolve.geometry.GeometryProvider;
import com.github.micycle1.geosolve.geometry.PossibilitySpace;
import com.github.micycle1.geosolve.geometry.Vector;
import com.github.micycle1.geosolve.graph.Constraint;
import com.github.micycle1.geosolve.graph.ConstraintGraph;
import com.github.micycle1.geosolve.order.OrderPlan;

/** Gathers the possibility spaces of a plan step from current positions. */
final class Loci {

	private Loci() {
	}

	/**
	 * Spaces of every active constraint of the step. At the orbiter's own step
	 * its provisional position is added as a 0D space, so the step only confirms
	 * (or rejects) that position.
	 */
	static List<PossibilitySpace> forStep(GeometryProvider provider, ConstraintGraph graph, OrderPlan plan, int stepIndex, Vector[] positions) {
		OrderPlan.Step step = plan.step(stepIndex);
		int point = step.point();
		List<PossibilitySpace> spaces = new ArrayList<>(step.active().size() + 1);
		for (int c : step.active()) {
			spaces.add(provider.possibilitySpace(graph.constraint(c), point, positions));
		}
		if (point == plan.orbiter()) {
			spaces.add(PossibilitySpace.points(List.of(positions[point])));
		}
		return spaces;
	}

	/**
	 * Drops candidates that violate one of the step's checked constraints, the
	 * ones giving the point no locus of its own.
	 */
	static List<Vector> admissible(GeometryProvider provider, ConstraintGraph graph, OrderPlan.Step step, Vector[] positions, List<Vector> candidates) {
		if (step.checked().isEmpty()) {
			return candidates;
		}
		Vector[] scratch = positions.clone();
		List<Vector> out = new ArrayList<>(candidates.size());
		for (Vector candidate : candidates) {
			scratch[step.point()] = candidate;
			boolean ok = true;
			for (int c : step.checked()) {
				if (!provider.isSatisfied(graph.constraint(c), scratch)) {
					ok = false;
					break;
				}
			}
			if (ok) {
				out.add(candidate);
			}
		}
		return out;
	}

	/**
	 * Spaces of the step's active constraints whose other points are already
	 * resolved in {@code positions}; the rest are skipped.
	 */
	static List<PossibilitySpace> resolvable(GeometryProvider provider, ConstraintGraph graph, OrderPlan.Step step, Vector[] positions) {
		int point = step.point();
		List<PossibilitySpace> spaces = new ArrayList<>();
		for (int c : step.active()) {
			Constraint constraint = graph.constraint(c);
			boolean ready = true;
			for (int p : constraint.points()) {
				if (p != point && positions[p] == null) {
					ready = false;
					break;
				}
			}
			if (ready) {
				spaces.add(provider.possibilitySpace(constraint, point, positions));
			}
		}
		return spaces;
	}
}
