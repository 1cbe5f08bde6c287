package com.github.micycle1.geosolve.solve;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.github.micycle1.geosolve.geometry.DegenerateGeometryException;
import com.github.micycle1.geosolve.geometry.GeometryProvider;
import com.github.micycle1.geosolve.geometry.PossibilitySpace;
import com.github.micycle1.geosolve.geometry.PossibilitySpace.Dimension;
import com.github.micycle1.geosolve.geometry.Vector;
import com.github.micycle1.geosolve.graph.ConstraintGraph;
import com.github.micycle1.geosolve.order.OrderPlan;

/**
 * <p>
 * Ranks candidates by how well they keep later points reachable.
 * </p>
 *
 * <p>
 * For each candidate, the point is tentatively placed there and each of the
 * next {@code depth} steps is inspected using only the constraints already
 * computable at that moment. A step whose computable loci already fail to
 * intersect counts as one dead end; when they do intersect, the distance from
 * the candidate to the nearest surviving position of that later point breaks
 * ties, keeping chains from drifting away from points they must reconnect to.
 * Candidates are stably sorted by (dead ends, distance).
 * </p>
 */
public class LookaheadSelector implements CandidateSelector {

	private final GeometryProvider provider;
	private final int depth;

	public LookaheadSelector(GeometryProvider provider, int depth) {
		this.provider = provider;
		this.depth = depth;
	}

	@Override
	public List<Vector> rank(ConstraintGraph graph, OrderPlan plan, int stepIndex, Vector[] positions, List<Vector> candidates) {
		if (candidates.size() < 2 || stepIndex + 1 >= plan.size()) {
			return candidates;
		}
		int point = plan.step(stepIndex).point();
		Vector[] scratch = positions.clone();
		List<Scored> scored = new ArrayList<>(candidates.size());
		for (Vector candidate : candidates) {
			scratch[point] = candidate;
			scored.add(score(graph, plan, stepIndex, scratch, candidate));
		}
		scored.sort(Comparator.comparingInt((Scored s) -> s.deadEnds).thenComparingDouble(s -> s.distance));
		List<Vector> ranked = new ArrayList<>(candidates.size());
		for (Scored s : scored) {
			ranked.add(s.candidate);
		}
		return ranked;
	}

	private Scored score(ConstraintGraph graph, OrderPlan plan, int stepIndex, Vector[] scratch, Vector candidate) {
		int deadEnds = 0;
		double distance = 0;
		int last = Math.min(plan.size() - 1, stepIndex + depth);
		for (int j = stepIndex + 1; j <= last; j++) {
			OrderPlan.Step step = plan.step(j);
			if (step.point() == plan.orbiter()) {
				// provisional position, nothing to learn
				continue;
			}
			Vector saved = scratch[step.point()];
			scratch[step.point()] = null;
			try {
				List<PossibilitySpace> spaces = Loci.resolvable(provider, graph, step, scratch);
				if (countDiscretizing(spaces) < 2) {
					continue;
				}
				List<Vector> reachable = provider.intersect(spaces);
				if (reachable.isEmpty()) {
					deadEnds++;
				} else {
					distance += nearest(candidate, reachable);
				}
			} catch (DegenerateGeometryException e) {
				// says nothing about this candidate either way
				continue;
			} finally {
				scratch[step.point()] = saved;
			}
		}
		return new Scored(candidate, deadEnds, distance);
	}

	private static int countDiscretizing(List<PossibilitySpace> spaces) {
		int n = 0;
		for (PossibilitySpace s : spaces) {
			if (s.dimension() != Dimension.REGION) {
				n++;
			}
		}
		return n;
	}

	private static double nearest(Vector from, List<Vector> points) {
		double best = Double.POSITIVE_INFINITY;
		for (Vector p : points) {
			best = Math.min(best, from.distanceTo(p));
		}
		return best;
	}

	private static final class Scored {
		final Vector candidate;
		final int deadEnds;
		final double distance;

		Scored(Vector candidate, int deadEnds, double distance) {
			this.candidate = candidate;
			this.deadEnds = deadEnds;
			this.distance = distance;
		}
	}
}
