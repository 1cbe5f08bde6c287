package com.github.micycle1.geosolve.solve;

import java.util.List;

import com.github.micycle1.geosolve.geometry.Vector;
import com.github.micycle1.geosolve.graph.ConstraintGraph;
import com.github.micycle1.geosolve.order.OrderPlan;

/**
 * Orders the candidates of one step; the solver tries them first to last.
 * Implementations must be deterministic and must return a permutation of the
 * input (never drop or invent candidates).
 */
public interface CandidateSelector {

	/** Keeps the intersection order. */
	CandidateSelector FIRST = (graph, plan, stepIndex, positions, candidates) -> candidates;

	/**
	 * @param positions current positions by point id; the step's own point may
	 *                  hold a stale value and must not be relied on
	 */
	List<Vector> rank(ConstraintGraph graph, OrderPlan plan, int stepIndex, Vector[] positions, List<Vector> candidates);
}
