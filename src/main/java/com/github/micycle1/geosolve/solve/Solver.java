package com.github.micycle1.geosolve.solve;

import java.util.BitSet;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.geosolve.geometry.DegenerateGeometryException;
import com.github.micycle1.geosolve.geometry.GeometryProvider;
import com.github.micycle1.geosolve.geometry.PossibilitySpace;
import com.github.micycle1.geosolve.geometry.PossibilitySpace.Dimension;
import com.github.micycle1.geosolve.geometry.Vector;
import com.github.micycle1.geosolve.graph.ConstraintGraph;
import com.github.micycle1.geosolve.order.OrderPlan;
import com.github.micycle1.geosolve.solve.SolveResult.Reason;

/**
 * <p>
 * Assigns positions along one {@link OrderPlan}, backtracking over an explicit
 * choice stack.
 * </p>
 *
 * <p>
 * What:
 * </p>
 * <ul>
 * <li>If the plan has an orbiter, it is first placed provisionally on its seed
 * curve; the alternative placements are sample points along that curve.</li>
 * <li>Each step intersects the spaces of the step's active constraints. A
 * non-empty result is ranked by the {@link CandidateSelector}, pushed as a
 * {@link Choice} and its first candidate applied. Candidates failing a
 * constraint that gives the point no locus (the step's checks) are dropped
 * first.</li>
 * <li>An empty or degenerate result backtracks: the top choice moves to its
 * next candidate, or is popped (its point reverts) and the one below is
 * tried. The stack emptying means the plan is exhausted.</li>
 * </ul>
 *
 * <p>
 * Points are always resolved in plan order; backtracking only ever reopens the
 * most recent choice. The cancellation signal and the budget are consulted once
 * per resolution step and once per backtrack step. On cancellation or budget
 * exhaustion the partial state is dropped and no assignment is returned.
 * </p>
 */
public class Solver {

	private static final Logger LOGGER = LoggerFactory.getLogger(Solver.class);

	private final GeometryProvider provider;
	private final SolverOptions options;
	private final CandidateSelector selector;

	public Solver(GeometryProvider provider, SolverOptions options) {
		this.provider = Objects.requireNonNull(provider, "provider must not be null");
		this.options = Objects.requireNonNull(options, "options must not be null");
		this.selector = options.getSelection() == SolverOptions.Selection.LOOKAHEAD ? new LookaheadSelector(provider, options.getLookaheadDepth())
				: CandidateSelector.FIRST;
	}

	public Solver(GeometryProvider provider, SolverOptions options, CandidateSelector selector) {
		this.provider = Objects.requireNonNull(provider, "provider must not be null");
		this.options = Objects.requireNonNull(options, "options must not be null");
		this.selector = Objects.requireNonNull(selector, "selector must not be null");
	}

	/** Solves one plan without a step or time limit. */
	public SolveResult solve(ConstraintGraph graph, OrderPlan plan, CancellationSignal signal) {
		return solve(graph, plan, signal, Budget.unlimited());
	}

	/**
	 * Solves one plan.
	 *
	 * @param budget consumed one step per resolution and per backtrack; may be
	 *               shared across plans
	 */
	public SolveResult solve(ConstraintGraph graph, OrderPlan plan, CancellationSignal signal, Budget budget) {
		Objects.requireNonNull(signal, "signal must not be null");
		Objects.requireNonNull(budget, "budget must not be null");
		checkCoverage(graph, plan);

		SolverState state = new SolverState(graph);
		boolean degenerate = false;
		int backtracks = 0;
		int next = 0;

		if (plan.hasOrbiter()) {
			List<Vector> seeds;
			try {
				seeds = seedPositions(graph, plan, state.positions());
			} catch (DegenerateGeometryException e) {
				LOGGER.debug("Orbiter seed is degenerate: {}", e.getMessage());
				return SolveResult.failure(Reason.EXHAUSTED, true, 0);
			}
			state.push(new Choice(Choice.SEED, plan.orbiter(), seeds, null));
		}

		while (true) {
			Reason stop = checkpoint(signal, budget);
			if (stop != null) {
				return SolveResult.failure(stop, degenerate, backtracks);
			}
			if (next == plan.size()) {
				Assignment assignment = new Assignment(state.positions());
				LOGGER.debug("Plan solved after {} backtracks", backtracks);
				return SolveResult.success(assignment, degenerate, backtracks);
			}

			int point = plan.step(next).point();
			List<Vector> candidates;
			try {
				candidates = provider.intersect(Loci.forStep(provider, graph, plan, next, state.positions()));
				candidates = Loci.admissible(provider, graph, plan.step(next), state.positions(), candidates);
			} catch (DegenerateGeometryException e) {
				LOGGER.debug("Step {} (P{}) degenerate: {}", next, point, e.getMessage());
				degenerate = true;
				candidates = List.of();
			}

			if (!candidates.isEmpty()) {
				candidates = selector.rank(graph, plan, next, state.positions(), candidates);
				state.push(new Choice(next, point, candidates, state.positions()[point]));
				next++;
				continue;
			}

			// P(next) is exhausted: reopen the most recent choice
			LOGGER.trace("Step {} (P{}) has no candidates, backtracking", next, point);
			while (true) {
				stop = checkpoint(signal, budget);
				if (stop != null) {
					return SolveResult.failure(stop, degenerate, backtracks);
				}
				Choice top = state.top();
				if (top == null) {
					LOGGER.debug("Plan exhausted after {} backtracks", backtracks);
					return SolveResult.failure(Reason.EXHAUSTED, degenerate, backtracks);
				}
				backtracks++;
				if (top.advance()) {
					state.reapplyTop();
					next = top.step + 1;
					break;
				}
				state.pop();
			}
		}
	}

	private List<Vector> seedPositions(ConstraintGraph graph, OrderPlan plan, Vector[] positions) {
		PossibilitySpace space = provider.possibilitySpace(graph.constraint(plan.seedConstraint()), plan.orbiter(), positions);
		if (space.dimension() != Dimension.CURVE) {
			throw new IllegalStateException("Seed constraint C" + plan.seedConstraint() + " does not give a curve for P" + plan.orbiter());
		}
		return space.curve().sample(options.getOrbiterSamples());
	}

	private static Reason checkpoint(CancellationSignal signal, Budget budget) {
		if (signal.isCancelled()) {
			return Reason.CANCELLED;
		}
		if (!budget.tick()) {
			return Reason.BUDGET_EXCEEDED;
		}
		return null;
	}

	// every unknown point exactly once, no origins
	private static void checkCoverage(ConstraintGraph graph, OrderPlan plan) {
		BitSet seen = graph.originSet();
		for (OrderPlan.Step step : plan.steps()) {
			int p = step.point();
			if (seen.get(p)) {
				throw new IllegalArgumentException("Plan visits P" + p + " twice or visits an origin");
			}
			seen.set(p);
		}
		if (seen.cardinality() != graph.getPointCount()) {
			throw new IllegalArgumentException("Plan covers " + plan.size() + " of " + graph.getUnknownCount() + " unknown points");
		}
	}
}
