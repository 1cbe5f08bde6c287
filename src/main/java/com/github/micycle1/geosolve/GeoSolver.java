package com.github.micycle1.geosolve;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.geosolve.SolveOutcome.Status;
import com.github.micycle1.geosolve.geometry.GeometryProvider;
import com.github.micycle1.geosolve.geometry.PlanarGeometryProvider;
import com.github.micycle1.geosolve.graph.Constraint;
import com.github.micycle1.geosolve.graph.ConstraintGraph;
import com.github.micycle1.geosolve.graph.Figure;
import com.github.micycle1.geosolve.order.OrderPlan;
import com.github.micycle1.geosolve.order.OrderPlanner;
import com.github.micycle1.geosolve.solve.Assignment;
import com.github.micycle1.geosolve.solve.Budget;
import com.github.micycle1.geosolve.solve.CancellationSignal;
import com.github.micycle1.geosolve.solve.SolveResult;
import com.github.micycle1.geosolve.solve.Solver;
import com.github.micycle1.geosolve.solve.SolverOptions;

/**
 * <p>
 * Entry point: finds one position for every point of a figure.
 * </p>
 *
 * <p>
 * Key usage pattern:
 * </p>
 * <ol>
 * <li>Build a {@link Figure}: origins, unknown points, constraints.</li>
 * <li>Call {@link #solve(Figure)} (or {@link #solve(ConstraintGraph,
 * CancellationSignal)} to allow cancellation from another thread).</li>
 * <li>Read positions from {@link SolveOutcome#getAssignment()} when the status
 * is {@link Status#SOLVED}.</li>
 * </ol>
 *
 * <p>
 * Plans are pulled lazily from the {@link OrderPlanner} and solved one at a
 * time; a plan that fails is simply followed by the next one. One
 * {@link Budget} spans all plans. A solution is only reported after every
 * constraint has been re-checked against it.
 * </p>
 *
 * <p>
 * The class is stateless between calls and may be shared, but a single call
 * runs on the calling thread only.
 * </p>
 */
public class GeoSolver {

	private static final Logger LOGGER = LoggerFactory.getLogger(GeoSolver.class);

	private final GeometryProvider provider;
	private final SolverOptions options;
	private final OrderPlanner planner;
	private final Solver solver;

	public GeoSolver() {
		this(new SolverOptions());
	}

	public GeoSolver(SolverOptions options) {
		this(new PlanarGeometryProvider(options.getEpsilon(), options.getTolerance()), options);
	}

	public GeoSolver(GeometryProvider provider, SolverOptions options) {
		this.provider = Objects.requireNonNull(provider, "provider must not be null");
		this.options = Objects.requireNonNull(options, "options must not be null");
		this.planner = new OrderPlanner(provider);
		this.solver = new Solver(provider, options);
	}

	public SolveOutcome solve(Figure figure) {
		return solve(figure.toGraph(), CancellationSignal.NEVER);
	}

	public SolveOutcome solve(ConstraintGraph graph) {
		return solve(graph, CancellationSignal.NEVER);
	}

	/**
	 * Tries plans until one yields a verified solution, the plans run out, the
	 * budget is spent or the signal fires.
	 *
	 * @throws IllegalArgumentException if a constraint is malformed for the
	 *                                  provider
	 */
	public SolveOutcome solve(ConstraintGraph graph, CancellationSignal signal) {
		Objects.requireNonNull(graph, "graph must not be null");
		Objects.requireNonNull(signal, "signal must not be null");
		for (Constraint c : graph.constraints()) {
			provider.validate(c);
		}

		Budget budget = options.newBudget();
		Iterator<OrderPlan> plans = planner.plans(graph, signal::isCancelled).iterator();
		int tried = 0;
		boolean degenerate = false;
		while (true) {
			if (signal.isCancelled()) {
				return finish(Status.CANCELLED, null, null, tried, budget, degenerate);
			}
			if (budget.isExceeded() || tried >= options.getMaxPlans()) {
				return finish(Status.NOT_FOUND_WITHIN_BUDGET, null, null, tried, budget, degenerate);
			}
			if (!plans.hasNext()) {
				if (signal.isCancelled()) {
					// planning was cut short, not exhausted
					return finish(Status.CANCELLED, null, null, tried, budget, degenerate);
				}
				break;
			}
			OrderPlan plan = plans.next();
			tried++;
			SolveResult result = solver.solve(graph, plan, signal, budget);
			degenerate |= result.isDegenerate();
			if (result.isSuccess()) {
				List<Constraint> violated = violations(graph, result.getAssignment());
				if (violated.isEmpty()) {
					return finish(Status.SOLVED, result.getAssignment(), plan, tried, budget, degenerate);
				}
				// e.g. a constraint between origins only
				LOGGER.debug("Plan {} produced an assignment violating {}", tried, violated);
				continue;
			}
			switch (result.getReason()) {
				case CANCELLED :
					return finish(Status.CANCELLED, null, null, tried, budget, degenerate);
				case BUDGET_EXCEEDED :
					return finish(Status.NOT_FOUND_WITHIN_BUDGET, null, null, tried, budget, degenerate);
				default :
					LOGGER.debug("Plan {} exhausted after {} backtracks", tried, result.getBacktracks());
			}
		}
		Status status = tried == 0 ? Status.ORDERING_FAILED : Status.NOT_FOUND_WITHIN_BUDGET;
		return finish(status, null, null, tried, budget, degenerate);
	}

	/** Lazily enumerated plans for the graph, as the solve loop consumes them. */
	public Iterable<OrderPlan> planOrders(ConstraintGraph graph) {
		return planner.plans(graph);
	}

	/** Constraints the assignment does not satisfy within the provider's tolerance. */
	public List<Constraint> violations(ConstraintGraph graph, Assignment assignment) {
		List<Constraint> out = new ArrayList<>();
		var positions = assignment.toArray();
		for (Constraint c : graph.constraints()) {
			if (!provider.isSatisfied(c, positions)) {
				out.add(c);
			}
		}
		return out;
	}

	public SolverOptions getOptions() {
		return options;
	}

	private static SolveOutcome finish(Status status, Assignment assignment, OrderPlan plan, int tried, Budget budget, boolean degenerate) {
		SolveOutcome outcome = new SolveOutcome(status, assignment, plan, tried, budget.getSteps(), degenerate);
		LOGGER.info("Solve finished: {}", outcome);
		return outcome;
	}
}
