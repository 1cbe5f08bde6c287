package com.github.micycle1.geosolve.graph;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;

/**
 * <p>
 * Immutable point/constraint adjacency of a {@link Figure}.
 * </p>
 *
 * <p>
 * The graph never tracks solve-time state. Every query that depends on what is
 * already known takes the known set explicitly as a {@link BitSet} over point
 * ids, so one graph can serve any number of ordering and solving attempts.
 * </p>
 *
 * <p>
 * A constraint is <i>evaluable</i> against a known set when exactly one of its
 * points is unknown; that point is its <i>target</i>, the one whose locus it
 * constrains.
 * </p>
 */
public final class ConstraintGraph {

	private final List<Point> points;
	private final List<Constraint> constraints;
	// per point: ids of constraints referencing it, ascending
	private final List<List<Integer>> incident;
	private final List<Integer> origins;
	private final BitSet originSet;

	ConstraintGraph(Figure figure) {
		points = List.copyOf(figure.points());
		constraints = List.copyOf(figure.constraints());

		List<List<Integer>> inc = new ArrayList<>(points.size());
		for (int i = 0; i < points.size(); i++) {
			inc.add(new ArrayList<>());
		}
		for (Constraint c : constraints) {
			for (int p : c.points()) {
				inc.get(p).add(c.id());
			}
		}
		List<List<Integer>> frozen = new ArrayList<>(inc.size());
		for (List<Integer> l : inc) {
			frozen.add(Collections.unmodifiableList(l));
		}
		incident = Collections.unmodifiableList(frozen);

		List<Integer> o = new ArrayList<>();
		originSet = new BitSet(points.size());
		for (Point p : points) {
			if (p.isOrigin()) {
				o.add(p.id());
				originSet.set(p.id());
			}
		}
		origins = Collections.unmodifiableList(o);
	}

	public int getPointCount() {
		return points.size();
	}

	public int getConstraintCount() {
		return constraints.size();
	}

	public Point point(int id) {
		return points.get(id);
	}

	public Constraint constraint(int id) {
		return constraints.get(id);
	}

	public List<Constraint> constraints() {
		return constraints;
	}

	/** Constraint ids referencing the point, ascending. */
	public List<Integer> constraintsOf(int point) {
		return incident.get(point);
	}

	/** Point ids referenced by the constraint, in role order. */
	public List<Integer> pointsOf(int constraint) {
		return constraints.get(constraint).points();
	}

	/** Origin point ids, ascending. */
	public List<Integer> origins() {
		return origins;
	}

	/** A fresh known set holding exactly the origins. */
	public BitSet originSet() {
		return (BitSet) originSet.clone();
	}

	public int getUnknownCount() {
		return points.size() - origins.size();
	}

	/**
	 * @return the single point of the constraint not in {@code known}, or -1 if
	 *         zero or more than one of its points are unknown
	 */
	public int target(int constraint, BitSet known) {
		int target = -1;
		for (int p : constraints.get(constraint).points()) {
			if (!known.get(p)) {
				if (target >= 0) {
					return -1;
				}
				target = p;
			}
		}
		return target;
	}

	public boolean isEvaluable(int constraint, BitSet known) {
		return target(constraint, known) >= 0;
	}

	/** Ids of constraints currently evaluable with {@code point} as their target. */
	public List<Integer> evaluableConstraints(int point, BitSet known) {
		List<Integer> out = new ArrayList<>();
		if (known.get(point)) {
			return out;
		}
		for (int c : incident.get(point)) {
			if (target(c, known) == point) {
				out.add(c);
			}
		}
		return out;
	}

	/** Ids of every constraint currently evaluable, ascending. */
	public List<Integer> evaluableConstraints(BitSet known) {
		List<Integer> out = new ArrayList<>();
		for (Constraint c : constraints) {
			if (target(c.id(), known) >= 0) {
				out.add(c.id());
			}
		}
		return out;
	}

	/** True if every point the constraint references, other than {@code except}, is in {@code known}. */
	public boolean othersKnown(int constraint, int except, BitSet known) {
		for (int p : constraints.get(constraint).points()) {
			if (p != except && !known.get(p)) {
				return false;
			}
		}
		return true;
	}
}
