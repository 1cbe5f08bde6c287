package com.github.micycle1.geosolve.graph;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.github.micycle1.geosolve.geometry.Vector;

/**
 * A sketch under construction: points and constraints are appended in any
 * order, then frozen into a {@link ConstraintGraph} for solving.
 * <p>
 * Point and constraint ids are dense and 0-based, in creation order, so they
 * can be used directly as array indices.
 */
public class Figure {

	private final List<Point> points = new ArrayList<>();
	private final List<Constraint> constraints = new ArrayList<>();

	/** Adds an unknown point. */
	public int addPoint() {
		int id = points.size();
		points.add(new Point(id, null));
		return id;
	}

	/** Adds an origin: a point fixed at (x, y). */
	public int addOrigin(double x, double y) {
		if (!Double.isFinite(x) || !Double.isFinite(y)) {
			throw new IllegalArgumentException("Origin position must be finite: (" + x + ", " + y + ")");
		}
		int id = points.size();
		points.add(new Point(id, new Vector(x, y)));
		return id;
	}

	/**
	 * Adds a constraint over the given points. Points must already exist, be
	 * distinct, and match the kind's arity.
	 *
	 * @return the constraint id
	 */
	public int addConstraint(ConstraintKind kind, double value, int... pointIds) {
		Objects.requireNonNull(kind, "kind must not be null");
		if (pointIds.length < kind.minArity() || pointIds.length > kind.maxArity()) {
			throw new IllegalArgumentException(kind.name() + " takes " + arity(kind) + " points, got " + pointIds.length);
		}
		List<Integer> refs = new ArrayList<>(pointIds.length);
		Set<Integer> seen = new HashSet<>();
		for (int p : pointIds) {
			if (p < 0 || p >= points.size()) {
				throw new IllegalArgumentException("Unknown point " + p);
			}
			if (!seen.add(p)) {
				throw new IllegalArgumentException(kind.name() + " references point " + p + " twice");
			}
			refs.add(p);
		}
		int id = constraints.size();
		constraints.add(new Constraint(id, kind, refs, value));
		return id;
	}

	public int getPointCount() {
		return points.size();
	}

	public int getConstraintCount() {
		return constraints.size();
	}

	List<Point> points() {
		return points;
	}

	List<Constraint> constraints() {
		return constraints;
	}

	/** Snapshot of the current sketch. Later edits do not affect the graph. */
	public ConstraintGraph toGraph() {
		return new ConstraintGraph(this);
	}

	private static String arity(ConstraintKind kind) {
		if (kind.minArity() == kind.maxArity()) {
			return String.valueOf(kind.minArity());
		}
		return kind.maxArity() == Integer.MAX_VALUE ? "at least " + kind.minArity() : kind.minArity() + ".." + kind.maxArity();
	}
}
