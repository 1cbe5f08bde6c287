package com.github.micycle1.geosolve.graph;

import java.util.List;

/**
 * A relation between an ordered list of points. Which point plays which role
 * depends on the {@link ConstraintKind}.
 */
public final class Constraint {

	private final int id;
	private final ConstraintKind kind;
	private final List<Integer> points;
	private final double value;

	Constraint(int id, ConstraintKind kind, List<Integer> points, double value) {
		this.id = id;
		this.kind = kind;
		this.points = List.copyOf(points);
		this.value = value;
	}

	public int id() {
		return id;
	}

	public ConstraintKind kind() {
		return kind;
	}

	/** Referenced point ids, in role order. */
	public List<Integer> points() {
		return points;
	}

	public int point(int role) {
		return points.get(role);
	}

	/** Index of the given point among the references, or -1. */
	public int roleOf(int point) {
		return points.indexOf(point);
	}

	public boolean references(int point) {
		return points.contains(point);
	}

	public double value() {
		return value;
	}

	@Override
	public String toString() {
		return "C" + id + ":" + kind.name() + points + "=" + value;
	}
}
