package com.github.micycle1.geosolve.graph;

/**
 * Tag identifying what a {@link Constraint} means. The set of kinds is open:
 * each geometry provider supplies its own (typically as an enum) and is the
 * only component that interprets them.
 */
public interface ConstraintKind {

	String name();

	/** Smallest number of points a constraint of this kind references. */
	int minArity();

	/** Largest number of points, or {@link Integer#MAX_VALUE} if unbounded. */
	int maxArity();
}
