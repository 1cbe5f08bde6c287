package com.github.micycle1.geosolve.geometry;

/**
 * Signals a locus or an intersection that is not finite where a finite answer
 * was required: two curves coinciding over a continuous range, or a constraint
 * whose known points leave its locus undefined (e.g. a line through two
 * coincident points). Distinct from an empty intersection, which is a normal
 * result.
 */
public class DegenerateGeometryException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public DegenerateGeometryException(String message) {
		super(message);
	}
}
