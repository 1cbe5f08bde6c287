package com.github.micycle1.geosolve.geometry;

/**
 * Closed half plane to the left (or right) of the directed line from
 * {@code from} towards {@code to}.
 */
public final class HalfPlane implements Region {

	private final Vector from;
	private final Vector direction;
	private final boolean left;

	public HalfPlane(Vector from, Vector to, boolean left) {
		Vector d = to.subtract(from);
		if (!(d.magnitude() > 0)) {
			throw new DegenerateGeometryException("Half plane needs two distinct points, got " + from + " twice");
		}
		this.from = from;
		this.direction = d.unit();
		this.left = left;
	}

	@Override
	public boolean contains(Vector p, double tolerance) {
		double side = direction.cross(p.subtract(from));
		return left ? side >= -tolerance : side <= tolerance;
	}

	@Override
	public String toString() {
		return "HalfPlane[" + from + " -> " + direction + (left ? ", left]" : ", right]");
	}
}
