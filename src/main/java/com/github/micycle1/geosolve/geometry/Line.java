package com.github.micycle1.geosolve.geometry;

import java.util.ArrayList;
import java.util.List;

/**
 * A straight line through {@code origin} along the unit {@code direction}. When
 * {@code ray} is set only the half with parameter t >= 0 belongs to the curve.
 */
public final class Line implements Curve {

	private final Vector origin;
	private final Vector direction;
	private final boolean ray;

	private Line(Vector origin, Vector direction, boolean ray) {
		double m = direction.magnitude();
		if (!(m > 0) || Double.isInfinite(m)) {
			throw new IllegalArgumentException("Line direction must be non-zero: " + direction);
		}
		this.origin = origin;
		this.direction = direction.unit();
		this.ray = ray;
	}

	public static Line through(Vector origin, Vector direction) {
		return new Line(origin, direction, false);
	}

	public static Line ray(Vector origin, Vector direction) {
		return new Line(origin, direction, true);
	}

	public Vector origin() {
		return origin;
	}

	public Vector direction() {
		return direction;
	}

	public boolean isRay() {
		return ray;
	}

	public Vector at(double t) {
		return origin.add(direction.scale(t));
	}

	/** Signed parameter of the orthogonal projection of p onto the line. */
	public double project(Vector p) {
		return p.subtract(origin).dot(direction);
	}

	/** True if the parameter is admissible for this line (always, unless a ray). */
	boolean admits(double t, double tolerance) {
		return !ray || t >= -tolerance;
	}

	@Override
	public Type type() {
		return Type.LINE;
	}

	@Override
	public boolean contains(Vector p, double tolerance) {
		double t = project(p);
		if (!admits(t, tolerance)) {
			return false;
		}
		return Math.abs(direction.cross(p.subtract(origin))) <= tolerance;
	}

	// parameters 1, -1, 2, -2, ... (rays: 1, 2, 3, ...)
	@Override
	public List<Vector> sample(int count) {
		int n = Math.max(1, count);
		List<Vector> samples = new ArrayList<>(n);
		for (int i = 0; i < n; i++) {
			double t;
			if (ray) {
				t = i + 1;
			} else {
				t = (i / 2 + 1) * (i % 2 == 0 ? 1 : -1);
			}
			samples.add(at(t));
		}
		return samples;
	}

	@Override
	public String toString() {
		return (ray ? "Ray[o=" : "Line[o=") + origin + ", v=" + direction + "]";
	}
}
