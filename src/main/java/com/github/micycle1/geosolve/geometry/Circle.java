package com.github.micycle1.geosolve.geometry;

import java.util.ArrayList;
import java.util.List;

public final class Circle implements Curve {

	private final Vector center;
	private final double radius;

	public Circle(Vector center, double radius) {
		if (!(radius >= 0)) {
			throw new IllegalArgumentException("Circle radius must be non-negative: " + radius);
		}
		this.center = center;
		this.radius = radius;
	}

	public Vector center() {
		return center;
	}

	public double radius() {
		return radius;
	}

	@Override
	public Type type() {
		return Type.CIRCLE;
	}

	@Override
	public boolean contains(Vector p, double tolerance) {
		return Math.abs(p.distanceTo(center) - radius) <= tolerance;
	}

	@Override
	public List<Vector> sample(int count) {
		int n = Math.max(1, count);
		List<Vector> samples = new ArrayList<>(n);
		for (int i = 0; i < n; i++) {
			double angle = 2.0 * Math.PI * i / n;
			samples.add(center.add(Vector.fromAngle(angle).scale(radius)));
		}
		return samples;
	}

	@Override
	public String toString() {
		return "Circle[c=" + center + ", r=" + radius + "]";
	}
}
