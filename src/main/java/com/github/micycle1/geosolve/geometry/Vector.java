package com.github.micycle1.geosolve.geometry;

/**
 * Immutable 2D vector, used both for positions and directions.
 */
public final class Vector {

	public static final Vector ZERO = new Vector(0, 0);
	public static final Vector POSX = new Vector(1, 0);
	public static final Vector POSY = new Vector(0, 1);

	public final double x;
	public final double y;

	public Vector(double x, double y) {
		this.x = x;
		this.y = y;
	}

	/** Unit vector at the given angle (radians, CCW from +x). */
	public static Vector fromAngle(double angle) {
		return new Vector(Math.cos(angle), Math.sin(angle));
	}

	public Vector add(Vector other) {
		return new Vector(x + other.x, y + other.y);
	}

	public Vector subtract(Vector other) {
		return new Vector(x - other.x, y - other.y);
	}

	public Vector scale(double s) {
		return new Vector(x * s, y * s);
	}

	public Vector negate() {
		return new Vector(-x, -y);
	}

	public double dot(Vector other) {
		return x * other.x + y * other.y;
	}

	/** z-component of the 3D cross product. */
	public double cross(Vector other) {
		return x * other.y - y * other.x;
	}

	/** Perpendicular with positive rotation. */
	public Vector perp() {
		return new Vector(-y, x);
	}

	public Vector rotate(double angle) {
		double c = Math.cos(angle);
		double s = Math.sin(angle);
		return new Vector(x * c - y * s, x * s + y * c);
	}

	public double magnitude() {
		return Math.hypot(x, y);
	}

	public Vector unit() {
		double m = magnitude();
		return new Vector(x / m, y / m);
	}

	public double distanceTo(Vector other) {
		return Math.hypot(other.x - x, other.y - y);
	}

	public boolean aboutEquals(Vector other, double tolerance) {
		return Math.abs(x - other.x) <= tolerance && Math.abs(y - other.y) <= tolerance;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Vector)) {
			return false;
		}
		Vector other = (Vector) obj;
		return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0;
	}

	@Override
	public int hashCode() {
		return Double.hashCode(x) * 31 + Double.hashCode(y);
	}

	@Override
	public String toString() {
		return "(" + x + ", " + y + ")";
	}
}
