package com.github.micycle1.geosolve.graph;

import com.github.micycle1.geosolve.geometry.Vector;

/**
 * A point of a figure. Origins carry a fixed position and have no degrees of
 * freedom; every other point is unknown until solved.
 */
public final class Point {

	private final int id;
	private final Vector fixed;

	Point(int id, Vector fixed) {
		this.id = id;
		this.fixed = fixed;
	}

	public int id() {
		return id;
	}

	public boolean isOrigin() {
		return fixed != null;
	}

	/** @return the fixed position of an origin, or null for an unknown point */
	public Vector position() {
		return fixed;
	}

	public int degreesOfFreedom() {
		return fixed != null ? 0 : 2;
	}

	@Override
	public String toString() {
		return isOrigin() ? "P" + id + fixed : "P" + id;
	}
}
