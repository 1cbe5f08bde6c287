package com.github.micycle1.geosolve.geometry;

/** Closed disk. */
public final class Disk implements Region {

	private final Vector center;
	private final double radius;

	public Disk(Vector center, double radius) {
		this.center = center;
		this.radius = radius;
	}

	@Override
	public boolean contains(Vector p, double tolerance) {
		return p.distanceTo(center) <= radius + tolerance;
	}

	@Override
	public String toString() {
		return "Disk[c=" + center + ", r=" + radius + "]";
	}
}
