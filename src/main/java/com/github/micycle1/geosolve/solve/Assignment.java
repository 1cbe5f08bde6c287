package com.github.micycle1.geosolve.solve;

import java.util.Arrays;
import java.util.List;

import com.github.micycle1.geosolve.geometry.Vector;

/** A resolved position for every point of a graph, indexed by point id. */
public final class Assignment {

	private final Vector[] positions;

	Assignment(Vector[] positions) {
		for (int i = 0; i < positions.length; i++) {
			if (positions[i] == null) {
				throw new IllegalStateException("Point " + i + " is unresolved");
			}
		}
		this.positions = positions.clone();
	}

	public Vector position(int point) {
		return positions[point];
	}

	public int size() {
		return positions.length;
	}

	public List<Vector> positions() {
		return List.of(positions);
	}

	/** Copy as an array, suitable for {@code GeometryProvider} calls. */
	public Vector[] toArray() {
		return positions.clone();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Assignment)) {
			return false;
		}
		return Arrays.equals(positions, ((Assignment) obj).positions);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(positions);
	}

	@Override
	public String toString() {
		return "Assignment" + Arrays.toString(positions);
	}
}
