package com.github.micycle1.geosolve.solve;

import java.util.List;

import com.github.micycle1.geosolve.geometry.Vector;

/**
 * One entry of the backtracking stack: the candidates computed for a point,
 * which one is in use, and the position the point had before (null unless the
 * point is an orbiter being re-checked).
 */
final class Choice {

	/** Step index for the orbiter's provisional placement, before step 0. */
	static final int SEED = -1;

	final int step;
	final int point;
	final List<Vector> candidates;
	final Vector previous;
	private int chosen;

	Choice(int step, int point, List<Vector> candidates, Vector previous) {
		this.step = step;
		this.point = point;
		this.candidates = List.copyOf(candidates);
		this.previous = previous;
	}

	Vector current() {
		return candidates.get(chosen);
	}

	/** Moves to the next untried candidate, if any. */
	boolean advance() {
		if (chosen + 1 >= candidates.size()) {
			return false;
		}
		chosen++;
		return true;
	}

	@Override
	public String toString() {
		return "Choice[step=" + step + ", P" + point + ", " + (chosen + 1) + "/" + candidates.size() + "]";
	}
}
