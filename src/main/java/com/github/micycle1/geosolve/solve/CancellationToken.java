package com.github.micycle1.geosolve.solve;

import java.util.concurrent.atomic.AtomicBoolean;

/** A {@link CancellationSignal} that another thread can fire. */
public final class CancellationToken implements CancellationSignal {

	private final AtomicBoolean cancelled = new AtomicBoolean();

	public void cancel() {
		cancelled.set(true);
	}

	@Override
	public boolean isCancelled() {
		return cancelled.get();
	}
}
