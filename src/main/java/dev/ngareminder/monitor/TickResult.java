package dev.ngareminder.monitor;

import java.util.Map;

/** Summary of one sweep over the configured threads */
public record TickResult(int checked, int failed, int skipped, Map<Long, Long> lastSeen) {

	public TickResult {
		lastSeen = Map.copyOf(lastSeen);
	}

	@Override
	public String toString() {
		return "%d checked, %d failed, %d skipped".formatted(checked, failed, skipped);
	}
}
