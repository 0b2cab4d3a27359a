package dev.ngareminder.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/**
 * Override window for a thread's check interval. Applies on the listed days while the local clock
 * is inside {@code [startTime, endTime)}; a window whose start is after its end wraps midnight.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"days", "description", "startTime", "endTime", "interval"})
public record ScheduleRule(
		@JsonProperty("days") List<String> days,
		@JsonProperty("description") String description,
		@JsonProperty("startTime") String startTime,
		@JsonProperty("endTime") String endTime,
		@JsonProperty("interval") long interval) {

	public ScheduleRule {
		days = days == null ? List.of() : List.copyOf(days);
	}
}
