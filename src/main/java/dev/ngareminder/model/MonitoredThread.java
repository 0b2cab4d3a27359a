package dev.ngareminder.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/** Configuration and persisted watermark of one watched forum thread */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({
	"tid",
	"authorNotification",
	"checkInterval",
	"checkSchedule",
	"enabled",
	"lastSeenPostNumber"
})
public record MonitoredThread(
		@JsonProperty("tid") long tid,
		@JsonProperty("authorNotification") List<Long> authorNotification,
		@JsonProperty("checkInterval") long checkInterval,
		@JsonProperty("checkSchedule") List<ScheduleRule> checkSchedule,
		@JsonProperty("enabled") boolean enabled,
		@JsonProperty("lastSeenPostNumber") long lastSeenPostNumber) {

	public MonitoredThread {
		authorNotification = authorNotification == null ? List.of() : List.copyOf(authorNotification);
		// absent stays absent so a load/save round trip keeps the field set
		checkSchedule = checkSchedule == null ? null : List.copyOf(checkSchedule);
	}

	public boolean watches(long authorUid) {
		return authorNotification.contains(authorUid);
	}

	public boolean hasSchedule() {
		return checkSchedule != null && !checkSchedule.isEmpty();
	}

	public MonitoredThread withLastSeenPostNumber(long postNumber) {
		return new MonitoredThread(tid, authorNotification, checkInterval, checkSchedule, enabled, postNumber);
	}
}
