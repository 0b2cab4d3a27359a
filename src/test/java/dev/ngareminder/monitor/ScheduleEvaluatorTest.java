package dev.ngareminder.monitor;

import static dev.ngareminder.model.Threads.rule;
import static dev.ngareminder.model.Threads.scheduled;
import static org.assertj.core.api.Assertions.*;

import dev.ngareminder.model.MonitoredThread;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

class ScheduleEvaluatorTest {

	private static final ZoneId ZONE = ZoneId.of("Asia/Shanghai");

	private final ScheduleEvaluator evaluator = new ScheduleEvaluator();

	// 2024-05-06 is a Monday, 2024-05-04 a Saturday
	private static ZonedDateTime at(String localDateTime) {
		return LocalDateTime.parse(localDateTime).atZone(ZONE);
	}

	@Test
	void testIsDue_NeverChecked() {
		// Given
		MonitoredThread thread = scheduled(600);

		// When/Then
		assertThat(evaluator.isDue(thread, null, at("2024-05-06T10:00"))).isTrue();
	}

	@Test
	void testIsDue_StrictlyAfterInterval() {
		// Given
		MonitoredThread thread = scheduled(600);
		ZonedDateTime last = at("2024-05-06T10:00");

		// When/Then
		assertThat(evaluator.isDue(thread, last, at("2024-05-06T10:05"))).isFalse();
		assertThat(evaluator.isDue(thread, last, at("2024-05-06T10:10"))).isFalse();
		assertThat(evaluator.isDue(thread, last, at("2024-05-06T10:10:01"))).isTrue();
	}

	@Test
	void testEffectiveInterval_NoSchedule() {
		assertThat(evaluator.effectiveInterval(scheduled(0), at("2024-05-06T10:00")))
				.isEqualTo(Duration.ofSeconds(300));
		assertThat(evaluator.effectiveInterval(scheduled(120), at("2024-05-06T10:00")))
				.isEqualTo(Duration.ofSeconds(120));
	}

	@Test
	void testEffectiveInterval_OvernightWindow() {
		// Given
		MonitoredThread thread = scheduled(300, rule("22:00", "06:00", 1800, "weekdays"));

		// When/Then
		assertThat(evaluator.effectiveInterval(thread, at("2024-05-06T23:30"))).isEqualTo(Duration.ofSeconds(1800));
		assertThat(evaluator.effectiveInterval(thread, at("2024-05-07T05:59"))).isEqualTo(Duration.ofSeconds(1800));
		assertThat(evaluator.effectiveInterval(thread, at("2024-05-07T06:00"))).isEqualTo(Duration.ofSeconds(300));
		assertThat(evaluator.effectiveInterval(thread, at("2024-05-06T21:59"))).isEqualTo(Duration.ofSeconds(300));
	}

	@Test
	void testEffectiveInterval_WeekendNotInWeekdays() {
		// Given
		MonitoredThread thread = scheduled(300, rule("22:00", "06:00", 1800, "weekdays"));

		// When/Then
		assertThat(evaluator.effectiveInterval(thread, at("2024-05-04T23:30"))).isEqualTo(Duration.ofSeconds(300));
	}

	@Test
	void testEffectiveInterval_FirstMatchingRuleWins() {
		// Given
		MonitoredThread thread = scheduled(
				300, rule("09:00", "17:00", 60, "Monday"), rule("00:00", "24:00", 900, "weekdays", "weekends"));

		// When/Then
		assertThat(evaluator.effectiveInterval(thread, at("2024-05-06T10:00"))).isEqualTo(Duration.ofSeconds(60));
		assertThat(evaluator.effectiveInterval(thread, at("2024-05-06T18:00"))).isEqualTo(Duration.ofSeconds(900));
		assertThat(evaluator.matchingRule(thread, at("2024-05-06T10:00")))
				.hasValueSatisfying(r -> assertThat(r.interval()).isEqualTo(60));
	}

	@Test
	void testEffectiveInterval_InvalidTimeIgnored() {
		// Given
		MonitoredThread thread = scheduled(300, rule("9am", "17:00", 60, "weekdays"), rule("09:00", "17:00", 120));

		// When/Then
		assertThat(evaluator.effectiveInterval(thread, at("2024-05-06T10:00"))).isEqualTo(Duration.ofSeconds(300));
	}

	@Test
	void testEffectiveInterval_SecondsTruncated() {
		// Given
		MonitoredThread thread = scheduled(300, rule("09:00", "10:00", 60, "mon"));

		// When/Then
		assertThat(evaluator.effectiveInterval(thread, at("2024-05-06T09:59:59"))).isEqualTo(Duration.ofSeconds(60));
	}

	@Test
	void testInTimeRange() {
		assertThat(ScheduleEvaluator.inTimeRange("23:30", "22:00", "06:00")).isTrue();
		assertThat(ScheduleEvaluator.inTimeRange("05:59", "22:00", "06:00")).isTrue();
		assertThat(ScheduleEvaluator.inTimeRange("06:00", "22:00", "06:00")).isFalse();
		assertThat(ScheduleEvaluator.inTimeRange("12:00", "22:00", "06:00")).isFalse();
		assertThat(ScheduleEvaluator.inTimeRange("09:00", "09:00", "17:00")).isTrue();
		assertThat(ScheduleEvaluator.inTimeRange("17:00", "09:00", "17:00")).isFalse();
		assertThat(ScheduleEvaluator.inTimeRange("23:59", "00:00", "24:00")).isTrue();
		assertThat(ScheduleEvaluator.inTimeRange("8:05", "08:00", "09:00")).isTrue();
	}

	@Test
	void testExpandDays() {
		assertThat(ScheduleEvaluator.expandDays(1, List.of("weekdays")))
				.containsExactlyInAnyOrder(
						DayOfWeek.MONDAY, DayOfWeek.TUESDAY, DayOfWeek.WEDNESDAY, DayOfWeek.THURSDAY, DayOfWeek.FRIDAY);
		assertThat(ScheduleEvaluator.expandDays(1, List.of("Weekends")))
				.containsExactlyInAnyOrder(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY);
		assertThat(ScheduleEvaluator.expandDays(1, List.of("monday", "TUE", "someday")))
				.containsExactlyInAnyOrder(DayOfWeek.MONDAY, DayOfWeek.TUESDAY);
		assertThat(ScheduleEvaluator.expandDays(1, List.of())).isEmpty();
	}
}
