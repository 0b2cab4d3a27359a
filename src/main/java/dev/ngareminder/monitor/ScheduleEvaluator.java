package dev.ngareminder.monitor;

import dev.ngareminder.model.MonitoredThread;
import dev.ngareminder.model.ScheduleRule;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a thread is due for a check and at which interval.
 *
 * <p>A thread's schedule rules are evaluated in list order and the first rule whose days contain
 * today and whose time window contains the current local time (minute precision) supplies the
 * interval. Without a match the thread's own interval applies, or {@link #DEFAULT_CHECK_INTERVAL}
 * when that is zero.
 */
public class ScheduleEvaluator {
	private static final Logger logger = LoggerFactory.getLogger(ScheduleEvaluator.class);

	public static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofSeconds(300);

	private static final Set<DayOfWeek> WEEKDAYS = EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY);
	private static final Set<DayOfWeek> WEEKENDS = EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY);
	private static final DateTimeFormatter CLOCK = DateTimeFormatter.ofPattern("H:mm");
	private static final String END_OF_DAY = "24:00";

	/**
	 * @param lastCheckedAt time of the previous check, or null if the thread was never checked
	 * @return true if the thread should be checked at {@code now}
	 */
	public boolean isDue(MonitoredThread thread, ZonedDateTime lastCheckedAt, ZonedDateTime now) {
		if (lastCheckedAt == null) {
			return true;
		}
		return now.isAfter(lastCheckedAt.plus(effectiveInterval(thread, now)));
	}

	public Duration effectiveInterval(MonitoredThread thread, ZonedDateTime now) {
		Duration defaultInterval = defaultInterval(thread);
		if (!thread.hasSchedule()) {
			return defaultInterval;
		}
		return matchingRule(thread, now)
				.map(rule -> Duration.ofSeconds(rule.interval()))
				.orElse(defaultInterval);
	}

	/** The first rule of the thread's schedule that applies at {@code now} */
	public Optional<ScheduleRule> matchingRule(MonitoredThread thread, ZonedDateTime now) {
		if (!thread.hasSchedule()) {
			return Optional.empty();
		}
		DayOfWeek today = now.getDayOfWeek();
		LocalTime clock = now.toLocalTime().truncatedTo(ChronoUnit.MINUTES);
		for (ScheduleRule rule : thread.checkSchedule()) {
			if (!expandDays(thread.tid(), rule.days()).contains(today)) {
				continue;
			}
			try {
				if (inTimeRange(clock, parseClock(rule.startTime()), parseClock(rule.endTime()))) {
					return Optional.of(rule);
				}
			} catch (DateTimeParseException e) {
				logger.warn(
						"Ignoring schedule rule with invalid time window {}-{}: tid={}",
						rule.startTime(),
						rule.endTime(),
						thread.tid());
			}
		}
		return Optional.empty();
	}

	public static Duration defaultInterval(MonitoredThread thread) {
		return thread.checkInterval() > 0 ? Duration.ofSeconds(thread.checkInterval()) : DEFAULT_CHECK_INTERVAL;
	}

	/**
	 * Check whether a clock time lies in a window. {@code start <= end} is the half-open window
	 * {@code [start, end)}; otherwise the window wraps midnight.
	 *
	 * @param current "HH:MM"
	 * @param start "HH:MM"
	 * @param end "HH:MM", "24:00" is the end of the day
	 */
	public static boolean inTimeRange(String current, String start, String end) {
		return inTimeRange(parseClock(current), parseClock(start), parseClock(end));
	}

	static boolean inTimeRange(LocalTime current, LocalTime start, LocalTime end) {
		if (!start.isAfter(end)) {
			return !current.isBefore(start) && current.isBefore(end);
		}
		return !current.isBefore(start) || current.isBefore(end);
	}

	/**
	 * Expand day tokens into weekdays. Accepts "weekdays", "weekends", full weekday names and
	 * three-letter abbreviations, case-insensitively. Unknown tokens are logged and skipped.
	 */
	public static Set<DayOfWeek> expandDays(long tid, List<String> tokens) {
		Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
		for (String token : tokens) {
			String day = token == null ? "" : token.trim().toLowerCase(Locale.ROOT);
			switch (day) {
				case "weekdays" -> days.addAll(WEEKDAYS);
				case "weekends" -> days.addAll(WEEKENDS);
				default -> {
					Optional<DayOfWeek> parsed = parseDay(day);
					if (parsed.isPresent()) {
						days.add(parsed.get());
					} else {
						logger.warn("Error parsing weekday '{}': tid={}", token, tid);
					}
				}
			}
		}
		return days;
	}

	static Optional<DayOfWeek> parseDay(String token) {
		for (DayOfWeek day : DayOfWeek.values()) {
			String name = day.name().toLowerCase(Locale.ROOT);
			if (name.equals(token) || name.substring(0, 3).equals(token)) {
				return Optional.of(day);
			}
		}
		return Optional.empty();
	}

	static LocalTime parseClock(String text) {
		if (text == null) {
			throw new DateTimeParseException("Missing time", "", 0);
		}
		String trimmed = text.trim();
		if (END_OF_DAY.equals(trimmed)) {
			return LocalTime.MAX;
		}
		return LocalTime.parse(trimmed, CLOCK);
	}
}
