package dev.ngareminder;

import dev.ngareminder.config.AppConfig;
import dev.ngareminder.config.JsonConfigStore;
import dev.ngareminder.model.MonitoredThread;
import dev.ngareminder.model.ScheduleRule;
import dev.ngareminder.monitor.ScheduleEvaluator;
import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Show which check interval applies to each thread at a given time */
@Command(
		name = "schedule",
		description = "Print the effective check interval of every monitored thread",
		mixinStandardHelpOptions = true)
public class ScheduleCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Option(
			names = {"-c", "--config"},
			description = "Configuration file (default: config/config.json)",
			defaultValue = "config/config.json")
	private Path configFile;

	@Option(
			names = {"--at"},
			description = "Local date-time to evaluate, e.g. 2024-05-04T23:30 (default: now)")
	private LocalDateTime at;

	@Override
	public Integer call() throws Exception {
		AppConfig config;
		try {
			config = JsonConfigStore.read(configFile);
		} catch (IOException e) {
			logger.error("Failed to load configuration {}: {}", configFile.toAbsolutePath(), e.getMessage());
			return 1;
		}
		if (config.monitor() == null) {
			logger.error("Configuration {} has no 'monitor' section", configFile.toAbsolutePath());
			return 1;
		}

		ZonedDateTime now = at != null ? at.atZone(ZoneId.systemDefault()) : ZonedDateTime.now();
		ScheduleEvaluator evaluator = new ScheduleEvaluator();
		logger.info("Schedule at {} ({})", now.toLocalDateTime(), now.getDayOfWeek());
		logger.info("");

		for (MonitoredThread thread : config.monitor().monitoredThreads()) {
			Optional<ScheduleRule> rule = evaluator.matchingRule(thread, now);
			String source = rule.map(r -> "rule " + r.startTime() + "-" + r.endTime()
							+ (r.description() != null ? " (" + r.description() + ")" : ""))
					.orElse("default");
			logger.info(
					"  {}{}: every {}s [{}]",
					thread.tid(),
					thread.enabled() ? "" : " (disabled)",
					evaluator.effectiveInterval(thread, now).toSeconds(),
					source);
		}
		return 0;
	}
}
