package dev.ngareminder;

import dev.ngareminder.config.JsonConfigStore;
import dev.ngareminder.crawler.FetchException;
import dev.ngareminder.crawler.FetchOrchestrator;
import dev.ngareminder.crawler.NgaThreadFetcher;
import dev.ngareminder.model.MonitoredThread;
import dev.ngareminder.monitor.MonitorLoop;
import dev.ngareminder.notifier.NotificationDispatcher;
import dev.ngareminder.util.HttpUtils;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Check threads once, ignoring their schedules */
@Command(
		name = "check",
		description = "Check the monitored threads once and report new posts",
		mixinStandardHelpOptions = true)
public class CheckCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Option(
			names = {"-c", "--config"},
			description = "Configuration file (default: config/config.json)",
			defaultValue = "config/config.json")
	private Path configFile;

	@Option(
			names = {"--tid"},
			description = "Thread id to check, may be repeated (default: all enabled threads)")
	private List<Long> tids;

	@Option(
			names = {"--save"},
			description = "Persist the new last seen post numbers to the configuration")
	private boolean save;

	@Override
	public Integer call() throws Exception {
		JsonConfigStore store;
		try {
			store = JsonConfigStore.load(configFile);
		} catch (IOException e) {
			logger.error("Failed to load configuration {}: {}", configFile.toAbsolutePath(), e.getMessage());
			return 1;
		}

		List<MonitoredThread> threads = store.snapshot().monitor().monitoredThreads().stream()
				.filter(t -> tids == null || tids.isEmpty() ? t.enabled() : tids.contains(t.tid()))
				.toList();
		if (threads.isEmpty()) {
			logger.warn("No threads to check");
			return 0;
		}

		HttpUtils httpUtils = new HttpUtils();
		NotificationDispatcher dispatcher =
				NotificationDispatcher.fromConfig(store.snapshot().notifier(), httpUtils);
		Map<Long, Long> lastSeen = new LinkedHashMap<>();
		int failed;

		int threadCount = Math.max(1, store.snapshot().monitor().fetchPostsParallelLimit());
		try (FetchOrchestrator orchestrator =
				new FetchOrchestrator(new NgaThreadFetcher(store, httpUtils), threadCount)) {
			failed = checkThreads(new MonitorLoop(store, orchestrator, dispatcher), threads, lastSeen);
		}

		logger.info("");
		logger.info("Checked: {}, failed: {}", threads.size() - failed, failed);

		if (save && !lastSeen.isEmpty()) {
			store.updateLastSeen(lastSeen);
			logger.info("Saved last seen post numbers to {}", store.configFile().toAbsolutePath());
		}
		return failed > 0 ? 1 : 0;
	}

	/**
	 * Check each thread once. A failing thread is logged and counted; the others still run.
	 *
	 * @param lastSeen receives the new maximum post number of every thread checked successfully
	 * @return number of threads whose check failed
	 */
	static int checkThreads(MonitorLoop monitor, List<MonitoredThread> threads, Map<Long, Long> lastSeen) {
		int failed = 0;
		for (MonitoredThread thread : threads) {
			try {
				long maxPostNumber = monitor.checkThread(thread);
				lastSeen.put(thread.tid(), maxPostNumber);
				logger.info("  {}: last seen #{} -> #{}", thread.tid(), thread.lastSeenPostNumber(), maxPostNumber);
			} catch (FetchException e) {
				logger.error("  {}: FAILED ({})", thread.tid(), e.getMessage());
				failed++;
			} catch (RuntimeException e) {
				logger.error("  {}: FAILED", thread.tid(), e);
				failed++;
			}
		}
		return failed;
	}
}
