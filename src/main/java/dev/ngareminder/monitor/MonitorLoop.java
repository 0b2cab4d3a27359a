package dev.ngareminder.monitor;

import dev.ngareminder.config.AppConfig.MonitorConfig;
import dev.ngareminder.config.ConfigStore;
import dev.ngareminder.crawler.FetchException;
import dev.ngareminder.crawler.FetchOrchestrator;
import dev.ngareminder.model.FetchedPage;
import dev.ngareminder.model.MonitoredThread;
import dev.ngareminder.model.Post;
import dev.ngareminder.notifier.NotificationDispatcher;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ticking coordinator of the monitor. On every tick it checks each enabled thread that is due,
 * notifies about new posts of watched authors and persists the new watermarks in one batch.
 *
 * <p>Threads are checked one after another within a tick; only the pages of a single thread are
 * fetched in parallel. A thread counts as checked even when its check failed, so a broken thread
 * is retried at its normal interval rather than on every tick.
 */
public class MonitorLoop {
	private static final Logger logger = LoggerFactory.getLogger(MonitorLoop.class);

	static final Duration DEFAULT_MONITOR_DURATION = Duration.ofSeconds(60);

	private final ConfigStore configStore;
	private final FetchOrchestrator orchestrator;
	private final ScheduleEvaluator scheduleEvaluator;
	private final PostScanner postScanner;
	private final NotificationDispatcher dispatcher;
	private final Clock clock;

	// tid -> time of the last attempted check, reset on restart
	private final Map<Long, ZonedDateTime> lastChecked = new HashMap<>();
	private final CountDownLatch stopSignal = new CountDownLatch(1);

	public MonitorLoop(
			ConfigStore configStore,
			FetchOrchestrator orchestrator,
			ScheduleEvaluator scheduleEvaluator,
			PostScanner postScanner,
			NotificationDispatcher dispatcher,
			Clock clock) {
		this.configStore = configStore;
		this.orchestrator = orchestrator;
		this.scheduleEvaluator = scheduleEvaluator;
		this.postScanner = postScanner;
		this.dispatcher = dispatcher;
		this.clock = clock;
	}

	public MonitorLoop(ConfigStore configStore, FetchOrchestrator orchestrator, NotificationDispatcher dispatcher) {
		this(
				configStore,
				orchestrator,
				new ScheduleEvaluator(),
				new PostScanner(),
				dispatcher,
				Clock.systemDefaultZone());
	}

	/**
	 * Run ticks at the configured period until {@link #stop()} is called or the thread is
	 * interrupted. The first tick fires immediately. Ticks missed while a sweep overran are skipped,
	 * never replayed.
	 */
	public void run() {
		Duration period = tickPeriod(configStore.snapshot().monitor());
		logger.info("Started NGA monitor (every {}s)", period.toSeconds());

		Instant nextTick = clock.instant();
		while (stopSignal.getCount() > 0) {
			Duration wait = Duration.between(clock.instant(), nextTick);
			if (wait.compareTo(Duration.ZERO) > 0) {
				try {
					if (stopSignal.await(wait.toMillis(), TimeUnit.MILLISECONDS)) {
						break;
					}
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					logger.info("Monitor interrupted");
					break;
				}
				continue;
			}
			TickResult result = tick(ZonedDateTime.now(clock));
			logger.info("Check threads finished: {}", result);
			nextTick = nextTick(nextTick, period, clock.instant());
		}
		logger.info("Monitor stopped");
	}

	public void stop() {
		stopSignal.countDown();
	}

	/**
	 * One sweep over the configured threads.
	 *
	 * @param now the tick time, used for scheduling and recorded as the last check time
	 * @return counts and the watermarks handed to the config store
	 */
	public TickResult tick(ZonedDateTime now) {
		logger.info("Start check threads");
		List<MonitoredThread> threads = configStore.snapshot().monitor().monitoredThreads();
		Map<Long, Long> tidToMaxPostNumber = new LinkedHashMap<>();
		int checked = 0;
		int failed = 0;
		int skipped = 0;

		for (MonitoredThread thread : threads) {
			if (!thread.enabled()) {
				skipped++;
				continue;
			}
			if (!scheduleEvaluator.isDue(thread, lastChecked.get(thread.tid()), now)) {
				skipped++;
				continue;
			}
			try {
				long maxPostNumber = checkThread(thread);
				logger.info("Check thread finished, tid: {}, max_post_number: {}", thread.tid(), maxPostNumber);
				tidToMaxPostNumber.put(thread.tid(), maxPostNumber);
				checked++;
			} catch (FetchException e) {
				logger.warn("Monitor thread failed ({}): {}", thread.tid(), e.getMessage());
				failed++;
			} catch (RuntimeException e) {
				logger.error("Monitor thread failed ({})", thread.tid(), e);
				failed++;
			}
			lastChecked.put(thread.tid(), now);
		}

		if (!tidToMaxPostNumber.isEmpty()) {
			try {
				configStore.updateLastSeen(tidToMaxPostNumber);
			} catch (IOException e) {
				logger.error("Update post last seen failed: {}", e.getMessage(), e);
			}
		}
		return new TickResult(checked, failed, skipped, tidToMaxPostNumber);
	}

	/**
	 * Fetch, scan and notify for one thread.
	 *
	 * @return the highest post number seen, never below the thread's watermark
	 * @throws FetchException if the thread's current page could not be fetched
	 */
	public long checkThread(MonitoredThread thread) throws FetchException {
		MonitorConfig monitor = configStore.snapshot().monitor();
		List<FetchedPage> pages = orchestrator.fetchPages(thread, monitor.fetchPostsParallelLimit());
		PostScanner.ScanResult scan = postScanner.scan(thread, pages);
		for (Post post : scan.notifyList()) {
			logger.info("Collect notify post: tid={}, pid={}", post.tid(), post.pid());
			dispatcher.dispatch(post);
		}
		return scan.newMaxPostNumber();
	}

	/** Last check times, for inspection */
	Map<Long, ZonedDateTime> lastChecked() {
		return Map.copyOf(lastChecked);
	}

	static Duration tickPeriod(MonitorConfig monitor) {
		return monitor.monitorDuration() > 0 ? Duration.ofSeconds(monitor.monitorDuration()) : DEFAULT_MONITOR_DURATION;
	}

	/**
	 * The first period boundary after {@code previous} that is still in the future. Boundaries
	 * already passed are dropped.
	 */
	static Instant nextTick(Instant previous, Duration period, Instant now) {
		Instant next = previous.plus(period);
		if (next.isAfter(now)) {
			return next;
		}
		long missed = Duration.between(next, now).toNanos() / period.toNanos() + 1;
		logger.debug("Skipping {} missed tick(s)", missed);
		return next.plus(period.multipliedBy(missed));
	}
}
