package dev.ngareminder.config;

import dev.ngareminder.config.AppConfig.ConsoleConfig;
import dev.ngareminder.config.AppConfig.CrawlerConfig;
import dev.ngareminder.config.AppConfig.MonitorConfig;
import dev.ngareminder.config.AppConfig.NotifierConfig;
import dev.ngareminder.model.MonitoredThread;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * ConfigStore that keeps the configuration in memory. Records every watermark update and can be
 * told to fail writes.
 */
public class InMemoryConfigStore implements ConfigStore {
	private volatile AppConfig config;
	private final List<Map<Long, Long>> lastSeenUpdates = new ArrayList<>();
	private boolean failWrites;

	public InMemoryConfigStore(AppConfig config) {
		this.config = config;
	}

	public static InMemoryConfigStore withThreads(int parallelLimit, MonitoredThread... threads) {
		return new InMemoryConfigStore(new AppConfig(
				new CrawlerConfig("http://localhost/app_api.php", "uid", "cid", null, 5),
				new MonitorConfig(parallelLimit, 60, List.of(threads)),
				new NotifierConfig(null, new ConsoleConfig(false)),
				null));
	}

	public InMemoryConfigStore failingWrites() {
		this.failWrites = true;
		return this;
	}

	@Override
	public AppConfig snapshot() {
		return config;
	}

	@Override
	public synchronized void updateLastSeen(Map<Long, Long> tidToPostNumber) throws IOException {
		lastSeenUpdates.add(Map.copyOf(tidToPostNumber));
		config = config.withMonitor(config.monitor().withLastSeen(tidToPostNumber));
		if (failWrites) {
			throw new IOException("disk full");
		}
	}

	@Override
	public synchronized void updatePassportCredentials(String cid, String uid) throws IOException {
		if (failWrites) {
			throw new IOException("disk full");
		}
		config = config.withCrawler(config.crawler().withPassport(cid, uid));
	}

	public synchronized List<Map<Long, Long>> lastSeenUpdates() {
		return List.copyOf(lastSeenUpdates);
	}

	public long lastSeen(long tid) {
		return config.monitor().monitoredThreads().stream()
				.filter(t -> t.tid() == tid)
				.findFirst()
				.orElseThrow()
				.lastSeenPostNumber();
	}
}
