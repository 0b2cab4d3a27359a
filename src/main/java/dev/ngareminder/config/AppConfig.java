package dev.ngareminder.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import dev.ngareminder.model.MonitoredThread;
import java.util.List;
import java.util.Map;

/** Root of the JSON configuration document. Instances are immutable snapshots. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"crawler", "monitor", "notifier", "web"})
public record AppConfig(
		@JsonProperty("crawler") CrawlerConfig crawler,
		@JsonProperty("monitor") MonitorConfig monitor,
		@JsonProperty("notifier") NotifierConfig notifier,
		@JsonProperty("web") WebConfig web) {

	public AppConfig {
		if (notifier == null) {
			notifier = new NotifierConfig(null, null);
		}
	}

	/** Web settings, falling back to the defaults when the section is absent */
	public WebConfig webOrDefault() {
		return web != null ? web : WebConfig.DEFAULT;
	}

	public AppConfig withCrawler(CrawlerConfig crawler) {
		return new AppConfig(crawler, monitor, notifier, web);
	}

	public AppConfig withMonitor(MonitorConfig monitor) {
		return new AppConfig(crawler, monitor, notifier, web);
	}

	@JsonInclude(JsonInclude.Include.NON_NULL)
	@JsonPropertyOrder({"apiUrl", "ngaPassportUid", "ngaPassportCid", "userAgent", "timeout"})
	public record CrawlerConfig(
			@JsonProperty("apiUrl") String apiUrl,
			@JsonProperty("ngaPassportUid") String ngaPassportUid,
			@JsonProperty("ngaPassportCid") String ngaPassportCid,
			@JsonProperty("userAgent") String userAgent,
			@JsonProperty("timeout") long timeout) {

		public CrawlerConfig withPassport(String cid, String uid) {
			return new CrawlerConfig(apiUrl, uid, cid, userAgent, timeout);
		}
	}

	@JsonInclude(JsonInclude.Include.NON_NULL)
	@JsonPropertyOrder({"fetchPostsParallelLimit", "monitorDuration", "monitoredThreads"})
	public record MonitorConfig(
			@JsonProperty("fetchPostsParallelLimit") int fetchPostsParallelLimit,
			@JsonProperty("monitorDuration") long monitorDuration,
			@JsonProperty("monitoredThreads") List<MonitoredThread> monitoredThreads) {

		public MonitorConfig {
			monitoredThreads = monitoredThreads == null ? List.of() : List.copyOf(monitoredThreads);
		}

		/**
		 * Apply new watermarks. Unknown tids are ignored and a watermark is never lowered.
		 *
		 * @param tidToPostNumber new maximum post number per thread id
		 * @return the updated monitor configuration
		 */
		public MonitorConfig withLastSeen(Map<Long, Long> tidToPostNumber) {
			List<MonitoredThread> updated = monitoredThreads.stream()
					.map(t -> {
						Long lastSeen = tidToPostNumber.get(t.tid());
						if (lastSeen == null || lastSeen <= t.lastSeenPostNumber()) {
							return t;
						}
						return t.withLastSeenPostNumber(lastSeen);
					})
					.toList();
			return new MonitorConfig(fetchPostsParallelLimit, monitorDuration, updated);
		}
	}

	@JsonInclude(JsonInclude.Include.NON_NULL)
	@JsonPropertyOrder({"bark", "console"})
	public record NotifierConfig(@JsonProperty("bark") BarkConfig bark, @JsonProperty("console") ConsoleConfig console) {}

	@JsonInclude(JsonInclude.Include.NON_NULL)
	@JsonPropertyOrder({"enabled", "serverUrl", "deviceKey", "barkGroup"})
	public record BarkConfig(
			@JsonProperty("enabled") boolean enabled,
			@JsonProperty("serverUrl") String serverUrl,
			@JsonProperty("deviceKey") String deviceKey,
			@JsonProperty("barkGroup") String barkGroup) {}

	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record ConsoleConfig(@JsonProperty("enabled") boolean enabled) {}

	@JsonInclude(JsonInclude.Include.NON_NULL)
	@JsonPropertyOrder({"host", "port"})
	public record WebConfig(@JsonProperty("host") String host, @JsonProperty("port") int port) {
		public static final WebConfig DEFAULT = new WebConfig("127.0.0.1", 8080);
	}
}
