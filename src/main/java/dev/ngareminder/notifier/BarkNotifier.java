package dev.ngareminder.notifier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.ngareminder.config.AppConfig.BarkConfig;
import dev.ngareminder.util.HttpUtils;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pushes notifications to a Bark server. The endpoint is the configured server URL resolved against
 * the device key; the body is {@code {title, body, url?, group}}.
 */
public class BarkNotifier implements Notifier {
	private static final Logger logger = LoggerFactory.getLogger(BarkNotifier.class);

	static final Duration TIMEOUT = Duration.ofSeconds(5);
	static final String DEFAULT_GROUP = "NGA Reminder";

	private final BarkConfig config;
	private final HttpUtils httpUtils;
	private final ObjectMapper mapper = new ObjectMapper();

	public BarkNotifier(BarkConfig config, HttpUtils httpUtils) {
		this.config = config;
		this.httpUtils = httpUtils;
	}

	@Override
	public String name() {
		return "bark";
	}

	@Override
	public boolean send(String title, String message, String url) {
		if (!config.enabled()) {
			logger.debug("Bark notifier is disabled, skipping notification");
			return false;
		}
		String endpoint = endpoint();
		if (endpoint == null) {
			return false;
		}

		Map<String, String> body = new LinkedHashMap<>();
		body.put("title", title);
		body.put("body", message);
		if (url != null && !url.isEmpty()) {
			body.put("url", url);
		}
		body.put("group", isBlank(config.barkGroup()) ? DEFAULT_GROUP : config.barkGroup());

		try {
			HttpResponse<String> response = httpUtils.postJson(endpoint, mapper.writeValueAsString(body), TIMEOUT);
			if (HttpUtils.isSuccess(response.statusCode())) {
				return true;
			}
			logger.warn("Bark notification failed with status {}: {}", response.statusCode(), response.body());
		} catch (JsonProcessingException e) {
			logger.error("Failed to serialize Bark notification", e);
		} catch (IOException e) {
			logger.warn("Error sending Bark notification: {}", e.getMessage());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.warn("Interrupted while sending Bark notification");
		}
		return false;
	}

	String endpoint() {
		if (isBlank(config.serverUrl()) || isBlank(config.deviceKey())) {
			logger.warn("Bark server URL or device key missing, skipping notification");
			return null;
		}
		try {
			URI server = URI.create(config.serverUrl());
			if (!server.isAbsolute()) {
				logger.warn("Invalid Bark server URL: {}, skipping notification", config.serverUrl());
				return null;
			}
			return server.resolve(config.deviceKey()).toString();
		} catch (IllegalArgumentException e) {
			logger.warn(
					"Invalid Bark server URL or device key: {} / {}, skipping notification",
					config.serverUrl(),
					config.deviceKey());
			return null;
		}
	}

	private static boolean isBlank(String value) {
		return value == null || value.isBlank();
	}
}
