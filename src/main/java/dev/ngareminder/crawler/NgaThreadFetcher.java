package dev.ngareminder.crawler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.ngareminder.config.AppConfig.CrawlerConfig;
import dev.ngareminder.config.ConfigStore;
import dev.ngareminder.model.FetchedPage;
import dev.ngareminder.model.Post;
import dev.ngareminder.util.HttpUtils;
import java.io.IOException;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ThreadFetcher} for the NGA app API ({@code app_api.php?__lib=post&__act=list}). Crawler
 * settings are read from the {@link ConfigStore} on every call so credentials updated through the
 * admin endpoint take effect on the next fetch.
 */
public class NgaThreadFetcher implements ThreadFetcher {
	private static final Logger logger = LoggerFactory.getLogger(NgaThreadFetcher.class);

	static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
	static final String DEFAULT_USER_AGENT =
			"Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/131.0.0.0 Safari/537.36";

	private final ConfigStore configStore;
	private final HttpUtils httpUtils;
	private final ObjectMapper mapper = new ObjectMapper();

	public NgaThreadFetcher(ConfigStore configStore, HttpUtils httpUtils) {
		this.configStore = configStore;
		this.httpUtils = httpUtils;
	}

	@Override
	public FetchedPage fetch(long tid, int page) throws FetchException {
		CrawlerConfig crawler = configStore.snapshot().crawler();
		Map<String, String> form = new LinkedHashMap<>();
		form.put("tid", Long.toString(tid));
		form.put("page", Integer.toString(page));
		Map<String, String> headers = Map.of(
				"Cookie",
				"ngaPassportUid=%s; ngaPassportCid=%s".formatted(crawler.ngaPassportUid(), crawler.ngaPassportCid()),
				"User-Agent",
				isBlank(crawler.userAgent()) ? DEFAULT_USER_AGENT : crawler.userAgent());
		Duration timeout = crawler.timeout() > 0 ? Duration.ofSeconds(crawler.timeout()) : DEFAULT_TIMEOUT;

		if (isBlank(crawler.apiUrl())) {
			throw FetchException.transport(0, new IllegalArgumentException("Crawler apiUrl is not configured"));
		}

		HttpResponse<String> response;
		try {
			response = httpUtils.postForm(crawler.apiUrl(), form, headers, timeout);
		} catch (IOException e) {
			throw FetchException.transport(0, e);
		} catch (IllegalArgumentException e) {
			logger.warn("Invalid crawler apiUrl {}: {}", crawler.apiUrl(), e.getMessage());
			throw FetchException.transport(0, e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw FetchException.interrupted(e);
		}

		if (!HttpUtils.isSuccess(response.statusCode())) {
			logger.warn("Failed to fetch thread {} page {}: HTTP status {}", tid, page, response.statusCode());
			throw FetchException.transport(response.statusCode());
		}
		return parsePage(tid, page, response.body());
	}

	/**
	 * Parse a page response. The payload must carry {@code code == 0} and every post its
	 * {@code pid}, {@code lou} and {@code author.uid}; anything else is reported as a content error
	 * with the raw body attached.
	 */
	FetchedPage parsePage(long tid, int page, String body) throws FetchException {
		JsonNode root;
		try {
			root = mapper.readTree(body);
		} catch (JsonProcessingException e) {
			throw FetchException.content(body, e);
		}
		if (root == null || !root.path("code").isIntegralNumber() || root.path("code").asLong() != 0) {
			logger.warn("Invalid response for thread {} page {}: {}", tid, page, body);
			throw FetchException.content(body, null);
		}
		JsonNode totalPage = root.get("totalPage");
		JsonNode result = root.get("result");
		if (totalPage == null || !totalPage.canConvertToInt() || result == null || !result.isArray()) {
			throw FetchException.content(body, null);
		}

		String title = root.path("tsubject").asText("");
		List<Post> posts = new ArrayList<>();
		for (JsonNode node : result) {
			JsonNode author = node.path("author");
			if (!isIntegral(node.get("pid")) || !isIntegral(node.get("lou")) || !isIntegral(author.get("uid"))) {
				logger.warn("Malformed post in thread {} page {}: {}", tid, page, node);
				throw FetchException.content(body, null);
			}
			posts.add(new Post(
					node.path("tid").asLong(tid),
					node.path("pid").asLong(),
					node.path("content").asText(""),
					node.path("postdate").asText(""),
					node.path("postdatetimestamp").asLong(),
					node.path("lou").asLong(),
					page,
					author.path("uid").asLong(),
					author.path("username").asText(""),
					title));
		}
		return new FetchedPage(tid, page, totalPage.asInt(), root.path("vrows").asLong(), title, posts);
	}

	private static boolean isIntegral(JsonNode node) {
		return node != null && node.isIntegralNumber();
	}

	private static boolean isBlank(String value) {
		return value == null || value.isBlank();
	}
}
