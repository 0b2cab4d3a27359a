package dev.ngareminder.util;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

/** Utility class for HTTP operations. Requests are sent once; callers decide what a failure means. */
public class HttpUtils {

	private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

	private final HttpClient httpClient;

	public HttpUtils() {
		this.httpClient = HttpClient.newBuilder()
				.followRedirects(HttpClient.Redirect.NORMAL)
				.connectTimeout(CONNECT_TIMEOUT)
				.build();
	}

	/**
	 * POST an {@code application/x-www-form-urlencoded} body.
	 *
	 * @param url target URL
	 * @param form form fields, encoded in iteration order
	 * @param headers extra request headers
	 * @param timeout request timeout
	 * @return the response, whatever its status code
	 */
	public HttpResponse<String> postForm(String url, Map<String, String> form, Map<String, String> headers, Duration timeout)
			throws IOException, InterruptedException {
		HttpRequest.Builder builder = request(url, timeout)
				.header("Content-Type", "application/x-www-form-urlencoded")
				.POST(HttpRequest.BodyPublishers.ofString(encodeForm(form)));
		headers.forEach(builder::header);
		return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
	}

	/**
	 * POST a JSON document.
	 *
	 * @param url target URL
	 * @param json serialized JSON body
	 * @param timeout request timeout
	 * @return the response, whatever its status code
	 */
	public HttpResponse<String> postJson(String url, String json, Duration timeout)
			throws IOException, InterruptedException {
		HttpRequest request = request(url, timeout)
				.header("Content-Type", "application/json; charset=utf-8")
				.POST(HttpRequest.BodyPublishers.ofString(json))
				.build();
		return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
	}

	public static boolean isSuccess(int statusCode) {
		return statusCode >= 200 && statusCode < 300;
	}

	static String encodeForm(Map<String, String> form) {
		return form.entrySet().stream()
				.map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
						+ URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
				.collect(Collectors.joining("&"));
	}

	private HttpRequest.Builder request(String url, Duration timeout) {
		return HttpRequest.newBuilder().uri(URI.create(url)).timeout(timeout);
	}
}
