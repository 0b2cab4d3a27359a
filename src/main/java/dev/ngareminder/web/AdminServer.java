package dev.ngareminder.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import dev.ngareminder.config.AppConfig.WebConfig;
import dev.ngareminder.config.ConfigStore;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Small administrative HTTP endpoint. {@code POST /api/passport} replaces the NGA passport
 * credentials in the configuration; the crawler picks them up on its next request.
 */
public class AdminServer {
	private static final Logger logger = LoggerFactory.getLogger(AdminServer.class);

	static final String PASSPORT_PATH = "/api/passport";

	private static final ObjectMapper objectMapper = JsonMapper.builder()
			.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
			.build();

	private final WebConfig webConfig;
	private final ConfigStore configStore;

	private HttpServer server;
	private ExecutorService executor;

	public AdminServer(WebConfig webConfig, ConfigStore configStore) {
		this.webConfig = webConfig;
		this.configStore = configStore;
	}

	/** Request body of the passport endpoint */
	record PassportRequest(@JsonProperty("cid") String cid, @JsonProperty("uid") String uid) {}

	/** Response envelope; exactly one of message and error is set */
	@JsonInclude(JsonInclude.Include.NON_NULL)
	record ApiResponse(
			@JsonProperty("success") boolean success,
			@JsonProperty("message") String message,
			@JsonProperty("error") String error) {

		static ApiResponse ok(String message) {
			return new ApiResponse(true, message, null);
		}

		static ApiResponse failure(String error) {
			return new ApiResponse(false, null, error);
		}
	}

	public synchronized void start() throws IOException {
		if (server != null) {
			throw new IllegalStateException("Admin server already started");
		}
		server = HttpServer.create(new InetSocketAddress(webConfig.host(), webConfig.port()), 0);
		server.createContext(PASSPORT_PATH, this::handlePassport);
		executor = Executors.newFixedThreadPool(2, r -> {
			Thread t = new Thread(r, "admin-http");
			t.setDaemon(true);
			return t;
		});
		server.setExecutor(executor);
		server.start();
		logger.info("Web server listening on {}:{}", webConfig.host(), port());
	}

	public synchronized void stop() {
		if (server == null) {
			return;
		}
		server.stop(1);
		executor.shutdownNow();
		server = null;
		executor = null;
		logger.info("Web server stopped");
	}

	/** The bound port, which differs from the configured one when that is 0 */
	public synchronized int port() {
		if (server == null) {
			throw new IllegalStateException("Admin server not started");
		}
		return server.getAddress().getPort();
	}

	void handlePassport(HttpExchange exchange) throws IOException {
		try {
			exchange.getResponseHeaders().add("Access-Control-Allow-Origin", "*");
			String method = exchange.getRequestMethod();
			if ("OPTIONS".equalsIgnoreCase(method)) {
				exchange.getResponseHeaders().add("Access-Control-Allow-Methods", "POST, OPTIONS");
				exchange.getResponseHeaders().add("Access-Control-Allow-Headers", "*");
				exchange.sendResponseHeaders(204, -1);
				return;
			}
			if (!"POST".equalsIgnoreCase(method)) {
				exchange.getResponseHeaders().add("Allow", "POST, OPTIONS");
				respond(exchange, 405, ApiResponse.failure("Method not allowed: " + method));
				return;
			}

			PassportRequest request;
			try (InputStream in = exchange.getRequestBody()) {
				request = objectMapper.readValue(in, PassportRequest.class);
			} catch (JsonProcessingException e) {
				logger.warn("Rejected passport update: {}", e.getOriginalMessage());
				respond(exchange, 400, ApiResponse.failure("Invalid request body: " + e.getOriginalMessage()));
				return;
			}
			if (request == null || isBlank(request.cid()) || isBlank(request.uid())) {
				respond(exchange, 400, ApiResponse.failure("Both 'cid' and 'uid' are required"));
				return;
			}

			try {
				configStore.updatePassportCredentials(request.cid(), request.uid());
				respond(exchange, 200, ApiResponse.ok("Passport updated successfully"));
			} catch (IOException e) {
				logger.error("Failed to update passport: {}", e.getMessage(), e);
				respond(exchange, 500, ApiResponse.failure("Failed to update passport: " + e.getMessage()));
			}
		} finally {
			exchange.close();
		}
	}

	private static void respond(HttpExchange exchange, int status, ApiResponse response) throws IOException {
		byte[] body = objectMapper.writeValueAsBytes(response);
		exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
		exchange.sendResponseHeaders(status, body.length);
		try (OutputStream out = exchange.getResponseBody()) {
			out.write(body);
		}
	}

	private static boolean isBlank(String value) {
		return value == null || value.isBlank();
	}
}
