package dev.ngareminder.config;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ConfigStore} backed by a single JSON file. The monitor loop (watermarks) and the admin
 * endpoint (credentials) both mutate it, so every mutation runs under one lock: mutate the
 * in-memory snapshot, serialize, rewrite the whole file.
 */
public class JsonConfigStore implements ConfigStore {
	private static final Logger logger = LoggerFactory.getLogger(JsonConfigStore.class);

	private static final ObjectMapper readMapper = JsonMapper.builder()
			.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
			.build();

	private static final ObjectMapper writeMapper = JsonMapper.builder()
			.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false)
			.enable(SerializationFeature.INDENT_OUTPUT)
			.build();

	private final Path configFile;
	private final ReentrantLock fileLock = new ReentrantLock();
	private volatile AppConfig config;

	JsonConfigStore(Path configFile, AppConfig config) {
		this.configFile = configFile;
		this.config = config;
	}

	/**
	 * Load the configuration file.
	 *
	 * @param configFile path of the JSON document
	 * @return a store holding the loaded configuration
	 * @throws IOException if the file is missing or not a valid configuration
	 */
	public static JsonConfigStore load(Path configFile) throws IOException {
		AppConfig config = read(configFile);
		if (config.crawler() == null || config.monitor() == null) {
			throw new IOException("Configuration " + configFile + " must contain 'crawler' and 'monitor' sections");
		}
		logger.info(
				"Loaded configuration from {} ({} monitored threads)",
				configFile.toAbsolutePath(),
				config.monitor().monitoredThreads().size());
		return new JsonConfigStore(configFile, config);
	}

	public static AppConfig read(Path configFile) throws IOException {
		return readMapper.readValue(configFile.toFile(), AppConfig.class);
	}

	public static void write(Path configFile, AppConfig config) throws IOException {
		try (var writer = Files.newBufferedWriter(configFile)) {
			writeMapper.writeValue(writer, config);
			writer.write("\n");
		}
	}

	public Path configFile() {
		return configFile;
	}

	@Override
	public AppConfig snapshot() {
		return config;
	}

	@Override
	public void updateLastSeen(Map<Long, Long> tidToPostNumber) throws IOException {
		mutate(current -> current.withMonitor(current.monitor().withLastSeen(tidToPostNumber)));
		logger.debug("Persisted last seen post numbers: {}", tidToPostNumber);
	}

	@Override
	public void updatePassportCredentials(String cid, String uid) throws IOException {
		mutate(current -> current.withCrawler(current.crawler().withPassport(cid, uid)));
		logger.info("Updated passport credentials for uid {}", uid);
	}

	private void mutate(UnaryOperator<AppConfig> mutation) throws IOException {
		fileLock.lock();
		try {
			AppConfig updated = mutation.apply(config);
			// in-memory state advances even if the write below fails
			config = updated;
			write(configFile, updated);
		} finally {
			fileLock.unlock();
		}
	}
}
