package dev.ngareminder;

import dev.ngareminder.config.AppConfig;
import dev.ngareminder.config.JsonConfigStore;
import dev.ngareminder.crawler.FetchOrchestrator;
import dev.ngareminder.crawler.NgaThreadFetcher;
import dev.ngareminder.monitor.MonitorLoop;
import dev.ngareminder.notifier.NotificationDispatcher;
import dev.ngareminder.util.HttpUtils;
import dev.ngareminder.web.AdminServer;
import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Run the monitor and the admin endpoint until the process is stopped */
@Command(
		name = "run",
		description = "Start monitoring the configured threads",
		mixinStandardHelpOptions = true)
public class RunCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Option(
			names = {"-c", "--config"},
			description = "Configuration file (default: config/config.json)",
			defaultValue = "config/config.json")
	private Path configFile;

	@Option(
			names = {"--no-web"},
			description = "Do not start the admin web server")
	private boolean noWeb;

	@Override
	public Integer call() throws Exception {
		JsonConfigStore store;
		try {
			store = JsonConfigStore.load(configFile);
		} catch (IOException e) {
			logger.error("Failed to load configuration {}: {}", configFile.toAbsolutePath(), e.getMessage());
			return 1;
		}
		AppConfig config = store.snapshot();

		logger.info("NGA Reminder");
		logger.info("============");
		logger.info("Configuration: {}", store.configFile().toAbsolutePath());
		logger.info("Monitored threads: {}", config.monitor().monitoredThreads().size());
		logger.info("Parallel page fetches: {}", config.monitor().fetchPostsParallelLimit());
		logger.info("");

		HttpUtils httpUtils = new HttpUtils();
		NotificationDispatcher dispatcher = NotificationDispatcher.fromConfig(config.notifier(), httpUtils);

		int threadCount = Math.max(1, config.monitor().fetchPostsParallelLimit());
		try (FetchOrchestrator orchestrator =
				new FetchOrchestrator(new NgaThreadFetcher(store, httpUtils), threadCount)) {
			MonitorLoop monitor = new MonitorLoop(store, orchestrator, dispatcher);
			AdminServer adminServer = noWeb ? null : new AdminServer(config.webOrDefault(), store);
			if (adminServer != null) {
				adminServer.start();
			}

			Runtime.getRuntime()
					.addShutdownHook(new Thread(
							() -> {
								logger.info("Shutting down");
								monitor.stop();
								if (adminServer != null) {
									adminServer.stop();
								}
							},
							"shutdown"));

			monitor.run();
		}
		return 0;
	}
}
