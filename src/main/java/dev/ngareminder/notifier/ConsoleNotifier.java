package dev.ngareminder.notifier;

import dev.ngareminder.config.AppConfig.ConsoleConfig;
import java.io.PrintStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Prints notifications as a banner block to the console */
public class ConsoleNotifier implements Notifier {
	private static final Logger logger = LoggerFactory.getLogger(ConsoleNotifier.class);
	private static final String SEPARATOR = "=".repeat(80);

	private final ConsoleConfig config;
	private final PrintStream out;

	public ConsoleNotifier(ConsoleConfig config) {
		this(config, System.out);
	}

	public ConsoleNotifier(ConsoleConfig config, PrintStream out) {
		this.config = config;
		this.out = out;
	}

	@Override
	public String name() {
		return "console";
	}

	@Override
	public boolean send(String title, String message, String url) {
		if (!config.enabled()) {
			logger.debug("Console notifier is disabled, skipping notification");
			return false;
		}
		out.println();
		out.println(SEPARATOR);
		out.println("NOTIFICATION");
		out.println(SEPARATOR);
		out.println("Title: " + title);
		out.println("Message: " + message);
		if (url != null && !url.isEmpty()) {
			out.println("URL: " + url);
		}
		out.flush();
		return true;
	}
}
