package dev.ngareminder.notifier;

import dev.ngareminder.config.AppConfig.NotifierConfig;
import dev.ngareminder.model.Post;
import dev.ngareminder.util.HttpUtils;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans a post out to every configured {@link Notifier}. Each notifier is tried independently; a
 * failing notifier is logged and never affects the others or the caller.
 */
public class NotificationDispatcher {
	private static final Logger logger = LoggerFactory.getLogger(NotificationDispatcher.class);

	private final List<Notifier> notifiers;

	public NotificationDispatcher(List<Notifier> notifiers) {
		this.notifiers = List.copyOf(notifiers);
	}

	/** Build the notifiers present in the configuration, Bark first, then console */
	public static NotificationDispatcher fromConfig(NotifierConfig config, HttpUtils httpUtils) {
		List<Notifier> notifiers = new ArrayList<>();
		if (config.bark() != null) {
			notifiers.add(new BarkNotifier(config.bark(), httpUtils));
		}
		if (config.console() != null) {
			notifiers.add(new ConsoleNotifier(config.console()));
		}
		if (notifiers.isEmpty()) {
			logger.warn("No notifiers configured, new posts will only be logged");
		}
		return new NotificationDispatcher(notifiers);
	}

	public List<Notifier> notifiers() {
		return notifiers;
	}

	/**
	 * Notify about a post.
	 *
	 * @param post the qualifying post
	 * @return number of notifiers that accepted the notification
	 */
	public int dispatch(Post post) {
		return dispatch(toEvent(post));
	}

	public NotificationEvent toEvent(Post post) {
		return NotificationEvent.of(post);
	}

	public int dispatch(NotificationEvent event) {
		logger.info(
				"Notifying post: tid={}, pid={}, #{} by {}",
				event.post().tid(),
				event.post().pid(),
				event.post().postNumber(),
				event.post().authorName());
		int delivered = 0;
		for (Notifier notifier : notifiers) {
			try {
				if (notifier.send(event.title(), event.message(), event.url())) {
					delivered++;
				} else {
					logger.debug("Notifier {} did not deliver pid {}", notifier.name(), event.post().pid());
				}
			} catch (RuntimeException e) {
				logger.error("Notifier {} failed for pid {}", notifier.name(), event.post().pid(), e);
			}
		}
		return delivered;
	}
}
