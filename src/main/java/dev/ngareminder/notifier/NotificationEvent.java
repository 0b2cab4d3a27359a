package dev.ngareminder.notifier;

import dev.ngareminder.model.Post;

/** A qualifying post together with the text handed to every notifier */
public record NotificationEvent(Post post, String title, String message, String url) {

	static final String THREAD_URL = "https://nga.178.com/read.php?tid=%d&page=%d#pid%dAnchor";

	public static NotificationEvent of(Post post) {
		return new NotificationEvent(
				post,
				"New Post: " + post.threadTitle(),
				"%s (#%d):\n%s...".formatted(post.authorName(), post.postNumber(), post.content()),
				THREAD_URL.formatted(post.tid(), post.page(), post.pid()));
	}
}
