package dev.ngareminder.notifier;

/** A notification transport. Sends are best-effort and never retried. */
public interface Notifier {

	/** Short name used in log messages */
	String name();

	/**
	 * Send one notification.
	 *
	 * @param title notification title
	 * @param message notification body
	 * @param url link to the post, may be null
	 * @return true if the transport accepted the notification
	 */
	boolean send(String title, String message, String url);
}
