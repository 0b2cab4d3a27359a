package dev.ngareminder.crawler;

/** Failure to retrieve one page of a thread */
public class FetchException extends Exception {

	public enum Kind {
		/** Non-success HTTP status, or the request never got a response */
		TRANSPORT,
		/** The response payload lacks the success marker or does not have the expected shape */
		CONTENT,
		/** The calling thread was interrupted while waiting for the fetch */
		INTERRUPTED
	}

	private final Kind kind;
	private final int statusCode;
	private final String body;

	private FetchException(Kind kind, String message, int statusCode, String body, Throwable cause) {
		super(message, cause);
		this.kind = kind;
		this.statusCode = statusCode;
		this.body = body;
	}

	/**
	 * @param statusCode the HTTP status, or 0 when no response was received
	 */
	public static FetchException transport(int statusCode, Throwable cause) {
		String message = statusCode > 0
				? "HTTP request failed with status " + statusCode
				: "HTTP request failed: " + (cause != null ? cause.getMessage() : "no response");
		return new FetchException(Kind.TRANSPORT, message, statusCode, null, cause);
	}

	public static FetchException transport(int statusCode) {
		return transport(statusCode, null);
	}

	public static FetchException content(String body, Throwable cause) {
		return new FetchException(Kind.CONTENT, "Invalid response content: " + abbreviate(body), 0, body, cause);
	}

	public static FetchException interrupted(Throwable cause) {
		return new FetchException(Kind.INTERRUPTED, "Interrupted while fetching", 0, null, cause);
	}

	public Kind kind() {
		return kind;
	}

	public int statusCode() {
		return statusCode;
	}

	/** Raw response body for {@link Kind#CONTENT} failures */
	public String body() {
		return body;
	}

	private static String abbreviate(String body) {
		if (body == null) {
			return "<empty>";
		}
		return body.length() > 200 ? body.substring(0, 200) + "..." : body;
	}
}
