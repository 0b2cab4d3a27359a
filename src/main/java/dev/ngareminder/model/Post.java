package dev.ngareminder.model;

/**
 * A single post of a thread. {@code postNumber} is the floor number within the thread and is the
 * unit of the persisted watermark.
 */
public record Post(
		long tid,
		long pid,
		String content,
		String postDate,
		long postTimestamp,
		long postNumber,
		int page,
		long authorUid,
		String authorName,
		String threadTitle) {}
