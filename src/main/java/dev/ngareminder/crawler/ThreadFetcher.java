package dev.ngareminder.crawler;

import dev.ngareminder.model.FetchedPage;

/** Retrieves a single page of a forum thread */
@FunctionalInterface
public interface ThreadFetcher {

	/**
	 * Fetch one page.
	 *
	 * @param tid thread id
	 * @param page 1-based page number
	 * @return the page with its posts and the thread's total page count
	 * @throws FetchException if the page could not be retrieved or understood
	 */
	FetchedPage fetch(long tid, int page) throws FetchException;
}
