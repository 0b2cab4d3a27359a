package dev.ngareminder.crawler;

import dev.ngareminder.model.FetchedPage;
import dev.ngareminder.model.MonitoredThread;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retrieves the pages of a thread that may hold posts beyond its watermark.
 *
 * <p>The page holding the watermark is fetched first to learn the total page count; a failure there
 * fails the whole check. The remaining pages are fetched in parallel, never more than the given
 * limit at once and never on more threads than the shared pool holds. A page that fails is logged
 * and dropped. Results are returned in ascending page order regardless of completion order.
 */
public class FetchOrchestrator implements AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(FetchOrchestrator.class);

	public static final int POSTS_PER_PAGE = 20;

	private final ThreadFetcher fetcher;
	private final ExecutorService executorService;

	/**
	 * @param fetcher page source
	 * @param threadCount size of the worker pool shared by all calls
	 */
	public FetchOrchestrator(ThreadFetcher fetcher, int threadCount) {
		if (threadCount <= 0) {
			throw new IllegalArgumentException("Thread count must be positive: " + threadCount);
		}
		this.fetcher = fetcher;
		this.executorService = Executors.newFixedThreadPool(threadCount, new FetchThreadFactory());
	}

	/** Page holding the post right after the given watermark */
	public static int startPage(long lastSeenPostNumber) {
		return (int) (lastSeenPostNumber / POSTS_PER_PAGE) + 1;
	}

	/**
	 * Fetch the current page and every later page of a thread.
	 *
	 * @param thread the thread to fetch, its watermark decides the first page
	 * @param parallelLimit maximum number of page fetches in flight at once
	 * @return the fetched pages sorted by page number
	 * @throws FetchException if the first page could not be fetched
	 */
	public List<FetchedPage> fetchPages(MonitoredThread thread, int parallelLimit) throws FetchException {
		if (parallelLimit <= 0) {
			throw new IllegalArgumentException("Parallel fetch limit must be positive: " + parallelLimit);
		}
		long tid = thread.tid();
		int startPage = startPage(thread.lastSeenPostNumber());
		logger.info("Checking thread {} from page {} (last seen #{})", tid, startPage, thread.lastSeenPostNumber());

		FetchedPage current = fetcher.fetch(tid, startPage);
		List<FetchedPage> pages = new ArrayList<>();
		pages.add(current);

		int totalPages = current.totalPages();
		if (totalPages > startPage) {
			// One semaphore per call caps each thread independently; permits are taken before
			// submitting so no more than parallelLimit tasks of this call are queued or running
			Semaphore permits = new Semaphore(parallelLimit);
			List<Future<FetchedPage>> futures = new ArrayList<>();
			try {
				for (int page = startPage + 1; page <= totalPages; page++) {
					int pageNumber = page;
					permits.acquire();
					try {
						futures.add(executorService.submit(() -> fetchAndRelease(permits, tid, pageNumber)));
					} catch (RejectedExecutionException e) {
						permits.release();
						throw e;
					}
				}

				for (int i = 0; i < futures.size(); i++) {
					int pageNumber = startPage + 1 + i;
					try {
						pages.add(futures.get(i).get());
					} catch (ExecutionException e) {
						logger.warn(
								"Dropping page {} of thread {}: {}", pageNumber, tid, e.getCause().getMessage());
					}
				}
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				futures.forEach(f -> f.cancel(true));
				throw FetchException.interrupted(e);
			}
		}

		pages.sort(Comparator.comparingInt(FetchedPage::pageNumber));
		logger.debug("Fetched {} of {} pages for thread {}", pages.size(), totalPages - startPage + 1, tid);
		return pages;
	}

	private FetchedPage fetchAndRelease(Semaphore permits, long tid, int page) throws FetchException {
		try {
			logger.debug("Fetching thread {} page {}", tid, page);
			return fetcher.fetch(tid, page);
		} finally {
			permits.release();
		}
	}

	@Override
	public void close() {
		executorService.shutdown();
		try {
			if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
				executorService.shutdownNow();
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			executorService.shutdownNow();
		}
	}

	private static class FetchThreadFactory implements ThreadFactory {
		private final AtomicInteger counter = new AtomicInteger();

		@Override
		public Thread newThread(Runnable r) {
			Thread thread = new Thread(r, "page-fetch-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		}
	}
}
