package dev.ngareminder.crawler;

import static dev.ngareminder.crawler.FakeThreadFetcher.page;
import static dev.ngareminder.crawler.FakeThreadFetcher.post;
import static dev.ngareminder.model.Threads.thread;
import static org.assertj.core.api.Assertions.*;

import dev.ngareminder.model.FetchedPage;
import java.util.List;
import org.junit.jupiter.api.Test;

class FetchOrchestratorTest {

	private static FakeThreadFetcher fetcherWithPages(long tid, int totalPages) {
		FakeThreadFetcher fetcher = new FakeThreadFetcher();
		for (int p = 1; p <= totalPages; p++) {
			fetcher.withPage(page(tid, p, totalPages, post(tid, p, (p - 1) * 20L, 1)));
		}
		return fetcher;
	}

	@Test
	void testStartPage() {
		assertThat(FetchOrchestrator.startPage(0)).isEqualTo(1);
		assertThat(FetchOrchestrator.startPage(19)).isEqualTo(1);
		assertThat(FetchOrchestrator.startPage(20)).isEqualTo(2);
		assertThat(FetchOrchestrator.startPage(40)).isEqualTo(3);
	}

	@Test
	void testFetchPages_FromWatermarkPage() throws Exception {
		// Given
		FakeThreadFetcher fetcher = fetcherWithPages(100, 5);

		try (FetchOrchestrator orchestrator = new FetchOrchestrator(fetcher, 4)) {
			// When
			List<FetchedPage> pages = orchestrator.fetchPages(thread(100, 40), 2);

			// Then
			assertThat(pages).extracting(FetchedPage::pageNumber).containsExactly(3, 4, 5);
			assertThat(fetcher.requestedPages()).first().isEqualTo(3);
		}
	}

	@Test
	void testFetchPages_SinglePage() throws Exception {
		// Given
		FakeThreadFetcher fetcher = fetcherWithPages(100, 3);

		try (FetchOrchestrator orchestrator = new FetchOrchestrator(fetcher, 4)) {
			// When
			List<FetchedPage> pages = orchestrator.fetchPages(thread(100, 45), 4);

			// Then
			assertThat(pages).extracting(FetchedPage::pageNumber).containsExactly(3);
			assertThat(fetcher.requestedPages()).containsExactly(3);
		}
	}

	@Test
	void testFetchPages_RespectsParallelLimit() throws Exception {
		// Given
		FakeThreadFetcher fetcher = fetcherWithPages(100, 11);
		for (int p = 2; p <= 11; p++) {
			fetcher.delayed(p, 50);
		}

		try (FetchOrchestrator orchestrator = new FetchOrchestrator(fetcher, 4)) {
			// When
			List<FetchedPage> pages = orchestrator.fetchPages(thread(100, 0), 2);

			// Then
			assertThat(pages).hasSize(11);
			assertThat(fetcher.maxInFlight()).isEqualTo(2);
		}
	}

	@Test
	void testFetchPages_WorkerThreadsBounded() throws Exception {
		// Given
		FakeThreadFetcher fetcher = fetcherWithPages(100, 201);
		String caller = Thread.currentThread().getName();

		try (FetchOrchestrator orchestrator = new FetchOrchestrator(fetcher, 2)) {
			// When
			List<FetchedPage> pages = orchestrator.fetchPages(thread(100, 0), 8);

			// Then
			assertThat(pages).hasSize(201);
			assertThat(fetcher.fetchingThreads())
					.filteredOn(name -> !name.equals(caller))
					.hasSizeLessThanOrEqualTo(2)
					.allMatch(name -> name.startsWith("page-fetch-"));
		}
	}

	@Test
	void testConstructor_InvalidThreadCount() {
		assertThatThrownBy(() -> new FetchOrchestrator(new FakeThreadFetcher(), 0))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void testFetchPages_SortedDespiteCompletionOrder() throws Exception {
		// Given
		FakeThreadFetcher fetcher = fetcherWithPages(100, 4).delayed(2, 200).delayed(3, 100);

		try (FetchOrchestrator orchestrator = new FetchOrchestrator(fetcher, 4)) {
			// When
			List<FetchedPage> pages = orchestrator.fetchPages(thread(100, 0), 3);

			// Then
			assertThat(pages).extracting(FetchedPage::pageNumber).containsExactly(1, 2, 3, 4);
		}
	}

	@Test
	void testFetchPages_FailedPageDropped() throws Exception {
		// Given
		FakeThreadFetcher fetcher = fetcherWithPages(100, 6).failing(4);

		try (FetchOrchestrator orchestrator = new FetchOrchestrator(fetcher, 4)) {
			// When
			List<FetchedPage> pages = orchestrator.fetchPages(thread(100, 20), 2);

			// Then
			assertThat(pages).extracting(FetchedPage::pageNumber).containsExactly(2, 3, 5, 6);
		}
	}

	@Test
	void testFetchPages_FirstPageFailureFailsCheck() {
		// Given
		FakeThreadFetcher fetcher = fetcherWithPages(100, 5).failing(3);

		try (FetchOrchestrator orchestrator = new FetchOrchestrator(fetcher, 4)) {
			// When/Then
			assertThatThrownBy(() -> orchestrator.fetchPages(thread(100, 40), 2))
					.isInstanceOfSatisfying(
							FetchException.class, e -> assertThat(e.kind()).isEqualTo(FetchException.Kind.TRANSPORT));
			assertThat(fetcher.requestedPages()).containsExactly(3);
		}
	}

	@Test
	void testFetchPages_InvalidLimit() {
		try (FetchOrchestrator orchestrator = new FetchOrchestrator(new FakeThreadFetcher(), 2)) {
			assertThatThrownBy(() -> orchestrator.fetchPages(thread(100, 0), 0))
					.isInstanceOf(IllegalArgumentException.class);
			assertThatThrownBy(() -> orchestrator.fetchPages(thread(100, 0), -1))
					.isInstanceOf(IllegalArgumentException.class);
		}
	}
}
