package dev.ngareminder.model;

import java.util.List;

/** One page of a thread as returned by a single fetch */
public record FetchedPage(long tid, int pageNumber, int totalPages, long totalPosts, String title, List<Post> posts) {

	public FetchedPage {
		posts = posts == null ? List.of() : List.copyOf(posts);
	}
}
