package dev.ngareminder.monitor;

import dev.ngareminder.model.FetchedPage;
import dev.ngareminder.model.MonitoredThread;
import dev.ngareminder.model.Post;
import java.util.ArrayList;
import java.util.List;

/**
 * Walks the fetched pages of one thread once, tracking the highest post number and collecting the
 * posts of watched authors above the thread's previous watermark.
 */
public class PostScanner {

	/** Outcome of a scan: the new watermark and the posts to notify, in scan order */
	public record ScanResult(long newMaxPostNumber, List<Post> notifyList) {}

	/**
	 * @param thread the thread as configured before this sweep
	 * @param orderedPages pages in ascending page order
	 */
	public ScanResult scan(MonitoredThread thread, List<FetchedPage> orderedPages) {
		long watermark = thread.lastSeenPostNumber();
		long maxPostNumber = watermark;
		List<Post> notifyList = new ArrayList<>();
		for (FetchedPage page : orderedPages) {
			for (Post post : page.posts()) {
				maxPostNumber = Math.max(maxPostNumber, post.postNumber());
				if (post.postNumber() > watermark && thread.watches(post.authorUid())) {
					notifyList.add(post);
				}
			}
		}
		return new ScanResult(maxPostNumber, List.copyOf(notifyList));
	}
}
