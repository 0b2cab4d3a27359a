package dev.ngareminder.config;

import java.io.IOException;
import java.util.Map;

/**
 * Owner of the persisted configuration. Readers get immutable snapshots; all mutations are
 * serialized against each other and written through to durable storage.
 */
public interface ConfigStore {

	/** Current configuration snapshot */
	AppConfig snapshot();

	/**
	 * Record new watermarks for the given thread ids and persist them.
	 *
	 * @param tidToPostNumber new maximum post number per thread id
	 * @throws IOException if the configuration could not be written
	 */
	void updateLastSeen(Map<Long, Long> tidToPostNumber) throws IOException;

	/**
	 * Replace the forum session credentials and persist them.
	 *
	 * @param cid the passport cid
	 * @param uid the passport uid
	 * @throws IOException if the configuration could not be written
	 */
	void updatePassportCredentials(String cid, String uid) throws IOException;
}
