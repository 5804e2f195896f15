package org.springaicommunity.gitea.reconciler;

/**
 * Lifecycle state of a {@link ListCache}.
 */
public enum CacheState {

	UNPOPULATED, POPULATING, POPULATED

}
