package org.springaicommunity.gitea.reconciler;

/**
 * Outcome of {@link IssueOperations#ensureIssue}.
 */
public enum EnsureIssueResult {

	/**
	 * A new issue was created.
	 */
	CREATED,

	/**
	 * An existing issue was brought up to date.
	 */
	UPDATED,

	/**
	 * Nothing needed to change (or the issue is closed and may only be raised once).
	 */
	NONE,

	/**
	 * Nothing changed because a remote call failed. The failure has been logged.
	 */
	FAILED;

	/**
	 * Returns true when no change was made on the remote side.
	 */
	public boolean isNone() {
		return this == NONE || this == FAILED;
	}

}
