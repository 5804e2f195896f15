package org.springaicommunity.gitea.reconciler;

/**
 * Outcome of a best-effort operation that never throws.
 */
public enum OperationOutcome {

	/**
	 * The requested change was made.
	 */
	APPLIED,

	/**
	 * The remote side already had the requested state.
	 */
	UNCHANGED,

	/**
	 * The target of the operation does not exist.
	 */
	NOT_FOUND,

	/**
	 * A remote call failed; the failure has been logged and swallowed.
	 */
	FAILED

}
