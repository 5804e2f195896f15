package org.springaicommunity.gitea.reconciler;

/**
 * Thrown when a branch disappeared from under the automation (deleted or force-updated)
 * while it was being inspected.
 */
public class RepositoryChangedException extends RuntimeException {

	private final String branchName;

	public RepositoryChangedException(String branchName, Throwable cause) {
		super("Branch " + branchName + " no longer exists", cause);
		this.branchName = branchName;
	}

	public String getBranchName() {
		return branchName;
	}

}
