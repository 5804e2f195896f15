package org.springaicommunity.gitea.reconciler;

/**
 * Platform-neutral status of a branch or a single status check.
 */
public enum BranchStatus {

	GREEN("green"), YELLOW("yellow"), RED("red");

	private final String value;

	BranchStatus(String value) {
		this.value = value;
	}

	public String value() {
		return value;
	}

}
