package org.springaicommunity.gitea.reconciler;

import java.util.Map;

/**
 * Translates between Gitea commit status values and {@link BranchStatus}.
 *
 * <p>
 * Both directions are total: a value missing from the table falls back to the
 * "unknown" outcome instead of failing.
 */
public final class StatusMapper {

	private static final Map<String, BranchStatus> GITEA_TO_BRANCH_STATUS = Map.of("unknown", BranchStatus.YELLOW,
			"success", BranchStatus.GREEN, "pending", BranchStatus.YELLOW, "warning", BranchStatus.RED, "failure",
			BranchStatus.RED, "error", BranchStatus.RED);

	private static final Map<BranchStatus, String> BRANCH_STATUS_TO_GITEA = Map.of(BranchStatus.GREEN, "success",
			BranchStatus.YELLOW, "pending", BranchStatus.RED, "failure");

	private StatusMapper() {
	}

	/**
	 * Returns true if the Gitea value has an explicit mapping.
	 */
	public static boolean isKnown(String giteaStatus) {
		return GITEA_TO_BRANCH_STATUS.containsKey(giteaStatus);
	}

	/**
	 * Map a Gitea status value, defaulting to {@link BranchStatus#YELLOW}.
	 */
	public static BranchStatus toBranchStatus(String giteaStatus) {
		return GITEA_TO_BRANCH_STATUS.getOrDefault(giteaStatus, BranchStatus.YELLOW);
	}

	/**
	 * Map a branch status to the Gitea value, defaulting to {@code pending}.
	 */
	public static String toGiteaStatus(BranchStatus status) {
		return BRANCH_STATUS_TO_GITEA.getOrDefault(status, "pending");
	}

}
