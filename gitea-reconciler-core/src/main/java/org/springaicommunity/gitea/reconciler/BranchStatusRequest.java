package org.springaicommunity.gitea.reconciler;

import org.jspecify.annotations.Nullable;

/**
 * A status check to attach to the head commit of a branch.
 *
 * @param branchName the branch whose head commit receives the status
 * @param context the check name
 * @param description a short description
 * @param state the status to report
 * @param targetUrl link to the check details
 */
public record BranchStatusRequest(String branchName, String context, String description, BranchStatus state,
		@Nullable String targetUrl) {
}
