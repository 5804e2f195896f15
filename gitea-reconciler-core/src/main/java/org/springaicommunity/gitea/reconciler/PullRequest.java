package org.springaicommunity.gitea.reconciler;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;

/**
 * Platform-neutral view of a pull request opened by the automation.
 *
 * @param number the unique pull request number within the repository
 * @param state the folded state (open, closed or merged)
 * @param title the pull request title
 * @param body the pull request body (empty when none was set)
 * @param sourceBranch the branch containing the changes
 * @param targetBranch the branch the changes are merged into
 * @param sourceRepository full name of the repository holding the source branch
 * @param sha the head commit id
 * @param createdAt when the pull request was created
 * @param mergeable whether the remote reports the pull request as mergeable
 * @param hasAssignees whether anyone is assigned
 */
public record PullRequest(int number, PrState state, String title, String body, String sourceBranch,
		String targetBranch, String sourceRepository, String sha, @Nullable LocalDateTime createdAt, boolean mergeable,
		boolean hasAssignees) {

	public String displayNumber() {
		return "Pull Request #" + number;
	}

	@Nullable
	public String cannotMergeReason() {
		return mergeable ? null : "pr.mergeable=\"false\"";
	}

	public PullRequest withTitleAndBody(String newTitle, String newBody) {
		return new PullRequest(number, state, newTitle, newBody, sourceBranch, targetBranch, sourceRepository, sha,
				createdAt, mergeable, hasAssignees);
	}

}
