package org.springaicommunity.gitea.reconciler;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;

/**
 * A pull request exactly as reported by the Gitea API, before the visibility rules of
 * {@link PullRequestOperations#toPullRequest} are applied.
 *
 * @param number the pull request number within the repository
 * @param state the remote state ("open" or "closed")
 * @param merged whether the pull request has been merged
 * @param mergeable whether Gitea reports the pull request as mergeable
 * @param title the title
 * @param body the description (may be null)
 * @param baseRef the target branch (null when the base branch is gone)
 * @param headLabel the source branch label (null when the head branch is gone)
 * @param headSha the head commit id
 * @param headRepository the full name of the source repository
 * @param author the username of the creator
 * @param createdAt when the pull request was created
 * @param hasAssignees whether anyone is assigned
 */
public record GiteaPullRequest(int number, String state, boolean merged, boolean mergeable, String title,
		@Nullable String body, @Nullable String baseRef, @Nullable String headLabel, @Nullable String headSha,
		@Nullable String headRepository, @Nullable String author, @Nullable LocalDateTime createdAt,
		boolean hasAssignees) {
}
