package org.springaicommunity.gitea.reconciler;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Partial update of an issue. Null components are left unchanged on the server.
 *
 * @param title the new title
 * @param body the new body
 * @param state the new state ("open" or "closed")
 * @param assignees usernames to assign
 */
public record IssueUpdate(@Nullable String title, @Nullable String body, @Nullable String state,
		@Nullable List<String> assignees) {

	public static IssueUpdate closing() {
		return new IssueUpdate(null, null, Issue.CLOSED, null);
	}

	public static IssueUpdate assigning(List<String> assignees) {
		return new IssueUpdate(null, null, null, List.copyOf(assignees));
	}

}
