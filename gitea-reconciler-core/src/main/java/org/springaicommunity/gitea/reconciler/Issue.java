package org.springaicommunity.gitea.reconciler;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A Gitea issue.
 *
 * @param number the unique issue number within the repository
 * @param state the issue state ("open" or "closed")
 * @param title the issue title
 * @param body the issue body (may be null)
 * @param labels labels currently assigned to the issue
 * @param createdAt when the issue was created
 */
public record Issue(int number, String state, String title, @Nullable String body, List<Label> labels,
		@Nullable LocalDateTime createdAt) {

	public static final String OPEN = "open";

	public static final String CLOSED = "closed";

	public boolean isOpen() {
		return OPEN.equals(state);
	}

	public Set<Long> labelIds() {
		return labels.stream().map(Label::id).collect(Collectors.toSet());
	}

}
