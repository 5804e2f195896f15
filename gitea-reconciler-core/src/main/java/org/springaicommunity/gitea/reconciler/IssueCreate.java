package org.springaicommunity.gitea.reconciler;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Request body for creating an issue.
 *
 * @param title the title
 * @param body the body
 * @param labels label ids to apply (null for none)
 */
public record IssueCreate(String title, String body, @Nullable List<Long> labels) {
}
