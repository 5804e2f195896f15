package org.springaicommunity.gitea.reconciler;

import org.jspecify.annotations.Nullable;

/**
 * Request body for attaching a status check to a commit.
 *
 * @param state the Gitea status value
 * @param context the check name
 * @param description a short description
 * @param targetUrl link to the check details (omitted when null)
 */
public record CommitStatusCreate(String state, String context, String description, @Nullable String targetUrl) {
}
