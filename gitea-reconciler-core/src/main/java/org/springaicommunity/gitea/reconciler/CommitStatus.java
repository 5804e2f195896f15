package org.springaicommunity.gitea.reconciler;

import org.jspecify.annotations.Nullable;

/**
 * A single named status check attached to a commit.
 *
 * @param context the check name
 * @param status the raw Gitea status value (e.g. "success", "pending")
 * @param description a short description
 * @param targetUrl link to the check details
 */
public record CommitStatus(String context, String status, @Nullable String description, @Nullable String targetUrl) {
}
