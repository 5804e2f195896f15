package org.springaicommunity.gitea.reconciler;

import org.jspecify.annotations.Nullable;

/**
 * Partial update of a pull request. Null components are left unchanged on the server.
 *
 * @param title the new title
 * @param body the new description
 * @param state the new state ("open" or "closed")
 */
public record PullRequestUpdate(@Nullable String title, @Nullable String body, @Nullable String state) {
}
