package org.springaicommunity.gitea.reconciler;

import java.util.List;

/**
 * Request body for creating a pull request.
 *
 * @param base the target branch
 * @param head the source branch
 * @param title the title
 * @param body the description
 * @param labels label ids to apply
 */
public record PullRequestCreate(String base, String head, String title, String body, List<Long> labels) {
}
