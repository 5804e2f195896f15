package org.springaicommunity.gitea.reconciler;

/**
 * A comment on a Gitea issue or pull request.
 *
 * @param id the comment id (unique across the server)
 * @param issueNumber the number of the issue or pull request owning the comment
 * @param body the comment text
 */
public record Comment(long id, int issueNumber, String body) {
}
