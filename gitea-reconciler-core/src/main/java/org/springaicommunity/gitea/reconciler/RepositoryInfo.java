package org.springaicommunity.gitea.reconciler;

/**
 * Repository metadata from the Gitea API.
 *
 * <p>
 * Captures the flags needed to decide whether the automation may work on the repository
 * and which merge method it should use.
 *
 * @param id the unique repository id
 * @param fullName the full repository name in "owner/repo" format
 * @param archived whether the repository is archived (read-only)
 * @param mirror whether the repository is a pull mirror
 * @param empty whether the repository has no commits
 * @param fork whether the repository is a fork
 * @param canPull whether the authenticated user may pull
 * @param canPush whether the authenticated user may push
 * @param allowRebase whether fast-forward rebase merging is enabled
 * @param allowRebaseExplicit whether rebase with an explicit merge commit is enabled
 * @param allowSquashMerge whether squash merging is enabled
 * @param allowMergeCommits whether plain merge commits are enabled
 * @param defaultBranch the default branch name
 * @param cloneUrl the HTTP(S) clone URL
 */
public record RepositoryInfo(long id, String fullName, boolean archived, boolean mirror, boolean empty, boolean fork,
		boolean canPull, boolean canPush, boolean allowRebase, boolean allowRebaseExplicit, boolean allowSquashMerge,
		boolean allowMergeCommits, String defaultBranch, String cloneUrl) {
}
