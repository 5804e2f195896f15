package org.springaicommunity.gitea.reconciler;

import java.util.Optional;

/**
 * Merge styles supported by Gitea, in order of preference.
 */
public enum MergeMethod {

	REBASE("rebase"), REBASE_MERGE("rebase-merge"), SQUASH("squash"), MERGE("merge");

	private final String value;

	MergeMethod(String value) {
		this.value = value;
	}

	/**
	 * The value Gitea expects in the {@code Do} field of a merge request.
	 */
	public String value() {
		return value;
	}

	/**
	 * Pick the most preferred merge method the repository allows.
	 * @param repository the repository metadata
	 * @return the merge method, or empty when the repository allows none
	 */
	public static Optional<MergeMethod> preferredFor(RepositoryInfo repository) {
		if (repository.allowRebase()) {
			return Optional.of(REBASE);
		}
		if (repository.allowRebaseExplicit()) {
			return Optional.of(REBASE_MERGE);
		}
		if (repository.allowSquashMerge()) {
			return Optional.of(SQUASH);
		}
		if (repository.allowMergeCommits()) {
			return Optional.of(MERGE);
		}
		return Optional.empty();
	}

}
