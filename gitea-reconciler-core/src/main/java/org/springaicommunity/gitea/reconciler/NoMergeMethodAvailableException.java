package org.springaicommunity.gitea.reconciler;

/**
 * Thrown when a repository permits none of the merge methods the automation can use.
 */
public class NoMergeMethodAvailableException extends RepositoryUnusableException {

	public NoMergeMethodAvailableException(String repository) {
		super(repository, Reason.BLOCKED, "Repository " + repository + " has no allowed merge methods");
	}

}
