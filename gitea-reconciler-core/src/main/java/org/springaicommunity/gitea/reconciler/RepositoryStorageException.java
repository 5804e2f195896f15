package org.springaicommunity.gitea.reconciler;

/**
 * Failure of the local repository copy.
 */
public class RepositoryStorageException extends RuntimeException {

	public RepositoryStorageException(String message) {
		super(message);
	}

	public RepositoryStorageException(String message, Throwable cause) {
		super(message, cause);
	}

}
