package org.springaicommunity.gitea.reconciler;

/**
 * Thrown by {@link GiteaPlatform#initRepo} when the automation must not work on a
 * repository. Each {@link Reason} is fatal for that repository only.
 */
public class RepositoryUnusableException extends RuntimeException {

	/**
	 * Why the repository cannot be used.
	 */
	public enum Reason {

		ARCHIVED, MIRRORED, EMPTY, ACCESS_FORBIDDEN, BLOCKED

	}

	private final String repository;

	private final Reason reason;

	public RepositoryUnusableException(String repository, Reason reason, String message) {
		super(message);
		this.repository = repository;
		this.reason = reason;
	}

	public String getRepository() {
		return repository;
	}

	public Reason getReason() {
		return reason;
	}

}
