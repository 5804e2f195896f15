package org.springaicommunity.gitea.reconciler;

/**
 * Thrown when the automation identity cannot be established: the token is missing or the
 * server rejects it.
 */
public class AuthenticationException extends RuntimeException {

	public AuthenticationException(String message) {
		super(message);
	}

	public AuthenticationException(String message, Throwable cause) {
		super(message, cause);
	}

}
