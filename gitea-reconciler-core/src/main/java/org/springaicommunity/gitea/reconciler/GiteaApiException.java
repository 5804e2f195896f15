package org.springaicommunity.gitea.reconciler;

import org.jspecify.annotations.Nullable;

/**
 * Exception thrown when a Gitea API call fails.
 *
 * <p>
 * Carries the HTTP status code so callers can tell a missing resource ({@code 404}) or a
 * write conflict ({@code 409}) apart from a generic failure. Transport failures that never
 * produced a response use status code {@code -1}.
 */
public class GiteaApiException extends RuntimeException {

	private final int statusCode;

	@Nullable
	private final String responseBody;

	public GiteaApiException(String message, int statusCode, @Nullable String responseBody) {
		super(message);
		this.statusCode = statusCode;
		this.responseBody = responseBody;
	}

	public GiteaApiException(String message, Throwable cause) {
		super(message, cause);
		this.statusCode = -1;
		this.responseBody = null;
	}

	public int getStatusCode() {
		return statusCode;
	}

	@Nullable
	public String getResponseBody() {
		return responseBody;
	}

	public boolean isNotFound() {
		return statusCode == 404;
	}

	public boolean isConflict() {
		return statusCode == 409;
	}

	/**
	 * Returns true for failures worth retrying: server errors and transport failures.
	 */
	public boolean isTransient() {
		return statusCode == -1 || statusCode >= 500;
	}

}
