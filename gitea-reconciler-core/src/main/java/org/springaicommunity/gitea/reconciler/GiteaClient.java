package org.springaicommunity.gitea.reconciler;

import org.jspecify.annotations.Nullable;

/**
 * Interface for Gitea API HTTP operations.
 *
 * <p>
 * Paths are relative to the API endpoint (e.g. {@code /repos/owner/repo}). Provides
 * abstraction over the transport, enabling testability and decorator implementations
 * (retrying, logging).
 */
public interface GiteaClient {

	/**
	 * Execute a GET request.
	 * @param path API path (e.g., "/repos/owner/repo")
	 * @return Response body as String
	 * @throws GiteaApiException if the request fails
	 */
	String get(String path);

	/**
	 * Execute a GET request with query parameters.
	 * @param path API path (without query string)
	 * @param queryString Query string (without leading ?)
	 * @return Response body as String
	 * @throws GiteaApiException if the request fails
	 */
	String getWithQuery(String path, @Nullable String queryString);

	/**
	 * Execute a POST request with a JSON body.
	 * @param path API path
	 * @param body Request body (JSON)
	 * @return Response body as String (may be empty)
	 * @throws GiteaApiException if the request fails
	 */
	String post(String path, String body);

	/**
	 * Execute a PATCH request with a JSON body.
	 * @param path API path
	 * @param body Request body (JSON)
	 * @return Response body as String
	 * @throws GiteaApiException if the request fails
	 */
	String patch(String path, String body);

	/**
	 * Execute a PUT request with a JSON body.
	 * @param path API path
	 * @param body Request body (JSON)
	 * @return Response body as String
	 * @throws GiteaApiException if the request fails
	 */
	String put(String path, String body);

	/**
	 * Execute a DELETE request.
	 * @param path API path
	 * @throws GiteaApiException if the request fails
	 */
	void delete(String path);

}
