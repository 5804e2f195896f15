package org.springaicommunity.gitea.reconciler;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * HTTP client for the Gitea REST API using the JDK {@link HttpClient}.
 *
 * <p>
 * Authenticates every request with a personal access token and maps non-2xx responses
 * to {@link GiteaApiException}.
 */
public class GiteaHttpClient implements GiteaClient {

	private static final Logger logger = LoggerFactory.getLogger(GiteaHttpClient.class);

	private final HttpClient httpClient;

	private final String baseUrl;

	private final String token;

	public GiteaHttpClient(String endpoint, String token) {
		this.baseUrl = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
		this.token = token;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(Duration.ofSeconds(30))
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	public String getBaseUrl() {
		return baseUrl;
	}

	@Override
	public String get(String path) {
		return send("GET", path, null);
	}

	@Override
	public String getWithQuery(String path, @Nullable String queryString) {
		String target = path;
		if (queryString != null && !queryString.isEmpty()) {
			target += "?" + queryString;
		}
		return get(target);
	}

	@Override
	public String post(String path, String body) {
		return send("POST", path, body);
	}

	@Override
	public String patch(String path, String body) {
		return send("PATCH", path, body);
	}

	@Override
	public String put(String path, String body) {
		return send("PUT", path, body);
	}

	@Override
	public void delete(String path) {
		send("DELETE", path, null);
	}

	private String send(String method, String path, @Nullable String body) {
		String url = path.startsWith("http") ? path : baseUrl + path;
		logger.debug("{} {}", method, url);
		long start = System.currentTimeMillis();

		HttpRequest.Builder builder = HttpRequest.newBuilder()
			.uri(URI.create(url))
			.header("Authorization", "token " + token)
			.header("Accept", "application/json")
			.header("User-Agent", "gitea-reconciler");
		if (body != null) {
			builder.header("Content-Type", "application/json")
				.method(method, HttpRequest.BodyPublishers.ofString(body));
		}
		else {
			builder.method(method, HttpRequest.BodyPublishers.noBody());
		}

		try {
			String response = executeRequest(builder.build());
			logger.debug("{} {} completed in {}ms ({} bytes)", method, url, System.currentTimeMillis() - start,
					response.length());
			return response;
		}
		catch (GiteaApiException e) {
			logger.debug("{} {} failed after {}ms: {}", method, url, System.currentTimeMillis() - start,
					e.getMessage());
			throw e;
		}
	}

	private String executeRequest(HttpRequest request) {
		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

			int statusCode = response.statusCode();
			String body = response.body() != null ? response.body() : "";
			if (statusCode >= 200 && statusCode < 300) {
				return body;
			}
			else if (statusCode == 401) {
				throw new GiteaApiException("Unauthorized: Bad credentials. Check your GITEA_TOKEN.", statusCode,
						body);
			}
			else if (statusCode == 403) {
				throw new GiteaApiException("Forbidden: " + request.uri(), statusCode, body);
			}
			else if (statusCode == 404) {
				throw new GiteaApiException("Not found: " + request.uri(), statusCode, body);
			}
			else if (statusCode == 409) {
				throw new GiteaApiException("Conflict: " + request.uri(), statusCode, body);
			}
			else {
				throw new GiteaApiException("Gitea API error: " + statusCode, statusCode, body);
			}
		}
		catch (IOException e) {
			logger.error("HTTP request failed: {}", e.getMessage());
			throw new GiteaApiException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GiteaApiException("HTTP request interrupted", e);
		}
	}

}
