package org.springaicommunity.gitea.reconciler;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;

/**
 * Builder for wiring the Gitea reconciler without a container.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Token and endpoint from GITEA_TOKEN / GITEA_ENDPOINT (or .env)
 * GiteaPlatform platform = GiteaReconcilerBuilder.create()
 *     .tokenFromEnv()
 *     .endpointFromEnv()
 *     .initPlatform();
 *
 * RepositorySession session = platform.initRepo("owner/repo", false);
 * platform.issues().ensureIssue(session, EnsureIssueRequest.of("Dependency Dashboard", body));
 *
 * // For testing with a mock API
 * GiteaApi api = mock(GiteaApi.class);
 * GiteaPlatform testPlatform = GiteaReconcilerBuilder.create()
 *     .token("test-token")
 *     .api(api)
 *     .storage(mock(RepositoryStorage.class))
 *     .initPlatform();
 * }
 * </pre>
 */
public class GiteaReconcilerBuilder {

	private String token;

	private String endpoint;

	private ReconcilerProperties properties;

	private ObjectMapper objectMapper;

	private GiteaClient httpClient;

	private GiteaApi api;

	private RepositoryStorage storage;

	private SecretSanitizer sanitizer;

	private GiteaReconcilerBuilder() {
		this.properties = new ReconcilerProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new GiteaReconcilerBuilder
	 */
	public static GiteaReconcilerBuilder create() {
		return new GiteaReconcilerBuilder();
	}

	/**
	 * Set the Gitea token directly.
	 * @param token Gitea personal access token
	 * @return this builder
	 */
	public GiteaReconcilerBuilder token(String token) {
		this.token = token;
		return this;
	}

	/**
	 * Read the Gitea token from GITEA_TOKEN (a {@code .env} file or the environment).
	 * @return this builder
	 * @throws IllegalStateException if GITEA_TOKEN is not set
	 */
	public GiteaReconcilerBuilder tokenFromEnv() {
		this.token = EnvironmentSupport.get(EnvironmentSupport.TOKEN_VARIABLE);
		if (this.token == null) {
			throw new IllegalStateException(
					"GITEA_TOKEN environment variable is required. Please set your Gitea personal access token.");
		}
		return this;
	}

	/**
	 * Set the API endpoint, overriding the one in the properties.
	 * @param endpoint API base URL such as {@code https://gitea.example.com/api/v1/}
	 * @return this builder
	 */
	public GiteaReconcilerBuilder endpoint(String endpoint) {
		this.endpoint = endpoint;
		return this;
	}

	/**
	 * Read the API endpoint from GITEA_ENDPOINT when it is set.
	 * @return this builder
	 */
	public GiteaReconcilerBuilder endpointFromEnv() {
		String value = EnvironmentSupport.get(EnvironmentSupport.ENDPOINT_VARIABLE);
		if (value != null) {
			this.endpoint = value;
		}
		return this;
	}

	/**
	 * Set reconciler properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public GiteaReconcilerBuilder properties(@Nullable ReconcilerProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public GiteaReconcilerBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom GiteaClient implementation. Useful for testing with mocks or for
	 * adding decorators. A custom client is used as is, without the retry decorator.
	 * @param httpClient custom GiteaClient implementation (null to use default)
	 * @return this builder
	 */
	public GiteaReconcilerBuilder httpClient(@Nullable GiteaClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	/**
	 * Set a custom GiteaApi implementation, bypassing the HTTP client entirely.
	 * @param api custom GiteaApi implementation (null to use default)
	 * @return this builder
	 */
	public GiteaReconcilerBuilder api(@Nullable GiteaApi api) {
		this.api = api;
		return this;
	}

	/**
	 * Set a custom RepositoryStorage implementation.
	 * @param storage custom storage (null to clone with JGit under the configured
	 * directory)
	 * @return this builder
	 */
	public GiteaReconcilerBuilder storage(@Nullable RepositoryStorage storage) {
		this.storage = storage;
		return this;
	}

	/**
	 * Set the sanitizer that collects secrets to redact.
	 * @param sanitizer custom sanitizer (null to use a fresh one)
	 * @return this builder
	 */
	public GiteaReconcilerBuilder sanitizer(@Nullable SecretSanitizer sanitizer) {
		this.sanitizer = sanitizer;
		return this;
	}

	/**
	 * Build the GiteaApi directly (for advanced usage).
	 * @return configured GiteaApi
	 */
	public GiteaApi buildApi() {
		validateToken();
		applyEndpoint();
		return resolveApi();
	}

	/**
	 * Build the API and authenticate the automation account.
	 * @return initialized platform
	 * @throws AuthenticationException if the token is missing or rejected
	 */
	public GiteaPlatform initPlatform() {
		applyEndpoint();
		GiteaApi resolvedApi = resolveApi();
		RepositoryStorage resolvedStorage = this.storage != null ? this.storage
				: new JGitRepositoryStorage(Path.of(properties.getCloneBaseDir()));
		SecretSanitizer resolvedSanitizer = this.sanitizer != null ? this.sanitizer : new SecretSanitizer();
		return GiteaPlatform.initPlatform(resolvedApi, resolvedStorage, properties, resolvedSanitizer, token);
	}

	private void validateToken() {
		// Skip token validation if a custom client or API is provided
		if (httpClient != null || api != null) {
			return;
		}
		if (token == null || token.trim().isEmpty()) {
			throw new IllegalStateException("Gitea token is required. Call token() or tokenFromEnv() first.");
		}
	}

	private void applyEndpoint() {
		if (endpoint != null) {
			properties.setEndpoint(endpoint);
		}
	}

	private GiteaApi resolveApi() {
		if (api != null) {
			return api;
		}
		ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
		GiteaClient client = this.httpClient != null ? this.httpClient : createDefaultClient();
		return new GiteaRestService(client, mapper, properties.getPageSize());
	}

	private GiteaClient createDefaultClient() {
		if (token == null || token.isBlank()) {
			throw new AuthenticationException("You must configure a Gitea personal access token");
		}
		return RetryingGiteaClient.builder()
			.wrapping(new GiteaHttpClient(properties.getEndpoint(), token))
			.maxRetries(properties.getMaxRetries())
			.initialDelayMs(properties.getRetryDelayMs())
			.build();
	}

}
