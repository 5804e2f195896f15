package org.springaicommunity.gitea.reconciler;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Decorator that adds automatic retry logic with exponential backoff to a
 * {@link GiteaClient}.
 *
 * <p>
 * Only transient failures (5xx responses and transport errors) are retried. Client errors
 * (4xx) are returned to the caller immediately, since callers branch on 404 and 409.
 * {@code POST} requests are never retried: a create that timed out may still have
 * succeeded on the server.
 *
 * <pre>
 * {@code
 * GiteaClient client = RetryingGiteaClient.builder()
 *     .wrapping(new GiteaHttpClient(endpoint, token))
 *     .maxRetries(5)
 *     .initialDelay(Duration.ofSeconds(2))
 *     .build();
 * }
 * </pre>
 */
public final class RetryingGiteaClient implements GiteaClient {

	private static final Logger logger = LoggerFactory.getLogger(RetryingGiteaClient.class);

	private final GiteaClient delegate;

	private final int maxRetries;

	private final long initialDelayMs;

	private RetryingGiteaClient(Builder builder) {
		this.delegate = builder.delegate;
		this.maxRetries = builder.maxRetries;
		this.initialDelayMs = builder.initialDelayMs;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public String get(String path) {
		return executeWithRetry(() -> delegate.get(path), "GET " + path);
	}

	@Override
	public String getWithQuery(String path, @Nullable String queryString) {
		String desc = "GET " + path + (queryString != null ? "?" + queryString : "");
		return executeWithRetry(() -> delegate.getWithQuery(path, queryString), desc);
	}

	@Override
	public String post(String path, String body) {
		return delegate.post(path, body);
	}

	@Override
	public String patch(String path, String body) {
		return executeWithRetry(() -> delegate.patch(path, body), "PATCH " + path);
	}

	@Override
	public String put(String path, String body) {
		return executeWithRetry(() -> delegate.put(path, body), "PUT " + path);
	}

	@Override
	public void delete(String path) {
		executeWithRetry(() -> {
			delegate.delete(path);
			return "";
		}, "DELETE " + path);
	}

	private String executeWithRetry(Supplier<String> supplier, String description) {
		long delay = initialDelayMs;

		for (int attempt = 0;; attempt++) {
			try {
				return supplier.get();
			}
			catch (GiteaApiException e) {
				if (!e.isTransient()) {
					throw e;
				}
				if (attempt >= maxRetries) {
					logger.error("{} failed after {} attempts", description, maxRetries + 1);
					throw e;
				}
				logger.warn("{} failed (attempt {}/{}): {}. Retrying in {}ms...", description, attempt + 1,
						maxRetries + 1, e.getMessage(), delay);
				sleep(delay);
				delay *= 2;
			}
		}
	}

	private void sleep(long ms) {
		try {
			Thread.sleep(ms);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GiteaApiException("Retry interrupted", e);
		}
	}

	/**
	 * Builder for {@link RetryingGiteaClient}.
	 *
	 * <p>
	 * Defaults: 3 retries, 1 second initial delay.
	 */
	public static class Builder {

		private GiteaClient delegate;

		private int maxRetries = 3;

		private long initialDelayMs = 1000;

		private Builder() {
		}

		/**
		 * Set the client to wrap with retry logic.
		 * @param client the GiteaClient to wrap (required)
		 * @return this builder
		 */
		public Builder wrapping(GiteaClient client) {
			this.delegate = client;
			return this;
		}

		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		public Builder initialDelay(Duration delay) {
			this.initialDelayMs = delay.toMillis();
			return this;
		}

		public Builder initialDelayMs(long delayMs) {
			this.initialDelayMs = delayMs;
			return this;
		}

		/**
		 * Build the RetryingGiteaClient.
		 * @return configured RetryingGiteaClient
		 * @throws IllegalStateException if required parameters are missing or invalid
		 */
		public RetryingGiteaClient build() {
			if (delegate == null) {
				throw new IllegalStateException("A GiteaClient to wrap is required. Call wrapping() first.");
			}
			if (maxRetries < 0) {
				throw new IllegalStateException("maxRetries must be non-negative");
			}
			if (initialDelayMs <= 0) {
				throw new IllegalStateException("initialDelay must be positive");
			}
			return new RetryingGiteaClient(this);
		}

	}

}
