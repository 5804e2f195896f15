package org.springaicommunity.gitea.reconciler;

/**
 * Configuration properties for the Gitea reconciler.
 *
 * <p>
 * Properties can be set directly via setters or passed to
 * {@link GiteaReconcilerBuilder}. Default values are suitable for gitea.com.
 */
public class ReconcilerProperties {

	/**
	 * Gitea API endpoint, including the {@code /api/v1/} suffix.
	 */
	private String endpoint = "https://gitea.com/api/v1/";

	/**
	 * Number of items requested per page when listing collections.
	 */
	private int pageSize = 50;

	/**
	 * Maximum length of a pull request body after markdown massaging.
	 */
	private int maxBodyLength = 1_000_000;

	/**
	 * Oldest Gitea version that supports requesting pull request reviewers.
	 */
	private String reviewersMinVersion = "1.14.0";

	/**
	 * Maximum number of retry attempts for transient API failures.
	 */
	private int maxRetries = 3;

	/**
	 * Delay in milliseconds before the first retry (doubles on each retry).
	 */
	private long retryDelayMs = 1000;

	/**
	 * Directory under which repositories are cloned.
	 */
	private String cloneBaseDir = ".gitea-reconciler/repos";

	public String getEndpoint() {
		return endpoint;
	}

	public void setEndpoint(String endpoint) {
		this.endpoint = endpoint;
	}

	public int getPageSize() {
		return pageSize;
	}

	public void setPageSize(int pageSize) {
		this.pageSize = pageSize;
	}

	public int getMaxBodyLength() {
		return maxBodyLength;
	}

	public void setMaxBodyLength(int maxBodyLength) {
		this.maxBodyLength = maxBodyLength;
	}

	public String getReviewersMinVersion() {
		return reviewersMinVersion;
	}

	public void setReviewersMinVersion(String reviewersMinVersion) {
		this.reviewersMinVersion = reviewersMinVersion;
	}

	public int getMaxRetries() {
		return maxRetries;
	}

	public void setMaxRetries(int maxRetries) {
		this.maxRetries = maxRetries;
	}

	public long getRetryDelayMs() {
		return retryDelayMs;
	}

	public void setRetryDelayMs(long retryDelayMs) {
		this.retryDelayMs = retryDelayMs;
	}

	public String getCloneBaseDir() {
		return cloneBaseDir;
	}

	public void setCloneBaseDir(String cloneBaseDir) {
		this.cloneBaseDir = cloneBaseDir;
	}

}
