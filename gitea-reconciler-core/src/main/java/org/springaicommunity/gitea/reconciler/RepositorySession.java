package org.springaicommunity.gitea.reconciler;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * State of one repository reconciliation session.
 *
 * <p>
 * Created by {@link GiteaPlatform#initRepo(String, boolean)} and passed explicitly to
 * every operation. Starting a new session closes the previous one: its caches are reset
 * and further operations on it fail with {@link IllegalStateException}.
 */
public final class RepositorySession {

	private final String repository;

	private final RepositoryInfo repositoryInfo;

	private final MergeMethod mergeMethod;

	private final boolean cloneSubmodules;

	private final ListCache<PullRequest> pullRequests;

	private final ListCache<Issue> issues;

	private final ListCache<Label> labels;

	private final Map<String, CombinedCommitStatus> combinedStatuses = new ConcurrentHashMap<>();

	private volatile boolean active = true;

	RepositorySession(String repository, RepositoryInfo repositoryInfo, MergeMethod mergeMethod,
			boolean cloneSubmodules, Supplier<List<PullRequest>> pullRequestLoader,
			Supplier<List<Issue>> issueLoader, Supplier<List<Label>> labelLoader) {
		this.repository = repository;
		this.repositoryInfo = repositoryInfo;
		this.mergeMethod = mergeMethod;
		this.cloneSubmodules = cloneSubmodules;
		this.pullRequests = new ListCache<>("pull request", pullRequestLoader);
		this.issues = new ListCache<>("issue", issueLoader);
		this.labels = new ListCache<>("label", labelLoader);
	}

	/**
	 * Full repository name in "owner/repo" format.
	 */
	public String repository() {
		return repository;
	}

	public String owner() {
		int slash = repository.indexOf('/');
		return slash < 0 ? repository : repository.substring(0, slash);
	}

	public RepositoryInfo repositoryInfo() {
		return repositoryInfo;
	}

	public MergeMethod mergeMethod() {
		return mergeMethod;
	}

	public String defaultBranch() {
		return repositoryInfo.defaultBranch();
	}

	public boolean cloneSubmodules() {
		return cloneSubmodules;
	}

	public boolean isFork() {
		return repositoryInfo.fork();
	}

	public ListCache<PullRequest> pullRequests() {
		return pullRequests;
	}

	public ListCache<Issue> issues() {
		return issues;
	}

	public ListCache<Label> labels() {
		return labels;
	}

	Map<String, CombinedCommitStatus> combinedStatuses() {
		return combinedStatuses;
	}

	public boolean isActive() {
		return active;
	}

	/**
	 * Fail fast when an operation is issued against a session that has been replaced.
	 * @throws IllegalStateException if the session has been closed
	 */
	public void requireActive() {
		if (!active) {
			throw new IllegalStateException("Session for " + repository() + " has been closed");
		}
	}

	/**
	 * Close the session and drop everything it cached.
	 */
	void close() {
		active = false;
		pullRequests.invalidate();
		issues.invalidate();
		labels.invalidate();
		combinedStatuses.clear();
	}

	@Override
	public String toString() {
		return "RepositorySession[" + repository + ", mergeMethod=" + mergeMethod + ", active=" + active + "]";
	}

}
