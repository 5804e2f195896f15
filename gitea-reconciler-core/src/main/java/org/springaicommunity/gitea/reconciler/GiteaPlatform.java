package org.springaicommunity.gitea.reconciler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Optional;

/**
 * Entry point of the reconciler for one Gitea server.
 *
 * <p>
 * {@link #initPlatform} authenticates the automation account once. Each
 * {@link #initRepo} then validates a repository and returns the
 * {@link RepositorySession} to pass to the operations exposed by
 * {@link #pullRequests()}, {@link #issues()}, {@link #comments()}, {@link #labels()} and
 * {@link #branchStatus()}. Only one session is active at a time.
 */
public class GiteaPlatform {

	private static final Logger logger = LoggerFactory.getLogger(GiteaPlatform.class);

	private static final ObjectMapper JSON_READER = ObjectMapperFactory.create();

	private static final ObjectMapper JSON5_READER = ObjectMapperFactory.createLenient();

	private final GiteaApi api;

	private final RepositoryStorage storage;

	private final ReconcilerProperties properties;

	private final PlatformIdentity identity;

	private final String token;

	private final LabelOperations labelOperations;

	private final PullRequestOperations pullRequestOperations;

	private final IssueOperations issueOperations;

	private final CommentOperations commentOperations;

	private final BranchStatusOperations branchStatusOperations;

	@Nullable
	private RepositorySession activeSession;

	GiteaPlatform(GiteaApi api, RepositoryStorage storage, ReconcilerProperties properties,
			SecretSanitizer sanitizer, PlatformIdentity identity, String token) {
		this.api = api;
		this.storage = storage;
		this.properties = properties;
		this.identity = identity;
		this.token = token;
		this.labelOperations = new LabelOperations(api);
		this.pullRequestOperations = new PullRequestOperations(api, labelOperations, sanitizer, identity,
				properties.getReviewersMinVersion());
		this.issueOperations = new IssueOperations(api, labelOperations);
		this.commentOperations = new CommentOperations(api, sanitizer);
		this.branchStatusOperations = new BranchStatusOperations(api, storage);
	}

	/**
	 * Authenticate the automation account against the configured endpoint.
	 * @param api the Gitea API
	 * @param storage local repository storage
	 * @param properties reconciler configuration
	 * @param sanitizer receives the token so it is never sent in bodies or comments
	 * @param token the personal access token
	 * @return the initialized platform
	 * @throws AuthenticationException if the token is missing or rejected
	 */
	public static GiteaPlatform initPlatform(GiteaApi api, RepositoryStorage storage, ReconcilerProperties properties,
			SecretSanitizer sanitizer, @Nullable String token) {
		if (token == null || token.isBlank()) {
			throw new AuthenticationException("You must configure a Gitea personal access token");
		}
		String endpoint = ensureTrailingSlash(properties.getEndpoint());
		GiteaUser user;
		String version;
		try {
			user = api.getCurrentUser();
			version = api.getVersion();
		}
		catch (GiteaApiException e) {
			logger.debug("Error authenticating with Gitea. Check your token", e);
			throw new AuthenticationException("Authentication failure", e);
		}
		sanitizer.addSecret(token);
		PlatformIdentity identity = new PlatformIdentity(endpoint, user.id(), user.username(), user.gitAuthor(),
				version);
		logger.debug("Authenticated as {} on Gitea {} at {}", user.username(), version, endpoint);
		return new GiteaPlatform(api, storage, properties, sanitizer, identity, token);
	}

	/**
	 * Start a session for a repository, closing the previous session.
	 * @param repository full repository name in "owner/repo" format
	 * @param cloneSubmodules whether the local clone includes submodules
	 * @return the new session
	 * @throws RepositoryUnusableException if the repository is archived, mirrored, not
	 * writable, empty, or allows no merge method
	 * @throws GiteaApiException if the repository metadata cannot be fetched
	 */
	public synchronized RepositorySession initRepo(String repository, boolean cloneSubmodules) {
		if (activeSession != null) {
			activeSession.close();
			activeSession = null;
		}
		RepositoryInfo repo;
		try {
			repo = api.getRepository(repository);
		}
		catch (GiteaApiException e) {
			logger.debug("Unknown Gitea initRepo error for {}", repository, e);
			throw e;
		}
		validateUsable(repository, repo);
		MergeMethod mergeMethod = MergeMethod.preferredFor(repo).orElseThrow(() -> {
			logger.debug("Repository has no allowed merge methods - aborting");
			return new NoMergeMethodAvailableException(repository);
		});
		logger.debug("{} default branch = {}, merge method = {}", repository, repo.defaultBranch(), mergeMethod);

		storage.initRepo(repository, withCredentials(repo.cloneUrl()), cloneSubmodules);

		String owner = repository.contains("/") ? repository.substring(0, repository.indexOf('/')) : repository;
		RepositorySession session = new RepositorySession(repository, repo, mergeMethod, cloneSubmodules,
				() -> pullRequestOperations.fetchPullRequests(repository),
				() -> issueOperations.fetchIssues(repository), () -> labelOperations.fetchLabels(repository, owner));
		activeSession = session;
		return session;
	}

	private static void validateUsable(String repository, RepositoryInfo repo) {
		if (repo.archived()) {
			logger.debug("Repository is archived - aborting");
			throw new RepositoryUnusableException(repository, RepositoryUnusableException.Reason.ARCHIVED,
					"Repository " + repository + " is archived");
		}
		if (repo.mirror()) {
			logger.debug("Repository is a mirror - aborting");
			throw new RepositoryUnusableException(repository, RepositoryUnusableException.Reason.MIRRORED,
					"Repository " + repository + " is a mirror");
		}
		if (!repo.canPull() || !repo.canPush()) {
			logger.debug("Repository does not permit pull and push - aborting");
			throw new RepositoryUnusableException(repository, RepositoryUnusableException.Reason.ACCESS_FORBIDDEN,
					"Repository " + repository + " does not permit pull and push");
		}
		if (repo.empty()) {
			logger.debug("Repository is empty - aborting");
			throw new RepositoryUnusableException(repository, RepositoryUnusableException.Reason.EMPTY,
					"Repository " + repository + " is empty");
		}
	}

	String withCredentials(String cloneUrl) {
		try {
			URI uri = new URI(cloneUrl);
			return new URI(uri.getScheme(), token, uri.getHost(), uri.getPort(), uri.getPath(), uri.getQuery(),
					uri.getFragment())
				.toString();
		}
		catch (URISyntaxException e) {
			throw new IllegalArgumentException("Invalid clone URL returned by Gitea: " + cloneUrl, e);
		}
	}

	/**
	 * Full names of the non-archived repositories of the automation account.
	 * @throws GiteaApiException if the search fails
	 */
	public List<String> getRepos() {
		logger.debug("Auto-discovering Gitea repositories");
		try {
			return api.searchRepositories(identity.userId(), false).stream().map(RepositoryInfo::fullName).toList();
		}
		catch (GiteaApiException e) {
			logger.error("Gitea getRepos() error", e);
			throw e;
		}
	}

	/**
	 * Read a file from a repository.
	 * @param fileName path relative to the repository root
	 * @param repository repository in "owner/repo" format, or null for the active session's
	 * @param branchOrTag ref to read from, or null for the default branch
	 * @return the file content, or empty if the path holds no file content
	 * @throws GiteaApiException if the file cannot be read
	 * @throws IllegalStateException if no repository is given and no session is active
	 */
	public Optional<String> getRawFile(String fileName, @Nullable String repository, @Nullable String branchOrTag) {
		String repo = repository != null ? repository
				: getActiveSession().map(RepositorySession::repository)
					.orElseThrow(() -> new IllegalStateException("No repository given and no active session"));
		return api.getFileContent(repo, fileName, branchOrTag);
	}

	/**
	 * Read and parse a JSON file from a repository. Files ending in {@code .json5} are
	 * parsed leniently.
	 * @throws IllegalArgumentException if the content is not valid JSON
	 * @see #getRawFile(String, String, String)
	 */
	public Optional<JsonNode> getJsonFile(String fileName, @Nullable String repository,
			@Nullable String branchOrTag) {
		Optional<String> raw = getRawFile(fileName, repository, branchOrTag);
		if (raw.isEmpty()) {
			return Optional.empty();
		}
		ObjectMapper reader = fileName.endsWith(".json5") ? JSON5_READER : JSON_READER;
		try {
			return Optional.of(reader.readTree(raw.get()));
		}
		catch (JsonProcessingException e) {
			throw new IllegalArgumentException("Invalid JSON in " + fileName + ": " + e.getOriginalMessage(), e);
		}
	}

	public Optional<RepositorySession> getActiveSession() {
		synchronized (this) {
			return Optional.ofNullable(activeSession);
		}
	}

	public PlatformIdentity getIdentity() {
		return identity;
	}

	public PullRequestOperations pullRequests() {
		return pullRequestOperations;
	}

	public IssueOperations issues() {
		return issueOperations;
	}

	public CommentOperations comments() {
		return commentOperations;
	}

	public LabelOperations labels() {
		return labelOperations;
	}

	public BranchStatusOperations branchStatus() {
		return branchStatusOperations;
	}

	public RepositoryStorage getStorage() {
		return storage;
	}

	/**
	 * Gitea cannot force pull requests to be rebased before merging.
	 */
	public boolean getRepoForceRebase() {
		return false;
	}

	/**
	 * Gitea does not report vulnerability alerts.
	 */
	public List<VulnerabilityAlert> getVulnerabilityAlerts() {
		return List.of();
	}

	public String massageMarkdown(String body) {
		return MarkdownSupport.massageMarkdown(body, properties.getMaxBodyLength());
	}

	private static String ensureTrailingSlash(String url) {
		return url.endsWith("/") ? url : url + "/";
	}

}
