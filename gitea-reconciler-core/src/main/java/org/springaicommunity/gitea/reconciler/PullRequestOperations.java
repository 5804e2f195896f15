package org.springaicommunity.gitea.reconciler;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Reconciliation of pull requests opened by the automation.
 *
 * <p>
 * Reads go through the session pull request cache. Pull requests this class creates or
 * updates are written back to the cache so later lookups see them without a refetch.
 */
public class PullRequestOperations {

	private static final Logger logger = LoggerFactory.getLogger(PullRequestOperations.class);

	private final GiteaApi api;

	private final LabelOperations labelOperations;

	private final SecretSanitizer sanitizer;

	@Nullable
	private final PlatformIdentity identity;

	private final String reviewersMinVersion;

	/**
	 * Create pull request operations.
	 * @param api the Gitea API
	 * @param labelOperations used to resolve label names on creation
	 * @param sanitizer redacts secrets from pull request bodies
	 * @param identity the automation identity, or null when not yet known (no author
	 * filtering is applied then)
	 * @param reviewersMinVersion oldest server version that accepts reviewer requests
	 */
	public PullRequestOperations(GiteaApi api, LabelOperations labelOperations, SecretSanitizer sanitizer,
			@Nullable PlatformIdentity identity, String reviewersMinVersion) {
		this.api = api;
		this.labelOperations = labelOperations;
		this.sanitizer = sanitizer;
		this.identity = identity;
		this.reviewersMinVersion = reviewersMinVersion;
	}

	/**
	 * Convert a Gitea pull request to its platform-neutral form. Pull requests whose base
	 * or head branch is gone, or that were opened by someone other than the automation,
	 * are not visible to the reconciler.
	 * @param pr the pull request as reported by Gitea
	 * @param botUsername the automation username, or null when unknown
	 * @return the converted pull request, or empty if it is not visible
	 */
	static Optional<PullRequest> toPullRequest(GiteaPullRequest pr, @Nullable String botUsername) {
		if (pr.baseRef() == null || pr.headLabel() == null || pr.headSha() == null || pr.headRepository() == null) {
			logger.trace("Skipping pull request #{} due to missing base and/or head branch", pr.number());
			return Optional.empty();
		}
		if (pr.author() != null && botUsername != null && !pr.author().equals(botUsername)) {
			return Optional.empty();
		}
		return Optional.of(new PullRequest(pr.number(), PrState.fromRemote(pr.state(), pr.merged()), pr.title(),
				pr.body() != null ? pr.body() : "", pr.headLabel(), pr.baseRef(), pr.headRepository(), pr.headSha(),
				pr.createdAt(), pr.mergeable(), pr.hasAssignees()));
	}

	/**
	 * Cache loader: every visible pull request of the repository, in any state.
	 */
	List<PullRequest> fetchPullRequests(String repository) {
		List<PullRequest> prs = api.listPullRequests(repository, PrState.ALL)
			.stream()
			.map(pr -> toPullRequest(pr, botUsername()))
			.flatMap(Optional::stream)
			.toList();
		logger.debug("Retrieved {} pull requests", prs.size());
		return prs;
	}

	public List<PullRequest> getPrList(RepositorySession session) {
		session.requireActive();
		return session.pullRequests().get();
	}

	/**
	 * Find the pull request opened from {@code branchName} in the session repository.
	 * @param session the repository session
	 * @param branchName the source branch
	 * @param title required title, or null to accept any
	 * @param state a state value, {@code "all"}, or a negation such as {@code "!open"}
	 * @return the first match
	 */
	public Optional<PullRequest> findPr(RepositorySession session, String branchName, @Nullable String title,
			String state) {
		logger.debug("findPr({}, {}, {})", branchName, title, state);
		Optional<PullRequest> match = getPrList(session).stream()
			.filter(pr -> pr.sourceRepository().equals(session.repository()))
			.filter(pr -> pr.sourceBranch().equals(branchName))
			.filter(pr -> PrState.matchesState(pr.state(), state))
			.filter(pr -> title == null || pr.title().equals(title))
			.findFirst();
		match.ifPresent(pr -> logger.debug("Found PR #{}", pr.number()));
		return match;
	}

	public Optional<PullRequest> findPr(RepositorySession session, String branchName) {
		return findPr(session, branchName, null, PrState.ALL);
	}

	/**
	 * Get a pull request by number, from the cache when present.
	 * @param session the repository session
	 * @param number the pull request number
	 * @return the pull request, or empty if it does not exist or is not visible
	 */
	public Optional<PullRequest> getPr(RepositorySession session, int number) {
		Optional<PullRequest> cached = getPrList(session).stream().filter(pr -> pr.number() == number).findFirst();
		if (cached.isPresent()) {
			logger.debug("Returning PR #{} from cache", number);
			return cached;
		}
		logger.debug("PR #{} not found in cache - fetching directly", number);
		GiteaPullRequest remote;
		try {
			remote = api.getPullRequest(session.repository(), number);
		}
		catch (GiteaApiException e) {
			if (e.isNotFound()) {
				return Optional.empty();
			}
			throw e;
		}
		Optional<PullRequest> pr = toPullRequest(remote, botUsername());
		pr.ifPresent(session.pullRequests()::appendIfPopulated);
		return pr;
	}

	/**
	 * Get the open pull request of a branch.
	 */
	public Optional<PullRequest> getBranchPr(RepositorySession session, String branchName) {
		logger.debug("getBranchPr({})", branchName);
		return findPr(session, branchName, null, PrState.OPEN.value())
			.flatMap(pr -> getPr(session, pr.number()));
	}

	/**
	 * Open a pull request. When Gitea answers 409 because a stale pull request for the
	 * same branch still exists, that pull request is adopted and brought up to date
	 * instead.
	 * @param session the repository session
	 * @param sourceBranch the head branch
	 * @param targetBranch the base branch
	 * @param title the title
	 * @param body the description; registered secrets are redacted
	 * @param labelNames labels to apply; unknown names are ignored
	 * @return the created or adopted pull request
	 * @throws GiteaApiException if creation fails and cannot be recovered
	 */
	public PullRequest createPr(RepositorySession session, String sourceBranch, String targetBranch, String title,
			String body, List<String> labelNames) {
		session.requireActive();
		String sanitizedBody = sanitizer.sanitize(body);
		logger.debug("Creating pull request: {} ({} => {})", title, sourceBranch, targetBranch);
		GiteaPullRequest created;
		try {
			List<Long> labelIds = labelOperations.resolveLabelIds(session, labelNames);
			created = api.createPullRequest(session.repository(),
					new PullRequestCreate(targetBranch, sourceBranch, title, sanitizedBody, labelIds));
		}
		catch (GiteaApiException e) {
			if (e.isConflict()) {
				return recoverFromConflict(session, sourceBranch, title, sanitizedBody, e);
			}
			throw e;
		}
		PullRequest pr = toPullRequest(created, botUsername()).orElseThrow(
				() -> new IllegalStateException("Cannot parse newly created pull request #" + created.number()));
		session.pullRequests().appendIfPopulated(pr);
		return pr;
	}

	private PullRequest recoverFromConflict(RepositorySession session, String sourceBranch, String title, String body,
			GiteaApiException conflict) {
		// Older Gitea versions keep a pull request open after its branch was deleted and
		// revive it when a branch of the same name is pushed again
		logger.warn("Attempting to recover from 409 Conflict in createPr({}, {})", title, sourceBranch);
		session.pullRequests().invalidate();
		Optional<PullRequest> existing = findPr(session, sourceBranch, null, PrState.OPEN.value());
		if (existing.isEmpty()) {
			throw conflict;
		}
		PullRequest pr = existing.get();
		if (pr.title().equals(title) && pr.body().equals(body)) {
			logger.debug("Recovered from 409 Conflict and PR for {} is up-to-date", sourceBranch);
			return pr;
		}
		logger.debug("Recovered from 409 Conflict, but PR for {} is outdated. Updating...", sourceBranch);
		updatePr(session, pr.number(), title, body, null);
		return pr.withTitleAndBody(title, body);
	}

	/**
	 * Update a pull request. Null or empty {@code body} and null {@code state} are left
	 * unchanged on the server.
	 * @param session the repository session
	 * @param number the pull request number
	 * @param title the new title
	 * @param body the new description
	 * @param state {@link PrState#OPEN} or {@link PrState#CLOSED}
	 */
	public void updatePr(RepositorySession session, int number, String title, @Nullable String body,
			@Nullable PrState state) {
		session.requireActive();
		if (state == PrState.MERGED) {
			throw new IllegalArgumentException("Pull requests are merged with mergePr, not updatePr");
		}
		PullRequestUpdate update = new PullRequestUpdate(title, (body == null || body.isEmpty()) ? null : body,
				state != null ? state.value() : null);
		GiteaPullRequest updated = api.updatePullRequest(session.repository(), number, update);
		toPullRequest(updated, botUsername())
			.ifPresent(pr -> session.pullRequests().replaceIfPopulated(cached -> cached.number() == number, pr));
	}

	/**
	 * Merge a pull request with the session merge method.
	 * @return true if Gitea accepted the merge
	 */
	public boolean mergePr(RepositorySession session, int number) {
		session.requireActive();
		try {
			api.mergePullRequest(session.repository(), number, session.mergeMethod());
			return true;
		}
		catch (GiteaApiException e) {
			logger.warn("Merging of PR #{} failed: {}", number, e.getMessage());
			return false;
		}
	}

	/**
	 * Request reviews. Does nothing on servers that do not support reviewer requests;
	 * failures are logged.
	 */
	public void addReviewers(RepositorySession session, int number, List<String> reviewers) {
		session.requireActive();
		logger.debug("Adding reviewers '{}' to #{}", String.join(", ", reviewers), number);
		String version = identity != null ? identity.version() : "0.0.0";
		if (!GiteaVersion.isAtLeast(version, reviewersMinVersion)) {
			logger.debug("Adding reviewers is not supported by Gitea {}", version);
			return;
		}
		try {
			api.requestReviewers(session.repository(), number, reviewers);
		}
		catch (GiteaApiException e) {
			logger.warn("Failed to assign reviewers {} to #{}: {}", reviewers, number, e.getMessage());
		}
	}

	@Nullable
	private String botUsername() {
		return identity != null ? identity.username() : null;
	}

}
