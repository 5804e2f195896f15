package org.springaicommunity.gitea.reconciler;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reconciliation of automation issues such as dependency dashboards.
 *
 * <p>
 * An issue is identified by its title. {@link #ensureIssue} keeps at most one open issue
 * per title and only writes when the remote state differs from the desired one.
 */
public class IssueOperations {

	private static final Logger logger = LoggerFactory.getLogger(IssueOperations.class);

	private static final Comparator<Issue> BY_CREATION = Comparator
		.comparing(Issue::createdAt, Comparator.nullsFirst(Comparator.naturalOrder()))
		.thenComparingInt(Issue::number);

	private final GiteaApi api;

	private final LabelOperations labelOperations;

	public IssueOperations(GiteaApi api, LabelOperations labelOperations) {
		this.api = api;
		this.labelOperations = labelOperations;
	}

	/**
	 * Cache loader: all issues of the repository, open and closed.
	 */
	List<Issue> fetchIssues(String repository) {
		List<Issue> issues = api.listIssues(repository, PrState.ALL);
		logger.debug("Retrieved {} issues", issues.size());
		return issues;
	}

	public List<Issue> getIssueList(RepositorySession session) {
		session.requireActive();
		return session.issues().get();
	}

	/**
	 * Read an issue. Failures are logged and reported as empty.
	 * @param session the repository session
	 * @param number the issue number
	 * @param useCache serve the issue from a populated cache when possible
	 * @return the issue, or empty if it cannot be read
	 */
	public Optional<Issue> getIssue(RepositorySession session, int number, boolean useCache) {
		session.requireActive();
		if (useCache) {
			Optional<Issue> cached = session.issues()
				.peek()
				.flatMap(issues -> issues.stream().filter(issue -> issue.number() == number).findFirst());
			if (cached.isPresent()) {
				return cached;
			}
		}
		try {
			return Optional.of(api.getIssue(session.repository(), number));
		}
		catch (GiteaApiException e) {
			logger.debug("Error getting issue #{}: {}", number, e.getMessage());
			return Optional.empty();
		}
	}

	/**
	 * Find the open issue with the given title.
	 */
	public Optional<Issue> findIssue(RepositorySession session, String title) {
		Optional<Issue> issue = getIssueList(session).stream()
			.filter(Issue::isOpen)
			.filter(i -> i.title().equals(title))
			.findFirst();
		if (issue.isEmpty()) {
			return Optional.empty();
		}
		logger.debug("Found issue #{}", issue.get().number());
		return getIssue(session, issue.get().number(), true);
	}

	/**
	 * Bring the issue identified by the request title to the desired state. Never throws
	 * for remote failures; they are logged and reported as
	 * {@link EnsureIssueResult#FAILED}.
	 * @param session the repository session
	 * @param request the desired issue
	 * @return what was done
	 */
	public EnsureIssueResult ensureIssue(RepositorySession session, EnsureIssueRequest request) {
		session.requireActive();
		logger.debug("ensureIssue({})", request.title());
		try {
			return reconcile(session, request);
		}
		catch (RuntimeException e) {
			logger.warn("Could not ensure issue '{}': {}", request.title(), e.getMessage(), e);
			return EnsureIssueResult.FAILED;
		}
	}

	private EnsureIssueResult reconcile(RepositorySession session, EnsureIssueRequest request) {
		String repository = session.repository();
		String title = request.title();
		String body = MarkdownSupport.smartLinks(request.body());
		List<Issue> issueList = getIssueList(session);
		List<Issue> matches = withTitle(issueList, title);
		if (matches.isEmpty() && request.reuseTitle() != null) {
			matches = withTitle(issueList, request.reuseTitle());
		}
		List<Long> labelIds = request.labels() != null ? labelOperations.resolveLabelIds(session, request.labels())
				: null;

		if (matches.isEmpty()) {
			Issue created = api.createIssue(repository, new IssueCreate(title, body, labelIds));
			logger.debug("Created new issue #{}", created.number());
			// Label expansion on the server may differ from what was requested
			session.issues().invalidate();
			return EnsureIssueResult.CREATED;
		}

		Optional<Issue> newestOpen = matches.stream().filter(Issue::isOpen).max(BY_CREATION);
		Issue active;
		if (newestOpen.isPresent()) {
			active = newestOpen.get();
		}
		else {
			if (request.once()) {
				logger.debug("Issue already closed - skipping update");
				return EnsureIssueResult.NONE;
			}
			if (request.shouldReOpen()) {
				logger.debug("Reopening previously closed issue");
			}
			active = matches.stream().max(BY_CREATION).orElseThrow();
		}

		for (Issue issue : matches) {
			if (issue.isOpen() && issue.number() != active.number()) {
				logger.warn("Closing duplicate issue #{}", issue.number());
				Issue closed = api.closeIssue(repository, issue.number());
				session.issues().replaceIfPopulated(cached -> cached.number() == issue.number(), closed);
			}
		}

		String desiredState = request.shouldReOpen() ? Issue.OPEN : active.state();
		// A closed issue is always written back, even when title and body match
		if (active.isOpen() && active.title().equals(title) && body.equals(active.body())) {
			logger.debug("Issue #{} is up to date - nothing to do", active.number());
			return EnsureIssueResult.NONE;
		}

		logger.debug("Updating issue #{}", active.number());
		int number = active.number();
		Issue updated = api.updateIssue(repository, number, new IssueUpdate(title, body, desiredState, null));
		if (labelIds != null && !Set.copyOf(labelIds).equals(updated.labelIds())) {
			List<Label> labels = api.replaceIssueLabels(repository, number, labelIds);
			updated = new Issue(updated.number(), updated.state(), updated.title(), updated.body(), labels,
					updated.createdAt());
		}
		Issue fresh = updated;
		session.issues().replaceIfPopulated(cached -> cached.number() == number, fresh);
		return EnsureIssueResult.UPDATED;
	}

	private static List<Issue> withTitle(List<Issue> issues, @Nullable String title) {
		return issues.stream().filter(issue -> issue.title().equals(title)).toList();
	}

	/**
	 * Close every open issue with the given title.
	 * @return the number of issues closed
	 */
	public int ensureIssueClosing(RepositorySession session, String title) {
		logger.debug("ensureIssueClosing({})", title);
		int closedCount = 0;
		for (Issue issue : getIssueList(session)) {
			if (issue.isOpen() && issue.title().equals(title)) {
				logger.debug("Closing issue #{}", issue.number());
				Issue closed = api.closeIssue(session.repository(), issue.number());
				session.issues().replaceIfPopulated(cached -> cached.number() == issue.number(), closed);
				closedCount++;
			}
		}
		return closedCount;
	}

	/**
	 * Assign users to an issue or pull request.
	 */
	public void addAssignees(RepositorySession session, int number, List<String> assignees) {
		session.requireActive();
		logger.debug("Updating assignees '{}' on #{}", String.join(", ", assignees), number);
		api.updateIssue(session.repository(), number, IssueUpdate.assigning(assignees));
	}

}
