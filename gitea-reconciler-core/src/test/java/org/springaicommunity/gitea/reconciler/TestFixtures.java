package org.springaicommunity.gitea.reconciler;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Shared test data for the reconciliation tests.
 */
final class TestFixtures {

	static final String REPO = "owner/repo";

	static final String BOT = "renovate-bot";

	static final PlatformIdentity IDENTITY = new PlatformIdentity("https://gitea.example.com/api/v1/", 7L, BOT,
			"Renovate Bot <bot@example.com>", "1.21.4");

	private TestFixtures() {
	}

	static RepositoryInfo repository(String fullName) {
		return new RepositoryInfo(1L, fullName, false, false, false, false, true, true, true, true, true, true, "main",
				"https://gitea.example.com/" + fullName + ".git");
	}

	/**
	 * A session whose caches load through the given operations.
	 */
	static RepositorySession session(PullRequestOperations pullRequests, IssueOperations issues,
			LabelOperations labels) {
		return new RepositorySession(REPO, repository(REPO), MergeMethod.REBASE, false,
				() -> pullRequests.fetchPullRequests(REPO), () -> issues.fetchIssues(REPO),
				() -> labels.fetchLabels(REPO, "owner"));
	}

	static GiteaPullRequest giteaPr(int number, String branch, String title, String state) {
		return new GiteaPullRequest(number, state, false, true, title, "body of " + title, "main", branch,
				"sha" + number, REPO, BOT, LocalDateTime.of(2024, 1, number, 10, 0), false);
	}

	static Issue issue(int number, String state, String title, String body, int day) {
		return new Issue(number, state, title, body, List.of(), LocalDateTime.of(2024, 1, day, 10, 0));
	}

	static Label label(long id, String name, Label.Scope scope) {
		return new Label(id, name, "ff0000", scope);
	}

}
