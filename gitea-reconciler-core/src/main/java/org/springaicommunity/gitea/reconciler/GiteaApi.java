package org.springaicommunity.gitea.reconciler;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * Interface for Gitea REST API operations.
 *
 * <p>
 * Returns strongly-typed DTOs instead of raw JSON. Every method may fail with
 * {@link GiteaApiException}; callers that branch on a missing resource check
 * {@link GiteaApiException#isNotFound()}. List methods return the complete collection
 * across all pages.
 */
public interface GiteaApi {

	/**
	 * Get the authenticated user.
	 * @return the user owning the token
	 */
	GiteaUser getCurrentUser();

	/**
	 * Get the Gitea server version.
	 * @return version string such as "1.21.4"
	 */
	String getVersion();

	/**
	 * Search repositories owned by (or accessible to) a user.
	 * @param ownerId the user id
	 * @param archived whether to return archived repositories
	 * @return matching repositories
	 */
	List<RepositoryInfo> searchRepositories(long ownerId, boolean archived);

	/**
	 * Get repository metadata.
	 * @param repository repository in "owner/repo" format
	 * @return repository information
	 */
	RepositoryInfo getRepository(String repository);

	/**
	 * Read a file of the repository.
	 * @param repository repository in "owner/repo" format
	 * @param path file path relative to the repository root
	 * @param ref branch, tag or commit; the default branch when null
	 * @return the decoded UTF-8 content, or empty if the path holds no file content
	 */
	Optional<String> getFileContent(String repository, String path, @Nullable String ref);

	/**
	 * List pull requests.
	 * @param repository repository in "owner/repo" format
	 * @param state "open", "closed" or "all"
	 * @return pull requests in the order returned by the server
	 */
	List<GiteaPullRequest> listPullRequests(String repository, String state);

	GiteaPullRequest getPullRequest(String repository, int number);

	/**
	 * Create a pull request. Fails with status 409 when the server already holds a pull
	 * request for the same branch pairing.
	 */
	GiteaPullRequest createPullRequest(String repository, PullRequestCreate request);

	GiteaPullRequest updatePullRequest(String repository, int number, PullRequestUpdate update);

	void mergePullRequest(String repository, int number, MergeMethod method);

	void requestReviewers(String repository, int number, List<String> reviewers);

	/**
	 * List issues, excluding pull requests.
	 * @param repository repository in "owner/repo" format
	 * @param state "open", "closed" or "all"
	 * @return issues in the order returned by the server
	 */
	List<Issue> listIssues(String repository, String state);

	Issue getIssue(String repository, int number);

	Issue createIssue(String repository, IssueCreate request);

	Issue updateIssue(String repository, int number, IssueUpdate update);

	default Issue closeIssue(String repository, int number) {
		return updateIssue(repository, number, IssueUpdate.closing());
	}

	/**
	 * Replace all labels of an issue or pull request.
	 * @return the labels now assigned
	 */
	List<Label> replaceIssueLabels(String repository, int number, List<Long> labelIds);

	void unassignLabel(String repository, int number, long labelId);

	List<Comment> listComments(String repository, int issueNumber);

	Comment createComment(String repository, int issueNumber, String body);

	Comment updateComment(String repository, int issueNumber, long commentId, String body);

	void deleteComment(String repository, long commentId);

	List<Label> listRepositoryLabels(String repository);

	/**
	 * List labels defined at organization level. Fails when the owner is a user rather
	 * than an organization, or on servers older than 1.12.
	 */
	List<Label> listOrganizationLabels(String organization);

	CommitStatus createCommitStatus(String repository, String sha, CommitStatusCreate request);

	/**
	 * Get all status checks of a ref together with their aggregate.
	 * @param repository repository in "owner/repo" format
	 * @param ref branch name or commit id
	 * @return the combined status
	 */
	CombinedCommitStatus getCombinedCommitStatus(String repository, String ref);

}
