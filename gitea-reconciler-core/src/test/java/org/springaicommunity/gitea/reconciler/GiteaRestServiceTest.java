package org.springaicommunity.gitea.reconciler;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.Base64;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link GiteaRestService} with a mocked {@link GiteaClient}. No real Gitea API
 * calls.
 */
@DisplayName("GiteaRestService Tests")
@ExtendWith(MockitoExtension.class)
class GiteaRestServiceTest {

	@Mock
	private GiteaClient mockHttpClient;

	private ObjectMapper realObjectMapper;

	private GiteaRestService restService;

	@BeforeEach
	void setUp() {
		realObjectMapper = ObjectMapperFactory.create();
		restService = new GiteaRestService(mockHttpClient, realObjectMapper, 2);
	}

	@Nested
	@DisplayName("User and Repository Tests")
	class UserAndRepositoryTest {

		@Test
		@DisplayName("Should parse the authenticated user")
		void shouldParseCurrentUser() {
			when(mockHttpClient.get("/user")).thenReturn("""
					{"id": 7, "login": "renovate-bot", "full_name": "Renovate Bot", "email": "bot@example.com"}
					""");

			GiteaUser user = restService.getCurrentUser();

			assertThat(user.id()).isEqualTo(7L);
			assertThat(user.username()).isEqualTo("renovate-bot");
			assertThat(user.gitAuthor()).isEqualTo("Renovate Bot <bot@example.com>");
		}

		@Test
		@DisplayName("Should fall back to username when login is absent")
		void shouldFallBackToUsername() {
			when(mockHttpClient.get("/user")).thenReturn("{\"id\": 3, \"username\": \"legacy\", \"email\": \"l@x\"}");

			assertThat(restService.getCurrentUser().username()).isEqualTo("legacy");
		}

		@Test
		@DisplayName("Should read the server version")
		void shouldReadVersion() {
			when(mockHttpClient.get("/version")).thenReturn("{\"version\": \"1.21.4\"}");

			assertThat(restService.getVersion()).isEqualTo("1.21.4");
		}

		@Test
		@DisplayName("Should parse repository permissions and merge settings")
		void shouldParseRepository() {
			when(mockHttpClient.get("/repos/owner/repo")).thenReturn("""
					{
					    "id": 42,
					    "full_name": "owner/repo",
					    "archived": false,
					    "mirror": true,
					    "empty": false,
					    "fork": true,
					    "permissions": {"admin": false, "push": true, "pull": true},
					    "allow_rebase": false,
					    "allow_rebase_explicit": true,
					    "allow_squash_merge": true,
					    "allow_merge_commits": false,
					    "default_branch": "develop",
					    "clone_url": "https://gitea.example.com/owner/repo.git"
					}
					""");

			RepositoryInfo repo = restService.getRepository("owner/repo");

			assertThat(repo.fullName()).isEqualTo("owner/repo");
			assertThat(repo.mirror()).isTrue();
			assertThat(repo.fork()).isTrue();
			assertThat(repo.canPull()).isTrue();
			assertThat(repo.canPush()).isTrue();
			assertThat(repo.allowRebase()).isFalse();
			assertThat(repo.allowRebaseExplicit()).isTrue();
			assertThat(repo.defaultBranch()).isEqualTo("develop");
			assertThat(repo.cloneUrl()).isEqualTo("https://gitea.example.com/owner/repo.git");
		}

		@Test
		@DisplayName("Should unwrap search results from the data envelope")
		void shouldUnwrapSearchResults() {
			when(mockHttpClient.getWithQuery("/repos/search", "uid=7&archived=false&page=1&limit=2"))
				.thenReturn("{\"ok\": true, \"data\": [{\"id\": 1, \"full_name\": \"bot/one\"}]}");
			when(mockHttpClient.getWithQuery("/repos/search", "uid=7&archived=false&page=2&limit=2"))
				.thenReturn("{\"ok\": true, \"data\": []}");

			List<RepositoryInfo> repos = restService.searchRepositories(7L, false);

			assertThat(repos).extracting(RepositoryInfo::fullName).containsExactly("bot/one");
		}

	}

	@Nested
	@DisplayName("Pagination Tests")
	class PaginationTest {

		@Test
		@DisplayName("Should keep fetching past a short page until an empty page is returned")
		void shouldFetchAllPages() {
			// A server capping limit below the page size returns short pages that are not the last
			when(mockHttpClient.getWithQuery("/repos/owner/repo/pulls", "state=all&page=1&limit=2"))
				.thenReturn("[" + prJson(1, "a") + "]");
			when(mockHttpClient.getWithQuery("/repos/owner/repo/pulls", "state=all&page=2&limit=2"))
				.thenReturn("[" + prJson(2, "b") + "]");
			when(mockHttpClient.getWithQuery("/repos/owner/repo/pulls", "state=all&page=3&limit=2")).thenReturn("[]");

			List<GiteaPullRequest> prs = restService.listPullRequests("owner/repo", "all");

			assertThat(prs).extracting(GiteaPullRequest::number).containsExactly(1, 2);
			verify(mockHttpClient, times(3)).getWithQuery(eq("/repos/owner/repo/pulls"), anyString());
		}

		@Test
		@DisplayName("Should stop on an empty page")
		void shouldStopOnEmptyPage() {
			when(mockHttpClient.getWithQuery("/repos/owner/repo/labels", "page=1&limit=2"))
				.thenReturn("[{\"id\": 1, \"name\": \"bug\"}, {\"id\": 2, \"name\": \"deps\"}]");
			when(mockHttpClient.getWithQuery("/repos/owner/repo/labels", "page=2&limit=2")).thenReturn("[]");

			List<Label> labels = restService.listRepositoryLabels("owner/repo");

			assertThat(labels).extracting(Label::name).containsExactly("bug", "deps");
			assertThat(labels).allMatch(label -> label.scope() == Label.Scope.REPOSITORY);
		}

		@Test
		@DisplayName("Should mark organization labels with organization scope")
		void shouldMarkOrganizationLabels() {
			when(mockHttpClient.getWithQuery("/orgs/owner/labels", "page=1&limit=2"))
				.thenReturn("[{\"id\": 9, \"name\": \"security\"}]");
			when(mockHttpClient.getWithQuery("/orgs/owner/labels", "page=2&limit=2")).thenReturn("[]");

			List<Label> labels = restService.listOrganizationLabels("owner");

			assertThat(labels).singleElement().satisfies(label -> {
				assertThat(label.id()).isEqualTo(9L);
				assertThat(label.scope()).isEqualTo(Label.Scope.ORGANIZATION);
			});
		}

	}

	@Nested
	@DisplayName("Pull Request Tests")
	class PullRequestTest {

		@Test
		@DisplayName("Should parse head, base and author of a pull request")
		void shouldParsePullRequest() {
			when(mockHttpClient.get("/repos/owner/repo/pulls/5")).thenReturn(prJson(5, "renovate/lodash"));

			GiteaPullRequest pr = restService.getPullRequest("owner/repo", 5);

			assertThat(pr.number()).isEqualTo(5);
			assertThat(pr.headLabel()).isEqualTo("renovate/lodash");
			assertThat(pr.headSha()).isEqualTo("abc5");
			assertThat(pr.headRepository()).isEqualTo("owner/repo");
			assertThat(pr.baseRef()).isEqualTo("main");
			assertThat(pr.author()).isEqualTo("renovate-bot");
			assertThat(pr.createdAt()).isEqualTo(LocalDateTime.of(2024, 3, 1, 12, 0));
			assertThat(pr.hasAssignees()).isFalse();
		}

		@Test
		@DisplayName("Should report missing head branch as null")
		void shouldReportMissingHead() {
			when(mockHttpClient.get("/repos/owner/repo/pulls/6"))
				.thenReturn("{\"number\": 6, \"state\": \"open\", \"title\": \"t\", \"base\": {\"ref\": \"main\"}}");

			GiteaPullRequest pr = restService.getPullRequest("owner/repo", 6);

			assertThat(pr.headLabel()).isNull();
			assertThat(pr.headRepository()).isNull();
		}

		@Test
		@DisplayName("Should propagate not found as GiteaApiException")
		void shouldPropagateNotFound() {
			when(mockHttpClient.get("/repos/owner/repo/pulls/404"))
				.thenThrow(new GiteaApiException("Not found", 404, "{}"));

			assertThatThrownBy(() -> restService.getPullRequest("owner/repo", 404))
				.isInstanceOfSatisfying(GiteaApiException.class, e -> assertThat(e.isNotFound()).isTrue());
		}

		@Test
		@DisplayName("Should send create request with snake_case fields")
		void shouldSendCreateRequest() throws Exception {
			when(mockHttpClient.post(eq("/repos/owner/repo/pulls"), anyString())).thenReturn(prJson(8, "feature"));

			restService.createPullRequest("owner/repo",
					new PullRequestCreate("main", "feature", "Update lodash", "body", List.of(1L, 2L)));

			ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
			verify(mockHttpClient).post(eq("/repos/owner/repo/pulls"), body.capture());
			var json = realObjectMapper.readTree(body.getValue());
			assertThat(json.path("base").asText()).isEqualTo("main");
			assertThat(json.path("head").asText()).isEqualTo("feature");
			assertThat(json.path("labels")).hasSize(2);
		}

		@Test
		@DisplayName("Should omit unset fields in a partial update")
		void shouldOmitUnsetFields() {
			when(mockHttpClient.patch("/repos/owner/repo/pulls/8", "{\"title\":\"New title\"}"))
				.thenReturn(prJson(8, "feature"));

			restService.updatePullRequest("owner/repo", 8, new PullRequestUpdate("New title", null, null));

			verify(mockHttpClient).patch("/repos/owner/repo/pulls/8", "{\"title\":\"New title\"}");
		}

		@Test
		@DisplayName("Should send the merge style in the Do field")
		void shouldSendMergeStyle() {
			when(mockHttpClient.post("/repos/owner/repo/pulls/8/merge", "{\"Do\":\"rebase-merge\"}")).thenReturn("");

			restService.mergePullRequest("owner/repo", 8, MergeMethod.REBASE_MERGE);

			verify(mockHttpClient).post("/repos/owner/repo/pulls/8/merge", "{\"Do\":\"rebase-merge\"}");
		}

	}

	@Nested
	@DisplayName("Issue and Comment Tests")
	class IssueAndCommentTest {

		@Test
		@DisplayName("Should close an issue with a state-only update")
		void shouldCloseIssue() {
			when(mockHttpClient.patch("/repos/owner/repo/issues/3", "{\"state\":\"closed\"}")).thenReturn("""
					{"number": 3, "state": "closed", "title": "Dashboard", "body": "b",
					 "labels": [{"id": 4, "name": "deps"}], "created_at": "2024-01-02T03:04:05Z"}
					""");

			Issue issue = restService.closeIssue("owner/repo", 3);

			assertThat(issue.isOpen()).isFalse();
			assertThat(issue.labelIds()).containsExactly(4L);
			assertThat(issue.createdAt()).isEqualTo(LocalDateTime.of(2024, 1, 2, 3, 4, 5));
		}

		@Test
		@DisplayName("Should list issues excluding pull requests")
		void shouldListIssues() {
			when(mockHttpClient.getWithQuery("/repos/owner/repo/issues", "state=all&type=issues&page=1&limit=2"))
				.thenReturn("[{\"number\": 1, \"state\": \"open\", \"title\": \"A\", \"body\": null}]");
			when(mockHttpClient.getWithQuery("/repos/owner/repo/issues", "state=all&type=issues&page=2&limit=2"))
				.thenReturn("[]");

			List<Issue> issues = restService.listIssues("owner/repo", "all");

			assertThat(issues).singleElement().satisfies(issue -> {
				assertThat(issue.title()).isEqualTo("A");
				assertThat(issue.body()).isNull();
			});
		}

		@Test
		@DisplayName("Should list comments of an issue without paging")
		void shouldListComments() {
			when(mockHttpClient.get("/repos/owner/repo/issues/3/comments"))
				.thenReturn("[{\"id\": 11, \"body\": \"one\"}, {\"id\": 12, \"body\": \"two\"}, {\"id\": 13, \"body\": \"three\"}]");

			List<Comment> comments = restService.listComments("owner/repo", 3);

			assertThat(comments).extracting(Comment::id).containsExactly(11L, 12L, 13L);
			assertThat(comments).allMatch(comment -> comment.issueNumber() == 3);
		}

		@Test
		@DisplayName("Should replace issue labels by id")
		void shouldReplaceLabels() {
			when(mockHttpClient.put("/repos/owner/repo/issues/3/labels", "{\"labels\":[4,5]}"))
				.thenReturn("[{\"id\": 4, \"name\": \"deps\"}, {\"id\": 5, \"name\": \"bot\"}]");

			List<Label> labels = restService.replaceIssueLabels("owner/repo", 3, List.of(4L, 5L));

			assertThat(labels).extracting(Label::id).containsExactly(4L, 5L);
		}

	}

	@Nested
	@DisplayName("Repository Contents Tests")
	class RepositoryContentsTest {

		@Test
		@DisplayName("Should decode base64 file content at a ref")
		void shouldDecodeFileContent() {
			String encoded = Base64.getMimeEncoder()
				.encodeToString("{\"extends\": [\"config:base\"]}\n".getBytes(StandardCharsets.UTF_8));
			when(mockHttpClient.getWithQuery("/repos/owner/repo/contents/.gitea/renovate.json", "ref=release%2F1.x"))
				.thenReturn("{\"type\": \"file\", \"encoding\": \"base64\", \"content\": \""
						+ encoded.replace("\r\n", "\\n") + "\"}");

			assertThat(restService.getFileContent("owner/repo", ".gitea/renovate.json", "release/1.x"))
				.contains("{\"extends\": [\"config:base\"]}\n");
		}

		@Test
		@DisplayName("Should read from the default branch when no ref is given")
		void shouldReadDefaultBranch() {
			when(mockHttpClient.get("/repos/owner/repo/contents/my%20notes.md"))
				.thenReturn("{\"type\": \"file\", \"content\": \"aMOpbGxv\"}");

			assertThat(restService.getFileContent("owner/repo", "my notes.md", null)).contains("h\u00e9llo");
		}

		@Test
		@DisplayName("Should report a directory as empty")
		void shouldReportDirectoryAsEmpty() {
			when(mockHttpClient.get("/repos/owner/repo/contents/docs"))
				.thenReturn("[{\"type\": \"file\", \"name\": \"index.md\"}]");

			assertThat(restService.getFileContent("owner/repo", "docs", null)).isEmpty();
		}

		@Test
		@DisplayName("Should propagate a missing file")
		void shouldPropagateMissingFile() {
			when(mockHttpClient.get("/repos/owner/repo/contents/missing.json"))
				.thenThrow(new GiteaApiException("Resource not found", 404, null));

			assertThatThrownBy(() -> restService.getFileContent("owner/repo", "missing.json", null))
				.isInstanceOfSatisfying(GiteaApiException.class, e -> assertThat(e.isNotFound()).isTrue());
		}

	}

	@Nested
	@DisplayName("Commit Status Tests")
	class CommitStatusTest {

		@Test
		@DisplayName("Should aggregate the worst status across pages")
		void shouldAggregateWorstStatus() {
			when(mockHttpClient.getWithQuery("/repos/owner/repo/commits/renovate%2Flodash/statuses", "page=1&limit=2"))
				.thenReturn("""
						[{"context": "ci/build", "status": "success"},
						 {"context": "ci/test", "status": "failure", "target_url": "https://ci/1"}]
						""");
			when(mockHttpClient.getWithQuery("/repos/owner/repo/commits/renovate%2Flodash/statuses", "page=2&limit=2"))
				.thenReturn("[]");

			CombinedCommitStatus combined = restService.getCombinedCommitStatus("owner/repo", "renovate/lodash");

			assertThat(combined.worstStatus()).isEqualTo("failure");
			assertThat(combined.findByContext("ci/test")).hasValueSatisfying(
					status -> assertThat(status.targetUrl()).isEqualTo("https://ci/1"));
		}

		@Test
		@DisplayName("Should post a status for a commit")
		void shouldPostStatus() throws Exception {
			when(mockHttpClient.post(eq("/repos/owner/repo/statuses/abc"), anyString()))
				.thenReturn("{\"context\": \"renovate/stability-days\", \"status\": \"pending\"}");

			CommitStatus status = restService.createCommitStatus("owner/repo", "abc",
					new CommitStatusCreate("pending", "renovate/stability-days", "Waiting", "https://x"));

			ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
			verify(mockHttpClient).post(eq("/repos/owner/repo/statuses/abc"), body.capture());
			assertThat(realObjectMapper.readTree(body.getValue()).path("target_url").asText())
				.isEqualTo("https://x");
			assertThat(status.status()).isEqualTo("pending");
		}

	}

	@Test
	@DisplayName("Should wrap malformed JSON in GiteaApiException")
	void shouldWrapMalformedJson() {
		when(mockHttpClient.get("/version")).thenReturn("{not json");

		assertThatThrownBy(() -> restService.getVersion()).isInstanceOf(GiteaApiException.class)
			.hasMessageContaining("Malformed response");
	}

	private static String prJson(int number, String branch) {
		return """
				{
				    "number": %d,
				    "state": "open",
				    "merged": false,
				    "mergeable": true,
				    "title": "PR %d",
				    "body": "body",
				    "base": {"ref": "main"},
				    "head": {"label": "%s", "sha": "abc%d", "repo": {"full_name": "owner/repo"}},
				    "user": {"login": "renovate-bot"},
				    "created_at": "2024-03-01T12:00:00+00:00",
				    "assignees": []
				}
				""".formatted(number, number, branch, number);
	}

}
