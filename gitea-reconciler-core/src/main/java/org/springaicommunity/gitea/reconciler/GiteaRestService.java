package org.springaicommunity.gitea.reconciler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Service for Gitea REST API operations.
 *
 * <p>
 * Converts Gitea API JSON responses to strongly-typed DTOs at the service boundary and
 * walks {@code page}/{@code limit} pagination for list endpoints.
 */
public class GiteaRestService implements GiteaApi {

	private static final Logger logger = LoggerFactory.getLogger(GiteaRestService.class);

	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_DATE_TIME;

	private static final int MAX_PAGES = 1000;

	private final GiteaClient httpClient;

	private final ObjectMapper objectMapper;

	private final int pageSize;

	public GiteaRestService(GiteaClient httpClient, ObjectMapper objectMapper, int pageSize) {
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
		this.pageSize = pageSize;
	}

	@Override
	public GiteaUser getCurrentUser() {
		return parseUser(readTree(httpClient.get("/user")));
	}

	@Override
	public String getVersion() {
		return readTree(httpClient.get("/version")).path("version").asText("0.0.0");
	}

	@Override
	public List<RepositoryInfo> searchRepositories(long ownerId, boolean archived) {
		List<RepositoryInfo> repos = new ArrayList<>();
		for (JsonNode node : getAllPages("/repos/search", "uid=" + ownerId + "&archived=" + archived)) {
			repos.add(parseRepository(node));
		}
		return repos;
	}

	@Override
	public RepositoryInfo getRepository(String repository) {
		return parseRepository(readTree(httpClient.get(repoPath(repository))));
	}

	@Override
	public Optional<String> getFileContent(String repository, String path, @Nullable String ref) {
		String contentsPath = repoPath(repository) + "/contents/" + encodePath(path);
		String response = ref != null ? httpClient.getWithQuery(contentsPath, "ref=" + encode(ref))
				: httpClient.get(contentsPath);
		// Directories come back as an array of entries
		JsonNode content = readTree(response).path("content");
		if (!content.isTextual()) {
			logger.debug("No file content at {} in {}", path, repository);
			return Optional.empty();
		}
		try {
			byte[] decoded = Base64.getMimeDecoder().decode(content.asText());
			return Optional.of(new String(decoded, StandardCharsets.UTF_8));
		}
		catch (IllegalArgumentException e) {
			throw new GiteaApiException("Malformed file content from Gitea for " + path, e);
		}
	}

	@Override
	public List<GiteaPullRequest> listPullRequests(String repository, String state) {
		List<GiteaPullRequest> prs = new ArrayList<>();
		for (JsonNode node : getAllPages(repoPath(repository) + "/pulls", "state=" + state)) {
			prs.add(parsePullRequest(node));
		}
		return prs;
	}

	@Override
	public GiteaPullRequest getPullRequest(String repository, int number) {
		return parsePullRequest(readTree(httpClient.get(repoPath(repository) + "/pulls/" + number)));
	}

	@Override
	public GiteaPullRequest createPullRequest(String repository, PullRequestCreate request) {
		String response = httpClient.post(repoPath(repository) + "/pulls", writeJson(request));
		return parsePullRequest(readTree(response));
	}

	@Override
	public GiteaPullRequest updatePullRequest(String repository, int number, PullRequestUpdate update) {
		String response = httpClient.patch(repoPath(repository) + "/pulls/" + number, writeJson(update));
		return parsePullRequest(readTree(response));
	}

	@Override
	public void mergePullRequest(String repository, int number, MergeMethod method) {
		httpClient.post(repoPath(repository) + "/pulls/" + number + "/merge", writeJson(Map.of("Do", method.value())));
	}

	@Override
	public void requestReviewers(String repository, int number, List<String> reviewers) {
		httpClient.post(repoPath(repository) + "/pulls/" + number + "/requested_reviewers",
				writeJson(Map.of("reviewers", reviewers)));
	}

	@Override
	public List<Issue> listIssues(String repository, String state) {
		List<Issue> issues = new ArrayList<>();
		for (JsonNode node : getAllPages(repoPath(repository) + "/issues", "state=" + state + "&type=issues")) {
			issues.add(parseIssue(node));
		}
		return issues;
	}

	@Override
	public Issue getIssue(String repository, int number) {
		return parseIssue(readTree(httpClient.get(repoPath(repository) + "/issues/" + number)));
	}

	@Override
	public Issue createIssue(String repository, IssueCreate request) {
		return parseIssue(readTree(httpClient.post(repoPath(repository) + "/issues", writeJson(request))));
	}

	@Override
	public Issue updateIssue(String repository, int number, IssueUpdate update) {
		String response = httpClient.patch(repoPath(repository) + "/issues/" + number, writeJson(update));
		return parseIssue(readTree(response));
	}

	@Override
	public List<Label> replaceIssueLabels(String repository, int number, List<Long> labelIds) {
		String response = httpClient.put(repoPath(repository) + "/issues/" + number + "/labels",
				writeJson(Map.of("labels", labelIds)));
		return parseLabels(readTree(response), Label.Scope.REPOSITORY);
	}

	@Override
	public void unassignLabel(String repository, int number, long labelId) {
		httpClient.delete(repoPath(repository) + "/issues/" + number + "/labels/" + labelId);
	}

	@Override
	public List<Comment> listComments(String repository, int issueNumber) {
		// Older servers ignore page/limit on this endpoint and always return everything
		JsonNode nodes = readTree(httpClient.get(repoPath(repository) + "/issues/" + issueNumber + "/comments"));
		List<Comment> comments = new ArrayList<>();
		if (nodes.isArray()) {
			for (JsonNode node : nodes) {
				comments.add(parseComment(node, issueNumber));
			}
		}
		return comments;
	}

	@Override
	public Comment createComment(String repository, int issueNumber, String body) {
		String response = httpClient.post(repoPath(repository) + "/issues/" + issueNumber + "/comments",
				writeJson(Map.of("body", body)));
		return parseComment(readTree(response), issueNumber);
	}

	@Override
	public Comment updateComment(String repository, int issueNumber, long commentId, String body) {
		String response = httpClient.patch(repoPath(repository) + "/issues/comments/" + commentId,
				writeJson(Map.of("body", body)));
		return parseComment(readTree(response), issueNumber);
	}

	@Override
	public void deleteComment(String repository, long commentId) {
		httpClient.delete(repoPath(repository) + "/issues/comments/" + commentId);
	}

	@Override
	public List<Label> listRepositoryLabels(String repository) {
		return parseLabelNodes(getAllPages(repoPath(repository) + "/labels", ""), Label.Scope.REPOSITORY);
	}

	@Override
	public List<Label> listOrganizationLabels(String organization) {
		return parseLabelNodes(getAllPages("/orgs/" + encode(organization) + "/labels", ""),
				Label.Scope.ORGANIZATION);
	}

	@Override
	public CommitStatus createCommitStatus(String repository, String sha, CommitStatusCreate request) {
		String response = httpClient.post(repoPath(repository) + "/statuses/" + sha, writeJson(request));
		return parseCommitStatus(readTree(response));
	}

	@Override
	public CombinedCommitStatus getCombinedCommitStatus(String repository, String ref) {
		List<CommitStatus> statuses = new ArrayList<>();
		for (JsonNode node : getAllPages(repoPath(repository) + "/commits/" + encode(ref) + "/statuses", "")) {
			statuses.add(parseCommitStatus(node));
		}
		return CombinedCommitStatus.of(statuses);
	}

	// ========== Request Helpers ==========

	private List<JsonNode> getAllPages(String path, String query) {
		List<JsonNode> items = new ArrayList<>();
		String prefix = query.isEmpty() ? "" : query + "&";
		for (int page = 1; page <= MAX_PAGES; page++) {
			JsonNode response = readTree(httpClient.getWithQuery(path, prefix + "page=" + page + "&limit=" + pageSize));
			// Search endpoints wrap results in {"ok": true, "data": [...]}
			JsonNode array = response.isArray() ? response : response.path("data");
			if (!array.isArray() || array.isEmpty()) {
				break;
			}
			// Servers cap limit at MAX_RESPONSE_ITEMS, so a short page is not necessarily the last
			array.forEach(items::add);
		}
		logger.debug("Fetched {} items from {}", items.size(), path);
		return items;
	}

	private static String repoPath(String repository) {
		return "/repos/" + repository;
	}

	private static String encode(String segment) {
		return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
	}

	private static String encodePath(String path) {
		StringBuilder encoded = new StringBuilder();
		for (String segment : path.split("/")) {
			if (segment.isEmpty()) {
				continue;
			}
			if (encoded.length() > 0) {
				encoded.append('/');
			}
			encoded.append(encode(segment));
		}
		return encoded.toString();
	}

	private JsonNode readTree(String response) {
		if (response.isEmpty()) {
			return objectMapper.missingNode();
		}
		try {
			return objectMapper.readTree(response);
		}
		catch (JsonProcessingException e) {
			throw new GiteaApiException("Malformed response from Gitea: " + e.getOriginalMessage(), e);
		}
	}

	private String writeJson(Object body) {
		try {
			return objectMapper.writeValueAsString(body);
		}
		catch (JsonProcessingException e) {
			throw new IllegalArgumentException("Cannot serialize request body: " + e.getOriginalMessage(), e);
		}
	}

	// ========== JSON Parsing Methods ==========

	private GiteaUser parseUser(JsonNode node) {
		String login = text(node.path("login"));
		if (login == null || login.isEmpty()) {
			login = node.path("username").asText("");
		}
		return new GiteaUser(node.path("id").asLong(), login, text(node.path("full_name")), text(node.path("email")));
	}

	private RepositoryInfo parseRepository(JsonNode node) {
		JsonNode permissions = node.path("permissions");
		return new RepositoryInfo(node.path("id").asLong(), node.path("full_name").asText(""),
				node.path("archived").asBoolean(false), node.path("mirror").asBoolean(false),
				node.path("empty").asBoolean(false), node.path("fork").asBoolean(false),
				permissions.path("pull").asBoolean(false), permissions.path("push").asBoolean(false),
				node.path("allow_rebase").asBoolean(false), node.path("allow_rebase_explicit").asBoolean(false),
				node.path("allow_squash_merge").asBoolean(false), node.path("allow_merge_commits").asBoolean(false),
				node.path("default_branch").asText(""), node.path("clone_url").asText(""));
	}

	private GiteaPullRequest parsePullRequest(JsonNode node) {
		JsonNode head = node.path("head");
		boolean hasAssignees = text(node.path("assignee").path("login")) != null
				|| (node.path("assignees").isArray() && !node.path("assignees").isEmpty());
		return new GiteaPullRequest(node.path("number").asInt(), node.path("state").asText(""),
				node.path("merged").asBoolean(false), node.path("mergeable").asBoolean(false),
				node.path("title").asText(""), text(node.path("body")), text(node.path("base").path("ref")),
				text(head.path("label")), text(head.path("sha")), text(head.path("repo").path("full_name")),
				parseUsername(node.path("user")), parseDateTime(text(node.path("created_at"))), hasAssignees);
	}

	private Issue parseIssue(JsonNode node) {
		return new Issue(node.path("number").asInt(), node.path("state").asText(Issue.OPEN),
				node.path("title").asText(""), text(node.path("body")),
				parseLabels(node.path("labels"), Label.Scope.REPOSITORY),
				parseDateTime(text(node.path("created_at"))));
	}

	private Comment parseComment(JsonNode node, int issueNumber) {
		return new Comment(node.path("id").asLong(), issueNumber, node.path("body").asText(""));
	}

	private List<Label> parseLabels(JsonNode nodes, Label.Scope scope) {
		List<JsonNode> list = new ArrayList<>();
		if (nodes.isArray()) {
			nodes.forEach(list::add);
		}
		return parseLabelNodes(list, scope);
	}

	private List<Label> parseLabelNodes(List<JsonNode> nodes, Label.Scope scope) {
		List<Label> labels = new ArrayList<>();
		for (JsonNode node : nodes) {
			labels.add(new Label(node.path("id").asLong(), node.path("name").asText(""), text(node.path("color")),
					scope));
		}
		return labels;
	}

	private CommitStatus parseCommitStatus(JsonNode node) {
		// Responses carry the value as "status"; some versions also echo "state"
		String status = text(node.path("status"));
		if (status == null || status.isEmpty()) {
			status = node.path("state").asText("unknown");
		}
		return new CommitStatus(node.path("context").asText(""), status, text(node.path("description")),
				text(node.path("target_url")));
	}

	@Nullable
	private String parseUsername(JsonNode user) {
		String login = text(user.path("login"));
		return login != null ? login : text(user.path("username"));
	}

	@Nullable
	private static String text(JsonNode node) {
		return (node.isMissingNode() || node.isNull()) ? null : node.asText();
	}

	@Nullable
	private LocalDateTime parseDateTime(@Nullable String dateTimeStr) {
		if (dateTimeStr == null || dateTimeStr.isEmpty()) {
			return null;
		}
		try {
			return LocalDateTime.parse(dateTimeStr, ISO_FORMATTER);
		}
		catch (DateTimeParseException e) {
			logger.warn("Failed to parse datetime: {}", dateTimeStr);
			return null;
		}
	}

}
