package org.springaicommunity.gitea.reconciler;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springaicommunity.gitea.reconciler.TestFixtures.*;

/**
 * Tests for {@link GiteaPlatform} initialization and session lifecycle.
 */
@DisplayName("GiteaPlatform Tests")
@ExtendWith(MockitoExtension.class)
class GiteaPlatformTest {

	private static final String TOKEN = "abc123";

	@Mock
	private GiteaApi api;

	@Mock
	private RepositoryStorage storage;

	private ReconcilerProperties properties;

	private SecretSanitizer sanitizer;

	@BeforeEach
	void setUp() {
		properties = new ReconcilerProperties();
		properties.setEndpoint("https://gitea.example.com/api/v1");
		sanitizer = new SecretSanitizer();
	}

	@Nested
	@DisplayName("Platform Initialization Tests")
	class InitPlatformTest {

		@ParameterizedTest
		@ValueSource(strings = { "", "   " })
		@DisplayName("Should reject a blank token")
		void shouldRejectBlankToken(String token) {
			assertThatThrownBy(() -> GiteaPlatform.initPlatform(api, storage, properties, sanitizer, token))
				.isInstanceOf(AuthenticationException.class);
			verifyNoInteractions(api);
		}

		@Test
		@DisplayName("Should reject a missing token")
		void shouldRejectMissingToken() {
			assertThatThrownBy(() -> GiteaPlatform.initPlatform(api, storage, properties, sanitizer, null))
				.isInstanceOf(AuthenticationException.class)
				.hasMessageContaining("personal access token");
		}

		@Test
		@DisplayName("Should report a rejected token as authentication failure")
		void shouldReportRejectedToken() {
			GiteaApiException unauthorized = new GiteaApiException("Unauthorized", 401, null);
			when(api.getCurrentUser()).thenThrow(unauthorized);

			assertThatThrownBy(() -> GiteaPlatform.initPlatform(api, storage, properties, sanitizer, TOKEN))
				.isInstanceOf(AuthenticationException.class)
				.hasMessage("Authentication failure")
				.hasCause(unauthorized);
		}

		@Test
		@DisplayName("Should record the automation identity and register the token")
		void shouldRecordIdentity() {
			GiteaPlatform platform = platform();

			PlatformIdentity identity = platform.getIdentity();
			assertThat(identity.endpoint()).isEqualTo("https://gitea.example.com/api/v1/");
			assertThat(identity.username()).isEqualTo(BOT);
			assertThat(identity.userId()).isEqualTo(7L);
			assertThat(identity.gitAuthor()).isEqualTo("Renovate Bot <bot@example.com>");
			assertThat(identity.version()).isEqualTo("1.21.4");
			assertThat(sanitizer.sanitize("token=" + TOKEN)).isEqualTo("token=**redacted**");
		}

	}

	@Nested
	@DisplayName("Repository Initialization Tests")
	class InitRepoTest {

		private GiteaPlatform platform;

		@BeforeEach
		void setUp() {
			platform = platform();
		}

		@Test
		@DisplayName("Should start a session with the preferred merge method")
		void shouldStartSession() {
			when(api.getRepository(REPO)).thenReturn(repo(false, false, true, true, false, false, true));

			RepositorySession session = platform.initRepo(REPO, true);

			assertThat(session.repository()).isEqualTo(REPO);
			assertThat(session.owner()).isEqualTo("owner");
			assertThat(session.mergeMethod()).isEqualTo(MergeMethod.SQUASH);
			assertThat(session.defaultBranch()).isEqualTo("main");
			assertThat(session.cloneSubmodules()).isTrue();
			assertThat(session.pullRequests().state()).isEqualTo(CacheState.UNPOPULATED);
			assertThat(session.issues().state()).isEqualTo(CacheState.UNPOPULATED);
			assertThat(session.labels().state()).isEqualTo(CacheState.UNPOPULATED);
			assertThat(platform.getActiveSession()).containsSame(session);
			verify(storage).initRepo(REPO, "https://abc123@gitea.example.com/owner/repo.git", true);
		}

		@Test
		@DisplayName("Should check archived before any other condition")
		void shouldCheckArchivedFirst() {
			when(api.getRepository(REPO)).thenReturn(repo(true, true, false, false, true, false, false));

			assertThatThrownBy(() -> platform.initRepo(REPO, false))
				.isInstanceOfSatisfying(RepositoryUnusableException.class,
						e -> assertThat(e.getReason()).isEqualTo(RepositoryUnusableException.Reason.ARCHIVED));
			verifyNoInteractions(storage);
		}

		@Test
		@DisplayName("Should reject a mirror")
		void shouldRejectMirror() {
			when(api.getRepository(REPO)).thenReturn(repo(false, true, false, false, true, false, false));

			assertThatThrownBy(() -> platform.initRepo(REPO, false))
				.isInstanceOfSatisfying(RepositoryUnusableException.class,
						e -> assertThat(e.getReason()).isEqualTo(RepositoryUnusableException.Reason.MIRRORED));
		}

		@Test
		@DisplayName("Should reject a repository without push permission")
		void shouldRejectWithoutPush() {
			when(api.getRepository(REPO)).thenReturn(repo(false, false, true, false, true, false, false));

			assertThatThrownBy(() -> platform.initRepo(REPO, false))
				.isInstanceOfSatisfying(RepositoryUnusableException.class, e -> assertThat(e.getReason())
					.isEqualTo(RepositoryUnusableException.Reason.ACCESS_FORBIDDEN));
		}

		@Test
		@DisplayName("Should reject an empty repository")
		void shouldRejectEmpty() {
			when(api.getRepository(REPO)).thenReturn(repo(false, false, true, true, true, false, false));

			assertThatThrownBy(() -> platform.initRepo(REPO, false))
				.isInstanceOfSatisfying(RepositoryUnusableException.class,
						e -> assertThat(e.getReason()).isEqualTo(RepositoryUnusableException.Reason.EMPTY));
		}

		@Test
		@DisplayName("Should reject a repository that allows no merge method")
		void shouldRejectWithoutMergeMethod() {
			when(api.getRepository(REPO)).thenReturn(repo(false, false, true, true, false, false, false));

			assertThatThrownBy(() -> platform.initRepo(REPO, false))
				.isInstanceOf(NoMergeMethodAvailableException.class)
				.isInstanceOfSatisfying(RepositoryUnusableException.class,
						e -> assertThat(e.getReason()).isEqualTo(RepositoryUnusableException.Reason.BLOCKED));
			verifyNoInteractions(storage);
		}

		@Test
		@DisplayName("Should propagate metadata lookup failures")
		void shouldPropagateLookupFailure() {
			when(api.getRepository(REPO)).thenThrow(new GiteaApiException("Not found", 404, null));

			assertThatThrownBy(() -> platform.initRepo(REPO, false)).isInstanceOf(GiteaApiException.class);
		}

		@Test
		@DisplayName("Should close the previous session when a new one starts")
		void shouldCloseSessionOnReinit() {
			when(api.getRepository(anyString())).thenReturn(repo(false, false, true, true, false, true, false));
			when(api.listPullRequests(REPO, "all")).thenReturn(List.of(giteaPr(1, "renovate/a", "a", "open")));

			RepositorySession first = platform.initRepo(REPO, false);
			platform.pullRequests().getPrList(first);
			RepositorySession second = platform.initRepo("owner/other", false);

			assertThat(first.isActive()).isFalse();
			assertThat(first.pullRequests().state()).isEqualTo(CacheState.UNPOPULATED);
			assertThat(second.isActive()).isTrue();
			assertThat(platform.getActiveSession()).containsSame(second);
			assertThatThrownBy(() -> platform.pullRequests().getPrList(first))
				.isInstanceOf(IllegalStateException.class);
		}

	}

	@Nested
	@DisplayName("Platform Surface Tests")
	class SurfaceTest {

		@Test
		@DisplayName("Should list non-archived repositories of the automation account")
		void shouldListRepos() {
			GiteaPlatform platform = platform();
			when(api.searchRepositories(7L, false)).thenReturn(List.of(repository("bot/one"), repository("org/two")));

			assertThat(platform.getRepos()).containsExactly("bot/one", "org/two");
		}

		@Test
		@DisplayName("Should rethrow repository discovery errors")
		void shouldRethrowDiscoveryErrors() {
			GiteaPlatform platform = platform();
			when(api.searchRepositories(7L, false)).thenThrow(new GiteaApiException("Internal", 500, null));

			assertThatThrownBy(platform::getRepos).isInstanceOf(GiteaApiException.class);
		}

		@Test
		@DisplayName("Should report constant capabilities")
		void shouldReportCapabilities() {
			GiteaPlatform platform = platform();

			assertThat(platform.getRepoForceRebase()).isFalse();
			assertThat(platform.getVulnerabilityAlerts()).isEmpty();
		}

		@Test
		@DisplayName("Should rewrite links and truncate to the configured length")
		void shouldMassageMarkdown() {
			properties.setMaxBodyLength(20);
			GiteaPlatform platform = platform();

			String massaged = platform.massageMarkdown("See [#1](../pull/1) and a lot more text");

			assertThat(massaged).isEqualTo("See [#1](pulls/1) an");
		}

		@Test
		@DisplayName("Should embed the token as clone URL user info")
		void shouldEmbedToken() {
			GiteaPlatform platform = platform();

			assertThat(platform.withCredentials("https://gitea.example.com:3000/owner/repo.git"))
				.isEqualTo("https://abc123@gitea.example.com:3000/owner/repo.git");
		}

	}

	@Nested
	@DisplayName("Repository File Tests")
	class RepositoryFileTest {

		private GiteaPlatform platform;

		@BeforeEach
		void setUp() {
			platform = platform();
		}

		@Test
		@DisplayName("Should read a file from the given repository and ref")
		void shouldReadRawFile() {
			when(api.getFileContent("other/repo", "renovate.json", "v1.0.0")).thenReturn(Optional.of("{}"));

			assertThat(platform.getRawFile("renovate.json", "other/repo", "v1.0.0")).contains("{}");
		}

		@Test
		@DisplayName("Should default to the repository of the active session")
		void shouldDefaultToActiveRepository() {
			when(api.getRepository(REPO)).thenReturn(repo(false, false, true, true, false, true, false));
			when(api.getFileContent(REPO, "README.md", null)).thenReturn(Optional.of("# Hello"));
			platform.initRepo(REPO, false);

			assertThat(platform.getRawFile("README.md", null, null)).contains("# Hello");
		}

		@Test
		@DisplayName("Should require a repository when no session is active")
		void shouldRequireRepository() {
			assertThatThrownBy(() -> platform.getRawFile("README.md", null, null))
				.isInstanceOf(IllegalStateException.class);
			verify(api, never()).getFileContent(anyString(), anyString(), any());
		}

		@Test
		@DisplayName("Should parse a JSON file")
		void shouldParseJsonFile() {
			when(api.getFileContent(REPO, "renovate.json", null))
				.thenReturn(Optional.of("{\"extends\": [\"config:base\"], \"automerge\": true}"));

			Optional<JsonNode> json = platform.getJsonFile("renovate.json", REPO, null);

			assertThat(json).hasValueSatisfying(node -> {
				assertThat(node.path("extends").get(0).asText()).isEqualTo("config:base");
				assertThat(node.path("automerge").asBoolean()).isTrue();
			});
		}

		@Test
		@DisplayName("Should parse a JSON5 file leniently")
		void shouldParseJson5File() {
			when(api.getFileContent(REPO, "renovate.json5", null)).thenReturn(Optional.of("""
					{
					  // shared presets
					  extends: ['config:base',],
					  prHourlyLimit: 2,
					}
					"""));

			Optional<JsonNode> json = platform.getJsonFile("renovate.json5", REPO, null);

			assertThat(json).hasValueSatisfying(node -> {
				assertThat(node.path("extends").get(0).asText()).isEqualTo("config:base");
				assertThat(node.path("prHourlyLimit").asInt()).isEqualTo(2);
			});
		}

		@Test
		@DisplayName("Should reject JSON5 syntax in a plain JSON file")
		void shouldRejectLenientSyntaxInJsonFile() {
			when(api.getFileContent(REPO, "renovate.json", null))
				.thenReturn(Optional.of("{ // comment\n extends: ['config:base'] }"));

			assertThatThrownBy(() -> platform.getJsonFile("renovate.json", REPO, null))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("renovate.json");
		}

		@Test
		@DisplayName("Should report a path without file content as empty")
		void shouldReportMissingContent() {
			when(api.getFileContent(REPO, "docs", null)).thenReturn(Optional.empty());

			assertThat(platform.getJsonFile("docs", REPO, null)).isEmpty();
		}

		@Test
		@DisplayName("Should propagate a missing file")
		void shouldPropagateMissingFile() {
			when(api.getFileContent(REPO, "missing.json", null))
				.thenThrow(new GiteaApiException("Not found", 404, null));

			assertThatThrownBy(() -> platform.getJsonFile("missing.json", REPO, null))
				.isInstanceOfSatisfying(GiteaApiException.class, e -> assertThat(e.isNotFound()).isTrue());
		}

	}

	private GiteaPlatform platform() {
		when(api.getCurrentUser()).thenReturn(new GiteaUser(7L, BOT, "Renovate Bot", "bot@example.com"));
		when(api.getVersion()).thenReturn("1.21.4");
		return GiteaPlatform.initPlatform(api, storage, properties, sanitizer, TOKEN);
	}

	private static RepositoryInfo repo(boolean archived, boolean mirror, boolean canPull, boolean canPush,
			boolean empty, boolean allowRebase, boolean allowSquash) {
		return new RepositoryInfo(1L, REPO, archived, mirror, empty, false, canPull, canPush, allowRebase, false,
				allowSquash, false, "main", "https://gitea.example.com/owner/repo.git");
	}

}
