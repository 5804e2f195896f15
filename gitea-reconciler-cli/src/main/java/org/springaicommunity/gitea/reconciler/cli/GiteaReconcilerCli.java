package org.springaicommunity.gitea.reconciler.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.gitea.reconciler.*;

import java.util.List;
import java.util.Optional;

/**
 * Gitea Reconciler CLI Application
 *
 * Plain Java command-line application driving the reconciler against one Gitea server. No
 * framework dependencies - uses GiteaReconcilerBuilder for wiring.
 *
 * Usage: java -jar gitea-reconciler-cli.jar COMMAND [OPTIONS]
 *
 * Environment Variables: GITEA_TOKEN - Gitea personal access token for authentication,
 * GITEA_ENDPOINT - API endpoint (optional)
 *
 * Exit codes: 0 on success, 1 on errors, 2 when the requested state could not be
 * reached.
 */
public class GiteaReconcilerCli {

	private static final Logger logger = LoggerFactory.getLogger(GiteaReconcilerCli.class);

	public static void main(String[] args) {
		try {
			int exitCode = run(args);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Reconciliation failed: {}", e.getMessage());
			System.exit(1);
		}
	}

	public static int run(String[] args) {
		ReconcilerProperties properties = new ReconcilerProperties();
		ArgumentParser argumentParser = new ArgumentParser(properties);

		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return 0;
		}

		ParsedConfiguration config = argumentParser.parseAndValidate(args);

		// Every command talks to the server and requires GITEA_TOKEN
		argumentParser.validateEnvironment();

		logConfiguration(config);

		GiteaReconcilerBuilder builder = GiteaReconcilerBuilder.create()
			.tokenFromEnv()
			.endpointFromEnv()
			.properties(properties);
		if (config.endpoint != null) {
			builder.endpoint(config.endpoint);
		}
		GiteaPlatform platform = builder.initPlatform();
		logger.info("Authenticated as {} (Gitea {})", platform.getIdentity().username(),
				platform.getIdentity().version());

		return execute(platform, config);
	}

	static int execute(GiteaPlatform platform, ParsedConfiguration config) {
		if ("repos".equals(config.command)) {
			return listRepositories(platform, config.verbose);
		}

		RepositorySession session = platform.initRepo(config.repository, false);
		switch (config.command) {
			case "branch-status":
				return showBranchStatus(platform, session, config);
			case "ensure-issue":
				return ensureIssue(platform, session, config);
			case "close-issue":
				int closed = platform.issues().ensureIssueClosing(session, config.title);
				logger.info("Closed {} issue(s) titled '{}'", closed, config.title);
				return 0;
			case "ensure-comment":
				boolean ensured = platform.comments().ensureComment(session, config.number, config.topic, config.body);
				logger.info("Comment on #{}: {}", config.number, ensured ? "in place" : "FAILED");
				return ensured ? 0 : 2;
			default:
				throw new IllegalArgumentException("Unknown command: " + config.command);
		}
	}

	private static int listRepositories(GiteaPlatform platform, boolean verbose) {
		List<String> repos = platform.getRepos();
		logger.info("Found {} repositories", repos.size());
		for (String repo : repos) {
			if (verbose) {
				logger.info("  - {}", repo);
			}
			System.out.println(repo);
		}
		return 0;
	}

	private static int showBranchStatus(GiteaPlatform platform, RepositorySession session,
			ParsedConfiguration config) {
		if (config.context != null) {
			Optional<BranchStatus> check = platform.branchStatus()
				.getBranchStatusCheck(session, config.branch, config.context);
			if (check.isEmpty()) {
				logger.info("No check '{}' on branch {}", config.context, config.branch);
				return 2;
			}
			System.out.println(check.get().value());
			return 0;
		}
		BranchStatus status = platform.branchStatus().getBranchStatus(session, config.branch);
		System.out.println(status.value());
		return 0;
	}

	private static int ensureIssue(GiteaPlatform platform, RepositorySession session, ParsedConfiguration config) {
		EnsureIssueRequest request = new EnsureIssueRequest(config.title, config.reuseTitle, config.body,
				config.labels, config.reopen, config.once);
		EnsureIssueResult result = platform.issues().ensureIssue(session, request);
		logger.info("Issue '{}': {}", config.title, result);
		return result == EnsureIssueResult.FAILED ? 2 : 0;
	}

	private static void logConfiguration(ParsedConfiguration config) {
		logger.info("Configuration:");
		logger.info("  Command: {}", config.command);
		logger.info("  Repository: {}", config.repository != null ? config.repository : "(not set)");
		logger.info("  Endpoint: {}", config.endpoint != null ? config.endpoint : "(default)");
		if (config.verbose) {
			logger.info("  Branch: {}", config.branch);
			logger.info("  Context: {}", config.context);
			logger.info("  Title: {}", config.title);
			logger.info("  Labels: {}", config.labels);
			logger.info("  Number: {}", config.number);
			logger.info("  Topic: {}", config.topic);
			logger.info("  Reopen: {}", config.reopen);
			logger.info("  Once: {}", config.once);
		}
	}

}
