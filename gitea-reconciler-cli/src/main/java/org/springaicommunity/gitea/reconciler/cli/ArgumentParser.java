package org.springaicommunity.gitea.reconciler.cli;

import org.springaicommunity.gitea.reconciler.EnvironmentSupport;
import org.springaicommunity.gitea.reconciler.ReconcilerProperties;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Command-line argument parser for the Gitea reconciler. Pure Java implementation with no
 * framework dependencies for maximum testability.
 */
public class ArgumentParser {

	static final List<String> COMMANDS = List.of("repos", "branch-status", "ensure-issue", "close-issue",
			"ensure-comment");

	private final ReconcilerProperties defaultProperties;

	public ArgumentParser(ReconcilerProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration();

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-r", "--repo":
					config.repository = getRequiredValue(args, i, "repository");
					i++; // Skip next argument since we consumed it
					break;

				case "-b", "--branch":
					config.branch = getRequiredValue(args, i, "branch");
					i++;
					break;

				case "-c", "--context":
					config.context = getRequiredValue(args, i, "context");
					i++;
					break;

				case "-t", "--title":
					config.title = getRequiredValue(args, i, "title");
					i++;
					break;

				case "--reuse-title":
					config.reuseTitle = getRequiredValue(args, i, "reuse-title");
					i++;
					break;

				case "--body":
					config.body = getRequiredValue(args, i, "body");
					i++;
					break;

				case "-l", "--labels":
					String labelStr = getRequiredValue(args, i, "labels");
					config.labels = Arrays.stream(labelStr.split(","))
						.map(String::trim)
						.filter(s -> !s.isEmpty())
						.collect(ArrayList::new, ArrayList::add, ArrayList::addAll);
					i++;
					break;

				case "-n", "--number":
					String numberStr = getRequiredValue(args, i, "number");
					try {
						config.number = Integer.parseInt(numberStr);
						if (config.number <= 0) {
							throw new IllegalArgumentException("Number must be positive: " + config.number);
						}
					}
					catch (NumberFormatException e) {
						throw new IllegalArgumentException(
								"Invalid number '" + numberStr + "': must be a positive integer");
					}
					i++;
					break;

				case "--topic":
					config.topic = getRequiredValue(args, i, "topic");
					i++;
					break;

				case "-e", "--endpoint":
					config.endpoint = getRequiredValue(args, i, "endpoint");
					i++;
					break;

				case "--reopen":
					config.reopen = true;
					break;

				case "--once":
					config.once = true;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					if (config.command != null) {
						throw new IllegalArgumentException("Unexpected argument: " + arg);
					}
					config.command = arg;
					break;
			}
		}

		validateConfiguration(config);

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		if (args.length == 0) {
			return true;
		}
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: gitea-reconciler COMMAND [OPTIONS]\n");
		help.append("\n");
		help.append("Keep automation issues, comments and status checks in sync with a Gitea server.\n");
		help.append("\n");
		help.append("COMMANDS:\n");
		help.append("    repos                   List repositories of the automation account\n");
		help.append("    branch-status           Show the combined status (or one check) of a branch\n");
		help.append("    ensure-issue            Create or update the issue with the given title\n");
		help.append("    close-issue             Close every open issue with the given title\n");
		help.append("    ensure-comment          Create or update a comment on an issue or pull request\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help              Show this help message\n");
		help.append("    -r, --repo REPO         Repository in format owner/repo\n");
		help.append("    -e, --endpoint URL      Gitea API endpoint (default: ")
			.append(defaultProperties.getEndpoint())
			.append(")\n");
		help.append("    -v, --verbose           Log more details\n");
		help.append("\n");
		help.append("BRANCH STATUS OPTIONS:\n");
		help.append("    -b, --branch BRANCH     Branch to inspect\n");
		help.append("    -c, --context NAME      Only report the check with this name\n");
		help.append("\n");
		help.append("ISSUE OPTIONS:\n");
		help.append("    -t, --title TITLE       Issue title\n");
		help.append("    --reuse-title TITLE     Previous title to adopt when no issue has TITLE\n");
		help.append("    --body TEXT             Issue or comment body\n");
		help.append("    -l, --labels LABELS     Comma-separated label names\n");
		help.append("    --reopen                Reopen a closed issue when updating it\n");
		help.append("    --once                  Never touch the issue again once it was closed\n");
		help.append("\n");
		help.append("COMMENT OPTIONS:\n");
		help.append("    -n, --number NUMBER     Issue or pull request number\n");
		help.append("    --topic TOPIC           Topic heading identifying the comment\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    GITEA_TOKEN             Gitea personal access token (required)\n");
		help.append("    GITEA_ENDPOINT          Gitea API endpoint (optional)\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    gitea-reconciler repos\n");
		help.append("    gitea-reconciler branch-status --repo owner/repo --branch main\n");
		help.append("    gitea-reconciler ensure-issue --repo owner/repo --title \"Dependency Dashboard\" --body \"...\"\n");
		help.append("    gitea-reconciler close-issue --repo owner/repo --title \"Dependency Dashboard\"\n");
		help.append("    gitea-reconciler ensure-comment --repo owner/repo --number 12 --topic Notes --body \"...\"\n");
		help.append("\n");

		return help.toString();
	}

	/**
	 * Validate environment (Gitea token, etc.)
	 * @throws IllegalStateException if environment is invalid
	 */
	public void validateEnvironment() {
		String token = EnvironmentSupport.get(EnvironmentSupport.TOKEN_VARIABLE);
		if (token == null || token.trim().isEmpty()) {
			throw new IllegalStateException(
					"GITEA_TOKEN environment variable is required. Please set your Gitea personal access token: export GITEA_TOKEN=your_token_here");
		}
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.command == null) {
			errors.add("A command is required (one of " + String.join(", ", COMMANDS) + ")");
		}
		else if (!COMMANDS.contains(config.command)) {
			errors.add("Unknown command: " + config.command + " (must be one of " + String.join(", ", COMMANDS) + ")");
		}
		else if (!"repos".equals(config.command)) {
			if (config.repository == null || config.repository.trim().isEmpty()) {
				errors.add("Repository cannot be empty");
			}
			else if (!config.repository.matches("^[a-zA-Z0-9._-]+/[a-zA-Z0-9._-]+$")) {
				errors.add("Repository must be in format 'owner/repo' (e.g., 'gitea/tea')");
			}

			switch (config.command) {
				case "branch-status" -> {
					if (config.branch == null) {
						errors.add("branch-status requires --branch");
					}
				}
				case "ensure-issue" -> {
					if (config.title == null) {
						errors.add("ensure-issue requires --title");
					}
					if (config.body == null) {
						errors.add("ensure-issue requires --body");
					}
				}
				case "close-issue" -> {
					if (config.title == null) {
						errors.add("close-issue requires --title");
					}
				}
				case "ensure-comment" -> {
					if (config.number == null) {
						errors.add("ensure-comment requires --number");
					}
					if (config.body == null) {
						errors.add("ensure-comment requires --body");
					}
				}
				default -> {
				}
			}
		}

		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

}
