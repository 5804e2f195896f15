package org.springaicommunity.gitea.reconciler.cli;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Command to run: repos, branch-status, ensure-issue, close-issue, ensure-comment
	public String command;

	// Target repository (owner/repo)
	public String repository;

	// Branch status
	public String branch;

	public String context;

	// Issues and comments
	public String title;

	public String reuseTitle;

	public String body;

	public List<String> labels;

	public Integer number;

	public String topic;

	public boolean reopen = false;

	public boolean once = false;

	// Connection
	public String endpoint;

	// Mode flags
	public boolean verbose = false;

	public boolean helpRequested = false;

	public ParsedConfiguration() {
		this.labels = null; // null leaves issue labels untouched
	}

	public List<String> labelsOrEmpty() {
		return labels != null ? labels : new ArrayList<>();
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "command='" + command + '\'' + ", repository='" + repository + '\''
				+ ", branch='" + branch + '\'' + ", context='" + context + '\'' + ", title='" + title + '\''
				+ ", reuseTitle='" + reuseTitle + '\'' + ", labels=" + labels + ", number=" + number + ", topic='"
				+ topic + '\'' + ", reopen=" + reopen + ", once=" + once + ", endpoint='" + endpoint + '\''
				+ ", verbose=" + verbose + ", helpRequested=" + helpRequested + '}';
	}

}
