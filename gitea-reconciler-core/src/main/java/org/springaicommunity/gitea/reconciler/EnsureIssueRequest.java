package org.springaicommunity.gitea.reconciler;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Desired state of an automation issue.
 *
 * @param title the issue title, which identifies the issue
 * @param reuseTitle a previous title to adopt when no issue carries {@code title}
 * @param body the desired body
 * @param labels label names to apply (null leaves labels untouched)
 * @param shouldReOpen reopen a closed issue when updating it
 * @param once never touch the issue again once it has been closed
 */
public record EnsureIssueRequest(String title, @Nullable String reuseTitle, String body,
		@Nullable List<String> labels, boolean shouldReOpen, boolean once) {

	public static EnsureIssueRequest of(String title, String body) {
		return new EnsureIssueRequest(title, null, body, null, true, false);
	}

}
