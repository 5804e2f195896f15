package org.springaicommunity.gitea.reconciler;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Markdown adjustments applied to pull request and issue bodies before they are sent to
 * Gitea.
 */
public final class MarkdownSupport {

	private static final Pattern RELEASE_NOTES = Pattern
		.compile("(?<preNotes>.*### Release Notes)(?<releaseNotes>.*)### Configuration(?<postNotes>.*)", Pattern.DOTALL);

	private static final String RELEASE_NOTES_DIVIDER = "\n\n</details>\n\n---\n\n### Configuration";

	private MarkdownSupport() {
	}

	/**
	 * Rewrite relative pull request links to the path Gitea serves them under.
	 */
	public static String smartLinks(String body) {
		return body.replace("](../pull/", "](pulls/");
	}

	/**
	 * Shorten a body to at most {@code maxLength} characters. When the body has a release
	 * notes section followed by a configuration section, the release notes are cut first
	 * so the configuration section survives.
	 * @param body the body
	 * @param maxLength the maximum length
	 * @return the body, truncated if needed
	 */
	public static String smartTruncate(String body, int maxLength) {
		if (body.length() < maxLength) {
			return body;
		}
		Matcher matcher = RELEASE_NOTES.matcher(body);
		if (!matcher.matches()) {
			return body.substring(0, maxLength);
		}
		String preNotes = matcher.group("preNotes");
		String releaseNotes = matcher.group("releaseNotes");
		String postNotes = matcher.group("postNotes");
		int available = maxLength - (preNotes.length() + postNotes.length() + RELEASE_NOTES_DIVIDER.length());
		if (available <= 0) {
			return body.substring(0, maxLength);
		}
		return preNotes + releaseNotes.substring(0, Math.min(available, releaseNotes.length())) + RELEASE_NOTES_DIVIDER
				+ postNotes;
	}

	public static String massageMarkdown(String body, int maxLength) {
		return smartTruncate(smartLinks(body), maxLength);
	}

}
