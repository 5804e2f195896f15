package org.springaicommunity.gitea.reconciler;

/**
 * Selects a comment to remove, either by its topic marker or by its exact content.
 *
 * @param issueNumber the issue or pull request holding the comment
 * @param type how {@code value} is matched
 * @param value the topic or the content
 */
public record CommentRemovalRequest(int issueNumber, Type type, String value) {

	public enum Type {

		BY_TOPIC, BY_CONTENT

	}

	public static CommentRemovalRequest byTopic(int issueNumber, String topic) {
		return new CommentRemovalRequest(issueNumber, Type.BY_TOPIC, topic);
	}

	public static CommentRemovalRequest byContent(int issueNumber, String content) {
		return new CommentRemovalRequest(issueNumber, Type.BY_CONTENT, content);
	}

}
