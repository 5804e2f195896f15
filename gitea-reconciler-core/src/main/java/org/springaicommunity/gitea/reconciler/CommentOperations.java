package org.springaicommunity.gitea.reconciler;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Keeps automation comments on issues and pull requests in place.
 *
 * <p>
 * A comment with a topic starts with a {@code ### <topic>} heading followed by a blank
 * line, which identifies it across edits. A comment without a topic is identified by its
 * exact (trimmed) body.
 */
public class CommentOperations {

	private static final Logger logger = LoggerFactory.getLogger(CommentOperations.class);

	private final GiteaApi api;

	private final SecretSanitizer sanitizer;

	public CommentOperations(GiteaApi api, SecretSanitizer sanitizer) {
		this.api = api;
		this.sanitizer = sanitizer;
	}

	static String topicMarker(String topic) {
		return "### " + topic + "\n\n";
	}

	static Optional<Comment> findCommentByTopic(List<Comment> comments, String topic) {
		String marker = topicMarker(topic);
		return comments.stream().filter(comment -> comment.body().startsWith(marker)).findFirst();
	}

	static Optional<Comment> findCommentByContent(List<Comment> comments, String content) {
		return comments.stream().filter(comment -> comment.body().trim().equals(content)).findFirst();
	}

	/**
	 * Create or update a comment so it carries {@code content}.
	 * @param session the repository session
	 * @param issueNumber the issue or pull request number
	 * @param topic the topic identifying the comment, or null to match by content
	 * @param content the desired comment text
	 * @return true if the comment is in the desired state, false if a remote call failed
	 */
	public boolean ensureComment(RepositorySession session, int issueNumber, @Nullable String topic, String content) {
		session.requireActive();
		String repository = session.repository();
		try {
			String body = sanitizer.sanitize(content);
			List<Comment> comments = api.listComments(repository, issueNumber);
			Optional<Comment> existing;
			if (topic != null) {
				existing = findCommentByTopic(comments, topic);
				body = topicMarker(topic) + body;
			}
			else {
				existing = findCommentByContent(comments, body);
			}

			if (existing.isEmpty()) {
				Comment created = api.createComment(repository, issueNumber, body);
				logger.info("Comment #{} added to #{} in {}", created.id(), issueNumber, repository);
			}
			else if (existing.get().body().equals(body)) {
				logger.debug("Comment #{} is already up-to-date", existing.get().id());
			}
			else {
				api.updateComment(repository, issueNumber, existing.get().id(), body);
				logger.debug("Comment #{} on #{} in {} updated", existing.get().id(), issueNumber, repository);
			}
			return true;
		}
		catch (GiteaApiException e) {
			logger.warn("Error ensuring comment on #{} (topic {}): {}", issueNumber, topic, e.getMessage());
			return false;
		}
	}

	/**
	 * Delete the comment selected by topic or content, if there is one.
	 * @param session the repository session
	 * @param request selects the comment
	 * @return {@link OperationOutcome#NOT_FOUND} when nothing matched,
	 * {@link OperationOutcome#FAILED} when deletion failed
	 */
	public OperationOutcome ensureCommentRemoval(RepositorySession session, CommentRemovalRequest request) {
		session.requireActive();
		int issueNumber = request.issueNumber();
		logger.debug("Ensuring comment \"{}\" in #{} is removed", request.value(), issueNumber);
		List<Comment> comments = api.listComments(session.repository(), issueNumber);
		Optional<Comment> comment = switch (request.type()) {
			case BY_TOPIC -> findCommentByTopic(comments, request.value());
			case BY_CONTENT -> findCommentByContent(comments, sanitizer.sanitize(request.value()));
		};
		if (comment.isEmpty()) {
			return OperationOutcome.NOT_FOUND;
		}
		try {
			api.deleteComment(session.repository(), comment.get().id());
			return OperationOutcome.APPLIED;
		}
		catch (GiteaApiException e) {
			logger.warn("Error deleting comment #{} on #{}: {}", comment.get().id(), issueNumber, e.getMessage());
			return OperationOutcome.FAILED;
		}
	}

}
