package org.springaicommunity.gitea.reconciler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Label lookups against the session label cache.
 *
 * <p>
 * The effective label set of a repository is its own labels followed by the labels of
 * its organization. Owners that are plain users (or servers older than 1.12) have no
 * organization labels.
 */
public class LabelOperations {

	private static final Logger logger = LoggerFactory.getLogger(LabelOperations.class);

	private final GiteaApi api;

	public LabelOperations(GiteaApi api) {
		this.api = api;
	}

	/**
	 * Cache loader: repository labels plus organization labels.
	 */
	List<Label> fetchLabels(String repository, String owner) {
		List<Label> repositoryLabels = api.listRepositoryLabels(repository);
		logger.debug("Retrieved {} repository labels", repositoryLabels.size());
		List<Label> labels = new ArrayList<>(repositoryLabels);
		labels.addAll(fetchOrganizationLabels(owner));
		return labels;
	}

	private List<Label> fetchOrganizationLabels(String owner) {
		try {
			List<Label> organizationLabels = api.listOrganizationLabels(owner);
			logger.debug("Retrieved {} organization labels", organizationLabels.size());
			return organizationLabels;
		}
		catch (GiteaApiException e) {
			logger.debug("Unable to fetch organization labels for {}: {}", owner, e.getMessage());
			return List.of();
		}
	}

	public List<Label> getLabelList(RepositorySession session) {
		session.requireActive();
		return session.labels().get();
	}

	public Optional<Label> lookupLabelByName(RepositorySession session, String name) {
		logger.debug("lookupLabelByName({})", name);
		return getLabelList(session).stream().filter(label -> label.name().equals(name)).findFirst();
	}

	/**
	 * Resolve label names to ids. Names without a matching label are dropped.
	 * @param session the repository session
	 * @param names the label names
	 * @return ids of the labels that exist, in the order of {@code names}
	 */
	public List<Long> resolveLabelIds(RepositorySession session, List<String> names) {
		List<Long> ids = new ArrayList<>();
		for (String name : names) {
			Optional<Label> label = lookupLabelByName(session, name);
			if (label.isPresent()) {
				ids.add(label.get().id());
			}
			else {
				logger.debug("Label '{}' does not exist in {}", name, session.repository());
			}
		}
		return ids;
	}

	/**
	 * Remove a label from an issue or pull request.
	 * @param session the repository session
	 * @param issueNumber the issue or pull request number
	 * @param labelName the label to remove
	 * @return {@link OperationOutcome#NOT_FOUND} when no label has that name
	 */
	public OperationOutcome deleteLabel(RepositorySession session, int issueNumber, String labelName) {
		logger.debug("Deleting label {} from #{}", labelName, issueNumber);
		Optional<Label> label = lookupLabelByName(session, labelName);
		if (label.isEmpty()) {
			logger.warn("Failed to lookup label '{}' for deletion from #{}", labelName, issueNumber);
			return OperationOutcome.NOT_FOUND;
		}
		api.unassignLabel(session.repository(), issueNumber, label.get().id());
		return OperationOutcome.APPLIED;
	}

}
