package org.springaicommunity.gitea.reconciler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Commit status checks on branch heads.
 *
 * <p>
 * Combined statuses are cached per session and branch. Setting a status always refetches
 * the combined status of that branch so later reads include it.
 */
public class BranchStatusOperations {

	private static final Logger logger = LoggerFactory.getLogger(BranchStatusOperations.class);

	private final GiteaApi api;

	private final RepositoryStorage storage;

	public BranchStatusOperations(GiteaApi api, RepositoryStorage storage) {
		this.api = api;
		this.storage = storage;
	}

	/**
	 * Attach a status check to the head commit of a branch. Best effort: failures are
	 * logged and reported as {@link OperationOutcome#FAILED}.
	 * @param session the repository session
	 * @param request the status to set
	 * @return the outcome
	 */
	public OperationOutcome setBranchStatus(RepositorySession session, BranchStatusRequest request) {
		session.requireActive();
		String branchName = request.branchName();
		try {
			Optional<String> commit = storage.getBranchCommit(branchName);
			if (commit.isEmpty()) {
				logger.warn("Failed to set branch status: no commit found for branch {}", branchName);
				return OperationOutcome.FAILED;
			}
			CommitStatusCreate status = new CommitStatusCreate(StatusMapper.toGiteaStatus(request.state()),
					request.context(), request.description(), request.targetUrl());
			api.createCommitStatus(session.repository(), commit.get(), status);
			fetchCombinedStatus(session, branchName);
			return OperationOutcome.APPLIED;
		}
		catch (GiteaApiException | RepositoryStorageException e) {
			logger.warn("Failed to set branch status {} on {}: {}", request.context(), branchName, e.getMessage());
			return OperationOutcome.FAILED;
		}
	}

	/**
	 * Aggregate status of a branch.
	 * @param session the repository session
	 * @param branchName the branch
	 * @return the mapped worst status, {@link BranchStatus#YELLOW} for unknown values
	 * @throws RepositoryChangedException if the branch no longer exists
	 */
	public BranchStatus getBranchStatus(RepositorySession session, String branchName) {
		session.requireActive();
		CombinedCommitStatus combined;
		try {
			combined = combinedStatus(session, branchName);
		}
		catch (GiteaApiException e) {
			if (e.isNotFound()) {
				logger.debug("Received 404 when checking branch status, assuming branch deletion");
				throw new RepositoryChangedException(branchName, e);
			}
			logger.debug("Unknown error when checking branch status of {}", branchName);
			throw e;
		}
		logger.debug("Branch status of {}: {}", branchName, combined.worstStatus());
		return StatusMapper.toBranchStatus(combined.worstStatus());
	}

	/**
	 * Status of a single named check on a branch.
	 * @param session the repository session
	 * @param branchName the branch
	 * @param context the check name
	 * @return the mapped status, or empty if the branch has no such check
	 */
	public Optional<BranchStatus> getBranchStatusCheck(RepositorySession session, String branchName,
			String context) {
		session.requireActive();
		Optional<CommitStatus> check = combinedStatus(session, branchName).findByContext(context);
		if (check.isEmpty()) {
			return Optional.empty();
		}
		String value = check.get().status();
		if (!StatusMapper.isKnown(value)) {
			logger.warn("Could not map Gitea status value '{}' of check {} on {}", value, context, branchName);
		}
		return Optional.of(StatusMapper.toBranchStatus(value));
	}

	private CombinedCommitStatus combinedStatus(RepositorySession session, String branchName) {
		CombinedCommitStatus cached = session.combinedStatuses().get(branchName);
		return cached != null ? cached : fetchCombinedStatus(session, branchName);
	}

	private CombinedCommitStatus fetchCombinedStatus(RepositorySession session, String branchName) {
		CombinedCommitStatus combined = api.getCombinedCommitStatus(session.repository(), branchName);
		session.combinedStatuses().put(branchName, combined);
		return combined;
	}

}
