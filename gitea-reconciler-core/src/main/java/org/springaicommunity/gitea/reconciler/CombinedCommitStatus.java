package org.springaicommunity.gitea.reconciler;

import java.util.List;
import java.util.Optional;

/**
 * Aggregate of all status checks on a commit.
 *
 * @param worstStatus the most severe raw status value among the checks ("unknown" when
 * there are none)
 * @param statuses the individual checks
 */
public record CombinedCommitStatus(String worstStatus, List<CommitStatus> statuses) {

	/**
	 * Severity order of Gitea status values, least severe first.
	 */
	private static final List<String> SEVERITY = List.of("unknown", "success", "pending", "warning", "failure",
			"error");

	/**
	 * Build the aggregate from a list of checks. Values outside the known severity order
	 * do not raise the aggregate.
	 * @param statuses the checks on the commit
	 * @return the combined status
	 */
	public static CombinedCommitStatus of(List<CommitStatus> statuses) {
		int worst = 0;
		for (CommitStatus status : statuses) {
			worst = Math.max(worst, SEVERITY.indexOf(status.status()));
		}
		return new CombinedCommitStatus(SEVERITY.get(worst), List.copyOf(statuses));
	}

	public Optional<CommitStatus> findByContext(String context) {
		return statuses.stream().filter(s -> s.context().equals(context)).findFirst();
	}

}
