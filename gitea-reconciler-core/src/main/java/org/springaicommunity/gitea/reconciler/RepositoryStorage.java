package org.springaicommunity.gitea.reconciler;

import java.util.Optional;

/**
 * Local working copy of the repository being reconciled.
 */
public interface RepositoryStorage {

	/**
	 * Prepare the local copy of a repository, cloning it or refreshing an existing clone.
	 * @param repository full repository name in "owner/repo" format
	 * @param url clone URL, possibly carrying credentials as user-info
	 * @param cloneSubmodules whether submodules are cloned as well
	 * @throws RepositoryStorageException if the clone cannot be prepared
	 */
	void initRepo(String repository, String url, boolean cloneSubmodules);

	/**
	 * Resolve the current head commit of a remote branch.
	 * @param branchName the branch name
	 * @return the commit id, or empty if the branch does not exist
	 * @throws RepositoryStorageException if the local copy cannot be read
	 */
	Optional<String> getBranchCommit(String branchName);

}
