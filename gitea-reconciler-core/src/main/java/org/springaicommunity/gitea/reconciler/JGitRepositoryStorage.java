package org.springaicommunity.gitea.reconciler;

import org.eclipse.jgit.api.CloneCommand;
import org.eclipse.jgit.api.FetchCommand;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.Ref;
import org.eclipse.jgit.lib.StoredConfig;
import org.eclipse.jgit.transport.CredentialsProvider;
import org.eclipse.jgit.transport.URIish;
import org.eclipse.jgit.transport.UsernamePasswordCredentialsProvider;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * {@link RepositoryStorage} backed by a JGit clone under a base directory.
 *
 * <p>
 * Credentials passed as user-info in the clone URL are handed to JGit through a
 * credentials provider and are not written to the clone configuration.
 */
public class JGitRepositoryStorage implements RepositoryStorage, AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(JGitRepositoryStorage.class);

	private final Path baseDir;

	@Nullable
	private Git git;

	public JGitRepositoryStorage(Path baseDir) {
		this.baseDir = baseDir;
	}

	@Override
	public synchronized void initRepo(String repository, String url, boolean cloneSubmodules) {
		close();
		Path directory = baseDir.resolve(repository);
		URIish uri = parseUri(url);
		CredentialsProvider credentials = credentialsFor(uri);
		String remoteUrl = uri.setUser(null).setPass(null).toString();
		try {
			if (Files.isDirectory(directory.resolve(Constants.DOT_GIT))) {
				logger.debug("Fetching existing clone of {} in {}", repository, directory);
				git = Git.open(directory.toFile());
				StoredConfig config = git.getRepository().getConfig();
				config.setString("remote", Constants.DEFAULT_REMOTE_NAME, "url", remoteUrl);
				config.save();
				FetchCommand fetch = git.fetch().setRemote(Constants.DEFAULT_REMOTE_NAME).setRemoveDeletedRefs(true);
				if (credentials != null) {
					fetch.setCredentialsProvider(credentials);
				}
				fetch.call();
			}
			else {
				logger.debug("Cloning {} into {}", repository, directory);
				Files.createDirectories(directory);
				CloneCommand clone = Git.cloneRepository()
					.setURI(remoteUrl)
					.setDirectory(directory.toFile())
					.setCloneSubmodules(cloneSubmodules);
				if (credentials != null) {
					clone.setCredentialsProvider(credentials);
				}
				git = clone.call();
			}
		}
		catch (IOException | GitAPIException e) {
			throw new RepositoryStorageException("Failed to initialize local copy of " + repository, e);
		}
	}

	@Override
	public synchronized Optional<String> getBranchCommit(String branchName) {
		if (git == null) {
			throw new RepositoryStorageException("No repository has been initialized");
		}
		try {
			Ref ref = git.getRepository().exactRef(Constants.R_REMOTES + Constants.DEFAULT_REMOTE_NAME + "/" + branchName);
			if (ref == null || ref.getObjectId() == null) {
				return Optional.empty();
			}
			return Optional.of(ref.getObjectId().getName());
		}
		catch (IOException e) {
			throw new RepositoryStorageException("Failed to resolve branch " + branchName, e);
		}
	}

	@Override
	public synchronized void close() {
		if (git != null) {
			git.close();
			git = null;
		}
	}

	private static URIish parseUri(String url) {
		try {
			return new URIish(url);
		}
		catch (URISyntaxException e) {
			throw new RepositoryStorageException("Invalid clone URL", e);
		}
	}

	@Nullable
	private static CredentialsProvider credentialsFor(URIish uri) {
		String user = uri.getUser();
		if (user == null || user.isEmpty()) {
			return null;
		}
		String pass = uri.getPass();
		return new UsernamePasswordCredentialsProvider(user, pass != null ? pass : "");
	}

}
