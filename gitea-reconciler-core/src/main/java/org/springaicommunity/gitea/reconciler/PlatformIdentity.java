package org.springaicommunity.gitea.reconciler;

/**
 * Identity of the automation account, established once by
 * {@link GiteaPlatform#initPlatform}.
 *
 * @param endpoint the Gitea API endpoint
 * @param userId the numeric id of the automation user
 * @param username the login of the automation user
 * @param gitAuthor git author line for commits ({@code Name <email>})
 * @param version the Gitea server version
 */
public record PlatformIdentity(String endpoint, long userId, String username, String gitAuthor, String version) {
}
