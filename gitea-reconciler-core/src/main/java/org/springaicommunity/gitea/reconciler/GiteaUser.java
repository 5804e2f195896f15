package org.springaicommunity.gitea.reconciler;

import org.jspecify.annotations.Nullable;

/**
 * A Gitea user account.
 *
 * @param id the numeric user id
 * @param username the login name (unique, never null)
 * @param fullName the display name (may be null or empty)
 * @param email the primary email address (may be null when hidden)
 */
public record GiteaUser(long id, String username, @Nullable String fullName, @Nullable String email) {

	/**
	 * Returns the git author line for commits made on behalf of this user, in the form
	 * {@code Full Name <email>}. Falls back to the username when no full name is set.
	 * @return the git author line
	 */
	public String gitAuthor() {
		String name = (fullName != null && !fullName.isEmpty()) ? fullName : username;
		return name + " <" + (email != null ? email : "") + ">";
	}

}
