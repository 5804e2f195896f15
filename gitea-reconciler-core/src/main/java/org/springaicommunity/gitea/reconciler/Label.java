package org.springaicommunity.gitea.reconciler;

import org.jspecify.annotations.Nullable;

/**
 * A label usable on issues and pull requests of a repository.
 *
 * @param id the label id
 * @param name the label name
 * @param color the hex color code (without the # prefix)
 * @param scope whether the label belongs to the repository or its organization
 */
public record Label(long id, String name, @Nullable String color, Scope scope) {

	/**
	 * Where a label is defined.
	 */
	public enum Scope {

		REPOSITORY, ORGANIZATION

	}

}
