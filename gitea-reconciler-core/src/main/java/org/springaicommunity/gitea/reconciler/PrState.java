package org.springaicommunity.gitea.reconciler;

/**
 * Platform-neutral pull request state.
 *
 * <p>
 * Queries may additionally use the wildcard {@link #ALL} or a negation such as
 * {@code "!closed"}, see {@link #matchesState(PrState, String)}.
 */
public enum PrState {

	OPEN("open"), CLOSED("closed"), MERGED("merged");

	/**
	 * Query wildcard matching every state.
	 */
	public static final String ALL = "all";

	private final String value;

	PrState(String value) {
		this.value = value;
	}

	public String value() {
		return value;
	}

	/**
	 * Fold the Gitea state vocabulary onto the three platform-neutral states.
	 * @param remoteState the Gitea state ("open" or "closed")
	 * @param merged the Gitea merged flag
	 * @return the folded state
	 */
	public static PrState fromRemote(String remoteState, boolean merged) {
		if (merged) {
			return MERGED;
		}
		return CLOSED.value.equals(remoteState) ? CLOSED : OPEN;
	}

	/**
	 * Test a state against a query expression: an exact state value, {@code "all"}, or a
	 * negated state value prefixed with {@code '!'}.
	 * @param actual the actual state value
	 * @param expected the query expression
	 * @return true when the state satisfies the query
	 */
	public static boolean matchesState(String actual, String expected) {
		if (ALL.equals(expected)) {
			return true;
		}
		if (expected.startsWith("!")) {
			return !actual.equals(expected.substring(1));
		}
		return actual.equals(expected);
	}

	public static boolean matchesState(PrState actual, String expected) {
		return matchesState(actual.value, expected);
	}

}
