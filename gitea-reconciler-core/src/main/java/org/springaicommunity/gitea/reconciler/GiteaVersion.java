package org.springaicommunity.gitea.reconciler;

/**
 * Compares Gitea server version strings such as {@code 1.14.0} or
 * {@code 1.17.0+dev-123-gabcdef}.
 */
public final class GiteaVersion {

	private GiteaVersion() {
	}

	/**
	 * Returns true if {@code version} is at least {@code minimum}. Only the numeric
	 * major/minor/patch prefix is compared; unparseable parts count as zero.
	 */
	public static boolean isAtLeast(String version, String minimum) {
		int[] actual = parse(version);
		int[] required = parse(minimum);
		for (int i = 0; i < 3; i++) {
			if (actual[i] != required[i]) {
				return actual[i] > required[i];
			}
		}
		return true;
	}

	private static int[] parse(String version) {
		int[] parts = new int[3];
		String core = version.split("[+-]", 2)[0];
		String[] segments = core.split("\\.");
		for (int i = 0; i < Math.min(3, segments.length); i++) {
			try {
				parts[i] = Integer.parseInt(segments[i].trim());
			}
			catch (NumberFormatException e) {
				parts[i] = 0;
			}
		}
		return parts;
	}

}
