package org.springaicommunity.gitea.reconciler;

import org.jspecify.annotations.Nullable;

/**
 * A security advisory affecting a dependency of the repository. Gitea has no
 * vulnerability alert API, so {@link GiteaPlatform#getVulnerabilityAlerts()} never
 * returns any.
 *
 * @param packageName the affected package
 * @param severity the advisory severity
 * @param fixedVersion the first fixed version, if known
 */
public record VulnerabilityAlert(String packageName, String severity, @Nullable String fixedVersion) {
}
