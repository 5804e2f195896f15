package org.springaicommunity.gitea.reconciler;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Redacts registered secrets from text before it is sent to the server.
 */
public class SecretSanitizer {

	static final String REDACTED = "**redacted**";

	private final Set<String> secrets = ConcurrentHashMap.newKeySet();

	public void addSecret(String secret) {
		if (!secret.isBlank()) {
			secrets.add(secret);
		}
	}

	public String sanitize(String text) {
		String result = text;
		for (String secret : secrets) {
			result = result.replace(secret, REDACTED);
		}
		return result;
	}

}
