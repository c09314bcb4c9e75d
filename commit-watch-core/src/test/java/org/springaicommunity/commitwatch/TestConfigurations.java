package org.springaicommunity.commitwatch;

import java.util.HashMap;
import java.util.Map;

/**
 * Variable maps for building {@link WatchConfiguration} instances in tests.
 */
final class TestConfigurations {

	private TestConfigurations() {
	}

	static Map<String, String> requiredVariables() {
		Map<String, String> variables = new HashMap<>();
		variables.put("REPO_URL", "https://github.com/example/myrepo.git");
		variables.put("BASE_LLM_API", "http://localhost:11434");
		variables.put("LLM_API_KEY", "test-key");
		variables.put("SMTP_SERVER", "smtp.example.com");
		variables.put("SMTP_USERNAME", "watcher");
		variables.put("SMTP_PASSWORD", "secret-password");
		variables.put("FROM_EMAIL", "watcher@example.com");
		variables.put("TO_EMAIL", "security@example.com");
		return variables;
	}

	static WatchConfiguration configuration() {
		return WatchConfiguration.load(requiredVariables()::get);
	}

	static WatchConfiguration configuration(Map<String, String> overrides) {
		Map<String, String> variables = requiredVariables();
		variables.putAll(overrides);
		return WatchConfiguration.load(variables::get);
	}

}
