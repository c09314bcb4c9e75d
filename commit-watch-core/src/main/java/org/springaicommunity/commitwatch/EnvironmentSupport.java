package org.springaicommunity.commitwatch;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvBuilder;
import io.github.cdimascio.dotenv.DotenvEntry;
import org.jspecify.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * Variable lookup backing {@link WatchConfiguration#fromEnvironment()}.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>{@code .env} file in the current working directory (if present)</li>
 * <li>System environment variable ({@link System#getenv})</li>
 * <li>{@code .env} file in the user's home directory (if present)</li>
 * </ol>
 *
 * <p>
 * Only entries declared in the files are taken from them, so a deployment's
 * {@code .env} overrides the environment and the home file only fills gaps. Both files
 * are read once per process.
 */
public final class EnvironmentSupport {

	private static final Map<String, String> WORKING_DIRECTORY_ENTRIES = declaredEntries(Dotenv.configure());

	private static final Map<String, String> HOME_ENTRIES = homeEntries();

	private EnvironmentSupport() {
	}

	/**
	 * Get a configuration variable value.
	 * @param name the variable name
	 * @return the value, or {@code null} if not found
	 */
	@Nullable
	public static String get(String name) {
		String value = WORKING_DIRECTORY_ENTRIES.get(name);
		if (value == null) {
			value = System.getenv(name);
		}
		if (value == null) {
			value = HOME_ENTRIES.get(name);
		}
		return value;
	}

	private static Map<String, String> homeEntries() {
		String home = System.getProperty("user.home");
		if (home == null) {
			return Map.of();
		}
		return declaredEntries(Dotenv.configure().directory(home));
	}

	private static Map<String, String> declaredEntries(DotenvBuilder builder) {
		Dotenv dotenv = builder.ignoreIfMissing().ignoreIfMalformed().load();
		Map<String, String> entries = new HashMap<>();
		for (DotenvEntry entry : dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)) {
			entries.put(entry.getKey(), entry.getValue());
		}
		return Map.copyOf(entries);
	}

}
