package org.springaicommunity.commitwatch;

/**
 * Command-line argument parser for the commit-watch CLI. Pure Java, no dependencies.
 */
public class ArgumentParser {

	private final WatchProperties defaultProperties;

	public ArgumentParser(WatchProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments.
	 * @param args Command-line arguments
	 * @return Parsed options
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedArguments parse(String[] args) {
		ParsedArguments parsed = new ParsedArguments();

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-h", "--help":
					parsed.helpRequested = true;
					break;

				case "-d", "--dry-run":
					parsed.dryRun = true;
					break;

				case "-v", "--verbose":
					parsed.verbose = true;
					break;

				case "--history":
					parsed.history = true;
					break;

				case "--lookback-days":
					String daysStr = getRequiredValue(args, i, "lookback-days");
					try {
						parsed.lookbackDays = Integer.parseInt(daysStr);
					}
					catch (NumberFormatException e) {
						throw new IllegalArgumentException(
								"Invalid lookback days '" + daysStr + "': must be a positive integer");
					}
					if (parsed.lookbackDays <= 0) {
						throw new IllegalArgumentException("Lookback days must be positive: " + parsed.lookbackDays);
					}
					i++; // Skip next argument since we consumed it
					break;

				default:
					throw new IllegalArgumentException("Unknown option: " + arg + " (use --help for usage)");
			}
		}

		if (parsed.history && parsed.dryRun) {
			throw new IllegalArgumentException("--history cannot be combined with --dry-run");
		}
		return parsed;
	}

	/**
	 * Copy parsed overrides onto the properties.
	 * @param parsed parsed options
	 * @param properties properties to update
	 */
	public void applyTo(ParsedArguments parsed, WatchProperties properties) {
		if (parsed.lookbackDays != null) {
			properties.setLookbackDays(parsed.lookbackDays);
		}
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: commit-watch [OPTIONS]\n");
		help.append("\n");
		help.append("Scan a repository branch for commits since the last run, ask a language model whether\n");
		help.append("they add security-relevant features, and email the assessment.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help              Show this help message\n");
		help.append("    -d, --dry-run           Build and log the prompt; send nothing, record no checkpoint\n");
		help.append("    -v, --verbose           Enable debug logging\n");
		help.append("    --lookback-days DAYS    Days scanned after a fresh clone (default: ")
			.append(defaultProperties.getLookbackDays())
			.append(")\n");
		help.append("    --history               Print the recorded checkpoints and exit\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES (read from .env or the environment):\n");
		help.append("    REPO_URL                Repository to watch (required)\n");
		help.append("    REPO_BRANCH             Branch to watch (default: ")
			.append(WatchConfiguration.DEFAULT_BRANCH)
			.append(")\n");
		help.append("    PERSONAL_TOKEN          Access token for private repositories\n");
		help.append("    DB_FILE                 Checkpoint database (default: ")
			.append(WatchConfiguration.DEFAULT_DATABASE_FILE)
			.append(")\n");
		help.append("    REPOS_DIR               Mirror parent directory (default: ")
			.append(WatchConfiguration.DEFAULT_REPOS_DIRECTORY)
			.append(")\n");
		help.append("    BASE_LLM_API            Analysis service base URL (required)\n");
		help.append("    PROMPT_LLM_API_ENDPOINT Analysis endpoint path (default: ")
			.append(WatchConfiguration.DEFAULT_ANALYSIS_ENDPOINT)
			.append(")\n");
		help.append("    LLM_API_KEY             Analysis service API key (required)\n");
		help.append("    LLM_MODEL               Model identifier (default: ")
			.append(WatchConfiguration.DEFAULT_ANALYSIS_MODEL)
			.append(")\n");
		help.append("    PROJECT_DESCRIPTION     Project description used as prompt context\n");
		help.append("    SMTP_SERVER, SMTP_PORT, SMTP_USERNAME, SMTP_PASSWORD\n");
		help.append("                            SMTP submission settings (STARTTLS, authenticated)\n");
		help.append("    FROM_EMAIL, TO_EMAIL    Sender and recipient (required)\n");
		help.append("\n");
		help.append("EXIT CODES:\n");
		help.append("    0  Scan completed, including runs with no new commits\n");
		help.append("    1  Scan failed; no checkpoint was recorded\n");
		help.append("    2  Invalid arguments or configuration\n");
		return help.toString();
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

}
