package org.springaicommunity.commitwatch;

import java.security.SecureRandom;

/**
 * Generates single-use delimiters from a cryptographically strong source over
 * {@code [A-Za-z0-9]}.
 */
public class DelimiterGenerator {

	private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

	private final SecureRandom random;

	private final int length;

	public DelimiterGenerator(int length) {
		this(new SecureRandom(), length);
	}

	public DelimiterGenerator(SecureRandom random, int length) {
		if (length < WatchProperties.MIN_DELIMITER_LENGTH) {
			throw new IllegalArgumentException(
					"Delimiter length must be at least " + WatchProperties.MIN_DELIMITER_LENGTH + ": " + length);
		}
		this.random = random;
		this.length = length;
	}

	/**
	 * Draw a new delimiter.
	 * @return {@code length} random letters and digits
	 */
	public String next() {
		StringBuilder delimiter = new StringBuilder(length);
		for (int i = 0; i < length; i++) {
			delimiter.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
		}
		return delimiter.toString();
	}

	public int getLength() {
		return length;
	}

}
