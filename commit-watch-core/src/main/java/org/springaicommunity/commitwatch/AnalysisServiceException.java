package org.springaicommunity.commitwatch;

import org.jspecify.annotations.Nullable;

/**
 * Exception thrown when the analysis service call fails. Fatal to the run.
 *
 * <p>
 * Carries the HTTP status and response body when the service answered, or {@code -1}
 * and {@code null} when the request never completed.
 */
public class AnalysisServiceException extends RuntimeException {

	private final int statusCode;

	@Nullable
	private final String responseBody;

	public AnalysisServiceException(int statusCode, String responseBody) {
		super("API error: " + statusCode + " - " + responseBody);
		this.statusCode = statusCode;
		this.responseBody = responseBody;
	}

	public AnalysisServiceException(String message) {
		super(message);
		this.statusCode = -1;
		this.responseBody = null;
	}

	public AnalysisServiceException(String message, Throwable cause) {
		super(message, cause);
		this.statusCode = -1;
		this.responseBody = null;
	}

	public int getStatusCode() {
		return statusCode;
	}

	@Nullable
	public String getResponseBody() {
		return responseBody;
	}

}
