package org.springaicommunity.commitwatch;

/**
 * Transport to the analysis (chat-completion) service.
 *
 * <p>
 * Separates HTTP concerns from request and response mapping so that
 * {@link AnalysisDispatcher} can be tested with a mock.
 */
public interface AnalysisClient {

	/**
	 * Post a chat-completion request.
	 * @param jsonBody request body (JSON)
	 * @return response body as String
	 * @throws AnalysisServiceException on a non-success status, I/O error or timeout
	 */
	String postChatCompletion(String jsonBody);

}
