package org.springaicommunity.commitwatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends a prompt to the analysis service and extracts the verdict text.
 */
public class AnalysisDispatcher {

	private static final Logger logger = LoggerFactory.getLogger(AnalysisDispatcher.class);

	private final AnalysisClient client;

	private final ObjectMapper objectMapper;

	private final String model;

	public AnalysisDispatcher(AnalysisClient client, ObjectMapper objectMapper, String model) {
		this.client = client;
		this.objectMapper = objectMapper;
		this.model = model;
	}

	/**
	 * Request an assessment of the prompt.
	 * @param prompt prompt to send as the sole user message
	 * @return content of the first choice's message
	 * @throws AnalysisServiceException if the call fails or the response has no content
	 */
	public String analyze(AnalysisPrompt prompt) {
		String body;
		try {
			body = objectMapper.writeValueAsString(ChatCompletionRequest.userPrompt(model, prompt.text()));
		}
		catch (JsonProcessingException e) {
			throw new AnalysisServiceException("Failed to serialize analysis request", e);
		}

		logger.info("Sending prompt ({} characters) to model {}", prompt.text().length(), model);
		String response = client.postChatCompletion(body);

		JsonNode content;
		try {
			content = objectMapper.readTree(response).path("choices").path(0).path("message").path("content");
		}
		catch (JsonProcessingException e) {
			throw new AnalysisServiceException("Analysis response is not valid JSON: " + e.getOriginalMessage(), e);
		}
		if (!content.isTextual()) {
			throw new AnalysisServiceException("Analysis response has no choices[0].message.content: " + response);
		}
		logger.info("Received analysis of {} characters", content.asText().length());
		return content.asText();
	}

}
