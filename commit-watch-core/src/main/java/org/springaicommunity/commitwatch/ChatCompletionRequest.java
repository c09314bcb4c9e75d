package org.springaicommunity.commitwatch;

import java.util.List;

/**
 * Body of a chat-completion request.
 *
 * @param model model identifier
 * @param messages conversation, here a single user message
 */
public record ChatCompletionRequest(String model, List<Message> messages) {

	/**
	 * Create a request with the prompt as the sole user message.
	 * @param model model identifier
	 * @param prompt prompt text
	 * @return the request
	 */
	public static ChatCompletionRequest userPrompt(String model, String prompt) {
		return new ChatCompletionRequest(model, List.of(new Message("user", prompt)));
	}

	/**
	 * A single chat message.
	 *
	 * @param role message role
	 * @param content message text
	 */
	public record Message(String role, String content) {
	}

}
