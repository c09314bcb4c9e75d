package org.springaicommunity.commitwatch;

/**
 * Delivers an analysis result to a recipient.
 */
public interface Notifier {

	/**
	 * Send the result.
	 * @param recipient recipient address
	 * @param subject subject line
	 * @param body analysis result, markdown or HTML
	 * @throws NotificationDeliveryException if delivery fails
	 */
	void notify(String recipient, String subject, String body);

}
