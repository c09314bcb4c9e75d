package org.springaicommunity.commitwatch;

/**
 * Thrown when a notification cannot be delivered. Fatal to the run.
 */
public class NotificationDeliveryException extends RuntimeException {

	public NotificationDeliveryException(String message, Throwable cause) {
		super(message, cause);
	}

}
