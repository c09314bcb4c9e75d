package org.springaicommunity.commitwatch;

import org.springframework.mail.javamail.JavaMailSenderImpl;

import java.util.Properties;

/**
 * Creates the {@link JavaMailSenderImpl} for authenticated SMTP submission over
 * STARTTLS.
 */
public final class MailSenderFactory {

	private MailSenderFactory() {
	}

	/**
	 * Create a mail sender for the configured SMTP server.
	 * @param configuration SMTP host, port and credentials
	 * @param timeoutSeconds connection, read and write timeout
	 * @return configured sender
	 */
	public static JavaMailSenderImpl create(WatchConfiguration configuration, int timeoutSeconds) {
		JavaMailSenderImpl sender = new JavaMailSenderImpl();
		sender.setHost(configuration.smtpHost());
		sender.setPort(configuration.smtpPort());
		sender.setUsername(configuration.smtpUsername());
		sender.setPassword(configuration.smtpPassword());
		sender.setDefaultEncoding("UTF-8");

		String timeoutMillis = String.valueOf(timeoutSeconds * 1000L);
		Properties props = sender.getJavaMailProperties();
		props.put("mail.transport.protocol", "smtp");
		props.put("mail.smtp.auth", "true");
		props.put("mail.smtp.starttls.enable", "true");
		props.put("mail.smtp.starttls.required", "true");
		props.put("mail.smtp.connectiontimeout", timeoutMillis);
		props.put("mail.smtp.timeout", timeoutMillis);
		props.put("mail.smtp.writetimeout", timeoutMillis);
		return sender;
	}

}
