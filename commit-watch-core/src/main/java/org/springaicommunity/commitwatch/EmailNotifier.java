package org.springaicommunity.commitwatch;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;

/**
 * {@link Notifier} that sends a multipart email: the raw result as the plain-text part
 * and its HTML rendering as the alternative.
 */
public class EmailNotifier implements Notifier {

	private static final Logger logger = LoggerFactory.getLogger(EmailNotifier.class);

	private final JavaMailSender mailSender;

	private final MarkdownRenderer markdownRenderer;

	private final String fromAddress;

	public EmailNotifier(JavaMailSender mailSender, MarkdownRenderer markdownRenderer, String fromAddress) {
		this.mailSender = mailSender;
		this.markdownRenderer = markdownRenderer;
		this.fromAddress = fromAddress;
	}

	@Override
	public void notify(String recipient, String subject, String body) {
		try {
			MimeMessage message = mailSender.createMimeMessage();
			MimeMessageHelper helper = new MimeMessageHelper(message, true, "UTF-8");
			helper.setFrom(fromAddress);
			helper.setTo(recipient);
			helper.setSubject(subject);
			helper.setText(body, markdownRenderer.toHtml(body));

			mailSender.send(message);
			logger.info("Email sent to {}: {}", recipient, subject);
		}
		catch (MessagingException | MailException e) {
			logger.error("Failed to send email to {}: {}", recipient, e.getMessage());
			throw new NotificationDeliveryException("Failed to send email to " + recipient, e);
		}
	}

}
