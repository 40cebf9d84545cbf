package org.rttrail.email;

import java.util.HashMap;
import java.util.Map;

import org.rttrail.global.RttrailUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;

import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Sends mails built from {@code templates/<name>.subject.txt} and {@code templates/<name>.body.html},
 * where every {@code {{key}}} is replaced by the given data.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmailService {

	public static final String ACTIVATION = "activation";
	public static final String ACCOUNT_EXISTS = "account_exists";
	public static final String RESET_PASSWORD = "reset_password";
	public static final String RESET_PASSWORD_UNKNOWN = "reset_password_unknown";
	public static final String MIGRATE_MAIL = "migrate_mail";
	public static final String MIGRATE_MAIL_ALREADY_USED = "migrate_mail_already_used";

	private static final String TEMPLATES_DIR = "templates/";

	private final JavaMailSender emailSender;

	@Value("${rttrail.mail.enabled:true}")
	private boolean enabled;
	@Value("${rttrail.mail.from.email:no-reply@rttrail.org}")
	private String fromEmail;
	@Value("${rttrail.mail.from.name:RTTrail}")
	private String fromName;
	@Value("${rttrail.link.base-url:http://localhost:8100}")
	private String baseUrl;

	public String getFromEmail() {
		return fromEmail;
	}

	public Mono<Void> send(String to, String template, Map<String, String> templateData) {
		if (!enabled) {
			log.info("Mail sending disabled, {} mail to {} not sent", template, to);
			return Mono.empty();
		}
		Mono<String> readSubject = RttrailUtils.readResource(TEMPLATES_DIR + template + ".subject.txt");
		Mono<String> readHtml = RttrailUtils.readResource(TEMPLATES_DIR + template + ".body.html");
		return Mono.zip(readSubject, readHtml).flatMap(files -> {
			String subject = applyTemplate(files.getT1().trim(), templateData);
			String html = applyTemplate(files.getT2(), templateData);
			return Mono.<Void>fromRunnable(() -> sendMessage(to, subject, html))
				.subscribeOn(Schedulers.boundedElastic());
		});
	}

	/** Sends without making the caller wait. A failure is logged. */
	public void sendInBackground(String to, String template, Map<String, String> templateData) {
		send(to, template, templateData)
			.doOnError(e -> log.error("Error sending {} mail to {}", template, to, e))
			.onErrorComplete()
			.checkpoint("Send " + template + " mail")
			.subscribe();
	}

	public String getLinkUrl(String path) {
		return baseUrl + path;
	}

	private void sendMessage(String to, String subject, String html) {
		try {
			MimeMessage message = emailSender.createMimeMessage();
			MimeMessageHelper helper = new MimeMessageHelper(message, false, "UTF-8");
			helper.setFrom(new InternetAddress(fromEmail, fromName));
			helper.setTo(to);
			helper.setSubject(subject);
			helper.setText(html, true);
			emailSender.send(message);
			log.info("Mail sent to {}: {}", to, subject);
		} catch (Exception e) {
			throw new MailException("Unable to send mail to " + to, e);
		}
	}

	private String applyTemplate(String template, Map<String, String> templateData) {
		Map<String, String> data = new HashMap<>(templateData);
		data.put("base_url", baseUrl);
		String result = template;
		for (var entry : data.entrySet()) result = result.replace("{{" + entry.getKey() + "}}", entry.getValue());
		return result;
	}

	public static class MailException extends RuntimeException {
		private static final long serialVersionUID = 1L;

		public MailException(String message, Throwable cause) {
			super(message, cause);
		}
	}

}
