package com.hamco.api.serviceImpl;

import com.hamco.api.config.AppProperties;
import com.hamco.api.service.EmailService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Plain-text mails through {@link JavaMailSender}. Without a configured SMTP host the link is only
 * logged, which is what local development relies on.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MailEmailService implements EmailService {

    private final ObjectProvider<JavaMailSender> mailSender;
    private final AppProperties appProperties;

    @Override
    public void sendVerificationEmail(String to, String rawToken) {
        String link = link("/api/auth/verify-email", rawToken);
        send(to, "Verify your Hamco account",
                "Welcome to Hamco!\n\nConfirm your e-mail address by opening:\n" + link
                        + "\n\nThe link expires in " + appProperties.tokens().ttl().toMinutes() + " minutes.");
    }

    @Override
    public void sendPasswordResetEmail(String to, String rawToken) {
        String link = link("/reset-password", rawToken);
        send(to, "Reset your Hamco password",
                "A password reset was requested for this address.\n\nChoose a new password here:\n" + link
                        + "\n\nIf you did not ask for this, ignore this mail. The link expires in "
                        + appProperties.tokens().ttl().toMinutes() + " minutes.");
    }

    private String link(String path, String rawToken) {
        return UriComponentsBuilder.fromHttpUrl(appProperties.baseUrl())
                .path(path)
                .queryParam("token", rawToken)
                .build()
                .toUriString();
    }

    private void send(String to, String subject, String text) {
        JavaMailSender sender = mailSender.getIfAvailable();
        if (sender == null) {
            log.info("Mail transport not configured; would send '{}' to {}:\n{}", subject, to, text);
            return;
        }
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(appProperties.mailFrom());
        message.setTo(to);
        message.setSubject(subject);
        message.setText(text);
        try {
            sender.send(message);
        } catch (MailException e) {
            // Caller flows stay successful; the user can request a new link
            log.error("Failed to send '{}' to {}: {}", subject, to, e.getMessage());
        }
    }
}
