package se.artisan_be.service;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.Nullable;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;

import java.io.UnsupportedEncodingException;

/**
 * Outgoing HTML mail. Sending is best effort: failures are logged and never reach the caller.
 */
@Service
@Slf4j
public class MailService {

    private final ObjectProvider<JavaMailSender> mailSender;

    @Value("${app.mail.enabled:false}")
    private boolean enabled;

    @Value("${app.mail.from-address:noreply@localhost}")
    private String fromAddress;

    @Value("${app.mail.from-name:Artisan Registry}")
    private String fromName;

    public MailService(ObjectProvider<JavaMailSender> mailSender) {
        this.mailSender = mailSender;
    }

    /**
     * @return whether the message was handed to the mail server
     */
    public boolean sendHtml(String to, String subject, String htmlBody, @Nullable String plainTextFallback) {
        JavaMailSender sender = mailSender.getIfAvailable();
        if (!enabled || sender == null) {
            log.info("Mail disabled, skipping '{}' to {}", subject, to);
            return false;
        }
        try {
            MimeMessage msg = sender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(msg, "UTF-8");
            helper.setFrom(new InternetAddress(fromAddress, fromName, "UTF-8"));
            helper.setTo(to);
            helper.setSubject(subject);
            helper.setText(plainTextFallback == null ? " " : plainTextFallback, htmlBody);
            sender.send(msg);
            log.info("Mail '{}' sent to {}", subject, to);
            return true;
        } catch (MessagingException | UnsupportedEncodingException | MailException e) {
            log.error("Failed to send mail '{}' to {}: {}", subject, to, e.getMessage(), e);
            return false;
        }
    }

    public boolean sendSubscriptionThanks(String to) {
        String html = """
                <div style="font-family: Arial, sans-serif; max-width: 600px; margin: 0 auto;">
                  <h2>Thank you for subscribing!</h2>
                  <p>You will now receive our updates by email.</p>
                  <p>You can unsubscribe at any time using the link in any of our emails.</p>
                </div>
                """;
        return sendHtml(to, "Thank You for Subscribing!", html,
                "Thank you for subscribing! You will now receive our updates by email.");
    }

    public boolean sendInquiryConfirmation(String to, String fullName, String desiredCountry) {
        String name = escape(fullName);
        String country = escape(desiredCountry);
        String html = """
                <div style="font-family: Arial, sans-serif; max-width: 600px; margin: 0 auto;">
                  <h2>We received your inquiry</h2>
                  <p>Dear %s,</p>
                  <p>Thank you for your interest in %s. One of our advisors will contact you shortly.</p>
                </div>
                """.formatted(name, country);
        return sendHtml(to, "We received your inquiry", html,
                "Dear " + fullName + ", thank you for your inquiry. One of our advisors will contact you shortly.");
    }

    private static String escape(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;").replace("\"", "&quot;");
    }
}
