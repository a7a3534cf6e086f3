package com.ztverify.riskauth.infrastructure.notify;

import com.ztverify.riskauth.domain.otp.RemainingTime;
import com.ztverify.riskauth.domain.ports.OtpNotifierPort;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Sends one-time codes as multipart (text + HTML) email through the configured SMTP relay.
 * Blocks until the relay accepts or rejects the message; timeouts come from {@code spring.mail.properties}.
 */
@Component
@ConditionalOnProperty(name = "app.otp.delivery", havingValue = "email")
public class EmailOtpNotifier implements OtpNotifierPort {

    private static final Logger log = LoggerFactory.getLogger(EmailOtpNotifier.class);

    private final JavaMailSender mailSender;
    private final String from;
    private final String subject;
    private final long lifetimeSeconds;

    public EmailOtpNotifier(JavaMailSender mailSender,
                            @Value("${app.otp.mail.from:no-reply@zt-verify.local}") String from,
                            @Value("${app.otp.mail.subject:Your verification code}") String subject,
                            @Value("${app.otp.lifetime-seconds:300}") long lifetimeSeconds) {
        this.mailSender = mailSender;
        this.from = from;
        this.subject = subject;
        this.lifetimeSeconds = lifetimeSeconds;
    }

    @Override
    public boolean send(String destination, String code, String username) {
        long startTime = System.currentTimeMillis();
        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, true, StandardCharsets.UTF_8.name());
            helper.setFrom(from);
            helper.setTo(destination);
            helper.setSubject(subject);
            helper.setText(textBody(code, username), htmlBody(code, username));
            mailSender.send(message);
            log.info("OTP email sent to {} for {} in {}ms", mask(destination), username,
                    System.currentTimeMillis() - startTime);
            return true;
        } catch (MessagingException | MailException e) {
            log.error("OTP email to {} for {} failed after {}ms: {}", mask(destination), username,
                    System.currentTimeMillis() - startTime, e.getMessage(), e);
            return false;
        }
    }

    private String textBody(String code, String username) {
        return String.format(
                "Hello %s,%n%n" +
                "Your verification code is: %s%n%n" +
                "The code expires in %s. Do not share it with anyone.%n" +
                "If you did not try to sign in, please contact your administrator.",
                username, code, RemainingTime.format(lifetimeSeconds));
    }

    private String htmlBody(String code, String username) {
        return "<html><body style=\"font-family:Arial,sans-serif\">"
                + "<p>Hello " + escape(username) + ",</p>"
                + "<p>Your verification code is:</p>"
                + "<p style=\"font-size:28px;font-weight:bold;letter-spacing:6px\">" + code + "</p>"
                + "<p>The code expires in " + RemainingTime.format(lifetimeSeconds) + ". Do not share it with anyone.</p>"
                + "<p style=\"color:#777\">If you did not try to sign in, please contact your administrator.</p>"
                + "</body></html>";
    }

    private static String escape(String s) {
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;").replace("\"", "&quot;");
    }

    static String mask(String email) {
        int at = email.indexOf('@');
        if (at <= 1) {
            return "***" + (at >= 0 ? email.substring(at) : "");
        }
        return email.charAt(0) + "***" + email.substring(at);
    }
}
