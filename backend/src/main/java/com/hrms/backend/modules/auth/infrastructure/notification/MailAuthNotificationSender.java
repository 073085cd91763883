package com.hrms.backend.modules.auth.infrastructure.notification;

import java.time.Duration;

import com.hrms.backend.modules.auth.application.AuthNotificationSender;
import com.hrms.backend.modules.auth.domain.OtpPurpose;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

@Component
public class MailAuthNotificationSender implements AuthNotificationSender {

    private static final Logger log = LoggerFactory.getLogger(MailAuthNotificationSender.class);

    private final JavaMailSender mailSender;
    private final String fromAddress;

    public MailAuthNotificationSender(
            JavaMailSender mailSender,
            @Value("${app.mail.from:no-reply@hrms.local}") String fromAddress
    ) {
        this.mailSender = mailSender;
        this.fromAddress = fromAddress;
    }

    @Async
    @Override
    public void sendOtp(String email, OtpPurpose purpose, String code, Duration ttl) {
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(fromAddress);
        message.setTo(email);
        message.setSubject(subjectFor(purpose));
        message.setText("Your verification code is " + code + ".\n"
                + "It expires in " + ttl.toMinutes() + " minutes. If you did not request it, ignore this message.");
        deliver(message, purpose.key());
    }

    @Async
    @Override
    public void sendPasswordReset(String email, String resetLink, Duration ttl) {
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(fromAddress);
        message.setTo(email);
        message.setSubject("Reset your password");
        message.setText("Use the link below to choose a new password. It expires in "
                + ttl.toMinutes() + " minutes.\n\n" + resetLink);
        deliver(message, "password_reset_link");
    }

    private void deliver(SimpleMailMessage message, String kind) {
        try {
            mailSender.send(message);
            log.info("Sent {} mail", kind);
        } catch (MailException ex) {
            log.error("Failed to send {} mail: {}", kind, ex.getMessage());
        }
    }

    private static String subjectFor(OtpPurpose purpose) {
        return switch (purpose) {
            case EMAIL_VERIFICATION -> "Verify your email address";
            case PHONE_VERIFICATION -> "Verify your phone number";
            case PASSWORD_RESET -> "Password reset code";
            case TWO_FACTOR -> "Your sign-in code";
        };
    }
}
