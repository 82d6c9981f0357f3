package com.sunny.hubsso.auth.notify;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;

import com.sunny.hubsso.auth.config.AuthSecurityProperties;

import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MailRecoveryNotifierTest {

    @Mock
    private JavaMailSender mailSender;

    private final RecoveryMessage message = new RecoveryMessage(
            "user@example.com", 3L, "密码找回", "https://auth.example.com/auth/login?token=a.b.c", 1_800_000_000L);

    private MailRecoveryNotifier notifier() {
        return new MailRecoveryNotifier(mailSender, new AuthSecurityProperties());
    }

    @Test
    void publish_shouldSendMessageToRecipient() throws Exception {
        MimeMessage mimeMessage = new MimeMessage((Session) null);
        when(mailSender.createMimeMessage()).thenReturn(mimeMessage);

        NotifyResult result = notifier().publish(message);

        assertTrue(result.success());
        verify(mailSender).send(mimeMessage);
        assertEquals("user@example.com", mimeMessage.getAllRecipients()[0].toString());
        assertEquals("密码找回", mimeMessage.getSubject());
    }

    @Test
    void publish_shouldReportFailureInsteadOfThrowing() {
        when(mailSender.createMimeMessage()).thenReturn(new MimeMessage((Session) null));
        doThrow(new MailSendException("smtp down")).when(mailSender).send(any(MimeMessage.class));

        NotifyResult result = notifier().publish(message);

        assertFalse(result.success());
        assertTrue(result.message().contains("smtp down"));
    }
}
