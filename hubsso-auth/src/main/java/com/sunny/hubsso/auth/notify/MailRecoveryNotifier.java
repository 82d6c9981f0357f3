package com.sunny.hubsso.auth.notify;

import java.time.Instant;

import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import com.sunny.hubsso.auth.config.AuthSecurityProperties;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 邮件找回通知发送器
 *
 * @author Sunny
 * @date 2026-10-17
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MailRecoveryNotifier implements RecoveryNotifier {

    private final JavaMailSender mailSender;
    private final AuthSecurityProperties securityProperties;

    @Override
    public NotifyResult publish(RecoveryMessage message) {
        try {
            MimeMessage mimeMessage = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(mimeMessage, "UTF-8");
            helper.setFrom(securityProperties.getRecovery().getFrom());
            helper.setTo(message.recipient());
            helper.setSubject(message.subject());
            helper.setText(formatHtmlContent(message), true);

            mailSender.send(mimeMessage);

            log.info("找回邮件发送成功: hubId={}", message.hubId());
            return NotifyResult.ok();
        } catch (MailException | MessagingException e) {
            log.error("找回邮件发送异常: hubId={}", message.hubId(), e);
            return NotifyResult.fail("发送异常: " + e.getMessage());
        }
    }

    private String formatHtmlContent(RecoveryMessage message) {
        String url = HtmlUtils.htmlEscape(message.recoveryUrl());
        return """
                <!DOCTYPE html>
                <html>
                <head><meta charset="UTF-8"></head>
                <body>
                    <p>请点击下方链接登录并重新设置密码：</p>
                    <p><a href="%s">%s</a></p>
                    <p>链接有效期至 %s (UTC)，如非本人操作请忽略此邮件。</p>
                </body>
                </html>
                """.formatted(url, url, Instant.ofEpochSecond(message.expiresAt()));
    }
}
