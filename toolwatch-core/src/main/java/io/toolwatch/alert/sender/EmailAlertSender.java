package io.toolwatch.alert.sender;

import io.toolwatch.alert.AlertSender;
import io.toolwatch.alert.DeliveryResult;
import io.toolwatch.config.ToolwatchProperties;
import io.toolwatch.core.Alert;
import io.toolwatch.core.AlertChannel;
import io.toolwatch.core.ChangeSummary;
import jakarta.mail.Authenticator;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Sends alerts as HTML mail over SMTP, with STARTTLS or implicit SSL.
 */
public class EmailAlertSender implements AlertSender {

    private static final Logger log = LoggerFactory.getLogger(EmailAlertSender.class);

    private final ToolwatchProperties.Email config;

    public EmailAlertSender(ToolwatchProperties.Email config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    @Override
    public AlertChannel channel() {
        return AlertChannel.EMAIL;
    }

    @Override
    public DeliveryResult send(Alert alert) {
        if (!config.isConfigured()) {
            log.warn("Email configuration incomplete, skipping alertId={}", alert.id());
            return DeliveryResult.fail(AlertChannel.EMAIL, "email channel not configured");
        }
        try {
            MimeMessage message = buildMessage(alert);
            transport(message);
            log.info("Email alert sent alertId={} to={}", alert.id(), config.getTo());
            return DeliveryResult.ok(AlertChannel.EMAIL);
        } catch (Exception e) {
            log.error("Email alert failed alertId={} msg={}", alert.id(), e.getMessage(), e);
            return DeliveryResult.fail(AlertChannel.EMAIL, "send error: " + e.getMessage());
        }
    }

    MimeMessage buildMessage(Alert alert) throws MessagingException {
        Session session = createSession();
        MimeMessage message = new MimeMessage(session);
        String from = config.getFrom() != null ? config.getFrom() : config.getUsername();
        if (from != null) {
            message.setFrom(new InternetAddress(from));
        }
        for (String to : config.getTo()) {
            message.addRecipient(Message.RecipientType.TO, new InternetAddress(to));
        }
        message.setSubject("[" + alert.severity().code().toUpperCase(Locale.ROOT) + "] " + alert.title(), "UTF-8");
        message.setContent(formatHtml(alert), "text/html;charset=UTF-8");
        return message;
    }

    protected void transport(MimeMessage message) throws MessagingException {
        Transport.send(message);
    }

    private Session createSession() {
        String timeout = String.valueOf(config.getTimeout().toMillis());
        Properties props = new Properties();
        props.put("mail.smtp.host", config.getSmtpHost());
        props.put("mail.smtp.port", String.valueOf(config.getSmtpPort()));
        props.put("mail.smtp.connectiontimeout", timeout);
        props.put("mail.smtp.timeout", timeout);
        props.put("mail.smtp.writetimeout", timeout);
        if (config.isUseSsl()) {
            props.put("mail.smtp.ssl.enable", "true");
        } else if (config.isUseTls()) {
            props.put("mail.smtp.starttls.enable", "true");
        }

        String username = config.getUsername();
        if (username == null || username.isBlank()) {
            return Session.getInstance(props);
        }
        props.put("mail.smtp.auth", "true");
        String password = config.getPassword();
        return Session.getInstance(props, new Authenticator() {
            @Override
            protected PasswordAuthentication getPasswordAuthentication() {
                return new PasswordAuthentication(username, password);
            }
        });
    }

    static String formatHtml(Alert alert) {
        StringBuilder html = new StringBuilder();
        html.append("<html><body>");
        html.append("<h2>").append(escapeHtml(alert.title())).append("</h2>");
        html.append("<p><strong>Tool:</strong> ").append(escapeHtml(alert.toolName())).append("</p>");
        html.append("<p><strong>Severity:</strong> ").append(alert.severity().code().toUpperCase(Locale.ROOT)).append("</p>");
        html.append("<p><strong>Message:</strong> ").append(escapeHtml(alert.message())).append("</p>");
        html.append("<p><strong>Time:</strong> ").append(ConsoleAlertSender.TIME_FORMAT.format(alert.createdAt())).append("</p>");
        html.append("<h3>Changes Detected (").append(alert.changes().size()).append("):</h3><ul>");
        for (ChangeSummary c : alert.changes()) {
            html.append("<li><strong>").append(c.changeType().label()).append(":</strong> ")
                    .append(escapeHtml(c.summary()))
                    .append("<br><small>Impact: ").append(c.impactScore()).append("/5, Confidence: ")
                    .append(Math.round(c.confidence() * 100)).append("%</small></li>");
        }
        html.append("</ul><hr><p><small>Sent by toolwatch</small></p></body></html>");
        return html.toString();
    }

    private static String escapeHtml(String text) {
        if (text == null) {
            return "";
        }
        return text
                .replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;")
                .replace("'", "&#39;");
    }
}
