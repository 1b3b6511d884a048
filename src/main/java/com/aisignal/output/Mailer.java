package com.aisignal.output;

import com.aisignal.config.Config;
import jakarta.mail.Authenticator;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Properties;

/**
 * Delivers one digest message per subscriber over SMTP (STARTTLS), or writes it to disk in dry-run
 * mode. Non-final so digest tests can capture messages instead of sending them.
 */
public class Mailer {
    private static final Logger log = LogManager.getLogger(Mailer.class);
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    public static final class Settings {
        public boolean enabled;
        public String host;
        public int port;
        public String user;
        public String pass;
        public String from;
        public String subjectPrefix;
        public boolean dryRun;
        public boolean failFast;
        public Path dryRunDir;

        String sender() {
            return isBlank(from) ? safe(user) : from.trim();
        }
    }

    public Settings loadSettings(Config config) {
        Settings settings = new Settings();
        settings.enabled = config.getBoolean("email.enabled", true);
        settings.host = config.getString("email.smtp_host", "smtp.gmail.com");
        settings.port = config.getInt("email.smtp_port", 587);
        settings.user = config.getString("email.smtp_user", "");
        settings.pass = config.getString("email.smtp_pass", "");
        settings.from = config.getString("email.from", settings.user);
        settings.subjectPrefix = config.getString("email.subject_prefix", "[AI Signal]");
        settings.dryRun = config.getBoolean("mail.dry_run", false);
        settings.failFast = config.getBoolean("mail.fail_fast", false);
        String dryRunDir = config.getString("mail.dry_run.dir", "");
        settings.dryRunDir = dryRunDir.isBlank()
                ? config.getPath("outputs.dir").resolve("mail_dry_run")
                : config.workingDir().resolve(dryRunDir).normalize();
        return settings;
    }

    /**
     * @return true when the message was handed to SMTP or written as a dry-run file
     * @throws MessagingException only when {@code failFast} is set
     */
    public boolean send(Settings s, String to, String subject, String textBody, String htmlBody) throws MessagingException {
        if (!s.enabled) {
            log.info("Mail disabled, skipping message to {}", maskAddress(to));
            return false;
        }
        if (isBlank(to)) {
            return fail(s, to, "no_recipient", new IllegalArgumentException("recipient address is blank"));
        }
        if (!s.dryRun && (isBlank(s.host) || isBlank(s.user) || isBlank(s.pass))) {
            return fail(s, to, "smtp_settings_incomplete",
                    new IllegalArgumentException("email.smtp_host, email.smtp_user and email.smtp_pass are required"));
        }

        MimeMessage message;
        try {
            message = buildMessage(session(s), s.sender(), to, subject, textBody, htmlBody);
        } catch (MessagingException | RuntimeException e) {
            return fail(s, to, "message_build_failed", e);
        }

        if (s.dryRun) {
            try {
                Path eml = writeDryRun(s, to, message, textBody, htmlBody);
                log.info("Mail dry-run saved. to={} file={}", maskAddress(to), eml.toAbsolutePath());
                return true;
            } catch (IOException | MessagingException e) {
                return fail(s, to, "dry_run_write_failed", e);
            }
        }

        try {
            Transport.send(message);
            return true;
        } catch (MessagingException | RuntimeException e) {
            return fail(s, to, "smtp_send_failed", e);
        }
    }

    /**
     * Text-only when there is no HTML body, otherwise multipart/alternative with text first so
     * clients that cannot render HTML still show the digest.
     */
    static MimeMessage buildMessage(Session session, String from, String to, String subject, String textBody, String htmlBody)
            throws MessagingException {
        MimeMessage message = new MimeMessage(session);
        if (!isBlank(from)) {
            message.setFrom(new InternetAddress(from));
        }
        message.setRecipients(Message.RecipientType.TO, InternetAddress.parse(to.trim()));
        message.setSubject(safe(subject), "UTF-8");
        if (isBlank(htmlBody)) {
            message.setText(safe(textBody), "UTF-8");
        } else {
            MimeBodyPart text = new MimeBodyPart();
            text.setText(safe(textBody), "UTF-8");
            MimeBodyPart html = new MimeBodyPart();
            html.setContent(htmlBody, "text/html; charset=UTF-8");
            message.setContent(new MimeMultipart("alternative", text, html));
        }
        message.saveChanges();
        return message;
    }

    private static Session session(Settings s) {
        Properties props = new Properties();
        props.put("mail.smtp.auth", "true");
        props.put("mail.smtp.starttls.enable", "true");
        props.put("mail.smtp.host", safe(s.host));
        props.put("mail.smtp.port", String.valueOf(s.port));
        return Session.getInstance(props, new Authenticator() {
            @Override
            protected PasswordAuthentication getPasswordAuthentication() {
                return new PasswordAuthentication(s.user, s.pass);
            }
        });
    }

    private static Path writeDryRun(Settings s, String to, MimeMessage message, String textBody, String htmlBody)
            throws IOException, MessagingException {
        Files.createDirectories(s.dryRunDir);
        String base = "mail_" + FILE_STAMP.format(LocalDateTime.now()) + "_" + fileSafe(to);
        Path eml = s.dryRunDir.resolve(base + ".eml");
        try (OutputStream out = Files.newOutputStream(eml)) {
            message.writeTo(out);
        }
        Files.writeString(s.dryRunDir.resolve(base + ".html"), safe(htmlBody), StandardCharsets.UTF_8);
        Files.writeString(s.dryRunDir.resolve(base + ".txt"), safe(textBody), StandardCharsets.UTF_8);
        return eml;
    }

    private static boolean fail(Settings s, String to, String stage, Exception e) throws MessagingException {
        String message = "Mail send failed stage=" + stage
                + " smtp=" + safe(s.host) + ":" + s.port
                + " to=" + maskAddress(to)
                + " err=" + safe(e.getMessage());
        if (s.failFast) {
            if (e instanceof MessagingException) {
                throw (MessagingException) e;
            }
            throw new MessagingException(message, e);
        }
        log.warn(message);
        return false;
    }

    static String maskAddress(String raw) {
        String value = safe(raw);
        int at = value.indexOf('@');
        if (at <= 0) {
            return value;
        }
        String domain = value.substring(at + 1);
        return at == 1 ? "*@" + domain : value.charAt(0) + "***@" + domain;
    }

    private static String fileSafe(String to) {
        String value = safe(to).trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9._-]", "_");
        return value.isEmpty() ? "unknown" : value;
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
