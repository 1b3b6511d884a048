package com.aisignal.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * SMTP settings bound from {@code email.*}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "email")
public class EmailProperties {
    private boolean enabled = true;
    private String smtpHost = "smtp.gmail.com";
    private int smtpPort = 587;
    private String smtpUser = "";
    private String smtpPass = "";
    private String from = "";
    private String subjectPrefix = "[AI Signal]";
}
