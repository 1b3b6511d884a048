package com.aisignal.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Digest selection and schedule bound from {@code digest.*}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "digest")
public class DigestProperties {
    private int maxArticles = 10;
    private int minRelevance = 5;
    private int fallbackArticles = 5;
    private String time = "08:00";
    private String zone = "UTC";
    private String appUrl = "http://localhost:3000";
}
