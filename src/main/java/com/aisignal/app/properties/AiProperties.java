package com.aisignal.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Chat model settings bound from {@code ai.*}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "ai")
public class AiProperties {
    private String provider = "anthropic";
    private String model = "claude-3-5-haiku-latest";
    private String apiKey = "";
    private String baseUrl = "";
    private int maxTokens = 600;
    private int timeoutSec = 30;
    private double temperature = 0.2;
}
