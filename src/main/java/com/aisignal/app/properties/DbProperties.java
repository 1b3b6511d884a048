package com.aisignal.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Article store connection bound from {@code db.*}; {@code AISIGNAL_DB_*} variables win over these.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "db")
public class DbProperties {
    private String url = "jdbc:postgresql://localhost:5432/aisignal";
    private String user = "aisignal";
    private String pass = "aisignal";
    private String schema = "aisignal";
}
