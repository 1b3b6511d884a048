package com.aisignal.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubscriberRow {
    private long id;
    private String email;
    private String name;
    private boolean active;
    private String categoriesJson;
    private int minRelevance;
    private OffsetDateTime createdAt;
}
