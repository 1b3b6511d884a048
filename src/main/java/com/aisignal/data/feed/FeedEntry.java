package com.aisignal.data.feed;

import lombok.Value;

import java.time.ZonedDateTime;
import java.util.List;

/**
 * One RSS item or Atom entry. {@code publishedAt} is null when the feed date could not be parsed.
 */
@Value
public class FeedEntry {
    String title;
    String link;
    String description;
    String source;
    List<String> authors;
    ZonedDateTime publishedAt;

    public FeedEntry(String title, String link, String description, String source, List<String> authors, ZonedDateTime publishedAt) {
        this.title = title == null ? "" : title.trim();
        this.link = link == null ? "" : link.trim();
        this.description = description == null ? "" : description.trim();
        this.source = source == null ? "" : source.trim();
        this.authors = authors == null ? List.of() : List.copyOf(authors);
        this.publishedAt = publishedAt;
    }
}
