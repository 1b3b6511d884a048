package com.aisignal.data.feed;

/**
 * The document is not well-formed XML.
 */
public class FeedParseException extends Exception {
    public FeedParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
