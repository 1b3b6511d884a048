package com.aisignal.data.http;

import lombok.Value;

/**
 * Status, lower-cased content type and (possibly empty) body of one GET.
 */
@Value
public class PageResponse {
    int status;
    String contentType;
    String body;

    public PageResponse(int status, String contentType, String body) {
        this.status = status;
        this.contentType = contentType == null ? "" : contentType;
        this.body = body == null ? "" : body;
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    public boolean isHtml() {
        return contentType.contains("html");
    }
}
