package com.aisignal.output;

import lombok.Value;

/**
 * Digest outcome counts for one run; {@code available} is the number of qualifying stories.
 */
@Value
public class DigestReport {
    int available;
    int recipients;
    int sent;
    int failed;
    int skipped;

    public String oneLine() {
        return "available=" + available
                + " recipients=" + recipients
                + " sent=" + sent
                + " failed=" + failed
                + " skipped=" + skipped;
    }
}
