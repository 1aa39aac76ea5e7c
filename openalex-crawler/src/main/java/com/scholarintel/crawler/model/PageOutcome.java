package com.scholarintel.crawler.model;

public enum PageOutcome {
    /** Page parsed; items may be empty */
    OK,
    /** Retries exhausted or the request was refused; the cursor must not advance */
    ABANDONED,
    /** Body did not have the expected structure; no items, cursor must not advance */
    MALFORMED
}
