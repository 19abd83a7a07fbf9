package io.relaychat.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for server instance identifier.
     */
    public static final String SERVER_ID = "server_id";

    /**
     * Tag key for outcome of an operation (accepted/rejected).
     */
    public static final String RESULT = "result";

    /**
     * Tag key for failure/drop reason.
     */
    public static final String REASON = "reason";
}
