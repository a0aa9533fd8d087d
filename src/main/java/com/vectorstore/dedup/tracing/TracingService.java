package com.vectorstore.dedup.tracing;

/**
 * Opens spans around the store load, the analysis and the deletion run.
 * The default {@link NoOpTracingService} does nothing, so the library works without
 * any tracing dependency on the classpath.
 */
public interface TracingService {

    /**
     * @param namespace display name of the namespace the operation works on
     */
    Span startSpan(TracedOperation operation, String namespace);
}
