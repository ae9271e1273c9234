/* (C)2026 */
package com.ammann.petrophysics.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;

/**
 * CDI producer for creating named ManagedExecutor instances.
 *
 * <p>Provides the "well-analysis-executor" bean used by FieldAnalysisService to
 * analyze several wells concurrently. The pool and queue bounds are the only
 * back-pressure on a field request.
 */
@ApplicationScoped
public class ExecutorProducer {

    static final int WELL_ANALYSIS_MAX_THREADS = 4;
    static final int WELL_ANALYSIS_QUEUE_SIZE = 16;

    @ConfigProperty(name = "petrophysics.well-analysis-executor.max-threads", defaultValue = "4")
    int maxThreads = WELL_ANALYSIS_MAX_THREADS;

    @ConfigProperty(name = "petrophysics.well-analysis-executor.queue-size", defaultValue = "16")
    int queueSize = WELL_ANALYSIS_QUEUE_SIZE;

    /**
     * Produces a named ManagedExecutor for per-well analysis tasks.
     *
     * <p>Configuration properties:
     * <ul>
     *   <li>petrophysics.well-analysis-executor.max-threads</li>
     *   <li>petrophysics.well-analysis-executor.queue-size</li>
     * </ul>
     *
     * @return Configured ManagedExecutor instance
     */
    @Produces
    @Named("well-analysis-executor")
    @ApplicationScoped
    public ManagedExecutor createWellAnalysisExecutor() {
        return ManagedExecutor.builder()
                .maxAsync(maxThreads)
                .maxQueued(queueSize)
                .propagated(ThreadContext.ALL_REMAINING)
                .cleared(ThreadContext.TRANSACTION)
                .build();
    }
}
