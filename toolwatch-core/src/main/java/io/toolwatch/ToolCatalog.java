package io.toolwatch;

import io.toolwatch.core.ProcessingPriority;
import io.toolwatch.core.ToolInfo;
import io.toolwatch.core.ToolRegistration;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Source of truth for tracked tools and their monitoring schedule.
 */
public interface ToolCatalog {

    /**
     * Actively monitored tools of the given tier whose next process time is unset or not after {@code now}.
     * For {@link ProcessingPriority#URGENT} this also includes tools whose last processing failed.
     */
    List<ToolInfo> findDueTools(ProcessingPriority tier, Instant now);

    Optional<ToolInfo> findTool(String toolId);

    /**
     * Toggle scheduled monitoring. A non-null {@code nextProcessAt} replaces the stored next process time.
     *
     * @return {@code false} if the tool is unknown
     */
    boolean setMonitoring(String toolId, boolean active, Instant nextProcessAt);

    /**
     * Record the outcome of one analysis. The next process time becomes {@code processedAt} plus the tool's
     * monitoring frequency.
     */
    void recordProcessed(String toolId, Instant processedAt, boolean failed);

    /**
     * Create a tool, or update the existing one matched by GitHub URL, then website URL, then name.
     * Registered tools are actively monitored and due at {@code nextProcessAt}.
     */
    ToolInfo register(ToolRegistration registration, Instant nextProcessAt);

    long countTools();

    long countMonitored();

    /**
     * Tools whose last processing at or after {@code since} succeeded.
     */
    long countProcessedSince(Instant since);
}
