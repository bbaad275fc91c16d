package io.toolwatch.internal;

import io.toolwatch.ToolCatalog;
import io.toolwatch.core.ProcessingPriority;
import io.toolwatch.core.ToolInfo;
import io.toolwatch.core.ToolRegistration;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local catalog, used when no persistent store is configured.
 */
public class InMemoryToolCatalog implements ToolCatalog {

    private final Map<String, Entry> tools = new LinkedHashMap<>();
    private final AtomicLong ids = new AtomicLong();

    private static final class Entry {
        private ToolInfo info;
        private String description;
        private String websiteUrl;
        private String githubUrl;

        private Entry(ToolInfo info) {
            this.info = info;
        }
    }

    /**
     * Add or replace a tool as-is.
     */
    public synchronized void put(ToolInfo tool) {
        Objects.requireNonNull(tool, "tool must not be null");
        Entry existing = tools.get(tool.id());
        if (existing != null) {
            existing.info = tool;
        } else {
            tools.put(tool.id(), new Entry(tool));
        }
    }

    @Override
    public synchronized List<ToolInfo> findDueTools(ProcessingPriority tier, Instant now) {
        Objects.requireNonNull(tier, "tier must not be null");
        Objects.requireNonNull(now, "now must not be null");
        List<ToolInfo> due = new ArrayList<>();
        for (Entry e : tools.values()) {
            ToolInfo t = e.info;
            if (!t.activelyMonitored() || t.tier() != tier) {
                continue;
            }
            boolean scheduled = t.nextProcessAt() == null || !t.nextProcessAt().isAfter(now);
            boolean retry = tier == ProcessingPriority.URGENT && t.lastProcessingFailed();
            if (scheduled || retry) {
                due.add(t);
            }
        }
        return due;
    }

    @Override
    public synchronized Optional<ToolInfo> findTool(String toolId) {
        Entry e = tools.get(toolId);
        return e == null ? Optional.empty() : Optional.of(e.info);
    }

    @Override
    public synchronized boolean setMonitoring(String toolId, boolean active, Instant nextProcessAt) {
        Entry e = tools.get(toolId);
        if (e == null) {
            return false;
        }
        e.info = e.info.withMonitoring(active, nextProcessAt != null ? nextProcessAt : e.info.nextProcessAt());
        return true;
    }

    @Override
    public synchronized void recordProcessed(String toolId, Instant processedAt, boolean failed) {
        Entry e = tools.get(toolId);
        if (e != null) {
            e.info = e.info.withProcessed(processedAt, failed);
        }
    }

    @Override
    public synchronized ToolInfo register(ToolRegistration registration, Instant nextProcessAt) {
        Objects.requireNonNull(registration, "registration must not be null");
        Entry entry = match(registration);
        String id;
        ToolInfo previous;
        if (entry == null) {
            id = String.valueOf(ids.incrementAndGet());
            while (tools.containsKey(id)) {
                id = String.valueOf(ids.incrementAndGet());
            }
            previous = null;
        } else {
            id = entry.info.id();
            previous = entry.info;
        }

        ToolInfo info = new ToolInfo(
                id,
                registration.name(),
                registration.category() != null ? registration.category() : previous == null ? null : previous.category(),
                registration.priorityLevelOrDefault(),
                registration.openSource() != null ? registration.openSource() : previous != null && previous.openSource(),
                true,
                registration.monitoringFrequencyOrDefault(),
                nextProcessAt,
                previous == null ? null : previous.lastProcessedAt(),
                previous != null && previous.lastProcessingFailed()
        );

        if (entry == null) {
            entry = new Entry(info);
            tools.put(id, entry);
        } else {
            entry.info = info;
        }
        if (registration.description() != null) {
            entry.description = registration.description();
        }
        if (registration.websiteUrl() != null) {
            entry.websiteUrl = registration.websiteUrl();
        }
        if (registration.githubUrl() != null) {
            entry.githubUrl = registration.githubUrl();
        }
        return info;
    }

    private Entry match(ToolRegistration r) {
        if (r.githubUrl() != null) {
            for (Entry e : tools.values()) {
                if (r.githubUrl().equals(e.githubUrl)) {
                    return e;
                }
            }
        }
        if (r.websiteUrl() != null) {
            for (Entry e : tools.values()) {
                if (r.websiteUrl().equals(e.websiteUrl)) {
                    return e;
                }
            }
        }
        for (Entry e : tools.values()) {
            if (r.name().equals(e.info.name())) {
                return e;
            }
        }
        return null;
    }

    @Override
    public synchronized long countTools() {
        return tools.size();
    }

    @Override
    public synchronized long countMonitored() {
        return tools.values().stream().filter(e -> e.info.activelyMonitored()).count();
    }

    @Override
    public synchronized long countProcessedSince(Instant since) {
        return tools.values().stream()
                .map(e -> e.info)
                .filter(t -> t.lastProcessedAt() != null && !t.lastProcessedAt().isBefore(since) && !t.lastProcessingFailed())
                .count();
    }
}
