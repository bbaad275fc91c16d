package io.toolwatch.internal.mongo;

import io.toolwatch.core.ToolInfo;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Duration;
import java.time.Instant;

/**
 * Mongo document model for tracked tools.
 */
@Document(collection = "tools")
public class ToolDocument {

    @Id
    private String id;

    private String name;
    private String description;
    private String websiteUrl;
    private String githubUrl;
    private String category;
    private int priorityLevel = 3;
    private boolean openSource;
    private boolean activelyMonitored = true;
    private long monitoringFrequencySeconds = Duration.ofDays(7).toSeconds();

    @Field(write = Field.Write.ALWAYS)
    private Instant nextProcessAt;

    private Instant lastProcessedAt;
    private boolean lastProcessingFailed;
    private Instant createdAt;
    private Instant updatedAt;

    public ToolDocument() {
    }

    public ToolInfo toInfo() {
        return new ToolInfo(
                id,
                name,
                category,
                priorityLevel,
                openSource,
                activelyMonitored,
                Duration.ofSeconds(monitoringFrequencySeconds),
                nextProcessAt,
                lastProcessedAt,
                lastProcessingFailed
        );
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getWebsiteUrl() {
        return websiteUrl;
    }

    public void setWebsiteUrl(String websiteUrl) {
        this.websiteUrl = websiteUrl;
    }

    public String getGithubUrl() {
        return githubUrl;
    }

    public void setGithubUrl(String githubUrl) {
        this.githubUrl = githubUrl;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public int getPriorityLevel() {
        return priorityLevel;
    }

    public void setPriorityLevel(int priorityLevel) {
        this.priorityLevel = priorityLevel;
    }

    public boolean isOpenSource() {
        return openSource;
    }

    public void setOpenSource(boolean openSource) {
        this.openSource = openSource;
    }

    public boolean isActivelyMonitored() {
        return activelyMonitored;
    }

    public void setActivelyMonitored(boolean activelyMonitored) {
        this.activelyMonitored = activelyMonitored;
    }

    public long getMonitoringFrequencySeconds() {
        return monitoringFrequencySeconds;
    }

    public void setMonitoringFrequencySeconds(long monitoringFrequencySeconds) {
        this.monitoringFrequencySeconds = monitoringFrequencySeconds;
    }

    public Instant getNextProcessAt() {
        return nextProcessAt;
    }

    public void setNextProcessAt(Instant nextProcessAt) {
        this.nextProcessAt = nextProcessAt;
    }

    public Instant getLastProcessedAt() {
        return lastProcessedAt;
    }

    public void setLastProcessedAt(Instant lastProcessedAt) {
        this.lastProcessedAt = lastProcessedAt;
    }

    public boolean isLastProcessingFailed() {
        return lastProcessingFailed;
    }

    public void setLastProcessingFailed(boolean lastProcessingFailed) {
        this.lastProcessingFailed = lastProcessingFailed;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
