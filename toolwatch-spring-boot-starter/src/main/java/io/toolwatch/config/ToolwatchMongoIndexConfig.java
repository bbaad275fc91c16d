package io.toolwatch.config;

import io.toolwatch.internal.mongo.AlertDocument;
import io.toolwatch.internal.mongo.BatchJobDocument;
import io.toolwatch.internal.mongo.ToolDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.Objects;

/**
 * MongoDB index definitions for the toolwatch collections.
 *
 * <p>Indexes are <b>not</b> created automatically unless {@code toolwatch.ensure-indexes-on-startup=true}.
 * In production they are usually managed by migrations or ops scripts.
 *
 * <h3>Required indexes</h3>
 * <ul>
 *   <li><b>idx_tool_due</b> on {@code tools}: { activelyMonitored: 1, priorityLevel: 1, nextProcessAt: 1 }
 *       <br/>Used by per-tier discovery of due tools.</li>
 *   <li><b>idx_tool_github</b>, <b>idx_tool_website</b>, <b>idx_tool_name</b> on {@code tools}
 *       <br/>Used to match existing tools during bulk import.</li>
 *   <li><b>idx_job_created</b> on {@code batch_jobs}: { createdAt: -1 }</li>
 *   <li><b>idx_alert_created</b> on {@code alerts}: { createdAt: -1 }
 *       <br/>Used by digests, which read alerts of a recent period.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.tools.createIndex({ activelyMonitored: 1, priorityLevel: 1, nextProcessAt: 1 }, { name: "idx_tool_due" });
 * db.tools.createIndex({ githubUrl: 1 }, { name: "idx_tool_github", sparse: true });
 * db.tools.createIndex({ websiteUrl: 1 }, { name: "idx_tool_website", sparse: true });
 * db.tools.createIndex({ name: 1 }, { name: "idx_tool_name" });
 * db.batch_jobs.createIndex({ createdAt: -1 }, { name: "idx_job_created" });
 * db.alerts.createIndex({ createdAt: -1 }, { name: "idx_alert_created" });
 * </pre>
 */
public class ToolwatchMongoIndexConfig {

    public static final String IDX_TOOL_DUE = "idx_tool_due";
    public static final String IDX_TOOL_GITHUB = "idx_tool_github";
    public static final String IDX_TOOL_WEBSITE = "idx_tool_website";
    public static final String IDX_TOOL_NAME = "idx_tool_name";
    public static final String IDX_JOB_CREATED = "idx_job_created";
    public static final String IDX_ALERT_CREATED = "idx_alert_created";

    private final MongoTemplate mongoTemplate;

    public ToolwatchMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(ToolDocument.class).createIndex(toolDueIndex());
        mongoTemplate.indexOps(ToolDocument.class).createIndex(sparseIndex("githubUrl", IDX_TOOL_GITHUB));
        mongoTemplate.indexOps(ToolDocument.class).createIndex(sparseIndex("websiteUrl", IDX_TOOL_WEBSITE));
        mongoTemplate.indexOps(ToolDocument.class).createIndex(
                new Index().on("name", Sort.Direction.ASC).named(IDX_TOOL_NAME));
        mongoTemplate.indexOps(BatchJobDocument.class).createIndex(createdAtIndex(IDX_JOB_CREATED));
        mongoTemplate.indexOps(AlertDocument.class).createIndex(createdAtIndex(IDX_ALERT_CREATED));
    }

    /**
     * Keys: activelyMonitored ASC, priorityLevel ASC, nextProcessAt ASC
     */
    public static Index toolDueIndex() {
        return new Index()
                .on("activelyMonitored", Sort.Direction.ASC)
                .on("priorityLevel", Sort.Direction.ASC)
                .on("nextProcessAt", Sort.Direction.ASC)
                .named(IDX_TOOL_DUE);
    }

    static Index sparseIndex(String field, String name) {
        return new Index().on(field, Sort.Direction.ASC).sparse().named(name);
    }

    static Index createdAtIndex(String name) {
        return new Index().on("createdAt", Sort.Direction.DESC).named(name);
    }
}
