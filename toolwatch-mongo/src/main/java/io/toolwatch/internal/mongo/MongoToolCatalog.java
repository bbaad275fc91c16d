package io.toolwatch.internal.mongo;

import io.toolwatch.ToolCatalog;
import io.toolwatch.core.ProcessingPriority;
import io.toolwatch.core.ToolInfo;
import io.toolwatch.core.ToolRegistration;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB-backed tool catalog.
 */
public class MongoToolCatalog implements ToolCatalog {

    private final MongoTemplate mongoTemplate;

    public MongoToolCatalog(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public List<ToolInfo> findDueTools(ProcessingPriority tier, Instant now) {
        Objects.requireNonNull(tier, "tier must not be null");
        Objects.requireNonNull(now, "now must not be null");

        Criteria due = new Criteria().orOperator(
                Criteria.where("nextProcessAt").is(null),
                Criteria.where("nextProcessAt").lte(now)
        );
        if (tier == ProcessingPriority.URGENT) {
            due = new Criteria().orOperator(due, Criteria.where("lastProcessingFailed").is(true));
        }

        Query q = new Query(new Criteria().andOperator(
                Criteria.where("activelyMonitored").is(true),
                levelCriteria(tier),
                due
        ));
        q.with(Sort.by(Sort.Order.asc("nextProcessAt"), Sort.Order.asc("_id")));

        List<ToolDocument> docs = mongoTemplate.find(q, ToolDocument.class);
        List<ToolInfo> tools = new ArrayList<>(docs.size());
        for (ToolDocument d : docs) {
            tools.add(d.toInfo());
        }
        return tools;
    }

    // Level 1 and below is URGENT, 5 and above is MAINTENANCE.
    private static Criteria levelCriteria(ProcessingPriority tier) {
        return switch (tier) {
            case URGENT -> Criteria.where("priorityLevel").lte(ProcessingPriority.URGENT.value());
            case MAINTENANCE -> Criteria.where("priorityLevel").gte(ProcessingPriority.MAINTENANCE.value());
            default -> Criteria.where("priorityLevel").is(tier.value());
        };
    }

    @Override
    public Optional<ToolInfo> findTool(String toolId) {
        if (toolId == null) {
            return Optional.empty();
        }
        ToolDocument doc = mongoTemplate.findById(toolId, ToolDocument.class);
        return doc == null ? Optional.empty() : Optional.of(doc.toInfo());
    }

    @Override
    public boolean setMonitoring(String toolId, boolean active, Instant nextProcessAt) {
        Objects.requireNonNull(toolId, "toolId must not be null");
        Update u = new Update()
                .set("activelyMonitored", active)
                .set("updatedAt", Instant.now());
        if (nextProcessAt != null) {
            u.set("nextProcessAt", nextProcessAt);
        }
        return mongoTemplate.updateFirst(byId(toolId), u, ToolDocument.class).getMatchedCount() > 0;
    }

    @Override
    public void recordProcessed(String toolId, Instant processedAt, boolean failed) {
        Objects.requireNonNull(toolId, "toolId must not be null");
        Objects.requireNonNull(processedAt, "processedAt must not be null");
        ToolDocument doc = mongoTemplate.findById(toolId, ToolDocument.class);
        if (doc == null) {
            return;
        }
        Update u = new Update()
                .set("lastProcessedAt", processedAt)
                .set("lastProcessingFailed", failed)
                .set("nextProcessAt", processedAt.plusSeconds(doc.getMonitoringFrequencySeconds()))
                .set("updatedAt", processedAt);
        mongoTemplate.updateFirst(byId(toolId), u, ToolDocument.class);
    }

    @Override
    public ToolInfo register(ToolRegistration registration, Instant nextProcessAt) {
        Objects.requireNonNull(registration, "registration must not be null");
        Instant now = Instant.now();

        ToolDocument doc = findExisting(registration);
        if (doc == null) {
            doc = new ToolDocument();
            doc.setCreatedAt(now);
        }
        doc.setName(registration.name());
        if (registration.description() != null) {
            doc.setDescription(registration.description());
        }
        if (registration.websiteUrl() != null) {
            doc.setWebsiteUrl(registration.websiteUrl());
        }
        if (registration.githubUrl() != null) {
            doc.setGithubUrl(registration.githubUrl());
        }
        if (registration.category() != null) {
            doc.setCategory(registration.category());
        }
        if (registration.openSource() != null) {
            doc.setOpenSource(registration.openSource());
        }
        doc.setPriorityLevel(registration.priorityLevelOrDefault());
        doc.setMonitoringFrequencySeconds(registration.monitoringFrequencyOrDefault().toSeconds());
        doc.setActivelyMonitored(true);
        doc.setNextProcessAt(nextProcessAt);
        doc.setUpdatedAt(now);

        return mongoTemplate.save(doc).toInfo();
    }

    private ToolDocument findExisting(ToolRegistration r) {
        if (r.githubUrl() != null) {
            ToolDocument d = mongoTemplate.findOne(new Query(Criteria.where("githubUrl").is(r.githubUrl())), ToolDocument.class);
            if (d != null) {
                return d;
            }
        }
        if (r.websiteUrl() != null) {
            ToolDocument d = mongoTemplate.findOne(new Query(Criteria.where("websiteUrl").is(r.websiteUrl())), ToolDocument.class);
            if (d != null) {
                return d;
            }
        }
        return mongoTemplate.findOne(new Query(Criteria.where("name").is(r.name())), ToolDocument.class);
    }

    @Override
    public long countTools() {
        return mongoTemplate.count(new Query(), ToolDocument.class);
    }

    @Override
    public long countMonitored() {
        return mongoTemplate.count(new Query(Criteria.where("activelyMonitored").is(true)), ToolDocument.class);
    }

    @Override
    public long countProcessedSince(Instant since) {
        Query q = new Query(Criteria.where("lastProcessedAt").gte(since).and("lastProcessingFailed").is(false));
        return mongoTemplate.count(q, ToolDocument.class);
    }

    private static Query byId(String id) {
        return new Query(Criteria.where("_id").is(id));
    }
}
