package io.toolwatch.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolwatch.AlertStore;
import io.toolwatch.core.Alert;
import io.toolwatch.core.AlertChannel;
import io.toolwatch.core.AlertSeverity;
import io.toolwatch.core.ChangeSummary;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * MongoDB-backed alert history.
 */
public class MongoAlertStore implements AlertStore {

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    public MongoAlertStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public void save(Alert alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        mongoTemplate.save(toDocument(alert));
    }

    @Override
    public boolean acknowledge(String alertId, String acknowledgedBy, Instant acknowledgedAt) {
        Objects.requireNonNull(alertId, "alertId must not be null");
        Update u = new Update()
                .set("acknowledged", true)
                .set("acknowledgedBy", acknowledgedBy)
                .set("acknowledgedAt", acknowledgedAt);
        Query q = new Query(Criteria.where("_id").is(alertId));
        return mongoTemplate.updateFirst(q, u, AlertDocument.class).getMatchedCount() > 0;
    }

    @Override
    public List<Alert> findSince(Instant since) {
        Objects.requireNonNull(since, "since must not be null");
        Query q = new Query(Criteria.where("createdAt").gte(since))
                .with(Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("_id")));

        List<AlertDocument> docs = mongoTemplate.find(q, AlertDocument.class);
        List<Alert> alerts = new ArrayList<>(docs.size());
        for (AlertDocument d : docs) {
            alerts.add(toAlert(d));
        }
        return alerts;
    }

    public Optional<AlertDocument> findById(String alertId) {
        return Optional.ofNullable(mongoTemplate.findById(alertId, AlertDocument.class));
    }

    private AlertDocument toDocument(Alert alert) {
        AlertDocument doc = new AlertDocument();
        doc.setId(alert.id());
        doc.setToolId(alert.toolId());
        doc.setToolName(alert.toolName());
        doc.setAlertType(alert.alertType());
        doc.setSeverity(alert.severity().code());
        doc.setTitle(alert.title());
        doc.setMessage(alert.message());
        doc.setCreatedAt(alert.createdAt());

        List<Map<String, Object>> changes = new ArrayList<>(alert.changes().size());
        for (ChangeSummary c : alert.changes()) {
            changes.add(objectMapper.convertValue(c, new TypeReference<Map<String, Object>>() {
            }));
        }
        doc.setChanges(changes);
        doc.setMetadata(objectMapper.convertValue(alert.metadata(), new TypeReference<Map<String, Object>>() {
        }));

        List<String> channels = new ArrayList<>();
        for (AlertChannel ch : AlertChannel.values()) {
            if (alert.channels().contains(ch)) {
                channels.add(ch.code());
            }
        }
        doc.setChannels(channels);
        return doc;
    }

    Alert toAlert(AlertDocument doc) {
        List<ChangeSummary> changes = new ArrayList<>();
        if (doc.getChanges() != null) {
            for (Map<String, Object> raw : doc.getChanges()) {
                changes.add(objectMapper.convertValue(raw, ChangeSummary.class));
            }
        }

        Set<AlertChannel> channels = EnumSet.noneOf(AlertChannel.class);
        if (doc.getChannels() != null) {
            for (String code : doc.getChannels()) {
                channels.add(AlertChannel.fromCode(code));
            }
        }

        return new Alert(
                doc.getId(),
                doc.getToolId(),
                doc.getToolName(),
                doc.getAlertType(),
                AlertSeverity.fromCode(doc.getSeverity()),
                doc.getTitle(),
                doc.getMessage(),
                changes,
                doc.getMetadata(),
                doc.getCreatedAt(),
                channels
        );
    }
}
