package io.toolwatch.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolwatch.JobStore;
import io.toolwatch.core.BatchJob;
import io.toolwatch.core.ToolOutcome;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB audit log of finished batch jobs. Saving the same job id twice replaces the earlier record.
 */
public class MongoJobStore implements JobStore {

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    public MongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public void save(BatchJob job) {
        Objects.requireNonNull(job, "job must not be null");
        mongoTemplate.save(toDocument(job));
    }

    public Optional<BatchJobDocument> findById(String jobId) {
        return Optional.ofNullable(mongoTemplate.findById(jobId, BatchJobDocument.class));
    }

    /**
     * Most recently created jobs first.
     */
    public List<BatchJobDocument> findRecent(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        Query q = new Query().with(Sort.by(Sort.Direction.DESC, "createdAt")).limit(limit);
        return mongoTemplate.find(q, BatchJobDocument.class);
    }

    private BatchJobDocument toDocument(BatchJob job) {
        BatchJobDocument doc = new BatchJobDocument();
        doc.setId(job.getJobId());
        doc.setToolIds(job.getToolIds());
        doc.setPriority(job.getPriority().name());
        doc.setPriorityValue(job.getPriority().value());
        doc.setJobType(job.getJobType().name());
        doc.setStatus(job.getStatus().name());
        doc.setCreatedAt(job.getCreatedAt());
        doc.setStartedAt(job.getStartedAt());
        doc.setCompletedAt(job.getCompletedAt());
        doc.setError(job.getError());
        doc.setProgress(job.getProgress());
        doc.setSuccessCount(job.successCount());

        List<ToolOutcome> outcomes = job.getResults();
        List<Map<String, Object>> results = new ArrayList<>(outcomes.size());
        for (ToolOutcome outcome : outcomes) {
            results.add(objectMapper.convertValue(outcome, new TypeReference<Map<String, Object>>() {
            }));
        }
        doc.setResults(results);
        return doc;
    }
}
