package io.toolwatch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.toolwatch.AlertStore;
import io.toolwatch.JobStore;
import io.toolwatch.ToolCatalog;
import io.toolwatch.internal.InMemoryAlertStore;
import io.toolwatch.internal.InMemoryJobStore;
import io.toolwatch.internal.InMemoryToolCatalog;
import io.toolwatch.internal.mongo.MongoAlertStore;
import io.toolwatch.internal.mongo.MongoJobStore;
import io.toolwatch.internal.mongo.MongoToolCatalog;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * Store wiring, imported in order: Mongo-backed stores when a {@link MongoTemplate} exists, in-memory
 * stores for whatever is still missing.
 */
abstract class ToolwatchStoreConfigurations {

    private ToolwatchStoreConfigurations() {
    }

    static ObjectMapper storeMapper(ObjectProvider<ObjectMapper> objectMapper) {
        return objectMapper.getIfAvailable(() -> new ObjectMapper().registerModule(new JavaTimeModule()));
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnBean(MongoTemplate.class)
    static class Mongo {

        @Bean
        @ConditionalOnMissingBean(ToolCatalog.class)
        ToolCatalog toolCatalog(MongoTemplate mongoTemplate) {
            return new MongoToolCatalog(mongoTemplate);
        }

        @Bean
        @ConditionalOnMissingBean(JobStore.class)
        JobStore jobStore(MongoTemplate mongoTemplate, ObjectProvider<ObjectMapper> objectMapper) {
            return new MongoJobStore(mongoTemplate, storeMapper(objectMapper));
        }

        @Bean
        @ConditionalOnMissingBean(AlertStore.class)
        AlertStore alertStore(MongoTemplate mongoTemplate, ObjectProvider<ObjectMapper> objectMapper) {
            return new MongoAlertStore(mongoTemplate, storeMapper(objectMapper));
        }

        @Bean
        @ConditionalOnMissingBean
        ToolwatchMongoIndexConfig toolwatchMongoIndexConfig(MongoTemplate mongoTemplate) {
            return new ToolwatchMongoIndexConfig(mongoTemplate);
        }

        @Bean
        @ConditionalOnProperty(prefix = "toolwatch", name = "ensure-indexes-on-startup", havingValue = "true")
        SmartInitializingSingleton toolwatchIndexesInitializer(ToolwatchMongoIndexConfig indexConfig) {
            return indexConfig::ensureIndexes;
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class InMemory {

        @Bean
        @ConditionalOnMissingBean(ToolCatalog.class)
        ToolCatalog toolCatalog() {
            return new InMemoryToolCatalog();
        }

        @Bean
        @ConditionalOnMissingBean(JobStore.class)
        JobStore jobStore() {
            return new InMemoryJobStore();
        }

        @Bean
        @ConditionalOnMissingBean(AlertStore.class)
        AlertStore alertStore() {
            return new InMemoryAlertStore();
        }
    }
}
