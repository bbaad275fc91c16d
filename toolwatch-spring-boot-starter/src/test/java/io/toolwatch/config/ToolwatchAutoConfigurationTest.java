package io.toolwatch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolwatch.AlertStore;
import io.toolwatch.CompetitiveMonitor;
import io.toolwatch.JobStore;
import io.toolwatch.ToolAnalyzer;
import io.toolwatch.ToolCatalog;
import io.toolwatch.alert.AlertDispatcher;
import io.toolwatch.alert.AlertIntegrationManager;
import io.toolwatch.alert.AlertRuleEngine;
import io.toolwatch.alert.AlertSender;
import io.toolwatch.alert.DeliveryResult;
import io.toolwatch.core.AlertChannel;
import io.toolwatch.core.AlertRule;
import io.toolwatch.core.CurationResult;
import io.toolwatch.internal.InMemoryAlertStore;
import io.toolwatch.internal.InMemoryToolCatalog;
import io.toolwatch.internal.mongo.MongoAlertStore;
import io.toolwatch.internal.mongo.MongoJobStore;
import io.toolwatch.internal.mongo.MongoToolCatalog;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class ToolwatchAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ToolwatchConfig.class))
            .withBean(ToolAnalyzer.class, () -> toolId -> CurationResult.of(toolId, List.of()))
            .withPropertyValues(
                    "toolwatch.monitor.max-workers=2",
                    "toolwatch.monitor.tick-interval=500ms",
                    "toolwatch.monitor.discover-every=10 minutes"
            );

    @Test
    void shouldAutoConfigureMongoBackedBeans() {
        contextRunner
                .withBean(MongoTemplate.class, () -> mock(MongoTemplate.class))
                .withBean(ObjectMapper.class, ObjectMapper::new)
                .run(context -> {
                    assertThat(context).hasSingleBean(CompetitiveMonitor.class);
                    assertThat(context).hasSingleBean(ToolwatchLifecycle.class);
                    assertThat(context).hasSingleBean(ToolwatchProperties.class);
                    assertThat(context).hasSingleBean(AlertIntegrationManager.class);
                    assertThat(context).hasSingleBean(ToolwatchMongoIndexConfig.class);
                    assertThat(context.getBean(ToolCatalog.class)).isInstanceOf(MongoToolCatalog.class);
                    assertThat(context.getBean(JobStore.class)).isInstanceOf(MongoJobStore.class);
                    assertThat(context.getBean(AlertStore.class)).isInstanceOf(MongoAlertStore.class);
                    assertThat(context.getBean(ToolwatchProperties.class).getMonitor().getMaxWorkers()).isEqualTo(2);
                });
    }

    @Test
    void shouldFallBackToInMemoryStoresWithoutMongo() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(CompetitiveMonitor.class);
            assertThat(context).doesNotHaveBean(ToolwatchMongoIndexConfig.class);
            assertThat(context.getBean(ToolCatalog.class)).isInstanceOf(InMemoryToolCatalog.class);
            assertThat(context.getBean(AlertStore.class)).isInstanceOf(InMemoryAlertStore.class);
        });
    }

    @Test
    void shouldSkipMonitorWithoutAnalyzer() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(ToolwatchConfig.class))
                .run(context -> {
                    assertThat(context).doesNotHaveBean(CompetitiveMonitor.class);
                    assertThat(context).hasSingleBean(AlertDispatcher.class);
                    assertThat(context).hasSingleBean(ToolwatchLifecycle.class);
                    assertThat(context.getBean(ToolwatchLifecycle.class).isRunning()).isTrue();
                    assertThat(context.getBean(AlertIntegrationManager.class).isRunning()).isTrue();
                });
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("toolwatch.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(ToolwatchProperties.class));
    }

    @Test
    void shouldUseDefaultRulesWhenNoneConfigured() {
        contextRunner.run(context -> {
            List<AlertRule> rules = context.getBean(AlertRuleEngine.class).listRules();
            assertThat(rules).extracting(AlertRule::ruleId)
                    .containsExactlyInAnyOrder("version_releases", "pricing_changes", "major_features", "priority_tools");
        });
    }

    @Test
    void shouldBindConfiguredRulesInsteadOfDefaults() {
        contextRunner
                .withPropertyValues(
                        "toolwatch.alerts.rules[0].id=pricing_only",
                        "toolwatch.alerts.rules[0].name=Pricing Only",
                        "toolwatch.alerts.rules[0].change-types=price_change",
                        "toolwatch.alerts.rules[0].severity-threshold=high",
                        "toolwatch.alerts.rules[0].cooldown=30 minutes",
                        "toolwatch.alerts.rules[0].channels=slack,database"
                )
                .run(context -> {
                    List<AlertRule> rules = context.getBean(AlertRuleEngine.class).listRules();
                    assertThat(rules).hasSize(1);
                    assertThat(rules.get(0).ruleId()).isEqualTo("pricing_only");
                });
    }

    @Test
    void shouldFailStartupOnMalformedRule() {
        contextRunner
                .withPropertyValues(
                        "toolwatch.alerts.rules[0].id=broken",
                        "toolwatch.alerts.rules[0].name=Broken",
                        "toolwatch.alerts.rules[0].change-types=not_a_type",
                        "toolwatch.alerts.rules[0].channels=email"
                )
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void senderBeanShouldReplaceBuiltInChannel() {
        contextRunner
                .withBean(AlertSender.class, () -> new AlertSender() {
                    @Override
                    public AlertChannel channel() {
                        return AlertChannel.SLACK;
                    }

                    @Override
                    public DeliveryResult send(io.toolwatch.core.Alert alert) {
                        return DeliveryResult.ok(AlertChannel.SLACK);
                    }
                })
                .run(context -> assertThat(context.getBean(AlertDispatcher.class).configuredChannels())
                        .contains(AlertChannel.CONSOLE, AlertChannel.SLACK, AlertChannel.DATABASE)
                        .doesNotContain(AlertChannel.EMAIL, AlertChannel.WEBHOOK));
    }
}
