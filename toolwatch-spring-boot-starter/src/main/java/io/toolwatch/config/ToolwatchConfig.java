package io.toolwatch.config;

import io.toolwatch.AlertStore;
import io.toolwatch.CompetitiveMonitor;
import io.toolwatch.JobCompletionListener;
import io.toolwatch.JobStore;
import io.toolwatch.ToolAnalyzer;
import io.toolwatch.ToolCatalog;
import io.toolwatch.alert.AlertDispatcher;
import io.toolwatch.alert.AlertIntegrationManager;
import io.toolwatch.alert.AlertRuleEngine;
import io.toolwatch.alert.AlertSender;
import io.toolwatch.alert.DefaultAlertRules;
import io.toolwatch.alert.ImpactSeverityClassifier;
import io.toolwatch.alert.sender.ConsoleAlertSender;
import io.toolwatch.alert.sender.EmailAlertSender;
import io.toolwatch.alert.sender.SlackAlertSender;
import io.toolwatch.alert.sender.WebhookAlertSender;
import io.toolwatch.core.AlertChannel;
import io.toolwatch.core.AlertRule;
import io.toolwatch.internal.DefaultCompetitiveMonitor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Spring Boot auto-configuration entrypoint for toolwatch components.
 *
 * <p>The monitor is only created when the application provides a {@link ToolAnalyzer} bean. Alert
 * senders declared as beans take precedence over the built-in sender for the same channel.
 */
@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration",
        "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration"
})
@ConditionalOnClass(CompetitiveMonitor.class)
@EnableConfigurationProperties(ToolwatchProperties.class)
@ConditionalOnProperty(prefix = "toolwatch", name = "enabled", havingValue = "true", matchIfMissing = true)
@Import({ToolwatchStoreConfigurations.Mongo.class, ToolwatchStoreConfigurations.InMemory.class})
public class ToolwatchConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock toolwatchClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ImpactSeverityClassifier impactSeverityClassifier(ToolwatchProperties props) {
        return ImpactSeverityClassifier.from(props.getAlerts().getSeverityBands());
    }

    @Bean
    @ConditionalOnMissingBean
    public AlertRuleEngine alertRuleEngine(ToolwatchProperties props, ImpactSeverityClassifier classifier, Clock clock) {
        List<AlertRule> rules = new ArrayList<>();
        for (AlertRuleDefinition definition : props.getAlerts().getRules()) {
            rules.add(definition.toRule());
        }
        if (rules.isEmpty() && props.getAlerts().isUseDefaultRules()) {
            rules.addAll(DefaultAlertRules.rules());
        }
        return new AlertRuleEngine(classifier, clock, rules);
    }

    @Bean
    @ConditionalOnMissingBean
    public AlertDispatcher alertDispatcher(ToolwatchProperties props,
                                           ObjectProvider<AlertSender> senderBeans,
                                           AlertStore alertStore) {
        List<AlertSender> senders = new ArrayList<>();
        Set<AlertChannel> covered = EnumSet.noneOf(AlertChannel.class);
        senderBeans.orderedStream().forEach(sender -> {
            if (covered.add(sender.channel())) {
                senders.add(sender);
            }
        });

        ToolwatchProperties.Alerts alerts = props.getAlerts();
        if (covered.add(AlertChannel.CONSOLE)) {
            senders.add(new ConsoleAlertSender());
        }
        if (alerts.getEmail().isConfigured() && covered.add(AlertChannel.EMAIL)) {
            senders.add(new EmailAlertSender(alerts.getEmail()));
        }
        if (alerts.getSlack().isConfigured() && covered.add(AlertChannel.SLACK)) {
            senders.add(new SlackAlertSender(alerts.getSlack()));
        }
        if (alerts.getWebhook().isConfigured() && covered.add(AlertChannel.WEBHOOK)) {
            senders.add(new WebhookAlertSender(alerts.getWebhook()));
        }
        return new AlertDispatcher(senders, alertStore);
    }

    @Bean
    @ConditionalOnMissingBean
    public AlertIntegrationManager alertIntegrationManager(ToolwatchProperties props,
                                                           AlertRuleEngine engine,
                                                           AlertDispatcher dispatcher,
                                                           ToolCatalog catalog,
                                                           AlertStore alertStore,
                                                           Clock clock) {
        return new AlertIntegrationManager(props.getAlerts().getIntegration(), engine, dispatcher, catalog, alertStore, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(ToolAnalyzer.class)
    public CompetitiveMonitor competitiveMonitor(ToolwatchProperties props,
                                                 ToolCatalog catalog,
                                                 ToolAnalyzer analyzer,
                                                 JobStore jobStore,
                                                 Clock clock,
                                                 ObjectProvider<JobCompletionListener> listeners) {
        DefaultCompetitiveMonitor monitor = new DefaultCompetitiveMonitor(props.getMonitor(), catalog, analyzer, jobStore, clock);
        listeners.orderedStream().forEach(monitor::addJobListener);
        return monitor;
    }

    @Bean
    @ConditionalOnMissingBean
    public ToolwatchLifecycle toolwatchLifecycle(ObjectProvider<CompetitiveMonitor> monitor,
                                                 AlertIntegrationManager alertIntegration) {
        return new ToolwatchLifecycle(monitor.getIfAvailable(), alertIntegration);
    }
}
