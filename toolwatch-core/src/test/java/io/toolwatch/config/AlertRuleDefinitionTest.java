package io.toolwatch.config;

import io.toolwatch.core.AlertChannel;
import io.toolwatch.core.AlertRule;
import io.toolwatch.core.AlertSeverity;
import io.toolwatch.core.ChangeType;
import io.toolwatch.core.ToolInfo;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AlertRuleDefinitionTest {

    @Test
    void toRuleShouldConvertCodesAndDurations() {
        AlertRuleDefinition def = definition();
        def.getToolFilter().setCategories(List.of("ide"));
        def.getToolFilter().setNamePatterns(List.of("^acme"));

        AlertRule rule = def.toRule();

        assertEquals("pricing", rule.ruleId());
        assertEquals(Set.of(ChangeType.PRICE_CHANGE, ChangeType.VERSION_BUMP), rule.changeTypes());
        assertEquals(AlertSeverity.HIGH, rule.severityThreshold());
        assertEquals(Duration.ofMinutes(30), rule.cooldown());
        assertEquals(Set.of(AlertChannel.EMAIL, AlertChannel.DATABASE), rule.channels());

        assertTrue(rule.toolFilter().matches(tool("ACME IDE", "ide")));
        assertFalse(rule.toolFilter().matches(tool("Other", "ide")));
        assertFalse(rule.toolFilter().matches(tool("Acme Chat", "chat")));
    }

    @Test
    void unknownCodesShouldBeRejectedWithRuleId() {
        AlertRuleDefinition badType = definition();
        badType.setChangeTypes(List.of("teleported"));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, badType::toRule);
        assertTrue(e.getMessage().startsWith("alert rule pricing:"));

        AlertRuleDefinition badChannel = definition();
        badChannel.setChannels(List.of("pager"));
        assertThrows(IllegalArgumentException.class, badChannel::toRule);

        AlertRuleDefinition badSeverity = definition();
        badSeverity.setSeverityThreshold("apocalyptic");
        assertThrows(IllegalArgumentException.class, badSeverity::toRule);

        AlertRuleDefinition badCooldown = definition();
        badCooldown.setCooldown("-5 minutes");
        assertThrows(IllegalArgumentException.class, badCooldown::toRule);
    }

    @Test
    void missingFieldsShouldBeRejected() {
        AlertRuleDefinition noChannels = definition();
        noChannels.setChannels(List.of());
        assertThrows(IllegalArgumentException.class, noChannels::toRule);

        AlertRuleDefinition noId = definition();
        noId.setId(" ");
        assertThrows(IllegalArgumentException.class, noId::toRule);

        AlertRuleDefinition noName = definition();
        noName.setName(null);
        assertThrows(IllegalArgumentException.class, noName::toRule);
    }

    private static AlertRuleDefinition definition() {
        AlertRuleDefinition def = new AlertRuleDefinition();
        def.setId("pricing");
        def.setName("Pricing");
        def.setChangeTypes(List.of("price_change", "VERSION_BUMP"));
        def.setSeverityThreshold("high");
        def.setCooldown("30 minutes");
        def.setChannels(List.of("email", "database"));
        return def;
    }

    private static ToolInfo tool(String name, String category) {
        return new ToolInfo("t", name, category, 3, false, true, null, null, null, false);
    }
}
