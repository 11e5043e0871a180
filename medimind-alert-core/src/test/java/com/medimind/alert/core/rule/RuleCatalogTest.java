package com.medimind.alert.core.rule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RuleCatalogTest {

    private final RuleCatalog catalog = RuleCatalog.defaults();

    @Test
    void groupsKeepCriticalBeforeWarning() {
        Map<String, List<AlertRule>> groups = catalog.groups();

        assertThat(groups).containsKeys("heart_rate", "blood_pressure", "oxygen_saturation", "temperature");
        assertThat(groups.get("heart_rate"))
                .extracting(AlertRule::id)
                .containsExactly(RuleCatalog.HEART_RATE_CRITICAL, RuleCatalog.HEART_RATE_WARNING);
    }

    @Test
    void criticalRulesRequireAcknowledgment() {
        assertThat(catalog.rule(RuleCatalog.HEART_RATE_CRITICAL).requiresAcknowledgment()).isTrue();
        assertThat(catalog.rule(RuleCatalog.BLOOD_PRESSURE_CRITICAL).escalationDelay())
                .isEqualTo(Duration.ofSeconds(30));
        assertThat(catalog.rule(RuleCatalog.TEMPERATURE_HIGH).requiresAcknowledgment()).isFalse();
        assertThat(catalog.rule(RuleCatalog.TEMPERATURE_HIGH).severity()).isEqualTo(Severity.WARNING);
    }

    @Test
    void bloodPressureRuleNeedsBothReadings() {
        assertThat(catalog.rule(RuleCatalog.BLOOD_PRESSURE_CRITICAL).vitals())
                .containsExactlyInAnyOrder(VitalSign.BLOOD_PRESSURE_SYSTOLIC, VitalSign.BLOOD_PRESSURE_DIASTOLIC);
    }

    @Test
    void unknownRuleIdIsRejected() {
        assertThatThrownBy(() -> catalog.rule("respiratory_rate_low")).isInstanceOf(IllegalArgumentException.class);
        assertThat(catalog.find("respiratory_rate_low")).isEmpty();
    }

    @Test
    void defaultCatalogHasFiveRules() {
        assertThat(catalog.rules()).hasSize(5);
        assertThat(VitalSign.fromWireKey("respiratory_rate")).isEqualTo(VitalSign.RESPIRATORY_RATE);
    }

    @Test
    void comparisonBoundsAreLiteral() {
        assertThat(Comparison.LESS_THAN.test(40, 40)).isFalse();
        assertThat(Comparison.LESS_THAN_OR_EQUAL.test(120, 120)).isTrue();
        assertThat(Comparison.GREATER_THAN.test(150, 150)).isFalse();
        assertThat(Comparison.GREATER_THAN_OR_EQUAL.test(50, 50)).isTrue();
    }
}
