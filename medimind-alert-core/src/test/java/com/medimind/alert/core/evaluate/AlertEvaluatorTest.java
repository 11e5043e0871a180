package com.medimind.alert.core.evaluate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.medimind.alert.core.error.InvalidSnapshotException;
import com.medimind.alert.core.model.VitalsSnapshot;
import com.medimind.alert.core.rule.RuleCatalog;
import com.medimind.alert.core.rule.VitalSign;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class AlertEvaluatorTest {

    private final AlertEvaluator evaluator = new AlertEvaluator(RuleCatalog.defaults());

    @ParameterizedTest
    @CsvSource({
        "35, heart_rate_critical",
        "160, heart_rate_critical",
        "110, heart_rate_warning",
        "120, heart_rate_warning",
        "55, heart_rate_warning",
        "40, ''",
        "60, ''",
        "75, ''",
        "100, ''",
        "150, ''"
    })
    void heartRateRulesUseLiteralBounds(double heartRate, String expectedRule) {
        List<AlertCandidate> candidates = evaluator.evaluate(snapshot(VitalSign.HEART_RATE, heartRate), "u1");

        if (expectedRule.isEmpty()) {
            assertThat(candidates).isEmpty();
        } else {
            assertThat(candidates).extracting(AlertCandidate::ruleId).containsExactly(expectedRule);
        }
    }

    @Test
    void oxygenSaturationBelowEightyEightIsCritical() {
        assertThat(evaluator.evaluate(snapshot(VitalSign.OXYGEN_SATURATION, 87), "u1"))
                .extracting(AlertCandidate::ruleId)
                .containsExactly(RuleCatalog.OXYGEN_SATURATION_CRITICAL);
        assertThat(evaluator.evaluate(snapshot(VitalSign.OXYGEN_SATURATION, 96), "u1")).isEmpty();
    }

    @Test
    void bloodPressureCrisisUsesBothReadings() {
        VitalsSnapshot snapshot = VitalsSnapshot.builder()
                .reading(VitalSign.BLOOD_PRESSURE_SYSTOLIC, 185)
                .reading(VitalSign.BLOOD_PRESSURE_DIASTOLIC, 90)
                .build();

        List<AlertCandidate> candidates = evaluator.evaluate(snapshot, "u1");

        assertThat(candidates).hasSize(1);
        AlertCandidate candidate = candidates.get(0);
        assertThat(candidate.ruleId()).isEqualTo(RuleCatalog.BLOOD_PRESSURE_CRITICAL);
        assertThat(candidate.data())
                .containsEntry("blood_pressure_systolic", 185.0)
                .containsEntry("blood_pressure_diastolic", 90.0)
                .containsEntry("severity", "critical");
    }

    @Test
    void bloodPressureWithOneReadingIsNotEvaluated() {
        assertThat(evaluator.evaluate(snapshot(VitalSign.BLOOD_PRESSURE_SYSTOLIC, 200), "u1"))
                .isEmpty();
    }

    @Test
    void elevatedTemperatureRaisesWarning() {
        List<AlertCandidate> candidates = evaluator.evaluate(snapshot(VitalSign.TEMPERATURE, 38.5), "u1");

        assertThat(candidates).extracting(AlertCandidate::ruleId).containsExactly(RuleCatalog.TEMPERATURE_HIGH);
        assertThat(candidates.get(0).data())
                .containsEntry("value", 38.5)
                .containsEntry("threshold", "> 38.0°C (100.4°F)")
                .containsEntry("severity", "warning");
        assertThat(evaluator.evaluate(snapshot(VitalSign.TEMPERATURE, 38.0), "u1")).isEmpty();
    }

    @Test
    void malformedValueSkipsOnlyThatVital() {
        VitalsSnapshot snapshot = VitalsSnapshot.builder()
                .reading(VitalSign.HEART_RATE, "fast")
                .reading(VitalSign.OXYGEN_SATURATION, 80)
                .build();

        assertThat(evaluator.evaluate(snapshot, "u1"))
                .extracting(AlertCandidate::ruleId)
                .containsExactly(RuleCatalog.OXYGEN_SATURATION_CRITICAL);
    }

    @Test
    void numericStringsAreAccepted() {
        assertThat(evaluator.evaluate(snapshot(VitalSign.HEART_RATE, " 35 "), "u1"))
                .extracting(AlertCandidate::ruleId)
                .containsExactly(RuleCatalog.HEART_RATE_CRITICAL);
    }

    @Test
    void nonFiniteValuesAreInvalid() {
        assertThatThrownBy(() -> AlertEvaluator.numeric(VitalSign.HEART_RATE, Double.NaN))
                .isInstanceOf(InvalidSnapshotException.class)
                .hasMessageContaining("heart_rate");
        assertThatThrownBy(() -> AlertEvaluator.numeric(VitalSign.HEART_RATE, List.of(1)))
                .isInstanceOf(InvalidSnapshotException.class);
    }

    @Test
    void emptySnapshotOrRespiratoryRateOnlyYieldsNothing() {
        assertThat(evaluator.evaluate(VitalsSnapshot.builder().build(), "u1")).isEmpty();
        assertThat(evaluator.evaluate(snapshot(VitalSign.RESPIRATORY_RATE, 40), "u1")).isEmpty();
    }

    @Test
    void everyGroupMayRaiseOneAlert() throws Exception {
        String json = """
                {"userId":"u7",
                 "heart_rate":{"value":35,"unit":"bpm"},
                 "blood_pressure_systolic":{"value":185},
                 "blood_pressure_diastolic":{"value":90},
                 "oxygen_saturation":87,
                 "temperature":{"value":"38.5"}}
                """;
        VitalsSnapshot snapshot = new ObjectMapper().readValue(json, VitalsSnapshot.class);

        assertThat(snapshot.userId()).isEqualTo("u7");
        assertThat(evaluator.evaluate(snapshot, snapshot.userId()))
                .extracting(AlertCandidate::ruleId)
                .containsExactly(
                        RuleCatalog.HEART_RATE_CRITICAL,
                        RuleCatalog.BLOOD_PRESSURE_CRITICAL,
                        RuleCatalog.OXYGEN_SATURATION_CRITICAL,
                        RuleCatalog.TEMPERATURE_HIGH);
    }

    private static VitalsSnapshot snapshot(VitalSign vital, Object value) {
        return VitalsSnapshot.builder().userId("u1").reading(vital, value).build();
    }
}
