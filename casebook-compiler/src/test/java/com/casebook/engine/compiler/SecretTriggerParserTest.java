package com.casebook.engine.compiler;

import com.casebook.engine.api.exceptions.CaseValidationException;
import com.casebook.engine.api.model.SecretTrigger;
import com.casebook.engine.api.model.SecretTrigger.Comparison;
import com.casebook.engine.api.model.SecretTrigger.ConditionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SecretTriggerParserTest {

    private final SecretTriggerParser parser = new SecretTriggerParser();

    @Test
    @DisplayName("Should give AND precedence over OR")
    void shouldGroupAndInsideOr() {
        SecretTrigger trigger = parser.parse("trust>70 AND evidence:e3 or evidence_count>=5");

        assertThat(trigger.groups()).hasSize(2);
        assertThat(trigger.groups().get(0)).hasSize(2);
        assertThat(trigger.groups().get(0).get(0).type()).isEqualTo(ConditionType.TRUST);
        assertThat(trigger.groups().get(0).get(1).evidenceId()).isEqualTo("e3");
        assertThat(trigger.groups().get(1).get(0).type()).isEqualTo(ConditionType.EVIDENCE_COUNT);
        assertThat(trigger.groups().get(1).get(0).comparison()).isEqualTo(Comparison.GREATER_OR_EQUAL);
        assertThat(trigger.groups().get(1).get(0).value()).isEqualTo(5);
    }

    @ParameterizedTest
    @ValueSource(strings = {"evidence_count>2", "evidence_count>=2", "evidence_count==2",
            "evidence_count<2", "evidence_count<=2", "evidence_count!=2"})
    @DisplayName("Should accept every evidence_count comparison")
    void shouldAcceptEvidenceCountOperators(String expression) {
        SecretTrigger trigger = parser.parse(expression);
        assertThat(trigger.groups().get(0).get(0).type()).isEqualTo(ConditionType.EVIDENCE_COUNT);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "trust>=50", "trust>high", "mood>3", "trust>70 AND", "evidence:"})
    @DisplayName("Should reject malformed expressions")
    void shouldRejectMalformed(String expression) {
        assertThatThrownBy(() -> parser.parse(expression))
                .isInstanceOf(CaseValidationException.class);
    }
}
