package com.marketsync.alerting.rule;

import com.marketsync.common.ConfigurationException;
import com.marketsync.domain.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeverityLadderTest {

    @Test
    void defaultLadder_escalatesWithRatio() {
        SeverityLadder ladder = SeverityLadder.defaultLadder();

        assertThat(ladder.severityFor(1.0)).isEqualTo(Severity.MEDIUM);
        assertThat(ladder.severityFor(1.99)).isEqualTo(Severity.MEDIUM);
        assertThat(ladder.severityFor(2.0)).isEqualTo(Severity.HIGH);
        assertThat(ladder.severityFor(4.0)).isEqualTo(Severity.CRITICAL);
        assertThat(ladder.severityFor(Double.POSITIVE_INFINITY)).isEqualTo(Severity.CRITICAL);
    }

    @Test
    void belowFirstStep_usesFirstSeverity() {
        SeverityLadder ladder = new SeverityLadder(List.of(new SeverityLadder.Step(1.5, Severity.LOW)));

        assertThat(ladder.severityFor(1.1)).isEqualTo(Severity.LOW);
    }

    @Test
    void stepsAreSortedByRatio() {
        SeverityLadder ladder = new SeverityLadder(List.of(
                new SeverityLadder.Step(3.0, Severity.HIGH),
                new SeverityLadder.Step(1.0, Severity.LOW)));

        assertThat(ladder.steps()).extracting(SeverityLadder.Step::minRatio).containsExactly(1.0, 3.0);
        assertThat(ladder.severityFor(3.5)).isEqualTo(Severity.HIGH);
    }

    @Test
    void deEscalatingLadder_rejected() {
        assertThatThrownBy(() -> new SeverityLadder(List.of(
                new SeverityLadder.Step(1.0, Severity.HIGH),
                new SeverityLadder.Step(2.0, Severity.LOW))))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void emptyLadder_rejected() {
        assertThatThrownBy(() -> new SeverityLadder(List.of())).isInstanceOf(ConfigurationException.class);
    }
}
