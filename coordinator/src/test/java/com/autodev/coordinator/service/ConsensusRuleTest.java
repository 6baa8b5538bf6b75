package com.autodev.coordinator.service;

import com.autodev.coordinator.model.Decision;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConsensusRuleTest {

    @Test
    void belowQuorum_isUndecidedWhateverTheSplit() {
        assertThat(ConsensusRule.evaluate(new Tally(2, 0), 3, 0.6)).isEqualTo(Decision.UNDECIDED);
        assertThat(ConsensusRule.evaluate(new Tally(0, 2), 3, 0.6)).isEqualTo(Decision.UNDECIDED);
        assertThat(ConsensusRule.evaluate(new Tally(0, 0), 1, 0.6)).isEqualTo(Decision.UNDECIDED);
    }

    @Test
    void exactlyAtThreshold_approves() {
        // 3/5 = 0.6 is not exactly representable; it must still count as meeting 0.6.
        assertThat(ConsensusRule.evaluate(new Tally(3, 2), 3, 0.6)).isEqualTo(Decision.APPROVED);
    }

    @Test
    void belowThreshold_rejects() {
        assertThat(ConsensusRule.evaluate(new Tally(2, 3), 3, 0.6)).isEqualTo(Decision.REJECTED);
        assertThat(ConsensusRule.evaluate(new Tally(1, 2), 3, 0.6)).isEqualTo(Decision.REJECTED);
    }

    @Test
    void unanimousAtQuorum_approves() {
        assertThat(ConsensusRule.evaluate(new Tally(3, 0), 3, 0.6)).isEqualTo(Decision.APPROVED);
    }

    @Test
    void invalidParameters_rejected() {
        assertThatThrownBy(() -> ConsensusRule.evaluate(new Tally(1, 0), 0, 0.6))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ConsensusRule.evaluate(new Tally(1, 0), 1, 1.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ConsensusRule.evaluate(new Tally(1, 0), 1, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void tally_emptyHasZeroApprovalRate() {
        assertThat(new Tally(0, 0).approvalRate()).isZero();
    }
}
