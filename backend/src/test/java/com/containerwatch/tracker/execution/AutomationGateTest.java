package com.containerwatch.tracker.execution;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AutomationGateTest {

    @Test
    void permitsAreBoundedAndReleasedOnce() throws Exception {
        AutomationGate gate = new AutomationGate(2);

        Optional<AutomationGate.Permit> first = gate.tryAcquire(Duration.ZERO);
        Optional<AutomationGate.Permit> second = gate.tryAcquire(Duration.ZERO);
        Optional<AutomationGate.Permit> third = gate.tryAcquire(Duration.ofMillis(20));

        assertThat(first).isPresent();
        assertThat(second).isPresent();
        assertThat(third).isEmpty();
        assertThat(gate.inUse()).isEqualTo(2);

        first.get().close();
        first.get().close();

        assertThat(gate.inUse()).isEqualTo(1);
        second.get().close();
        assertThat(gate.inUse()).isZero();
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new AutomationGate(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
