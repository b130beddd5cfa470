package lab.bank.ledger;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReentrancyGuardTest {

    private final ReentrancyGuard guard = new ReentrancyGuard("withdraw");

    @Test
    void secondEnterWhileHeld_isRejected() {
        try (ReentrancyGuard.Permit permit = guard.enter()) {
            assertThat(guard.state()).isEqualTo(ReentrancyGuard.State.ENTERED);
            assertThatThrownBy(guard::enter)
                    .isInstanceOf(ReentrancyDetectedException.class)
                    .hasMessageContaining("withdraw");
        }
        assertThat(guard.state()).isEqualTo(ReentrancyGuard.State.NOT_ENTERED);
    }

    @Test
    void permitIsReleasedWhenGuardedBlockThrows() {
        assertThatThrownBy(() -> {
            try (ReentrancyGuard.Permit permit = guard.enter()) {
                throw new IllegalStateException("boom");
            }
        }).isInstanceOf(IllegalStateException.class);

        assertThat(guard.state()).isEqualTo(ReentrancyGuard.State.NOT_ENTERED);
        guard.enter().close();
    }

    @Test
    void closingPermitTwice_doesNotReleaseALaterHolder() {
        ReentrancyGuard.Permit first = guard.enter();
        first.close();
        ReentrancyGuard.Permit second = guard.enter();

        first.close();

        assertThat(guard.state()).isEqualTo(ReentrancyGuard.State.ENTERED);
        second.close();
        assertThat(guard.state()).isEqualTo(ReentrancyGuard.State.NOT_ENTERED);
    }

    @Test
    void exit_resetsUnconditionally() {
        guard.enter();
        guard.exit();
        guard.exit();
        assertThat(guard.state()).isEqualTo(ReentrancyGuard.State.NOT_ENTERED);
    }
}
