package lab.bank.ledger;

import java.util.concurrent.atomic.AtomicReference;

// Two-state latch; a second enter() while held fails, even on the holding thread.
public class ReentrancyGuard {

    public enum State {
        NOT_ENTERED,
        ENTERED
    }

    private final String operation;
    private final AtomicReference<State> state = new AtomicReference<>(State.NOT_ENTERED);

    public ReentrancyGuard(String operation) {
        this.operation = operation;
    }

    public Permit enter() {
        if (!state.compareAndSet(State.NOT_ENTERED, State.ENTERED)) {
            throw new ReentrancyDetectedException(operation);
        }
        return new Permit();
    }

    public void exit() {
        state.set(State.NOT_ENTERED);
    }

    public State state() {
        return state.get();
    }

    public final class Permit implements AutoCloseable {

        private boolean released;

        private Permit() {
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                exit();
            }
        }
    }
}
