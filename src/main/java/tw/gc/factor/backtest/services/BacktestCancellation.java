package tw.gc.factor.backtest.services;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative stop signal for a running backtest, checked before each rebalance date.
 * Either an explicit {@link #cancel(String)} or a passed deadline stops the run.
 */
public class BacktestCancellation {

    private final AtomicReference<String> reason = new AtomicReference<>();
    private final Instant deadline;
    private final Clock clock;

    private BacktestCancellation(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    public static BacktestCancellation none() {
        return new BacktestCancellation(null, Clock.systemUTC());
    }

    public static BacktestCancellation withDeadline(Instant deadline, Clock clock) {
        return new BacktestCancellation(deadline, clock);
    }

    public void cancel(String why) {
        reason.compareAndSet(null, why != null ? why : "cancelled");
    }

    public boolean isCancelled() {
        if (reason.get() != null) {
            return true;
        }
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            reason.compareAndSet(null, "deadline " + deadline + " reached");
            return true;
        }
        return false;
    }

    public String reason() {
        return reason.get();
    }
}
