package domreplay.player;

import domreplay.model.Browser;
import domreplay.model.Transition;
import domreplay.model.TransitionLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Replays a {@link TransitionLog} step by step against a {@link Browser}.
 *
 * <p>For each transition the player:
 * <ol>
 *   <li>Skips it if it is not replayable ({@code load}, {@code request}).</li>
 *   <li>Replays it and records whatever transition the browser produced.</li>
 *   <li>Sleeps {@code replay.step.delay.ms} for pacing.</li>
 * </ol>
 *
 * <p>The first failing step ends the run; the failure is reported in the
 * returned {@link ReplayResult} rather than thrown.
 */
public class TransitionPlayer {

    private static final Logger log = LoggerFactory.getLogger(TransitionPlayer.class);

    private final ReplayConfig config;

    public TransitionPlayer() {
        this(new ReplayConfig());
    }

    public TransitionPlayer(ReplayConfig config) {
        this.config = config;
    }

    /**
     * Replays every transition of {@code transitions} in order.
     *
     * @return a {@link ReplayResult} summarising success/failure
     */
    public ReplayResult play(TransitionLog transitions, Browser<?> browser) {
        List<Transition> steps = transitions.getTransitions();
        int total = steps.size();
        TransitionLog produced = new TransitionLog();

        log.info("Replaying {} transition(s), depth {}", total, transitions.depth());

        for (int i = 0; i < total; i++) {
            Transition transition = steps.get(i);
            try {
                if (!transition.isReplayable()) {
                    log.debug("Step {}/{}: skipping non-replayable {}", i + 1, total, transition);
                    continue;
                }
                log.info("Step {}/{}: {}", i + 1, total, transition);
                Optional<Transition> result = transition.replay(browser);
                result.ifPresent(produced::push);

                long delay = config.getStepDelayMs();
                if (delay > 0) {
                    Thread.sleep(delay);
                }

            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                String reason = "Replay interrupted at step " + (i + 1);
                log.error(reason, ie);
                return new ReplayResult(false, i, total, reason, produced);

            } catch (ReplayException re) {
                String reason = "Replay failure at step " + (i + 1) + ": " + re.getMessage();
                log.error(reason, re);
                return new ReplayResult(false, i, total, reason, produced);

            } catch (RuntimeException e) {
                String reason = "Unexpected error at step " + (i + 1) + ": " + e.getMessage();
                log.error(reason, e);
                return new ReplayResult(false, i, total, reason, produced);
            }
        }

        log.info("Replay completed successfully ({} steps, {} produced)", total, produced.size());
        return new ReplayResult(true, total, total, null, produced);
    }

    // ── Result ────────────────────────────────────────────────────────────

    /**
     * Immutable outcome of {@link #play}.
     */
    public static final class ReplayResult {

        private final boolean success;
        private final int stepsCompleted;
        private final int totalSteps;
        private final String failureReason;
        private final TransitionLog produced;

        public ReplayResult(boolean success, int stepsCompleted, int totalSteps,
                            String failureReason, TransitionLog produced) {
            this.success        = success;
            this.stepsCompleted = stepsCompleted;
            this.totalSteps     = totalSteps;
            this.failureReason  = failureReason;
            this.produced       = produced;
        }

        /** True when every step completed without error. */
        public boolean isSuccess()          { return success; }

        /** Steps finished (replayed or skipped) before the run ended. */
        public int getStepsCompleted()      { return stepsCompleted; }

        public int getTotalSteps()          { return totalSteps; }

        /** Human-readable failure reason, or {@code null} on success. */
        public String getFailureReason()    { return failureReason; }

        /** Transitions the browser produced while replaying, in order. */
        public TransitionLog getProduced()  { return produced; }

        @Override
        public String toString() {
            return success
                    ? String.format("ReplayResult{SUCCESS, %d/%d steps}", stepsCompleted, totalSteps)
                    : String.format("ReplayResult{FAILED at step %d/%d: %s}",
                                    stepsCompleted, totalSteps, failureReason);
        }
    }
}
