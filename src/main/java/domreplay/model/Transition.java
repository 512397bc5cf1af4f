package domreplay.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * One DOM event applied to one element, recorded so that it can be replayed
 * against a fresh browser to reconstruct a page state.
 *
 * <p>Lifecycle: unstarted → {@link #start running} → {@link #complete completed}.
 * Nothing leaves the completed state. {@link #getElapsed() elapsed} is present
 * only once completed, and the options become read-only at that point.
 *
 * <p>Two transitions are equal when their element, event and options are
 * equal; how long either one took is not part of its identity.
 *
 * <p>Not thread-safe: a transition belongs to a single replay log and is
 * driven by one thread at a time.
 */
public class Transition {

    private static final Logger log = LoggerFactory.getLogger(Transition.class);

    /** Events reached as a side effect of navigation; they cannot be re-fired. */
    public static final Set<DomEvent> NON_REPLAYABLE = Set.of(DomEvent.REQUEST, DomEvent.LOAD);

    /** Events that add no DOM depth. */
    public static final Set<DomEvent> ZERO_DEPTH = Set.of(DomEvent.REQUEST);

    private final Clock clock;

    private String element;
    private DomEvent event;
    private Map<String, Object> options = new LinkedHashMap<>();

    /** Set while running, cleared on completion. */
    private Instant runningSince;

    /** Set on completion only. */
    private Duration elapsed;

    /** Creates an unstarted transition. */
    public Transition() {
        this(Clock.systemUTC());
    }

    /**
     * Creates and starts a transition.
     *
     * @see #start(Map, Map, Runnable)
     */
    public Transition(Map<?, ?> transition) {
        this(transition, Map.of(), null);
    }

    /**
     * Creates and starts a transition.
     *
     * @see #start(Map, Map, Runnable)
     */
    public Transition(Map<?, ?> transition, Map<String, ?> options) {
        this(transition, options, null);
    }

    /**
     * Creates and starts a transition, completing it after {@code work} runs
     * when {@code work} is non-null.
     *
     * @see #start(Map, Map, Runnable)
     */
    public Transition(Map<?, ?> transition, Map<String, ?> options, Runnable work) {
        this(Clock.systemUTC());
        start(transition, options, work);
    }

    /** Package-private for tests that need deterministic timing. */
    Transition(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // ── Lifecycle ────────────────────────────────────────────────────────

    /** Starts the transition with no options and no work. */
    public Transition start(Map<?, ?> transition) {
        return start(transition, Map.of(), null);
    }

    /** Starts the transition with {@code options} and no work. */
    public Transition start(Map<?, ?> transition, Map<String, ?> options) {
        return start(transition, options, null);
    }

    /**
     * Starts the timer for this transition.
     *
     * @param transition single-entry map of {@code element => event}; the key
     *                   must be a {@link CharSequence} or an enum constant, the
     *                   value a {@link DomEvent} or an event name
     * @param options    extra parameters passed through on replay; copied
     * @param work       optional work to run right away; when given, the
     *                   transition is completed before this method returns
     * @return {@code this}
     * @throws TransitionException {@link TransitionError#ALREADY_COMPLETED},
     *         {@link TransitionError#ALREADY_RUNNING} or
     *         {@link TransitionError#INVALID_ELEMENT}
     * @throws IllegalArgumentException if {@code transition} does not hold
     *         exactly one entry or its event name is blank
     */
    public Transition start(Map<?, ?> transition, Map<String, ?> options, Runnable work) {
        checkStartable();
        Objects.requireNonNull(transition, "transition");
        if (transition.size() != 1) {
            throw new IllegalArgumentException(
                    "Expected a single element => event entry, got " + transition.size());
        }
        Map.Entry<?, ?> entry = transition.entrySet().iterator().next();
        return start(toIdentifier(entry.getKey()), DomEvent.of(entry.getValue()), options, work);
    }

    /**
     * Typed form of {@link #start(Map, Map, Runnable)}.
     *
     * @return {@code this}
     */
    public Transition start(String element, DomEvent event, Map<String, ?> options, Runnable work) {
        checkStartable();
        if (element == null || element.isEmpty()) {
            throw new TransitionException(TransitionError.INVALID_ELEMENT, "Element must not be empty.");
        }
        DomEvent normalized = DomEvent.of(event);

        this.element      = element;
        this.event        = normalized;
        this.options      = options == null ? new LinkedHashMap<>() : new LinkedHashMap<>(options);
        this.runningSince = clock.instant();
        log.debug("Started {}", this);

        if (work == null) return this;

        work.run();
        return complete();
    }

    /**
     * Stops the timer and marks the transition as completed.
     *
     * @return {@code this}
     * @throws TransitionException {@link TransitionError#ALREADY_COMPLETED} or
     *         {@link TransitionError#NOT_RUNNING}
     */
    public Transition complete() {
        if (isCompleted()) throw new TransitionException(TransitionError.ALREADY_COMPLETED);
        if (!isRunning())  throw new TransitionException(TransitionError.NOT_RUNNING);

        Duration took = Duration.between(runningSince, clock.instant());
        this.elapsed      = took.isNegative() ? Duration.ZERO : took;
        this.runningSince = null;
        this.options      = freeze(options);
        log.debug("Completed {} in {} ms", this, elapsed.toMillis());
        return this;
    }

    public boolean isRunning()   { return runningSince != null; }
    public boolean isCompleted() { return elapsed != null; }

    // ── Replay ───────────────────────────────────────────────────────────

    /** {@code 0} for events in {@link #ZERO_DEPTH}, {@code 1} otherwise. */
    public int depth() {
        return event != null && ZERO_DEPTH.contains(event) ? 0 : 1;
    }

    /** {@code false} for events in {@link #NON_REPLAYABLE}. */
    public boolean isReplayable() {
        return event == null || !NON_REPLAYABLE.contains(event);
    }

    /**
     * Re-fires this transition's event on its element.
     *
     * @param browser browser to replay on
     * @return whatever transition the browser produced; empty when this
     *         transition is not {@linkplain #isReplayable() replayable} or
     *         the browser produced none
     * @throws IllegalStateException if the transition was never started
     */
    public <H> Optional<Transition> replay(Browser<H> browser) {
        if (element == null) {
            throw new IllegalStateException("Cannot replay a transition that was never started");
        }
        if (!isReplayable()) {
            log.debug("Not replaying {}", this);
            return Optional.empty();
        }
        H handle = browser.locateElement(element);
        return browser.fireEvent(handle, event, options);
    }

    // ── Accessors ────────────────────────────────────────────────────────

    /** Identifier of the element which received {@link #getEvent()}; null until started. */
    public String getElement() { return element; }

    /** Event fired on {@link #getElement()}; null until started. */
    public DomEvent getEvent() { return event; }

    /** Extra options; editable while running, read-only once completed. */
    public Map<String, Object> getOptions() { return options; }

    /** Time it took to apply the event; present once completed. */
    public Optional<Duration> getElapsed() { return Optional.ofNullable(elapsed); }

    // ── Export / copy ────────────────────────────────────────────────────

    /**
     * Structured export with keys {@code element}, {@code event},
     * {@code options} and {@code elapsed}, in that order.
     */
    public Map<String, Object> toStructured() {
        Map<String, Object> structured = new LinkedHashMap<>();
        structured.put("element", element);
        structured.put("event",   event);
        structured.put("options", deepCopy(options));
        structured.put("elapsed", elapsed);
        return structured;
    }

    /**
     * Deep copy sharing no mutable state with this transition. The copy's
     * options are editable even when this transition is completed.
     */
    public Transition duplicate() {
        Transition copy = new Transition(clock);
        copy.element      = element;
        copy.event        = event;
        copy.options      = deepCopy(options);
        copy.runningSince = runningSince;
        copy.elapsed      = elapsed;
        return copy;
    }

    /**
     * Rebuilds an already completed transition, e.g. one read back from a
     * structured export.
     */
    static Transition completed(String element, DomEvent event, Map<String, ?> options, Duration elapsed) {
        Transition t = new Transition(Clock.systemUTC());
        t.start(element, event, options, null);
        t.runningSince = null;
        t.elapsed      = elapsed == null ? Duration.ZERO : elapsed;
        t.options      = freeze(t.options);
        return t;
    }

    // ── Identity ─────────────────────────────────────────────────────────

    /** Fields equality and hashing are computed from. Excludes {@code elapsed}. */
    record Identity(String element, DomEvent event, Map<String, Object> options) {}

    Identity identity() {
        return new Identity(element, event, options);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Transition other)) return false;
        return identity().equals(other.identity());
    }

    @Override
    public int hashCode() {
        return identity().hashCode();
    }

    @Override
    public String toString() {
        return String.format("'%s' on: %s", event, element);
    }

    // ── Helpers ──────────────────────────────────────────────────────────

    private void checkStartable() {
        if (isCompleted()) throw new TransitionException(TransitionError.ALREADY_COMPLETED);
        if (isRunning())   throw new TransitionException(TransitionError.ALREADY_RUNNING);
    }

    private static String toIdentifier(Object key) {
        if (key instanceof CharSequence cs) {
            return cs.toString();
        }
        if (key instanceof Enum<?> symbol) {
            return symbol.name();
        }
        throw new TransitionException(TransitionError.INVALID_ELEMENT,
                "Expected a string or symbolic identifier, got "
                + (key == null ? "null" : key.getClass().getSimpleName()) + ".");
    }

    @SuppressWarnings("unchecked")
    private static <T> T freeze(T value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(k, freeze(v)));
            return (T) Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(v -> copy.add(freeze(v)));
            return (T) Collections.unmodifiableList(copy);
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    private static <T> T deepCopy(T value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(k, deepCopy(v)));
            return (T) copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(v -> copy.add(deepCopy(v)));
            return (T) copy;
        }
        return value;
    }
}
