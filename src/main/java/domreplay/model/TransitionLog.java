package domreplay.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Ordered sequence of completed {@link Transition}s which, replayed in order
 * on a fresh page, reconstructs the page state they were recorded from.
 */
public class TransitionLog {

    private final List<Transition> transitions = new ArrayList<>();

    public TransitionLog() {}

    public TransitionLog(List<Transition> transitions) {
        transitions.forEach(this::push);
    }

    /**
     * Appends a completed transition.
     *
     * @return {@code this}
     * @throws IllegalArgumentException if the transition has not completed
     */
    public TransitionLog push(Transition transition) {
        if (!transition.isCompleted()) {
            throw new IllegalArgumentException("Only completed transitions can be logged: " + transition);
        }
        transitions.add(transition);
        return this;
    }

    public List<Transition> getTransitions() {
        return Collections.unmodifiableList(transitions);
    }

    public int size()         { return transitions.size(); }
    public boolean isEmpty()  { return transitions.isEmpty(); }

    /** Sum of the {@linkplain Transition#depth() depths} of all transitions. */
    public int depth() {
        return transitions.stream().mapToInt(Transition::depth).sum();
    }

    /** Transitions that would be re-fired on replay, in order. */
    public List<Transition> replayable() {
        return transitions.stream().filter(Transition::isReplayable).toList();
    }

    public List<Map<String, Object>> toStructured() {
        return transitions.stream().map(Transition::toStructured).toList();
    }

    public TransitionLog duplicate() {
        TransitionLog copy = new TransitionLog();
        transitions.forEach(t -> copy.transitions.add(t.duplicate()));
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransitionLog other)) return false;
        return transitions.equals(other.transitions);
    }

    @Override
    public int hashCode() {
        return transitions.hashCode();
    }

    @Override
    public String toString() {
        return String.format("TransitionLog{transitions=%d, depth=%d}", size(), depth());
    }
}
