package domreplay.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Canonical name of a DOM event a {@link Transition} can record.
 *
 * <p>Any event name is accepted; the constants below are the well-known ones
 * the player has dedicated handling for. Two events are equal when their
 * lowercase names are equal, and {@link #of} returns the constant itself for
 * well-known names.
 *
 * <p>{@code LOAD} and {@code REQUEST} are pseudo-events: they describe page
 * states reached through navigation rather than user interaction.
 */
public final class DomEvent {

    private static final Map<String, DomEvent> WELL_KNOWN = new LinkedHashMap<>();

    public static final DomEvent CLICK     = wellKnown("click");
    public static final DomEvent DBLCLICK  = wellKnown("dblclick");
    public static final DomEvent MOUSEOVER = wellKnown("mouseover");
    public static final DomEvent MOUSEOUT  = wellKnown("mouseout");
    public static final DomEvent MOUSEDOWN = wellKnown("mousedown");
    public static final DomEvent MOUSEUP   = wellKnown("mouseup");
    public static final DomEvent MOUSEMOVE = wellKnown("mousemove");
    public static final DomEvent FOCUS     = wellKnown("focus");
    public static final DomEvent BLUR      = wellKnown("blur");
    public static final DomEvent CHANGE    = wellKnown("change");
    public static final DomEvent INPUT     = wellKnown("input");
    public static final DomEvent KEYDOWN   = wellKnown("keydown");
    public static final DomEvent KEYUP     = wellKnown("keyup");
    public static final DomEvent KEYPRESS  = wellKnown("keypress");
    public static final DomEvent SUBMIT    = wellKnown("submit");
    public static final DomEvent SELECT    = wellKnown("select");
    /** Page finished loading. */
    public static final DomEvent LOAD      = wellKnown("load");
    /** Implicit page request, e.g. the initial navigation. */
    public static final DomEvent REQUEST   = wellKnown("request");

    /** Names that start with "on" without it being a handler prefix. */
    private static final String ONLINE = "online";

    private final String name;

    private DomEvent(String name) {
        this.name = name;
    }

    private static DomEvent wellKnown(String name) {
        DomEvent event = new DomEvent(name);
        WELL_KNOWN.put(name, event);
        return event;
    }

    /** The well-known events, in declaration order. */
    public static Collection<DomEvent> wellKnown() {
        return Collections.unmodifiableCollection(WELL_KNOWN.values());
    }

    /** Lowercase DOM name, e.g. {@code "click"}. */
    @JsonValue
    public String getName() {
        return name;
    }

    /** {@code true} if this is one of the constants of this class. */
    public boolean isWellKnown() {
        return WELL_KNOWN.get(name) == this;
    }

    /**
     * Normalizes an event given as a {@code DomEvent}, an enum constant or a
     * name ({@code "click"}, {@code "CLICK"}, {@code "onclick"}). Names are
     * trimmed and lowercased, and a leading {@code on} handler prefix is
     * dropped.
     *
     * @throws IllegalArgumentException if the value is null or blank
     */
    @JsonCreator
    public static DomEvent of(Object event) {
        if (event instanceof DomEvent e) return e;
        if (event == null) {
            throw new IllegalArgumentException("Event must not be null");
        }
        String raw = event instanceof Enum<?> constant ? constant.name() : event.toString();
        String name = raw.trim().toLowerCase(Locale.ROOT);
        if (name.startsWith("on") && name.length() > 2
                && !WELL_KNOWN.containsKey(name) && !name.equals(ONLINE)) {
            name = name.substring(2);
        }
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Event name must not be blank: '" + raw + "'");
        }
        DomEvent known = WELL_KNOWN.get(name);
        return known != null ? known : new DomEvent(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof DomEvent other && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
