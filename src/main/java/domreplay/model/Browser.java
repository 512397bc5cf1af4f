package domreplay.model;

import java.util.Map;
import java.util.Optional;

/**
 * Browser capability a {@link Transition} needs in order to replay itself.
 *
 * <p>Timeouts and cancellation are owned by the implementation; a
 * {@code Transition} imposes none of its own.
 *
 * @param <H> live element handle type, e.g. a Selenium {@code WebElement}
 */
public interface Browser<H> {

    /**
     * Resolves a stored element identifier to a live element of the current page.
     *
     * @param identifier element identifier recorded by {@link Transition#getElement()}
     * @return the live element handle
     * @throws RuntimeException if the element no longer exists
     */
    H locateElement(String identifier);

    /**
     * Dispatches {@code event} on {@code element}.
     *
     * @return the transition produced by the dispatch, or empty if it produced none
     */
    Optional<Transition> fireEvent(H element, DomEvent event, Map<String, Object> options);
}
