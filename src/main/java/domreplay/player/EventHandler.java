package domreplay.player;

import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;

import java.util.Map;

/**
 * Strategy interface implemented by every per-event dispatcher.
 *
 * <p>Handlers are stateless; the driver, element and options are supplied
 * per call so one instance serves every replayed transition.
 */
public interface EventHandler {

    /**
     * Fires the handler's event on {@code element}.
     *
     * @param driver  the live WebDriver session
     * @param element the located target element
     * @param options options recorded with the transition
     * @param wait    explicit wait helpers
     * @throws ReplayException if the event cannot be fired
     */
    void handle(WebDriver driver, WebElement element, Map<String, Object> options, WaitStrategy wait);
}
