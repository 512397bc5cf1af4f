package domreplay.player;

import domreplay.model.DomEvent;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Fires events that have no native WebDriver gesture ({@code focus},
 * {@code keyup}, {@code mouseout}, …) by dispatching a synthetic bubbling
 * DOM {@code Event} from script.
 */
public class DispatchEventHandler implements EventHandler {

    private static final Logger log = LoggerFactory.getLogger(DispatchEventHandler.class);

    static final String DISPATCH_SCRIPT =
            "arguments[0].dispatchEvent(new Event(arguments[1], {bubbles: true, cancelable: true}));";

    private final DomEvent event;

    public DispatchEventHandler(DomEvent event) {
        this.event = event;
    }

    @Override
    public void handle(WebDriver driver, WebElement element, Map<String, Object> options, WaitStrategy wait) {
        if (!(driver instanceof JavascriptExecutor js)) {
            throw new ReplayException("Driver cannot execute script; unable to fire '" + event + "'");
        }
        log.info("Dispatching '{}' on element: {}", event, element);
        js.executeScript(DISPATCH_SCRIPT, element, event.getName());
    }
}
