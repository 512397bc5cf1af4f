package domreplay.player;

import domreplay.model.Browser;
import domreplay.model.DomEvent;
import domreplay.model.Transition;
import org.openqa.selenium.By;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.WeakHashMap;

/**
 * {@link Browser} backed by a Selenium {@link WebDriver} session.
 *
 * <p>Element identifiers are CSS selectors, or XPath expressions when they
 * start with {@code /} or {@code (}. Every fired event is recorded as a new
 * completed {@link Transition} on the identifier the element was located by,
 * so replaying a log yields a log of the replay itself.
 */
public class SeleniumBrowser implements Browser<WebElement> {

    private static final Logger log = LoggerFactory.getLogger(SeleniumBrowser.class);

    private final WebDriver driver;
    private final WaitStrategy wait;
    private final boolean waitForPageLoad;
    private final Map<DomEvent, EventHandler> handlers = new HashMap<>();

    /** Identifiers elements were located by. */
    private final Map<WebElement, String> locatedBy = new WeakHashMap<>();

    /**
     * Creates a browser with settings from {@link ReplayConfig}.
     *
     * @param driver a configured, ready-to-use WebDriver session
     */
    public SeleniumBrowser(WebDriver driver) {
        this(driver, new ReplayConfig());
    }

    public SeleniumBrowser(WebDriver driver, ReplayConfig config) {
        this(driver, new WaitStrategy(driver, config.getExplicitWaitSec()), config.isWaitForPageLoad());
    }

    /** Package-private constructor for unit tests with a mocked {@link WaitStrategy}. */
    SeleniumBrowser(WebDriver driver, WaitStrategy wait, boolean waitForPageLoad) {
        this.driver          = driver;
        this.wait            = wait;
        this.waitForPageLoad = waitForPageLoad;

        InputHandler input = new InputHandler();
        handlers.put(DomEvent.CLICK,     new ClickHandler());
        handlers.put(DomEvent.DBLCLICK,  new DoubleClickHandler());
        handlers.put(DomEvent.MOUSEOVER, new HoverHandler());
        handlers.put(DomEvent.INPUT,     input);
        handlers.put(DomEvent.CHANGE,    input);
        handlers.put(DomEvent.SUBMIT,    new SubmitHandler());
    }

    /**
     * Finds the element for {@code identifier}, waiting for it to be present.
     *
     * @throws ReplayException if the element does not appear within the timeout
     */
    @Override
    public WebElement locateElement(String identifier) {
        By by = HandlerSupport.toBy(identifier);
        WebElement element = wait.waitForPresent(by);
        locatedBy.put(element, identifier);
        log.debug("Located '{}' with {}", identifier, by);
        return element;
    }

    /**
     * Fires {@code event} on {@code element} and returns the completed,
     * timed transition describing it.
     *
     * @throws ReplayException if the event is a navigation pseudo-event or the
     *                         browser rejects the dispatch
     */
    @Override
    public Optional<Transition> fireEvent(WebElement element, DomEvent event, Map<String, Object> options) {
        if (Transition.NON_REPLAYABLE.contains(event)) {
            throw new ReplayException("'" + event + "' cannot be fired on an element");
        }
        EventHandler handler = handlers.computeIfAbsent(event, DispatchEventHandler::new);
        String identifier = identifierOf(element);

        try {
            Transition fired = new Transition(Map.of(identifier, event), options, () -> {
                handler.handle(driver, element, options, wait);
                if (waitForPageLoad) {
                    wait.waitForPageLoad();
                }
            });
            log.info("Fired {} in {} ms", fired, fired.getElapsed().orElseThrow().toMillis());
            return Optional.of(fired);
        } catch (WebDriverException e) {
            throw new ReplayException("Failed to fire '" + event + "' on " + identifier + ": " + e.getMessage(), e);
        }
    }

    /**
     * The identifier {@code element} was located by, or a best-effort one for foreign handles.
     *
     * @throws ReplayException if a foreign handle has neither an id nor a tag name
     */
    private String identifierOf(WebElement element) {
        String identifier = locatedBy.get(element);
        if (identifier != null) return identifier;

        String id = element.getAttribute("id");
        if (id != null && !id.isBlank()) return "#" + id;
        String tag = element.getTagName();
        if (tag != null && !tag.isBlank()) return tag;
        throw new ReplayException("Cannot identify element " + element + ": it was not located by this browser "
                + "and has neither an id nor a tag name");
    }
}
