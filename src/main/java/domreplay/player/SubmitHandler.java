package domreplay.player;

import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Handles {@code submit} on a form or any element inside one.
 */
public class SubmitHandler implements EventHandler {

    private static final Logger log = LoggerFactory.getLogger(SubmitHandler.class);

    @Override
    public void handle(WebDriver driver, WebElement element, Map<String, Object> options, WaitStrategy wait) {
        log.info("Submitting form of element: {}", element);
        element.submit();
    }
}
