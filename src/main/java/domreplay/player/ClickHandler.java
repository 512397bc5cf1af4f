package domreplay.player;

import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Handles {@code click}: waits for the element to be clickable, then performs
 * a native {@link WebElement#click()}.
 */
public class ClickHandler implements EventHandler {

    private static final Logger log = LoggerFactory.getLogger(ClickHandler.class);

    @Override
    public void handle(WebDriver driver, WebElement element, Map<String, Object> options, WaitStrategy wait) {
        WebElement clickable = wait.waitForClickable(element);
        log.info("Clicking element: {}", element);
        clickable.click();
    }
}
