package domreplay.player;

import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.interactions.Actions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Handles {@code mouseover} by moving the mouse to the element.
 */
public class HoverHandler implements EventHandler {

    private static final Logger log = LoggerFactory.getLogger(HoverHandler.class);

    @Override
    public void handle(WebDriver driver, WebElement element, Map<String, Object> options, WaitStrategy wait) {
        WebElement visible = wait.waitForVisible(element);
        log.info("Hovering over element: {}", element);
        new Actions(driver).moveToElement(visible).perform();
    }
}
