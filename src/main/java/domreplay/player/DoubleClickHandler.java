package domreplay.player;

import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.interactions.Actions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Handles {@code dblclick} with an {@link Actions} double-click.
 */
public class DoubleClickHandler implements EventHandler {

    private static final Logger log = LoggerFactory.getLogger(DoubleClickHandler.class);

    @Override
    public void handle(WebDriver driver, WebElement element, Map<String, Object> options, WaitStrategy wait) {
        WebElement clickable = wait.waitForClickable(element);
        log.info("Double-clicking element: {}", element);
        new Actions(driver).doubleClick(clickable).perform();
    }
}
