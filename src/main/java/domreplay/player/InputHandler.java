package domreplay.player;

import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Handles {@code input} and {@code change}: clears the field and types the
 * recorded {@code value} option.
 *
 * <p>Password fields are logged as {@code [REDACTED]}.
 */
public class InputHandler implements EventHandler {

    private static final Logger log = LoggerFactory.getLogger(InputHandler.class);

    static final String VALUE_OPTION = "value";

    @Override
    public void handle(WebDriver driver, WebElement element, Map<String, Object> options, WaitStrategy wait) {
        String value = HandlerSupport.requireOption(options, VALUE_OPTION, "InputHandler");
        WebElement visible = wait.waitForVisible(element);

        String logValue = isPasswordField(visible) ? "[REDACTED]" : value;
        log.info("Typing into element {}, value: {}", element, logValue);
        visible.clear();
        visible.sendKeys(value);
    }

    private boolean isPasswordField(WebElement element) {
        return "password".equalsIgnoreCase(element.getAttribute("type"));
    }
}
