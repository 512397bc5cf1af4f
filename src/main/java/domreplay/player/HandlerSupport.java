package domreplay.player;

import org.openqa.selenium.By;

import java.util.Map;

/**
 * Static helpers shared across {@link EventHandler} implementations and
 * {@link SeleniumBrowser}.
 */
final class HandlerSupport {

    private HandlerSupport() { }

    /**
     * Converts a stored element identifier to a Selenium {@link By}: XPath when
     * it starts with {@code /} or {@code (}, CSS otherwise.
     */
    static By toBy(String identifier) {
        String trimmed = identifier.trim();
        if (trimmed.startsWith("/") || trimmed.startsWith("(")) {
            return By.xpath(trimmed);
        }
        return By.cssSelector(trimmed);
    }

    /**
     * Returns the option as a string, throwing {@link ReplayException} with
     * context if it is missing.
     */
    static String requireOption(Map<String, Object> options, String key, String handlerName) {
        Object value = options == null ? null : options.get(key);
        if (value == null) {
            throw new ReplayException(handlerName + " requires option '" + key + "', got: " + options);
        }
        return value.toString();
    }
}
