package domreplay.player;

import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * All explicit waits used during replay. Implicit waits are never set, so
 * every timeout goes through here and is logged the same way.
 */
public class WaitStrategy {

    private static final Logger log = LoggerFactory.getLogger(WaitStrategy.class);

    private final WebDriverWait wait;
    private final int timeoutSec;

    /**
     * @param driver     active WebDriver session
     * @param timeoutSec maximum time to wait for any condition
     */
    public WaitStrategy(WebDriver driver, int timeoutSec) {
        this.timeoutSec = timeoutSec;
        this.wait = new WebDriverWait(driver, Duration.ofSeconds(timeoutSec));
    }

    /**
     * Waits until the element is present in the DOM (not necessarily visible).
     *
     * @throws ReplayException if the element is not present within the timeout
     */
    public WebElement waitForPresent(By locator) {
        log.debug("Waiting up to {}s for element PRESENT: {}", timeoutSec, locator);
        try {
            return wait.until(ExpectedConditions.presenceOfElementLocated(locator));
        } catch (Exception e) {
            throw new ReplayException(
                    "Timed out after " + timeoutSec + "s waiting for element to be present: " + locator, e);
        }
    }

    /**
     * Waits until an already located element is visible.
     *
     * @throws ReplayException if the element is not visible within the timeout
     */
    public WebElement waitForVisible(WebElement element) {
        log.debug("Waiting up to {}s for WebElement to be VISIBLE", timeoutSec);
        try {
            return wait.until(ExpectedConditions.visibilityOf(element));
        } catch (Exception e) {
            throw new ReplayException(
                    "Timed out after " + timeoutSec + "s waiting for WebElement to be visible", e);
        }
    }

    /**
     * Waits until an already located element is visible and enabled.
     *
     * @throws ReplayException if the element is not clickable within the timeout
     */
    public WebElement waitForClickable(WebElement element) {
        log.debug("Waiting up to {}s for WebElement to be CLICKABLE", timeoutSec);
        try {
            return wait.until(ExpectedConditions.elementToBeClickable(element));
        } catch (Exception e) {
            throw new ReplayException(
                    "Timed out after " + timeoutSec + "s waiting for WebElement to be clickable", e);
        }
    }

    /**
     * Waits until the browser reports {@code document.readyState == 'complete'}.
     *
     * @throws ReplayException if the page does not finish loading within the timeout
     */
    public void waitForPageLoad() {
        log.debug("Waiting up to {}s for page load (document.readyState == complete)", timeoutSec);
        try {
            wait.until(d -> {
                Object state = ((JavascriptExecutor) d)
                        .executeScript("return document.readyState");
                return "complete".equals(state);
            });
        } catch (Exception e) {
            throw new ReplayException(
                    "Timed out after " + timeoutSec + "s waiting for page to finish loading", e);
        }
    }
}
