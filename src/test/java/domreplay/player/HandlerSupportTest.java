package domreplay.player;

import org.openqa.selenium.By;
import org.testng.annotations.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link HandlerSupport}.
 */
public class HandlerSupportTest {

    @Test
    public void toBy_treatsSlashAndParenPrefixesAsXPath() {
        assertThat(HandlerSupport.toBy("//button[@type='submit']"))
                .hasToString(By.xpath("//button[@type='submit']").toString());
        assertThat(HandlerSupport.toBy("(//a)[2]"))
                .hasToString(By.xpath("(//a)[2]").toString());
    }

    @Test
    public void toBy_defaultsToCss() {
        assertThat(HandlerSupport.toBy(" #submit-btn "))
                .hasToString(By.cssSelector("#submit-btn").toString());
        assertThat(HandlerSupport.toBy("form > input[name=q]"))
                .hasToString(By.cssSelector("form > input[name=q]").toString());
    }

    @Test
    public void requireOption_returnsValueAsString() {
        assertThat(HandlerSupport.requireOption(Map.of("value", 42), "value", "InputHandler"))
                .isEqualTo("42");
    }

    @Test
    public void requireOption_missing_throwsReplayException() {
        assertThatThrownBy(() -> HandlerSupport.requireOption(Map.of(), "value", "InputHandler"))
                .isInstanceOf(ReplayException.class)
                .hasMessageContaining("InputHandler")
                .hasMessageContaining("'value'");
        assertThatThrownBy(() -> HandlerSupport.requireOption(null, "value", "InputHandler"))
                .isInstanceOf(ReplayException.class);
    }
}
