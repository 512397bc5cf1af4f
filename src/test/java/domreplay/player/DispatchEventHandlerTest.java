package domreplay.player;

import domreplay.model.DomEvent;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.testng.annotations.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

/**
 * Unit tests for {@link DispatchEventHandler}.
 */
public class DispatchEventHandlerTest {

    @Test
    public void handle_withoutScriptSupport_throwsReplayException() {
        WebDriver plainDriver = mock(WebDriver.class);
        DispatchEventHandler handler = new DispatchEventHandler(DomEvent.BLUR);

        assertThatThrownBy(() -> handler.handle(plainDriver, mock(WebElement.class), Map.of(),
                mock(WaitStrategy.class)))
                .isInstanceOf(ReplayException.class)
                .hasMessageContaining("blur");
    }
}
