package me.golemcore.phoneagent.adapter.outbound.device;

import me.golemcore.phoneagent.domain.model.ScreenState;
import me.golemcore.phoneagent.domain.model.UiElement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UiHierarchyParserTest {

    private static final String DUMP = """
            <?xml version='1.0' encoding='UTF-8' standalone='yes' ?>
            <hierarchy rotation="0">
              <node index="0" text="" resource-id="" class="android.widget.FrameLayout" \
            package="com.google.android.apps.chromecast.app" content-desc="" clickable="false" \
            enabled="true" bounds="[0,0][1080,2400]">
                <node index="0" text="Living Room" resource-id="com.google.android.apps.chromecast.app:id/title" \
            class="android.widget.TextView" package="com.google.android.apps.chromecast.app" content-desc="" \
            clickable="false" enabled="true" bounds="[48,200][600,260]" />
                <node index="1" text="" resource-id="com.google.android.apps.chromecast.app:id/plus" \
            class="android.widget.ImageButton" package="com.google.android.apps.chromecast.app" \
            content-desc="Increase temperature" clickable="true" enabled="true" bounds="[800,1000][960,1160]" />
                <node index="2" text="" resource-id="com.android.systemui:id/clock" class="android.view.View" \
            package="com.android.systemui" content-desc="" clickable="true" enabled="false" \
            bounds="[0,0][100,50]" />
                <node index="3" text="Heat &amp; Cool" resource-id="" class="android.widget.TextView" \
            package="com.google.android.apps.chromecast.app" content-desc="" clickable="false" \
            bounds="[48,300][400,360]" />
              </node>
            </hierarchy>
            """;

    private UiHierarchyParser parser;

    @BeforeEach
    void setUp() {
        parser = new UiHierarchyParser();
    }

    @Test
    void shouldParseAllNodesIncludingContainers() {
        List<UiElement> elements = parser.parse(DUMP);

        assertEquals(5, elements.size());
        UiElement root = elements.get(0);
        assertEquals("android.widget.FrameLayout", root.getClassName());
        assertEquals(1080, root.getRight());
        assertEquals(2400, root.getBottom());
    }

    @Test
    void shouldReadAttributesAndBounds() {
        UiElement plus = parser.parse(DUMP).get(2);

        assertEquals("Increase temperature", plus.getContentDesc());
        assertEquals("Increase temperature", plus.getLabel());
        assertEquals("com.google.android.apps.chromecast.app:id/plus", plus.getResourceId());
        assertTrue(plus.isClickable());
        assertTrue(plus.isEnabled());
        assertEquals(880, plus.getCenterX());
        assertEquals(1080, plus.getCenterY());
    }

    @Test
    void shouldUnescapeEntitiesAndDefaultEnabled() {
        UiElement mode = parser.parse(DUMP).get(4);

        assertEquals("Heat & Cool", mode.getText());
        assertTrue(mode.isEnabled());
        assertFalse(parser.parse(DUMP).get(3).isEnabled());
    }

    @Test
    void shouldKeepOnlyClickableOrLabeledElementsInScreenState() {
        ScreenState state = parser.toScreenState(DUMP, "aGVsbG8=");

        assertEquals(5, state.getElementCount());
        assertEquals(4, state.getElements().size());
        assertEquals("aGVsbG8=", state.getScreenshotBase64());
        assertEquals(DUMP, state.getHierarchyXml());
        assertEquals("com.google.android.apps.chromecast.app", state.getDominantPackage());
    }

    @Test
    void shouldPreferFirstSeenPackageOnTie() {
        List<UiElement> elements = List.of(
                UiElement.builder().packageName("com.first").build(),
                UiElement.builder().packageName("com.second").build());

        assertEquals("com.first", UiHierarchyParser.dominantPackage(elements));
        assertNull(UiHierarchyParser.dominantPackage(List.of()));
    }

    @Test
    void shouldReturnEmptyListForMissingDump() {
        assertTrue(parser.parse(null).isEmpty());
        assertTrue(parser.parse("").isEmpty());
    }
}
