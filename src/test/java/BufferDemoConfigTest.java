import com.ordoAetheris.buffer.BufferDemoConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.util.PropertyResourceBundle;
import java.util.ResourceBundle;

import static com.ordoAetheris.buffer.PushPopType.FRONT;
import static com.ordoAetheris.buffer.PushPopType.REAR;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BufferDemoConfig")
class BufferDemoConfigTest {

    private static final String VALID = String.join("\n",
            "demo.producers=3",
            "demo.consumers=2",
            "demo.per-producer=100",
            "demo.batch-size=4",
            "demo.push-type=front",
            "demo.pop-type=REAR",
            "demo.timeout-seconds=5");

    @AfterEach
    void clearOverrides() {
        System.clearProperty("demo.producers");
    }

    @Test
    @DisplayName("classpath defaults load")
    void loadsClasspathDefaults() {
        BufferDemoConfig c = BufferDemoConfig.load();
        assertEquals(2, c.producers());
        assertEquals(2, c.consumers());
        assertEquals(REAR, c.pushType());
        assertEquals(FRONT, c.popType());
    }

    @Test
    @DisplayName("values are parsed; directions are case-insensitive")
    void parsesBundle() throws IOException {
        BufferDemoConfig c = BufferDemoConfig.load(bundle(VALID));
        assertEquals(3, c.producers());
        assertEquals(2, c.consumers());
        assertEquals(100, c.perProducer());
        assertEquals(4, c.batchSize());
        assertEquals(FRONT, c.pushType());
        assertEquals(REAR, c.popType());
        assertEquals(5, c.timeoutSeconds());
        assertEquals(300, c.totalItems());
    }

    @Test
    @DisplayName("system property overrides the file")
    void systemPropertyWins() throws IOException {
        System.setProperty("demo.producers", "7");
        assertEquals(7, BufferDemoConfig.load(bundle(VALID)).producers());
    }

    @Test
    @DisplayName("missing key -> IllegalStateException naming the key")
    void missingKey() throws IOException {
        String text = VALID.replace("demo.batch-size=4", "");
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> BufferDemoConfig.load(bundle(text)));
        assertTrue(e.getMessage().contains("demo.batch-size"));
    }

    @Test
    @DisplayName("bad values -> IllegalArgumentException")
    void badValues() throws IOException {
        ResourceBundle notInt = bundle(VALID.replace("demo.consumers=2", "demo.consumers=two"));
        assertThrows(IllegalArgumentException.class, () -> BufferDemoConfig.load(notInt));

        ResourceBundle zero = bundle(VALID.replace("demo.consumers=2", "demo.consumers=0"));
        assertThrows(IllegalArgumentException.class, () -> BufferDemoConfig.load(zero));

        ResourceBundle badType = bundle(VALID.replace("demo.pop-type=REAR", "demo.pop-type=MIDDLE"));
        assertThrows(IllegalArgumentException.class, () -> BufferDemoConfig.load(badType));
    }

    @Test
    @DisplayName("producers * per-producer overflowing int -> IllegalArgumentException naming both keys")
    void totalItemsOverflow() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new BufferDemoConfig(70_000, 1, 70_000, 1, REAR, FRONT, 1));
        assertTrue(e.getMessage().contains("demo.producers"));
        assertTrue(e.getMessage().contains("demo.per-producer"));
    }

    private static ResourceBundle bundle(String text) throws IOException {
        return new PropertyResourceBundle(new StringReader(text));
    }
}
