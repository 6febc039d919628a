package macrorec.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the {@link Snapshot} value type and its JSON shape.
 */
public class SnapshotTest {

    private final ObjectMapper mapper = RecordingIO.getMapper();

    @Test
    public void keyList_isCopiedOnConstruction() {
        List<KeyPress> keys = new ArrayList<>();
        keys.add(new KeyPress(Key.A, 1.0));
        Snapshot s = new Snapshot(2.0, new CursorPosition(1, 2), keys, null, null);

        keys.add(new KeyPress(Key.B, 1.5));

        assertThat(s.getKeys()).containsExactly(new KeyPress(Key.A, 1.0));
        assertThatThrownBy(() -> s.getKeys().add(new KeyPress(Key.C, 1.6)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    public void nullKeys_becomeEmptyList() {
        Snapshot s = new Snapshot(2.0, new CursorPosition(1, 2), null, null, null);
        assertThat(s.getKeys()).isEmpty();
        assertThat(s.hasButton()).isFalse();
        assertThat(s.hasScroll()).isFalse();
    }

    @Test
    public void json_writesExactlyTheFiveFields() {
        JsonNode node = mapper.valueToTree(Snapshot.at(10.5, 3, 4));

        assertThat(node.size()).isEqualTo(5);
        assertThat(node.get("timestamp").asDouble()).isEqualTo(10.5);
        assertThat(node.get("mouse_pos").toString()).isEqualTo("[3,4]");
        assertThat(node.get("keys").isArray()).isTrue();
        assertThat(node.get("keys")).isEmpty();
        assertThat(node.get("button").isNull()).isTrue();
        assertThat(node.get("scroll").isNull()).isTrue();
    }

    @Test
    public void json_arrayEncodingOfNestedValues() {
        Snapshot s = new Snapshot(10.0, new CursorPosition(3, 4),
                List.of(new KeyPress(Key.CTRL, 9.5), new KeyPress(Key.C, 9.75)),
                new ButtonEvent(MouseButton.LEFT, true),
                ScrollDelta.vertical(-2));

        JsonNode node = mapper.valueToTree(s);

        assertThat(node.get("button").toString()).isEqualTo("[\"Button.left\",true]");
        assertThat(node.get("scroll").toString()).isEqualTo("[0,-2]");
        assertThat(node.get("keys").toString()).isEqualTo("[[\"Key.ctrl\",9.5],[\"c\",9.75]]");
    }

    @Test
    public void json_readBack_equalsOriginal() throws Exception {
        Snapshot s = new Snapshot(10.0, new CursorPosition(3, 4),
                List.of(new KeyPress(Key.SHIFT, 9.5)),
                new ButtonEvent(MouseButton.RIGHT, false),
                ScrollDelta.horizontal(1));

        Snapshot back = mapper.readValue(mapper.writeValueAsString(s), Snapshot.class);

        assertThat(back).isEqualTo(s);
    }

    @Test
    public void cursorPosition_isWithin() {
        CursorPosition p = new CursorPosition(1919, 0);
        assertThat(p.isWithin(1920, 1080)).isTrue();
        assertThat(new CursorPosition(1920, 0).isWithin(1920, 1080)).isFalse();
        assertThat(new CursorPosition(-1, 5).isWithin(1920, 1080)).isFalse();
    }
}
