package macrorec.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;

/**
 * A mouse button transition. Persisted as {@code [identifier, isPressed]}.
 */
public record ButtonEvent(MouseButton button, boolean pressed) {

    public ButtonEvent {
        Objects.requireNonNull(button, "button");
    }

    @JsonValue
    List<Object> toArray() {
        return List.of(button.identifier(), pressed);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static ButtonEvent fromArray(JsonNode node) {
        if (node == null || !node.isArray() || node.size() != 2
                || !node.get(0).isTextual() || !node.get(1).isBoolean()) {
            throw new IllegalArgumentException(
                    "button must be an [identifier, pressed] pair, got: " + node);
        }
        return new ButtonEvent(MouseButton.fromIdentifier(node.get(0).asText()), node.get(1).asBoolean());
    }
}
