package macrorec.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;

/**
 * A key together with the time it went down, in epoch seconds. Persisted as
 * {@code [identifier, pressTimestamp]}.
 *
 * <p>The identifier is kept exactly as recorded, so a file loaded and saved
 * again writes the same identifiers even for keys {@link Key} does not name.
 */
public record KeyPress(String identifier, double pressTimestamp) {

    public KeyPress {
        Objects.requireNonNull(identifier, "identifier");
    }

    public KeyPress(Key key, double pressTimestamp) {
        this(key.identifier(), pressTimestamp);
    }

    /** The named key, or {@link Key#UNKNOWN} for identifiers without a constant. */
    public Key key() {
        return Key.fromIdentifier(identifier);
    }

    @JsonValue
    List<Object> toArray() {
        return List.of(identifier, pressTimestamp);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static KeyPress fromArray(JsonNode node) {
        if (node == null || !node.isArray() || node.size() != 2
                || !node.get(0).isTextual() || !node.get(1).isNumber()) {
            throw new IllegalArgumentException(
                    "keys entries must be [identifier, timestamp] pairs, got: " + node);
        }
        return new KeyPress(node.get(0).asText(), node.get(1).asDouble());
    }
}
