package macrorec.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Reads and writes recordings: an object holding a single {@code "records"}
 * array of {@link Snapshot} objects.
 *
 * <pre>{@code
 * {
 *   "records": [
 *     { "timestamp": 1718000000.25, "mouse_pos": [640, 360], "button": ["Button.left", true],
 *       "keys": [["a", 1718000000.11]], "scroll": null }
 *   ]
 * }
 * }</pre>
 *
 * <p>On read the file must be UTF-8 JSON whose root is an object with a
 * {@code records} array ({@link RecordingDecodeException} otherwise); every
 * record is then validated against {@code recording-schema.json} and bound to
 * a {@link Snapshot} ({@link InvalidRecordingException} on failure). Device
 * specific checks (screen bounds, unknown keys or buttons) are left to playback.
 */
public final class RecordingIO {

    private static final Logger log = LoggerFactory.getLogger(RecordingIO.class);
    private static final String SCHEMA_RESOURCE = "/recording-schema.json";
    private static final String RECORDS_FIELD = "records";
    private static final TypeReference<List<Snapshot>> SNAPSHOT_LIST = new TypeReference<>() {};

    /** Singleton ObjectMapper, thread-safe after configuration. */
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);

    /** Loaded once from classpath; null if schema resource is missing. */
    private static volatile JsonSchema SNAPSHOT_SCHEMA = null;

    private RecordingIO() {}

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Reads a recording from a JSON file.
     *
     * @param path recording file
     * @return the snapshots in recorded order
     * @throws IOException                if the file cannot be read
     * @throws RecordingDecodeException   if the file is not UTF-8 JSON with a {@code records} array
     * @throws InvalidRecordingException  if a record has missing or ill-typed fields
     */
    public static List<Snapshot> read(Path path) throws IOException {
        log.debug("Reading recording from: {}", path);
        String json;
        try {
            json = Files.readString(path, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            throw new RecordingDecodeException(path + " is not a UTF-8 text file", e);
        }
        List<Snapshot> snapshots = decode(json, path.toString());
        log.info("Loaded {} snapshot(s) from {}", snapshots.size(), path);
        return snapshots;
    }

    /**
     * Writes a recording to a JSON file, creating parent directories.
     *
     * @throws IOException if the file cannot be written
     */
    public static void write(List<Snapshot> snapshots, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(path, toJson(snapshots), StandardCharsets.UTF_8);
        log.info("Wrote {} snapshot(s) to {}", snapshots.size(), path);
    }

    /** Serializes snapshots to the recording JSON document. */
    public static String toJson(List<Snapshot> snapshots) throws JsonProcessingException {
        ObjectNode root = MAPPER.createObjectNode();
        root.set(RECORDS_FIELD, MAPPER.valueToTree(snapshots));
        return MAPPER.writeValueAsString(root);
    }

    /** Parses a recording JSON document (with the same validation as {@link #read(Path)}). */
    public static List<Snapshot> fromJson(String json) {
        return decode(json, "<string>");
    }

    /**
     * Reads a recording and reports its size and the time it spans, for listings.
     */
    public static Summary summarize(Path path) throws IOException {
        List<Snapshot> snapshots = read(path);
        double duration = snapshots.isEmpty() ? 0.0
                : snapshots.get(snapshots.size() - 1).getTimestamp() - snapshots.get(0).getTimestamp();
        return new Summary(snapshots.size(), duration);
    }

    /** Returns the shared ObjectMapper (for use in tests and other modules). */
    public static ObjectMapper getMapper() { return MAPPER; }

    // ── Decoding ──────────────────────────────────────────────────────────

    private static List<Snapshot> decode(String json, String source) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RecordingDecodeException("Malformed JSON in " + source + ": " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject() || !root.path(RECORDS_FIELD).isArray()) {
            throw new RecordingDecodeException(
                    source + " is not a recording: expected an object with a \"records\" array");
        }

        JsonNode records = root.get(RECORDS_FIELD);
        validateRecords(records, source);
        try {
            return MAPPER.convertValue(records, SNAPSHOT_LIST);
        } catch (IllegalArgumentException e) {
            // convertValue wraps binding failures (bad arity, bad types) in IllegalArgumentException
            Throwable cause = e.getCause() instanceof JsonMappingException ? e.getCause() : e;
            throw new InvalidRecordingException("Invalid record in " + source + ": " + cause.getMessage(), e);
        }
    }

    private static void validateRecords(JsonNode records, String source) {
        JsonSchema schema = getSchema();
        if (schema == null) {
            log.warn("recording-schema.json not found on classpath; skipping schema validation");
            return;
        }
        for (int i = 0; i < records.size(); i++) {
            Set<ValidationMessage> errors = schema.validate(records.get(i));
            if (!errors.isEmpty()) {
                StringBuilder sb = new StringBuilder("Record ").append(i)
                        .append(" in ").append(source).append(" is invalid:\n");
                errors.forEach(e -> sb.append("  ").append(e.getMessage()).append("\n"));
                throw new InvalidRecordingException(sb.toString());
            }
        }
    }

    private static JsonSchema getSchema() {
        if (SNAPSHOT_SCHEMA == null) {
            synchronized (RecordingIO.class) {
                if (SNAPSHOT_SCHEMA == null) {
                    try (InputStream is = RecordingIO.class.getResourceAsStream(SCHEMA_RESOURCE)) {
                        if (is == null) {
                            log.warn("Schema resource not found: {}", SCHEMA_RESOURCE);
                            return null;
                        }
                        JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
                        SNAPSHOT_SCHEMA = factory.getSchema(is);
                        log.debug("JSON schema loaded from classpath: {}", SCHEMA_RESOURCE);
                    } catch (IOException e) {
                        log.warn("Failed to load schema: {}", e.getMessage());
                    }
                }
            }
        }
        return SNAPSHOT_SCHEMA;
    }

    // ── Types ─────────────────────────────────────────────────────────────

    /** Size and time span of a stored recording. */
    public record Summary(int snapshotCount, double durationSeconds) {}

    /** The input is not a UTF-8 JSON recording document. */
    public static class RecordingDecodeException extends RuntimeException {
        public RecordingDecodeException(String msg) { super(msg); }
        public RecordingDecodeException(String msg, Throwable cause) { super(msg, cause); }
    }

    /** A record inside an otherwise well-formed recording has invalid fields. */
    public static class InvalidRecordingException extends RuntimeException {
        public InvalidRecordingException(String msg) { super(msg); }
        public InvalidRecordingException(String msg, Throwable cause) { super(msg, cause); }
    }
}
