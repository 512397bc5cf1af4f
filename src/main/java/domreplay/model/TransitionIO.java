package domreplay.model;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Renders {@link Transition#toStructured() structured exports} as JSON and
 * reads transition logs back.
 *
 * <p>Events are written as lowercase DOM names and {@code elapsed} as an
 * ISO-8601 duration ({@code "PT0.25S"}), or {@code null} while incomplete.
 */
public class TransitionIO {

    private static final Logger log = LoggerFactory.getLogger(TransitionIO.class);
    private static final String SCHEMA_RESOURCE = "/transition-log-schema.json";

    private static final TypeReference<LinkedHashMap<String, Object>> OPTIONS_TYPE =
            new TypeReference<>() {};

    /** Singleton ObjectMapper, thread-safe after configuration. */
    private static final ObjectMapper MAPPER;

    static {
        MAPPER = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
    }

    /** Loaded once from classpath; null if schema resource is missing. */
    private static volatile JsonSchema JSON_SCHEMA = null;

    private TransitionIO() {}

    // ── Write ─────────────────────────────────────────────────────────────

    public static String toJson(Transition transition) throws IOException {
        return MAPPER.writeValueAsString(transition.toStructured());
    }

    /** Serializes a log as {@code {"transitions": [...]}}. */
    public static String toJson(TransitionLog transitionLog) throws IOException {
        return MAPPER.writeValueAsString(Map.of("transitions", transitionLog.toStructured()));
    }

    /**
     * Writes a log to a file (pretty-printed).
     *
     * @param path destination file; parent directories are created
     */
    public static void write(TransitionLog transitionLog, Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        MAPPER.writerWithDefaultPrettyPrinter()
                .writeValue(path.toFile(), Map.of("transitions", transitionLog.toStructured()));
        log.info("Wrote {} transition(s) to {}", transitionLog.size(), path);
    }

    // ── Read ──────────────────────────────────────────────────────────────

    public static TransitionLog read(Path path) throws IOException {
        log.debug("Reading transition log from: {}", path);
        return readLog(Files.readString(path), path.toString());
    }

    /**
     * Parses and validates a log. Every transition in the result is completed.
     *
     * @throws IOException               if the JSON cannot be parsed
     * @throws SchemaValidationException if the JSON does not match the log schema
     * @throws IllegalArgumentException  if an event name is blank
     */
    public static TransitionLog readLog(String json) throws IOException {
        return readLog(json, "<string>");
    }

    private static TransitionLog readLog(String json, String source) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        validateSchema(root, source);

        TransitionLog result = new TransitionLog();
        ArrayNode transitions = (ArrayNode) root.get("transitions");
        for (JsonNode node : transitions) {
            result.push(toTransition((ObjectNode) node));
        }
        log.info("Loaded {} transition(s) from {}", result.size(), source);
        return result;
    }

    private static Transition toTransition(ObjectNode node) {
        JsonNode options = node.get("options");
        JsonNode elapsed = node.get("elapsed");
        return Transition.completed(
                node.get("element").asText(),
                DomEvent.of(node.get("event").asText()),
                options == null || options.isNull()
                        ? Map.of()
                        : MAPPER.convertValue(options, OPTIONS_TYPE),
                elapsed == null || elapsed.isNull() ? null : Duration.parse(elapsed.asText()));
    }

    /** Returns the shared ObjectMapper. */
    public static ObjectMapper getMapper() { return MAPPER; }

    // ── Schema validation ─────────────────────────────────────────────────

    private static void validateSchema(JsonNode root, String source) {
        JsonSchema schema = getSchema();
        if (schema == null) {
            log.warn("{} not found on classpath; skipping schema validation", SCHEMA_RESOURCE);
            return;
        }
        Set<ValidationMessage> errors = schema.validate(root);
        if (!errors.isEmpty()) {
            StringBuilder sb = new StringBuilder("Schema validation failed for ").append(source).append(":\n");
            errors.forEach(e -> sb.append("  ").append(e.getMessage()).append("\n"));
            throw new SchemaValidationException(sb.toString());
        }
    }

    private static JsonSchema getSchema() {
        if (JSON_SCHEMA == null) {
            synchronized (TransitionIO.class) {
                if (JSON_SCHEMA == null) {
                    try (InputStream is = TransitionIO.class.getResourceAsStream(SCHEMA_RESOURCE)) {
                        if (is == null) {
                            return null;
                        }
                        JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
                        JSON_SCHEMA = factory.getSchema(is);
                        log.debug("JSON schema loaded from classpath: {}", SCHEMA_RESOURCE);
                    } catch (IOException e) {
                        log.warn("Failed to load schema: {}", e.getMessage());
                    }
                }
            }
        }
        return JSON_SCHEMA;
    }

    // ── Exceptions ────────────────────────────────────────────────────────

    public static class SchemaValidationException extends RuntimeException {
        public SchemaValidationException(String msg) { super(msg); }
    }
}
