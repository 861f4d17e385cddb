package de.mirkosertic.skills.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Help.Ansi;

import java.io.PrintWriter;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Writes command results to stdout as JSON or as human readable text.
 * <p>
 * Human formatters are registered per result tag. Every tag can be written as JSON; a tag
 * without a human formatter falls back to JSON in human mode as well.
 */
public class OutputDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(OutputDispatcher.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .setPropertyNamingStrategy(PropertyNamingStrategies.KEBAB_CASE)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private record Registration<T extends TaggedResult>(Class<T> type, HumanFormatter<T> formatter) {

        boolean tryFormat(final TaggedResult result, final PrintWriter out, final Ansi ansi) {
            if (!type.isInstance(result)) {
                return false;
            }
            formatter.format(type.cast(result), out, ansi);
            return true;
        }
    }

    private final Map<String, Registration<?>> registrations = new HashMap<>();
    private final PrintWriter out;
    private final Ansi ansi;

    public OutputDispatcher(final PrintWriter out, final Ansi ansi) {
        this.out = out;
        this.ansi = ansi;
    }

    /**
     * A dispatcher with the human formatters for all result types of the CLI.
     */
    public static OutputDispatcher withDefaultFormatters(final PrintWriter out, final Ansi ansi) {
        final OutputDispatcher dispatcher = new OutputDispatcher(out, ansi);
        HumanFormatters.registerAll(dispatcher);
        return dispatcher;
    }

    public <T extends TaggedResult> OutputDispatcher register(final String tag, final Class<T> type,
                                                              final HumanFormatter<T> formatter) {
        registrations.put(tag, new Registration<>(type, formatter));
        return this;
    }

    public Set<String> registeredTags() {
        return Set.copyOf(registrations.keySet());
    }

    public void write(final TaggedResult result, final OutputFormat format) {
        if (format == OutputFormat.HUMAN) {
            final Registration<?> registration = registrations.get(result.type());
            if (registration != null && registration.tryFormat(result, out, ansi)) {
                out.flush();
                return;
            }
            logger.debug("No human formatter for '{}', writing JSON", result.type());
        }
        out.println(toJson(result));
        out.flush();
    }

    /**
     * Serialize a result with its tag as the leading {@code type} field.
     */
    public static String toJson(final TaggedResult result) {
        try {
            final ObjectNode node = OBJECT_MAPPER.createObjectNode();
            node.put("type", result.type());
            final JsonNode body = OBJECT_MAPPER.valueToTree(result);
            if (body instanceof ObjectNode objectNode) {
                node.setAll(objectNode);
            } else {
                node.set("data", body);
            }
            return OBJECT_MAPPER.writeValueAsString(node);
        } catch (final JsonProcessingException | IllegalArgumentException e) {
            logger.error("Failed to serialize result of type {}", result.type(), e);
            return "{\"type\":\"error\",\"error\":\"JSON serialization error: "
                    + escapeJson(e.getMessage()) + "\"}";
        }
    }

    private static String escapeJson(final String s) {
        if (s == null) {
            return "";
        }
        return s.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }
}
