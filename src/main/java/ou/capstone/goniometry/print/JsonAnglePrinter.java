package ou.capstone.goniometry.print;

import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/** Prints angles as a pretty-printed JSON array. */
public final class JsonAnglePrinter extends AnglePrinter {

    private final ObjectMapper objectMapper;

    public JsonAnglePrinter() {
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public String render(final List<AngleView> angles) {
        final List<AngleView> values = angles == null ? List.of() : angles;
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(values);
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize angles to JSON", e);
        }
    }
}
