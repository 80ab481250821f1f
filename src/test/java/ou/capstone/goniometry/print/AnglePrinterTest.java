package ou.capstone.goniometry.print;

import java.util.List;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ou.capstone.goniometry.Angle;
import ou.capstone.goniometry.Direction;

class AnglePrinterTest {

    private static final double TOLERANCE = 0.000001;

    private static AngleView view() {
        return AngleView.of("angle", Angle.createFromValues(12, 30, 0, Direction.CLOCKWISE), 2);
    }

    @Test
    void testAngleView_Of() {
        final AngleView view = view();

        assertEquals("-12° 30' 0\"", view.text());
        assertEquals(-12, view.degrees());
        assertEquals(30, view.minutes());
        assertEquals("CLOCKWISE", view.direction());
        assertEquals(-12.5, view.decimal(), TOLERANCE);
        assertEquals(-0.22, view.radian(), TOLERANCE);
        assertEquals(45000.0, view.totalSeconds(), TOLERANCE);
    }

    @Test
    void testAngleView_NoPrecisionKeepsValues() {
        final AngleView view = AngleView.of("angle", Angle.createFromDecimal(12.504305), null);

        assertEquals(12.504305, view.decimal());
    }

    @Test
    void testTextPrinter_Render() {
        final String output = new TextAnglePrinter().render(List.of(view()));

        assertTrue(output.startsWith("Angle"), "Block should start with the capitalized label");
        assertTrue(output.contains("-12° 30' 0\""));
        assertTrue(output.contains("Sexagesimal   : -12, 30, 0.0"));
        assertTrue(output.contains("Direction     : CLOCKWISE"));
        assertTrue(output.contains("Decimal       : -12.5"));
    }

    @Test
    void testTextPrinter_Empty() {
        assertEquals("No angles to display.", new TextAnglePrinter().render(List.of()));
        assertEquals("No angles to display.", new TextAnglePrinter().render(null));
    }

    @Test
    void testJsonPrinter_Render() throws Exception {
        final String output = new JsonAnglePrinter().render(List.of(view()));
        final JsonNode root = new ObjectMapper().readTree(output);

        assertTrue(root.isArray());
        assertEquals(1, root.size());
        assertEquals("angle", root.get(0).get("label").asText());
        assertEquals(-12, root.get(0).get("degrees").asInt());
        assertEquals(-12.5, root.get(0).get("decimal").asDouble(), TOLERANCE);
        assertEquals("CLOCKWISE", root.get(0).get("direction").asText());
    }

    @Test
    void testJsonPrinter_Empty() throws Exception {
        final JsonNode root = new ObjectMapper().readTree(new JsonAnglePrinter().render(null));

        assertTrue(root.isArray());
        assertEquals(0, root.size());
    }

    @Test
    void testOutputConfig_Defaults() {
        final OutputConfig config = OutputConfig.defaults();

        assertEquals(OutputConfig.OutputFormat.TEXT, config.format());
        assertNull(config.precision());
        assertInstanceOf(TextAnglePrinter.class, config.printer());
        assertInstanceOf(JsonAnglePrinter.class,
                new OutputConfig(OutputConfig.OutputFormat.JSON, 3).printer());
    }
}
