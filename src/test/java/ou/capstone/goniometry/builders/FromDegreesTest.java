package ou.capstone.goniometry.builders;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ou.capstone.goniometry.AngleData;
import ou.capstone.goniometry.Direction;
import ou.capstone.goniometry.exceptions.AngleOverflowException;

class FromDegreesTest {

    private static final double TOLERANCE = 0.000001;

    @Test
    void testFetchData_BasicValues() {
        final AngleData data = new FromDegrees(12, 30, 15.5).fetchData();

        assertEquals(12, data.degrees());
        assertEquals(30, data.minutes());
        assertEquals(15.5, data.seconds(), TOLERANCE);
        assertEquals(Direction.COUNTER_CLOCKWISE, data.direction(), "Default direction is counterclockwise");
        assertNull(data.originalDecimal());
        assertNull(data.originalRadian());
    }

    @Test
    void testFetchData_SecondsRoundedToOneDecimal() {
        final AngleData data = new FromDegrees(12, 30, 15.55).fetchData();

        assertEquals(15.6, data.seconds(), TOLERANCE);
        assertEquals(1, data.secondsPrecision());
        assertEquals(7, data.suggestedDecimalPrecision(), "Suggested precision is seconds precision + 6");
    }

    @Test
    void testFetchData_IntDirection() {
        assertEquals(Direction.CLOCKWISE, new FromDegrees(12, 0, 0, -1).fetchData().direction());
        assertEquals(Direction.COUNTER_CLOCKWISE, new FromDegrees(12, 0, 0, 1).fetchData().direction());
        assertEquals(Direction.COUNTER_CLOCKWISE, new FromDegrees(12, 0, 0, 0).fetchData().direction());
    }

    @Test
    void testFetchData_NegativeMagnitudesUseAbsoluteValues() {
        final AngleData data = new FromDegrees(-12, -30, -15.5, Direction.COUNTER_CLOCKWISE).fetchData();

        assertEquals(12, data.degrees());
        assertEquals(30, data.minutes());
        assertEquals(15.5, data.seconds(), TOLERANCE);
        assertEquals(Direction.COUNTER_CLOCKWISE, data.direction(), "Sign comes from the direction only");
    }

    @Test
    void testFetchData_NullAngleIsCounterClockwise() {
        final AngleData data = new FromDegrees(0, 0, 0, Direction.CLOCKWISE).fetchData();

        assertEquals(Direction.COUNTER_CLOCKWISE, data.direction());
    }

    @Test
    void testFullAngle_Allowed() {
        assertDoesNotThrow(() -> new FromDegrees(360, 0, 0));
        assertEquals(Direction.CLOCKWISE, new FromDegrees(360, 0, 0, Direction.CLOCKWISE).fetchData().direction());
    }

    @Test
    void testDegreesOverflow_throwsException() {
        final AngleOverflowException e = assertThrows(AngleOverflowException.class,
                () -> new FromDegrees(361, 0, 0));

        assertEquals("degrees", e.getField());
        assertEquals("361", e.getValue());
        assertEquals("360°", e.getLimit());
    }

    @Test
    void testMinutesOverflow_throwsException() {
        final AngleOverflowException e = assertThrows(AngleOverflowException.class,
                () -> new FromDegrees(0, 60, 0));
        assertEquals("minutes", e.getField());
    }

    @Test
    void testSecondsOverflow_throwsException() {
        assertThrows(AngleOverflowException.class, () -> new FromDegrees(0, 0, 60.0));
        // 59.96 rounds to 60.0
        assertThrows(AngleOverflowException.class, () -> new FromDegrees(0, 0, 59.96));
        assertDoesNotThrow(() -> new FromDegrees(0, 0, 59.94));
    }

    @Test
    void testFullAngleWithRemainder_throwsException() {
        assertThrows(AngleOverflowException.class, () -> new FromDegrees(360, 1, 0));
        assertThrows(AngleOverflowException.class, () -> new FromDegrees(360, 0, 0.1));
    }

    @Test
    void testMinIntDegrees_throwsOverflow() {
        assertThrows(AngleOverflowException.class, () -> new FromDegrees(Integer.MIN_VALUE, 0, 0));
    }

    @Test
    void testNonFiniteSeconds_throwsException() {
        assertThrows(IllegalArgumentException.class, () -> new FromDegrees(1, 0, Double.NaN));
    }

    @Test
    void testNullDirection_throwsException() {
        assertThrows(NullPointerException.class, () -> new FromDegrees(1, 0, 0, (Direction) null));
    }

    @Test
    void testFetchDataTwice_throwsException() {
        final FromDegrees builder = new FromDegrees(12, 0, 0);
        builder.fetchData();

        assertThrows(IllegalStateException.class, builder::fetchData, "Builders are single-use");
    }
}
