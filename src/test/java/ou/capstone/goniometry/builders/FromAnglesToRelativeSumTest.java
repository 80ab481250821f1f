package ou.capstone.goniometry.builders;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ou.capstone.goniometry.Angle;
import ou.capstone.goniometry.AngleData;
import ou.capstone.goniometry.Direction;

class FromAnglesToRelativeSumTest {

    private static final double TOLERANCE = 0.000001;

    private static AngleData sum(final Angle first, final Angle second) {
        return new FromAnglesToRelativeSum(first, second).fetchData();
    }

    @Test
    void testSum_OppositeDirections() {
        final AngleData data = sum(Angle.createFromValues(30),
                Angle.createFromValues(90, 0, 0, Direction.CLOCKWISE));

        assertEquals(60, data.degrees());
        assertEquals(Direction.CLOCKWISE, data.direction(), "Direction follows the sign of the sum");
        assertEquals(-60.0, data.originalDecimal());
    }

    @Test
    void testSum_Positive() {
        final AngleData data = sum(Angle.createFromValues(10, 15), Angle.createFromValues(20, 30));

        assertEquals(30, data.degrees());
        assertEquals(45, data.minutes());
        assertEquals(0.0, data.seconds(), TOLERANCE);
        assertEquals(Direction.COUNTER_CLOCKWISE, data.direction());
    }

    @Test
    void testSum_WrapsOnceAboveFullAngle() {
        final AngleData data = sum(Angle.createFromValues(300), Angle.createFromValues(100));

        assertEquals(40, data.degrees());
        assertEquals(Direction.COUNTER_CLOCKWISE, data.direction());
    }

    @Test
    void testSum_WrapsOnceBelowNegativeFullAngle() {
        final AngleData data = sum(Angle.createFromValues(300, 0, 0, Direction.CLOCKWISE),
                Angle.createFromValues(100, 0, 0, Direction.CLOCKWISE));

        assertEquals(40, data.degrees());
        assertEquals(Direction.CLOCKWISE, data.direction());
        assertEquals(-40.0, data.originalDecimal());
    }

    @Test
    void testSum_TwoPositiveFullAngles() {
        final AngleData data = sum(Angle.createFromValues(360), Angle.createFromValues(360));

        assertEquals(360, data.degrees());
        assertEquals(Direction.COUNTER_CLOCKWISE, data.direction());
    }

    @Test
    void testSum_TwoNegativeFullAngles() {
        final AngleData data = sum(Angle.createFromValues(360, 0, 0, Direction.CLOCKWISE),
                Angle.createFromValues(360, 0, 0, Direction.CLOCKWISE));

        assertEquals(360, data.degrees());
        assertEquals(Direction.CLOCKWISE, data.direction());
    }

    @Test
    void testSum_OppositeFullAnglesCancel() {
        final AngleData data = sum(Angle.createFromValues(360),
                Angle.createFromValues(360, 0, 0, Direction.CLOCKWISE));

        assertEquals(0, data.degrees());
        assertEquals(Direction.COUNTER_CLOCKWISE, data.direction());
    }

    @Test
    void testSum_NullAngles() {
        final AngleData data = sum(Angle.createFromValues(0), Angle.createFromValues(0));

        assertEquals(0, data.degrees());
        assertEquals(0, data.minutes());
        assertEquals(0.0, data.seconds(), TOLERANCE);
    }

    @Test
    void testSum_UsesHighestSuggestedPrecision() {
        // suggested precisions 1 and 2
        final AngleData data = sum(Angle.createFromDecimal(12.5), Angle.createFromDecimal(0.25));

        assertEquals(12, data.degrees());
        assertEquals(45, data.minutes());
        assertEquals(2, data.suggestedDecimalPrecision());
        assertEquals(12.75, data.originalDecimal());
    }

    @Test
    void testNullOperand_throwsException() {
        assertThrows(NullPointerException.class,
                () -> new FromAnglesToRelativeSum(null, Angle.createFromValues(1)));
    }
}
