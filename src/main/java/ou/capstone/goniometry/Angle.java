package ou.capstone.goniometry;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.OptionalInt;

import ou.capstone.goniometry.builders.AngleBuilder;
import ou.capstone.goniometry.builders.FromAnglesToAbsoluteSum;
import ou.capstone.goniometry.builders.FromAnglesToRelativeSum;
import ou.capstone.goniometry.builders.FromDecimal;
import ou.capstone.goniometry.builders.FromDegrees;
import ou.capstone.goniometry.builders.FromRadian;
import ou.capstone.goniometry.builders.FromString;
import ou.capstone.goniometry.exceptions.InvalidOperandException;
import ou.capstone.goniometry.operations.Sum;
import ou.capstone.goniometry.util.Precision;

/**
 * An immutable planar angle between -360° and +360°.
 *
 * The angle is stored in sexagesimal form (degrees, minutes, seconds) with the sign kept apart in
 * its {@link Direction}. It can be read back as decimal degrees or radians; when the angle was
 * built from one of those, the original value is returned unchanged.
 *
 * Instances come only from builders, either through {@link #Angle(AngleBuilder)} or the static
 * factories:
 * <pre>
 *   Angle.createFromValues(12, 30, 15.5);
 *   Angle.createFromDecimal(-12.504305);
 *   Angle.createFromRadian(Math.PI / 4);
 *   Angle.createFromString("-12° 30' 15.5\"");
 * </pre>
 *
 * Comparisons work on magnitudes: the direction of either side is ignored.
 */
public class Angle {

    public static final int MAX_DEGREES = 360;
    public static final int MAX_MINUTES = 60;
    public static final int MAX_SECONDS = 60;
    public static final double MAX_RADIAN = 2 * Math.PI;

    private final AngleData data;

    // Derived once at construction
    private final double decimal;
    private final double radian;

    /**
     * Builds an angle with the given builder.
     *
     * @param builder a builder that has not been fetched yet
     * @throws IllegalStateException if the builder was already used
     */
    public Angle(final AngleBuilder builder) {
        this(Objects.requireNonNull(builder, "builder").fetchData());
    }

    private Angle(final AngleData data) {
        this.data = data;
        this.decimal = data.originalDecimal() != null
                ? data.originalDecimal()
                : Precision.round(rawDecimal(), data.suggestedDecimalPrecision());
        this.radian = data.originalRadian() != null
                ? data.originalRadian()
                : Math.toRadians(decimal);
    }

    // Factories

    public static Angle createFromValues(final int degrees) {
        return createFromValues(degrees, 0, 0.0, Direction.COUNTER_CLOCKWISE);
    }

    public static Angle createFromValues(final int degrees, final int minutes) {
        return createFromValues(degrees, minutes, 0.0, Direction.COUNTER_CLOCKWISE);
    }

    public static Angle createFromValues(final int degrees, final int minutes, final double seconds) {
        return createFromValues(degrees, minutes, seconds, Direction.COUNTER_CLOCKWISE);
    }

    /**
     * @param direction any negative value means clockwise
     */
    public static Angle createFromValues(final int degrees, final int minutes, final double seconds,
                                         final int direction) {
        return new Angle(new FromDegrees(degrees, minutes, seconds, direction));
    }

    public static Angle createFromValues(final int degrees, final int minutes, final double seconds,
                                         final Direction direction) {
        return new Angle(new FromDegrees(degrees, minutes, seconds, direction));
    }

    /**
     * @param decimal decimal degrees in [-360, 360]
     */
    public static Angle createFromDecimal(final double decimal) {
        return new Angle(new FromDecimal(decimal));
    }

    /**
     * @param radian radians in [-2π, 2π]
     */
    public static Angle createFromRadian(final double radian) {
        return new Angle(new FromRadian(radian));
    }

    /**
     * @param angle text such as {@code 12° 30' 15.5"}; a leading '-' makes the angle clockwise
     */
    public static Angle createFromString(final String angle) {
        return new Angle(new FromString(angle));
    }

    /**
     * Net rotation of two angles, e.g. 30° + (-90°) = -60°.
     */
    public static Sum sum(final Angle first, final Angle second) {
        return new Sum(new FromAnglesToRelativeSum(first, second));
    }

    /**
     * Total rotation traveled by two angles, e.g. 1° + (-180°) = 181°.
     */
    public static Sum absSum(final Angle first, final Angle second) {
        return new Sum(new FromAnglesToAbsoluteSum(first, second));
    }

    // Accessors

    public int degrees() {
        return data.degrees();
    }

    public int minutes() {
        return data.minutes();
    }

    public double seconds() {
        return data.seconds();
    }

    public Direction direction() {
        return data.direction();
    }

    public int secondsPrecision() {
        return data.secondsPrecision();
    }

    public int suggestedDecimalPrecision() {
        return data.suggestedDecimalPrecision();
    }

    public OptionalDouble originalDecimal() {
        return data.originalDecimal() == null ? OptionalDouble.empty() : OptionalDouble.of(data.originalDecimal());
    }

    public OptionalDouble originalRadian() {
        return data.originalRadian() == null ? OptionalDouble.empty() : OptionalDouble.of(data.originalRadian());
    }

    public OptionalInt originalRadianPrecision() {
        return data.originalRadianPrecision() == null
                ? OptionalInt.empty()
                : OptionalInt.of(data.originalRadianPrecision());
    }

    /**
     * @return signed degrees, minutes and seconds, e.g. {@code [-12, 30, 15.5]}
     */
    public List<Number> getDegrees() {
        return List.of(signedDegrees(), data.minutes(), data.seconds());
    }

    /**
     * @return the values of {@link #getDegrees()} keyed by "degrees", "minutes" and "seconds"
     */
    public Map<String, Number> getDegreesAsMap() {
        final Map<String, Number> values = new LinkedHashMap<>();
        values.put("degrees", signedDegrees());
        values.put("minutes", data.minutes());
        values.put("seconds", data.seconds());
        return Collections.unmodifiableMap(values);
    }

    public boolean isClockwise() {
        return data.direction() == Direction.CLOCKWISE;
    }

    public boolean isCounterClockwise() {
        return data.direction() == Direction.COUNTER_CLOCKWISE;
    }

    /**
     * @return true for 0° 0' 0", whatever the direction
     */
    public boolean isNullAngle() {
        return data.isNullAngle();
    }

    /**
     * @return true for 360° 0' 0", whatever the direction
     */
    public boolean isFullAngle() {
        return data.isFullAngle();
    }

    /**
     * Returns the same angle rotating the other way. A null angle stays counterclockwise.
     */
    public Angle toggleDirection() {
        return new Angle(data.toggled());
    }

    // Conversions

    /**
     * @return the decimal this angle was built from, or the decimal degrees rounded to
     *         {@link #suggestedDecimalPrecision()}
     */
    public double toDecimal() {
        return decimal;
    }

    /**
     * @param precision decimal digits, clamped to 15
     */
    public double toDecimal(final int precision) {
        return Precision.round(rawDecimal(), Precision.clampPrecision(precision));
    }

    /**
     * @return the radian this angle was built from, or the unrounded conversion of {@link #toDecimal()}
     */
    public double toRadian() {
        return radian;
    }

    /**
     * @param precision decimal digits, clamped to 15
     */
    public double toRadian(final int precision) {
        return Precision.round(radian, Precision.clampPrecision(precision));
    }

    // Comparisons. Both sides are compared by magnitude.

    public boolean isEqual(final Angle angle) {
        requireOperand(angle, "isEqual");
        return data.degrees() == angle.degrees()
                && data.minutes() == angle.minutes()
                && Double.compare(data.seconds(), angle.seconds()) == 0;
    }

    public boolean isEqual(final int angle) {
        return compareWith(angle) == 0;
    }

    public boolean isEqual(final double angle) {
        return isEqual(angle, suggestedDecimalPrecision());
    }

    public boolean isEqual(final double angle, final int precision) {
        requireOperand(angle, "isEqual");
        return compareWith(angle, precision) == 0;
    }

    public boolean isEqual(final String angle) {
        requireOperand(angle, "isEqual");
        final Angle other = createFromString(angle);
        return compareWith(other, maxSuggestedPrecision(other)) == 0;
    }

    public boolean isEqual(final String angle, final int precision) {
        requireOperand(angle, "isEqual");
        return compareWith(createFromString(angle), precision) == 0;
    }

    public boolean isDifferent(final Angle angle) {
        return !isEqual(angle);
    }

    public boolean isDifferent(final int angle) {
        return !isEqual(angle);
    }

    public boolean isDifferent(final double angle) {
        return !isEqual(angle);
    }

    public boolean isDifferent(final double angle, final int precision) {
        return !isEqual(angle, precision);
    }

    public boolean isDifferent(final String angle) {
        return !isEqual(angle);
    }

    public boolean isDifferent(final String angle, final int precision) {
        return !isEqual(angle, precision);
    }

    public boolean isGreaterThan(final Angle angle) {
        requireOperand(angle, "isGreaterThan");
        return compareWith(angle, maxSuggestedPrecision(angle)) > 0;
    }

    public boolean isGreaterThan(final Angle angle, final int precision) {
        requireOperand(angle, "isGreaterThan");
        return compareWith(angle, precision) > 0;
    }

    public boolean isGreaterThan(final int angle) {
        return compareWith(angle) > 0;
    }

    public boolean isGreaterThan(final double angle) {
        return isGreaterThan(angle, suggestedDecimalPrecision());
    }

    public boolean isGreaterThan(final double angle, final int precision) {
        requireOperand(angle, "isGreaterThan");
        return compareWith(angle, precision) > 0;
    }

    public boolean isGreaterThan(final String angle) {
        requireOperand(angle, "isGreaterThan");
        return isGreaterThan(createFromString(angle));
    }

    public boolean isGreaterThan(final String angle, final int precision) {
        requireOperand(angle, "isGreaterThan");
        return isGreaterThan(createFromString(angle), precision);
    }

    public boolean isGreaterThanOrEqual(final Angle angle) {
        return isEqual(angle) || isGreaterThan(angle);
    }

    public boolean isGreaterThanOrEqual(final int angle) {
        return isEqual(angle) || isGreaterThan(angle);
    }

    public boolean isGreaterThanOrEqual(final double angle) {
        return isEqual(angle) || isGreaterThan(angle);
    }

    public boolean isGreaterThanOrEqual(final double angle, final int precision) {
        return isEqual(angle, precision) || isGreaterThan(angle, precision);
    }

    public boolean isGreaterThanOrEqual(final String angle) {
        return isEqual(angle) || isGreaterThan(angle);
    }

    public boolean isGreaterThanOrEqual(final String angle, final int precision) {
        return isEqual(angle, precision) || isGreaterThan(angle, precision);
    }

    public boolean isLessThan(final Angle angle) {
        requireOperand(angle, "isLessThan");
        return compareWith(angle, maxSuggestedPrecision(angle)) < 0;
    }

    public boolean isLessThan(final Angle angle, final int precision) {
        requireOperand(angle, "isLessThan");
        return compareWith(angle, precision) < 0;
    }

    public boolean isLessThan(final int angle) {
        return compareWith(angle) < 0;
    }

    public boolean isLessThan(final double angle) {
        return isLessThan(angle, suggestedDecimalPrecision());
    }

    public boolean isLessThan(final double angle, final int precision) {
        requireOperand(angle, "isLessThan");
        return compareWith(angle, precision) < 0;
    }

    public boolean isLessThan(final String angle) {
        requireOperand(angle, "isLessThan");
        return isLessThan(createFromString(angle));
    }

    public boolean isLessThan(final String angle, final int precision) {
        requireOperand(angle, "isLessThan");
        return isLessThan(createFromString(angle), precision);
    }

    public boolean isLessThanOrEqual(final Angle angle) {
        return isEqual(angle) || isLessThan(angle);
    }

    public boolean isLessThanOrEqual(final int angle) {
        return isEqual(angle) || isLessThan(angle);
    }

    public boolean isLessThanOrEqual(final double angle) {
        return isEqual(angle) || isLessThan(angle);
    }

    public boolean isLessThanOrEqual(final double angle, final int precision) {
        return isEqual(angle, precision) || isLessThan(angle, precision);
    }

    public boolean isLessThanOrEqual(final String angle) {
        return isEqual(angle) || isLessThan(angle);
    }

    public boolean isLessThanOrEqual(final String angle, final int precision) {
        return isEqual(angle, precision) || isLessThan(angle, precision);
    }

    // Aliases

    public boolean eq(final Angle angle) {
        return isEqual(angle);
    }

    public boolean eq(final int angle) {
        return isEqual(angle);
    }

    public boolean eq(final double angle) {
        return isEqual(angle);
    }

    public boolean eq(final String angle) {
        return isEqual(angle);
    }

    public boolean not(final Angle angle) {
        return isDifferent(angle);
    }

    public boolean not(final int angle) {
        return isDifferent(angle);
    }

    public boolean not(final double angle) {
        return isDifferent(angle);
    }

    public boolean not(final String angle) {
        return isDifferent(angle);
    }

    public boolean gt(final Angle angle) {
        return isGreaterThan(angle);
    }

    public boolean gt(final int angle) {
        return isGreaterThan(angle);
    }

    public boolean gt(final double angle) {
        return isGreaterThan(angle);
    }

    public boolean gt(final String angle) {
        return isGreaterThan(angle);
    }

    public boolean gte(final Angle angle) {
        return isGreaterThanOrEqual(angle);
    }

    public boolean gte(final int angle) {
        return isGreaterThanOrEqual(angle);
    }

    public boolean gte(final double angle) {
        return isGreaterThanOrEqual(angle);
    }

    public boolean gte(final String angle) {
        return isGreaterThanOrEqual(angle);
    }

    public boolean lt(final Angle angle) {
        return isLessThan(angle);
    }

    public boolean lt(final int angle) {
        return isLessThan(angle);
    }

    public boolean lt(final double angle) {
        return isLessThan(angle);
    }

    public boolean lt(final String angle) {
        return isLessThan(angle);
    }

    public boolean lte(final Angle angle) {
        return isLessThanOrEqual(angle);
    }

    public boolean lte(final int angle) {
        return isLessThanOrEqual(angle);
    }

    public boolean lte(final double angle) {
        return isLessThanOrEqual(angle);
    }

    public boolean lte(final String angle) {
        return isLessThanOrEqual(angle);
    }

    /**
     * Seconds of arc in the angle magnitude.
     */
    public static double toTotalSeconds(final Angle angle) {
        return toTotalSeconds(angle, 1);
    }

    public static double toTotalSeconds(final Angle angle, final int precision) {
        Objects.requireNonNull(angle, "angle");
        final double total = angle.degrees() * (double) MAX_MINUTES * MAX_SECONDS
                + angle.minutes() * (double) MAX_SECONDS
                + angle.seconds();
        return Precision.round(total, precision);
    }

    /**
     * Formats the angle as {@code -12° 30' 15.5"}. Whole seconds are printed without decimals.
     */
    @Override
    public String toString() {
        final String sign = isClockwise() ? "-" : "";
        return sign + data.degrees() + "° " + data.minutes() + "' " + formatSeconds() + "\"";
    }

    /**
     * Two angles are equal when they have the same degrees, minutes, seconds and direction.
     * Use {@link #isEqual(Angle)} to compare magnitudes only.
     */
    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Angle)) {
            return false;
        }
        final Angle other = (Angle) o;
        return data.degrees() == other.degrees()
                && data.minutes() == other.minutes()
                && Double.compare(data.seconds(), other.seconds()) == 0
                && data.direction() == other.direction();
    }

    @Override
    public int hashCode() {
        return Objects.hash(data.degrees(), data.minutes(), data.seconds(), data.direction());
    }

    // Helpers

    private int signedDegrees() {
        return data.degrees() * data.direction().sign();
    }

    private double rawDecimal() {
        final double magnitude = data.degrees()
                + data.minutes() / (double) MAX_MINUTES
                + data.seconds() / ((double) MAX_MINUTES * MAX_SECONDS);
        return data.direction().sign() * magnitude;
    }

    private String formatSeconds() {
        final double seconds = data.seconds();
        if (seconds == Math.rint(seconds)) {
            return String.valueOf((long) seconds);
        }
        final int digits = Math.max(data.secondsPrecision(), 1);
        return BigDecimal.valueOf(seconds).setScale(digits, RoundingMode.HALF_UP).toPlainString();
    }

    private int maxSuggestedPrecision(final Angle other) {
        return Math.max(suggestedDecimalPrecision(), other.suggestedDecimalPrecision());
    }

    private int compareWith(final Angle other, final int precision) {
        return Double.compare(Math.abs(toDecimal(precision)), Math.abs(other.toDecimal(precision)));
    }

    private int compareWith(final int value) {
        return Double.compare(Math.abs(toDecimal(0)), Math.abs((double) value));
    }

    private int compareWith(final double value, final int precision) {
        final int digits = Precision.clampPrecision(precision);
        return Double.compare(Math.abs(toDecimal(digits)), Math.abs(Precision.round(value, digits)));
    }

    private static void requireOperand(final Object operand, final String method) {
        if (operand == null) {
            throw new InvalidOperandException(method, 1, "null");
        }
    }

    private static void requireOperand(final double operand, final String method) {
        if (Double.isNaN(operand) || Double.isInfinite(operand)) {
            throw new InvalidOperandException(method, 1, "non-finite double " + operand);
        }
    }
}
