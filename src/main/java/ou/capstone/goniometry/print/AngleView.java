package ou.capstone.goniometry.print;

import ou.capstone.goniometry.Angle;

/** Minimal UI-friendly angle DTO. */
public record AngleView(
        String label,
        String text,
        int degrees,   // signed
        int minutes,
        double seconds,
        String direction,
        double decimal,
        double radian,
        double totalSeconds
) {
    /**
     * Maps an angle to its view.
     *
     * @param label     what the angle is, e.g. "angle" or "sum"
     * @param angle     the angle to show
     * @param precision decimal digits for the decimal, radian and total seconds; null keeps the
     *                  angle's own values (total seconds default to one digit)
     */
    public static AngleView of(final String label, final Angle angle, final Integer precision) {
        final double decimal = precision == null ? angle.toDecimal() : angle.toDecimal(precision);
        final double radian = precision == null ? angle.toRadian() : angle.toRadian(precision);
        final double totalSeconds = precision == null
                ? Angle.toTotalSeconds(angle)
                : Angle.toTotalSeconds(angle, precision);
        return new AngleView(
                label,
                angle.toString(),
                angle.getDegrees().get(0).intValue(),
                angle.minutes(),
                angle.seconds(),
                angle.direction().name(),
                decimal,
                radian,
                totalSeconds);
    }
}
