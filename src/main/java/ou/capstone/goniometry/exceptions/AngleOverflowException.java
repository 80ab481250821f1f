package ou.capstone.goniometry.exceptions;

/**
 * Thrown when an angle input exceeds the bound of its field, for example 361° or 60'.
 * Raised while the builder validates its input, so no angle is ever created.
 */
public class AngleOverflowException extends AngleException {

    private final String field;
    private final String value;
    private final String limit;

    /**
     * @param field the exceeded field (degrees, minutes, seconds, decimal, radian)
     * @param value the offending value as given
     * @param limit the maximum allowed, with its unit symbol
     */
    public AngleOverflowException(final String field, final Object value, final String limit) {
        super("The angle " + field + " can't be greater than " + limit + ", found " + value + ".");
        this.field = field;
        this.value = String.valueOf(value);
        this.limit = limit;
    }

    /**
     * Variant used by the string parser; the message also names the parsed text.
     */
    public AngleOverflowException(final String field, final Object value, final String limit,
                                  final String source) {
        super("The angle " + field + " can't be greater than " + limit + ", found " + value
                + " in " + source + ".");
        this.field = field;
        this.value = String.valueOf(value);
        this.limit = limit;
    }

    public String getField() {
        return field;
    }

    public String getValue() {
        return value;
    }

    public String getLimit() {
        return limit;
    }
}
