package ou.capstone.goniometry.print;

/**
 * Configuration for angle output.
 * Controls how converted angles are displayed to the user.
 */
public record OutputConfig(
    /**
     * Output format: plain text or JSON.
     */
    OutputFormat format,

    /**
     * Decimal digits for the decimal, radian and total seconds values, or null to print them
     * as the angle holds them.
     */
    Integer precision
) {
    public enum OutputFormat {
        TEXT,
        JSON
    }

    /**
     * Creates a default OutputConfig: text output, values not rounded.
     */
    public static OutputConfig defaults() {
        return new OutputConfig(OutputFormat.TEXT, null);
    }

    /**
     * @return the printer matching {@link #format()}
     */
    public AnglePrinter printer() {
        return format == OutputFormat.JSON ? new JsonAnglePrinter() : new TextAnglePrinter();
    }

    @Override
    public String toString() {
        return String.format("OutputConfig{format=%s, precision=%s}", format, precision);
    }
}
