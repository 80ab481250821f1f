package ou.capstone.goniometry.exceptions;

/**
 * Thrown when a comparison receives an operand it cannot compare against:
 * a null angle or string, or a non-finite number.
 */
public class InvalidOperandException extends AngleException {

    private static final String EXPECTED = "int, double, String or Angle";

    /**
     * @param method   the comparison method that rejected the operand
     * @param position 1-based parameter position
     * @param found    description of what was actually passed
     */
    public InvalidOperandException(final String method, final int position, final String found) {
        super(method + " method expects parameter " + position + " to be " + EXPECTED
                + ", but found " + found);
    }
}
