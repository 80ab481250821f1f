package ou.capstone.goniometry.print;

import java.util.List;

/**
 * Console printer for angles.
 *
 * Provides both {@link #print(List)} for CLI stdout and {@link #render(List)}
 * for tests/logging.
 */
public abstract class AnglePrinter {

    protected static final String EMPTY_MESSAGE = "No angles to display.";

    /**
     * Print directly to stdout for CLI usage.
     * Delegates to {@link #render(List)}.
     */
    public void print(final List<AngleView> angles) {
        System.out.println(render(angles));
    }

    /**
     * Renders the angles as a single String.
     *
     * @param angles angle view models in display order
     * @return the rendered output
     */
    public abstract String render(List<AngleView> angles);
}
