package ou.capstone.goniometry.print;

import java.util.List;
import java.util.Locale;

import org.apache.commons.lang3.StringUtils;

/** Plain text printer: one block of labelled rows per angle. */
public final class TextAnglePrinter extends AnglePrinter {

    private static final int LABEL_COL_WIDTH = 14;
    private static final int VALUE_COL_WIDTH = 24;

    @Override
    public String render(final List<AngleView> angles) {
        if (angles == null || angles.isEmpty()) {
            return EMPTY_MESSAGE;
        }

        final StringBuilder sb = new StringBuilder();
        for (final AngleView view : angles) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(formatBlock(view));
        }
        return sb.toString();
    }

    private static String formatBlock(final AngleView view) {
        final StringBuilder sb = new StringBuilder();
        sb.append(StringUtils.capitalize(view.label())).append('\n');
        sb.append("-".repeat(LABEL_COL_WIDTH + VALUE_COL_WIDTH)).append('\n');
        row(sb, "Angle", view.text());
        row(sb, "Sexagesimal", String.format(Locale.ROOT, "%d, %d, %s",
                view.degrees(), view.minutes(), view.seconds()));
        row(sb, "Direction", view.direction());
        row(sb, "Decimal", String.valueOf(view.decimal()));
        row(sb, "Radian", String.valueOf(view.radian()));
        row(sb, "Total seconds", String.valueOf(view.totalSeconds()));
        return sb.toString();
    }

    private static void row(final StringBuilder sb, final String label, final String value) {
        sb.append(StringUtils.rightPad(label, LABEL_COL_WIDTH)).append(": ")
                .append(StringUtils.defaultIfBlank(value, "-")).append('\n');
    }
}
