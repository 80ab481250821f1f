package ou.capstone.goniometry;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.goniometry.exceptions.AngleException;
import ou.capstone.goniometry.print.AngleView;
import ou.capstone.goniometry.print.OutputConfig;
import ou.capstone.goniometry.print.OutputConfig.OutputFormat;

/**
 * Command line driver for the angle library.
 *
 * Reads one angle as text, decimal degrees or radians, optionally adds a second angle to it,
 * and prints every representation of the result:
 * <pre>
 *   angle -s "12° 30' 15.5\""
 *   angle -d -45.25 --sum "10° 0' 0\"" -p 4 -f json
 * </pre>
 */
public final class AngleApp {
    private static final Logger logger = LoggerFactory.getLogger(AngleApp.class);

    private static ExitHandler exitHandler = new ExitHandler();

    public static void setExitHandler( final ExitHandler exitHandler )
    {
        AngleApp.exitHandler = exitHandler;
    }

    private AngleApp() {
        // Prevent instantiation
    }

    public static void main(final String[] args) throws ParseException {
        // The input options are mutually exclusive but none is "required",
        // otherwise --help alone would be rejected. Checked by hand below.
        final Option stringOption = Option.builder("s")
                .longOpt("string").hasArg()
                .desc("Angle text, e.g. \"-12° 30' 15.5\\\"\"").get();
        final Option decimalOption = Option.builder("d")
                .longOpt("decimal").hasArg()
                .desc("Angle in decimal degrees, -360 to 360").get();
        final Option radianOption = Option.builder("r")
                .longOpt("radian").hasArg()
                .desc("Angle in radians, -2π to 2π").get();
        final Option sumOption = Option.builder()
                .longOpt("sum").hasArg()
                .desc("Add the angle text to the input angle (net rotation)").get();
        final Option absSumOption = Option.builder()
                .longOpt("abs-sum").hasArg()
                .desc("Add the angle text to the input angle (total rotation)").get();
        final Option precisionOption = Option.builder("p")
                .longOpt("precision").hasArg()
                .desc("Decimal digits for decimal and radian output (default: unrounded)").get();
        final Option formatOption = Option.builder("f")
                .longOpt("format").hasArg()
                .desc("Output format: 'text' or 'json' (default: text)").get();
        final Option helpOption = Option.builder("h").longOpt("help")
                .desc("Display help").get();

        final Options options = new Options();
        options.addOption( stringOption );
        options.addOption( decimalOption );
        options.addOption( radianOption );
        options.addOption( sumOption );
        options.addOption( absSumOption );
        options.addOption( precisionOption );
        options.addOption( formatOption );
        options.addOption( helpOption );

        final CommandLineParser cliParser = new DefaultParser();
        final CommandLine line;
        try {
            line = cliParser.parse(options, args);
        } catch (final ParseException e) {
            logger.error("Parsing args failed for reason: {}",
                    e.getMessage());
            throw e;
        }

        if (line.hasOption(helpOption.getOpt()) || line.getOptions().length == 0) {
            final HelpFormatter helpFormatter = HelpFormatter.builder().get();
            helpFormatter.printHelp("angle",
                    "Angle conversion options", options,
                    "Exactly one of --string, --decimal or --radian is required.",
                    true);
            exitHandler.exit(0);
            return;
        }

        int inputs = 0;
        for (final Option input : List.of(stringOption, decimalOption, radianOption)) {
            if (line.hasOption(input.getLongOpt())) {
                inputs++;
            }
        }
        if (inputs != 1) {
            throw new ParseException("Invalid options: exactly one of --string, --decimal or --radian is required, found "
                    + inputs);
        }
        if (line.hasOption(sumOption.getLongOpt()) && line.hasOption(absSumOption.getLongOpt())) {
            throw new ParseException("Invalid options: --sum and --abs-sum cannot be used together");
        }

        try {
            final OutputConfig config = readOutputConfig(line, precisionOption, formatOption);
            logger.info("Output configuration: {}", config);

            final Angle angle;
            if (line.hasOption(stringOption.getLongOpt())) {
                angle = Angle.createFromString(line.getOptionValue(stringOption.getLongOpt()));
            } else if (line.hasOption(decimalOption.getLongOpt())) {
                angle = Angle.createFromDecimal(
                        Double.parseDouble(line.getOptionValue(decimalOption.getLongOpt())));
            } else {
                angle = Angle.createFromRadian(
                        Double.parseDouble(line.getOptionValue(radianOption.getLongOpt())));
            }
            logger.info("Input angle: {}", angle);

            final List<AngleView> views = new ArrayList<>();
            views.add(AngleView.of("angle", angle, config.precision()));

            if (line.hasOption(sumOption.getLongOpt()) || line.hasOption(absSumOption.getLongOpt())) {
                final boolean absolute = line.hasOption(absSumOption.getLongOpt());
                final Angle addend = Angle.createFromString(line.getOptionValue(
                        absolute ? absSumOption.getLongOpt() : sumOption.getLongOpt()));
                final Angle sum = absolute ? Angle.absSum(angle, addend) : Angle.sum(angle, addend);
                logger.info("{} sum of {} and {} is {}", absolute ? "Absolute" : "Relative", angle, addend, sum);
                views.add(AngleView.of("addend", addend, config.precision()));
                views.add(AngleView.of(absolute ? "absolute sum" : "sum", sum, config.precision()));
            }

            config.printer().print(views);
        } catch (final AngleException e) {
            logger.error("Invalid angle: {}", e.getMessage());
            System.err.println("\nError: " + e.getMessage());
            exitHandler.exit(1);

        } catch (final IllegalArgumentException e) {
            // NumberFormatException included
            logger.error("Invalid input: {}", e.getMessage());
            System.err.println("\nError: " + e.getMessage());
            exitHandler.exit(1);

        } catch (final Exception e) {
            logger.error("Unexpected error during execution", e);
            System.err.println("\nUnexpected Error: " + e.getMessage());
            exitHandler.exit(1);
        }
    }

    /**
     * Builds the output configuration from the command line.
     * An unknown format falls back to text.
     *
     * @throws NumberFormatException if the precision is not an integer
     */
    private static OutputConfig readOutputConfig(final CommandLine line,
                                                 final Option precisionOption,
                                                 final Option formatOption) {
        final OutputConfig defaults = OutputConfig.defaults();

        OutputFormat format = defaults.format();
        if (line.hasOption(formatOption.getOpt())) {
            final String formatRaw = line.getOptionValue(formatOption.getOpt());
            if ("json".equalsIgnoreCase(formatRaw)) {
                format = OutputFormat.JSON;
            } else if ("text".equalsIgnoreCase(formatRaw)) {
                format = OutputFormat.TEXT;
            } else {
                logger.warn("Unknown output format '{}', defaulting to text", formatRaw);
            }
        }

        Integer precision = defaults.precision();
        if (line.hasOption(precisionOption.getOpt())) {
            precision = Integer.parseInt(line.getOptionValue(precisionOption.getOpt()));
        }
        return new OutputConfig(format, precision);
    }

    public static class ExitHandler
    {
        public void exit( final int code )
        {
            System.exit( code );
        }
    }
}
