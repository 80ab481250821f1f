package ou.capstone.goniometry.parse;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.goniometry.Angle;
import ou.capstone.goniometry.exceptions.AngleOverflowException;
import ou.capstone.goniometry.exceptions.NoMatchException;
import ou.capstone.goniometry.exceptions.RegExFailureException;

/**
 * Parses the textual form of an angle, e.g. {@code -12° 30' 15.5"}.
 *
 * Degrees, minutes and seconds are matched by three independent patterns. Only the degrees
 * token is mandatory; minutes and seconds default to 0. Patterns accept any digit run and the
 * ranges are checked afterwards by {@link #validate(ParsedAngle)}, so "361°" is reported as an
 * overflow rather than as unrecognized text.
 */
public final class AngleStringParser {
    private static final Logger logger = LoggerFactory.getLogger(AngleStringParser.class);

    // Degrees must open the string, e.g. "-12°"
    private static final Pattern DEGREES_PATTERN = Pattern.compile("^-?(\\d+)°");

    // Minutes not glued to a preceding number, e.g. "30'". A fraction is captured so it can be rejected.
    private static final Pattern MINUTES_PATTERN = Pattern.compile("(?<![\\d.])(\\d+(?:\\.\\d+)?)'");

    // Seconds with an optional fraction, e.g. "15.5\""
    private static final Pattern SECONDS_PATTERN = Pattern.compile("(?<![\\d.])(\\d+(?:\\.\\d+)?)\"");

    private static final String DEGREES_LIMIT = Angle.MAX_DEGREES + "°";
    private static final String MINUTES_LIMIT = (Angle.MAX_MINUTES - 1) + "'";
    private static final String SECONDS_LIMIT = "59.9\"";
    private static final BigDecimal MAX_SECONDS_TOKEN = BigDecimal.valueOf(Integer.MAX_VALUE);

    private AngleStringParser() {
        // Utility class - prevent instantiation
    }

    /**
     * Extracts the tokens of an angle string. Seconds are rounded to one decimal place,
     * half away from zero.
     *
     * @param text the angle text
     * @return the raw tokens, range-checked only against the size of an {@code int}
     * @throws NoMatchException       if the text has no degrees token or has fractional minutes
     * @throws AngleOverflowException if a token is too long to be held at all
     * @throws RegExFailureException  if the regex engine fails
     */
    public static ParsedAngle parse(final String text) {
        logger.debug("Parsing angle string '{}'", text);

        final String degreesToken = find(DEGREES_PATTERN, text);
        if (degreesToken == null) {
            throw new NoMatchException(text);
        }
        final String minutesToken = find(MINUTES_PATTERN, text);
        if (minutesToken != null && minutesToken.indexOf('.') >= 0) {
            logger.debug("Fractional minutes '{}' in '{}'", minutesToken, text);
            throw new NoMatchException(text);
        }
        final String secondsToken = find(SECONDS_PATTERN, text);

        // The sign comes from the whole string, so "-0° 30'" stays negative.
        final boolean negative = text.startsWith("-");
        final int degrees = toWhole(degreesToken, "degrees", DEGREES_LIMIT, text);
        final int minutes = minutesToken == null ? 0 : toWhole(minutesToken, "minutes", MINUTES_LIMIT, text);
        final double seconds = secondsToken == null ? 0.0 : toSeconds(secondsToken, text);

        final ParsedAngle parsed = new ParsedAngle(text, negative, degrees, minutes, seconds);
        logger.debug("Parsed tokens: {}", parsed);
        return parsed;
    }

    /**
     * Checks every parsed field against its bound.
     *
     * @param parsed the tokens returned by {@link #parse(String)}
     * @throws AngleOverflowException naming the first field out of range and the parsed text
     */
    public static void validate(final ParsedAngle parsed) {
        final String source = parsed.source();
        if (parsed.degrees() > Angle.MAX_DEGREES) {
            throw new AngleOverflowException("degrees", parsed.degrees(), DEGREES_LIMIT, source);
        }
        if (parsed.minutes() >= Angle.MAX_MINUTES) {
            throw new AngleOverflowException("minutes", parsed.minutes(), MINUTES_LIMIT, source);
        }
        if (parsed.seconds() >= Angle.MAX_SECONDS) {
            throw new AngleOverflowException("seconds", parsed.seconds(), SECONDS_LIMIT, source);
        }
        if (parsed.degrees() == Angle.MAX_DEGREES && (parsed.minutes() > 0 || parsed.seconds() > 0)) {
            throw new AngleOverflowException("magnitude", parsed.degrees() + "° " + parsed.minutes()
                    + "' " + parsed.seconds() + "\"", DEGREES_LIMIT, source);
        }
    }

    /**
     * A digit run longer than an {@code int} is already past every field limit.
     */
    private static int toWhole(final String token, final String field, final String limit, final String source) {
        final BigInteger value = new BigInteger(token);
        if (value.bitLength() >= Integer.SIZE) {
            throw new AngleOverflowException(field, token, limit, source);
        }
        return value.intValue();
    }

    private static double toSeconds(final String token, final String source) {
        final BigDecimal value = new BigDecimal(token).setScale(1, RoundingMode.HALF_UP);
        if (value.compareTo(MAX_SECONDS_TOKEN) > 0) {
            throw new AngleOverflowException("seconds", token, SECONDS_LIMIT, source);
        }
        return value.doubleValue();
    }

    static String find(final Pattern pattern, final String text) {
        final Matcher matcher = pattern.matcher(text);
        try {
            return matcher.find() ? matcher.group(1) : null;
        } catch (final StackOverflowError e) {
            logger.error("Regex engine failed on pattern {} for input '{}'",
                    pattern.pattern(), StringUtils.abbreviate(text, 64));
            throw new RegExFailureException("Regex engine failed while parsing "
                    + StringUtils.abbreviate(text, 64), e);
        }
    }
}
