package ou.capstone.goniometry.parse;

/**
 * Raw tokens extracted from an angle string, before range validation.
 *
 * @param source   the parsed text
 * @param negative true when the text starts with '-'
 * @param degrees  degrees magnitude
 * @param minutes  minutes, 0 when the token is absent
 * @param seconds  seconds rounded to one decimal place, 0 when the token is absent
 */
public record ParsedAngle(String source, boolean negative, int degrees, int minutes, double seconds) {
}
