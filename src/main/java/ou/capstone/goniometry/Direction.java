package ou.capstone.goniometry;

/**
 * Rotation direction of an angle. The sign of an angle lives here and nowhere else.
 */
public enum Direction {
    /** Negative rotation. */
    CLOCKWISE(-1),
    /** Positive rotation. */
    COUNTER_CLOCKWISE(1);

    private final int sign;

    Direction(final int sign) {
        this.sign = sign;
    }

    /** @return -1 for clockwise, +1 for counterclockwise */
    public int sign() {
        return sign;
    }

    public Direction opposite() {
        return this == CLOCKWISE ? COUNTER_CLOCKWISE : CLOCKWISE;
    }

    /**
     * Maps a raw integer direction. Any negative value is clockwise, anything else
     * (including 0 and values other than 1) is counterclockwise.
     */
    public static Direction of(final int value) {
        return value < 0 ? CLOCKWISE : COUNTER_CLOCKWISE;
    }

    /**
     * Direction of a signed decimal value; -0.0 counts as counterclockwise.
     */
    public static Direction of(final double value) {
        return value < 0 ? CLOCKWISE : COUNTER_CLOCKWISE;
    }
}
