package me.go_gradually.ceddy.domain.golf;

/**
 * Distance-to-club lookup. Each band's lower bound is inclusive and its upper bound exclusive.
 */
public final class ClubSelector {
    private static final double WEDGE_LIMIT = 100.0;
    private static final double NINE_IRON_LIMIT = 150.0;
    private static final double SEVEN_IRON_LIMIT = 180.0;
    private static final double FIVE_IRON_LIMIT = 220.0;

    private ClubSelector() {
    }

    public static ClubSuggestion suggest(double distanceYards) {
        if (Double.isNaN(distanceYards) || distanceYards < 0) {
            throw new IllegalArgumentException("distance must be a non-negative number of yards");
        }
        if (distanceYards < WEDGE_LIMIT) {
            return new ClubSuggestion(Club.WEDGE,
                    "For short distances under 100 yards, a wedge is appropriate.");
        }
        if (distanceYards < NINE_IRON_LIMIT) {
            return new ClubSuggestion(Club.NINE_IRON,
                    "For distances between 100-150 yards, a 9 iron is a good choice.");
        }
        if (distanceYards < SEVEN_IRON_LIMIT) {
            return new ClubSuggestion(Club.SEVEN_IRON,
                    "For distances between 150-180 yards, a 7 iron is recommended.");
        }
        if (distanceYards < FIVE_IRON_LIMIT) {
            return new ClubSuggestion(Club.FIVE_IRON,
                    "For distances between 180-220 yards, a 5 iron provides good distance.");
        }
        return new ClubSuggestion(Club.DRIVER,
                "For distances over 220 yards, use your driver for maximum distance.");
    }
}
