package me.go_gradually.ceddy.domain.golf;

// Static reading until a weather source is wired in.
public record WindConditions(String speed, String direction, String recommendation) {
    private static final WindConditions PLACEHOLDER = new WindConditions(
            "10 mph",
            "North-East",
            "Adjust your aim slightly to the left to account for the crosswind."
    );

    public static WindConditions placeholder() {
        return PLACEHOLDER;
    }
}
