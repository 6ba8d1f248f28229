package me.go_gradually.ceddy.domain.golf;

public enum Club {
    WEDGE("Wedge"),
    NINE_IRON("9 Iron"),
    SEVEN_IRON("7 Iron"),
    FIVE_IRON("5 Iron"),
    DRIVER("Driver");

    private final String label;

    Club(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
