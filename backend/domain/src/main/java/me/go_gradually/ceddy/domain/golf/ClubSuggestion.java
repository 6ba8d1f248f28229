package me.go_gradually.ceddy.domain.golf;

public record ClubSuggestion(Club club, String explanation) {
    public ClubSuggestion {
        if (club == null) {
            throw new IllegalArgumentException("club is required");
        }
        explanation = explanation == null ? "" : explanation;
    }
}
