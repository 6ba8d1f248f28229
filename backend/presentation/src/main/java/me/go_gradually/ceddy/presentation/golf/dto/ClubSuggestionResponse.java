package me.go_gradually.ceddy.presentation.golf.dto;

import me.go_gradually.ceddy.domain.golf.ClubSuggestion;

public class ClubSuggestionResponse {
    private String club;
    private String explanation;

    public static ClubSuggestionResponse from(ClubSuggestion suggestion) {
        ClubSuggestionResponse response = new ClubSuggestionResponse();
        response.setClub(suggestion.club().label());
        response.setExplanation(suggestion.explanation());
        return response;
    }

    public String getClub() {
        return club;
    }

    public void setClub(String club) {
        this.club = club;
    }

    public String getExplanation() {
        return explanation;
    }

    public void setExplanation(String explanation) {
        this.explanation = explanation;
    }
}
