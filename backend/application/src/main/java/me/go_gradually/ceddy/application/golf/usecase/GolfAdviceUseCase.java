package me.go_gradually.ceddy.application.golf.usecase;

import me.go_gradually.ceddy.domain.golf.ClubSelector;
import me.go_gradually.ceddy.domain.golf.ClubSuggestion;
import me.go_gradually.ceddy.domain.golf.WindConditions;

public class GolfAdviceUseCase {
    public ClubSuggestion suggestClub(double distanceYards) {
        return ClubSelector.suggest(distanceYards);
    }

    public WindConditions windConditions() {
        return WindConditions.placeholder();
    }
}
