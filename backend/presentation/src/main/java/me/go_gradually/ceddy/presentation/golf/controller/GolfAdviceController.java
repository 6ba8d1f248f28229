package me.go_gradually.ceddy.presentation.golf.controller;

import me.go_gradually.ceddy.application.golf.usecase.GolfAdviceUseCase;
import me.go_gradually.ceddy.presentation.golf.dto.ClubSuggestionResponse;
import me.go_gradually.ceddy.presentation.golf.dto.WindConditionsResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/golf-assistant")
public class GolfAdviceController {
    private final GolfAdviceUseCase golfAdviceUseCase;

    public GolfAdviceController(GolfAdviceUseCase golfAdviceUseCase) {
        this.golfAdviceUseCase = golfAdviceUseCase;
    }

    @GetMapping("/suggest-club/{distance}")
    public ClubSuggestionResponse suggestClub(@PathVariable("distance") double distance) {
        return ClubSuggestionResponse.from(golfAdviceUseCase.suggestClub(distance));
    }

    @GetMapping("/wind-conditions")
    public WindConditionsResponse windConditions() {
        return WindConditionsResponse.from(golfAdviceUseCase.windConditions());
    }
}
