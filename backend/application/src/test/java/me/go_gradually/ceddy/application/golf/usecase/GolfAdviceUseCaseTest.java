package me.go_gradually.ceddy.application.golf.usecase;

import me.go_gradually.ceddy.domain.golf.Club;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GolfAdviceUseCaseTest {

    private final GolfAdviceUseCase useCase = new GolfAdviceUseCase();

    @Test
    void suggestClub_delegatesToDistanceTable() {
        assertEquals(Club.SEVEN_IRON, useCase.suggestClub(150.0).club());
    }

    @Test
    void windConditions_returnsPlaceholder() {
        assertEquals("North-East", useCase.windConditions().direction());
    }
}
