package me.go_gradually.ceddy.domain.golf;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class WindConditionsTest {

    @Test
    void placeholder_returnsFixedReading() {
        WindConditions wind = WindConditions.placeholder();

        assertEquals("10 mph", wind.speed());
        assertEquals("North-East", wind.direction());
        assertEquals("Adjust your aim slightly to the left to account for the crosswind.", wind.recommendation());
    }
}
