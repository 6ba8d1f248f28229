package me.go_gradually.ceddy.presentation.golf.dto;

import me.go_gradually.ceddy.domain.golf.WindConditions;

public class WindConditionsResponse {
    private String speed;
    private String direction;
    private String recommendation;

    public static WindConditionsResponse from(WindConditions conditions) {
        WindConditionsResponse response = new WindConditionsResponse();
        response.setSpeed(conditions.speed());
        response.setDirection(conditions.direction());
        response.setRecommendation(conditions.recommendation());
        return response;
    }

    public String getSpeed() {
        return speed;
    }

    public void setSpeed(String speed) {
        this.speed = speed;
    }

    public String getDirection() {
        return direction;
    }

    public void setDirection(String direction) {
        this.direction = direction;
    }

    public String getRecommendation() {
        return recommendation;
    }

    public void setRecommendation(String recommendation) {
        this.recommendation = recommendation;
    }
}
