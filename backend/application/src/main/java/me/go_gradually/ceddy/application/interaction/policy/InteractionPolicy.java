package me.go_gradually.ceddy.application.interaction.policy;

public interface InteractionPolicy {
    String wakeWord();

    boolean serializePerSession();
}
