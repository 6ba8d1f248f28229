package me.go_gradually.ceddy.application.shared.policy;

public interface RuntimePolicy {
    String environmentName();

    boolean debug();
}
