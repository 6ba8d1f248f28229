package me.go_gradually.ceddy.application.shared.model;

public enum ProviderFailure {
    UNCONFIGURED,
    ERROR,
    TIMEOUT,
    EMPTY
}
