package com.creditgate.shared.model;

public enum ResultState {
    SUCCESS,
    NO_RESULTS,
    ERROR
}
