package com.registration.exception;

import lombok.Getter;

@Getter
public class InsufficientMatchesException extends RegistrationException {
    private final int found;
    private final int required;
    private final double ratio;

    public InsufficientMatchesException(int found, int required, double ratio) {
        super(String.format("Too few matches survived the ratio test (ratio %.2f): found %d, need at least %d",
                ratio, found, required));
        this.found = found;
        this.required = required;
        this.ratio = ratio;
    }

    @Override
    public String kind() {
        return "InsufficientMatches";
    }
}
