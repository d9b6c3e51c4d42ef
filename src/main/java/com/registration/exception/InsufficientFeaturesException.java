package com.registration.exception;

import lombok.Getter;

@Getter
public class InsufficientFeaturesException extends RegistrationException {
    private final String image;
    private final int found;
    private final int required;

    public InsufficientFeaturesException(String image, int found, int required) {
        super(String.format("Too few features in %s image to register reliably: found %d, need at least %d",
                image, found, required));
        this.image = image;
        this.found = found;
        this.required = required;
    }

    @Override
    public String kind() {
        return "InsufficientFeatures";
    }
}
