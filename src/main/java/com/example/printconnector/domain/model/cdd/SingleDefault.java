package com.example.printconnector.domain.model.cdd;

import com.example.printconnector.domain.exception.InvalidCapabilityException;

import java.util.List;
import java.util.function.Predicate;

/**
 * Guards the one-default rule shared by every multiple-choice capability.
 */
final class SingleDefault {

    private SingleDefault() {
    }

    static <T> List<T> require(String section, List<T> options, Predicate<T> isDefault) {
        if (options == null || options.isEmpty()) {
            throw new InvalidCapabilityException(section);
        }
        List<T> copy = List.copyOf(options);
        long defaults = copy.stream().filter(isDefault).count();
        if (defaults != 1) {
            throw new InvalidCapabilityException(section, defaults);
        }
        return copy;
    }
}
