package dev.visibility.model;

import java.util.ArrayList;
import java.util.List;

public record Location(String city, String state, String country) {

    /**
     * "City, State" or whichever of the two is present; empty when neither is.
     */
    public String display() {
        List<String> parts = new ArrayList<>();
        if (city != null && !city.isBlank()) {
            parts.add(city.trim());
        }
        if (state != null && !state.isBlank()) {
            parts.add(state.trim());
        }
        return String.join(", ", parts);
    }
}
