package com.goormthonuniv.newscheckr.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Bias {
    LEFT("Left"),
    CENTER("Center"),
    RIGHT("Right");

    private final String label;

    Bias(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** "Left" / "left" / "LEFT" 모두 허용 */
    @JsonCreator
    public static Bias fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("bias label is blank");
        }
        String v = value.strip().toUpperCase(Locale.ROOT);
        for (Bias b : values()) {
            if (b.name().equals(v)) return b;
        }
        throw new IllegalArgumentException("unknown bias label: " + value);
    }
}
