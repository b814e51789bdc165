package com.vigil.service.core.detect;

import java.util.Locale;

public enum DetectorCategory {
    STATISTICAL,
    ML,
    ADVANCED;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
