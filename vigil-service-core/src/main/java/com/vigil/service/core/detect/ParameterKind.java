package com.vigil.service.core.detect;

/** What the sensitivity-driven knob of a detector means, and which direction is stricter. */
public enum ParameterKind {
    /** A deviation multiplier; larger values flag fewer points. */
    THRESHOLD,
    /** An expected outlier fraction in (0, 0.5]; smaller values flag fewer points. */
    CONTAMINATION;

    /** True when {@code stricter} flags no more points than {@code looser}. */
    public boolean isAtLeastAsStrict(double stricter, double looser) {
        return this == THRESHOLD ? stricter >= looser : stricter <= looser;
    }
}
