package com.astropsf.model;

import java.util.Locale;

public final class StarCandidate {
    public final double x;
    public final double y;
    public final StarRole role;

    public StarCandidate(double x, double y, StarRole role) {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new IllegalArgumentException("Star position must be finite: (" + x + ", " + y + ")");
        }
        if (role == null) throw new IllegalArgumentException("Star role is required");
        this.x = x;
        this.y = y;
        this.role = role;
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "%s(%.2f, %.2f)", role.label(), x, y);
    }
}
