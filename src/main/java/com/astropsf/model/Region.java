package com.astropsf.model;

public final class Region {

    public final int x0;
    public final int y0;
    public final int width;
    public final int height;

    public Region(int x0, int y0, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Region size must be positive: " + width + "x" + height);
        }
        this.x0 = x0;
        this.y0 = y0;
        this.width = width;
        this.height = height;
    }

    // corners truncated to whole pixels, as the viewer slices arrays
    public static Region fromCorners(double xa, double ya, double xb, double yb) {
        int left = (int) Math.min(xa, xb);
        int top = (int) Math.min(ya, yb);
        int right = (int) Math.max(xa, xb);
        int bottom = (int) Math.max(ya, yb);
        return new Region(left, top, Math.max(1, right - left), Math.max(1, bottom - top));
    }

    @Override
    public String toString() {
        return String.format("[x=%d, y=%d, %dx%d]", x0, y0, width, height);
    }
}
