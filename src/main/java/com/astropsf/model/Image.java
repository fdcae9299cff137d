package com.astropsf.model;

import com.astropsf.exception.PreconditionException;

public final class Image {

    private final int width;
    private final int height;
    private final double[] pixels;

    public Image(int width, int height, double[] pixels) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive: " + width + "x" + height);
        }
        if (pixels.length != width * height) {
            throw new IllegalArgumentException("Expected " + (width * height) + " samples, got " + pixels.length);
        }
        for (int i = 0; i < pixels.length; i++) {
            if (!Double.isFinite(pixels[i])) {
                throw new IllegalArgumentException("Non-finite sample at x=" + (i % width) + ", y=" + (i / width));
            }
        }
        this.width = width;
        this.height = height;
        this.pixels = pixels.clone();
    }

    public static Image sanitized(double[][] rows) {
        int h = rows.length;
        int w = h > 0 ? rows[0].length : 0;
        double[] px = new double[w * h];
        for (int y = 0; y < h; y++) {
            if (rows[y].length != w) {
                throw new IllegalArgumentException("Ragged row " + y + ": " + rows[y].length + " != " + w);
            }
            for (int x = 0; x < w; x++) {
                px[y * w + x] = sanitize(rows[y][x]);
            }
        }
        return new Image(w, h, px);
    }

    public static double sanitize(double v) {
        if (Double.isNaN(v)) return 0.0;
        if (v == Double.POSITIVE_INFINITY) return Double.MAX_VALUE;
        if (v == Double.NEGATIVE_INFINITY) return -Double.MAX_VALUE;
        return v;
    }

    public int getWidth() { return width; }
    public int getHeight() { return height; }

    // x is the column, y the row
    public double get(int x, int y) {
        return pixels[y * width + x];
    }

    public boolean contains(int x, int y) {
        return x >= 0 && y >= 0 && x < width && y < height;
    }

    public boolean contains(Region r) {
        return r.x0 >= 0 && r.y0 >= 0 && r.x0 + r.width <= width && r.y0 + r.height <= height;
    }

    public double[] crop(Region r) throws PreconditionException {
        if (!contains(r)) {
            throw new PreconditionException("Region " + r + " is not inside the " + width + "x" + height + " image");
        }
        double[] out = new double[r.width * r.height];
        for (int y = 0; y < r.height; y++) {
            System.arraycopy(pixels, (r.y0 + y) * width + r.x0, out, y * r.width, r.width);
        }
        return out;
    }

    public Region bounds() {
        return new Region(0, 0, width, height);
    }
}
