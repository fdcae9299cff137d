package com.astropsf.model;

import com.astropsf.exception.ConfigurationException;
import java.util.prefs.Preferences;

public class AppConfig {

    private static final String KEY_FWHM_SEED = "fwhm_seed";
    private static final String KEY_THRESHOLD = "threshold";
    private static final String KEY_SIGMA_CLIP = "sigma_clip";
    private static final String KEY_COMP_MAG = "comparison_magnitude";
    private static final String KEY_PATCH_SIZE = "fwhm_patch_size";

    public static final double DEFAULT_FWHM_SEED = 5.0;
    public static final double DEFAULT_THRESHOLD = 5.0;
    public static final double DEFAULT_SIGMA_CLIP = 3.0;
    public static final double DEFAULT_COMPARISON_MAGNITUDE = 10.0;
    public static final int DEFAULT_PATCH_SIZE = 31;

    private final Preferences prefs;

    public AppConfig(Preferences prefs) {
        this.prefs = prefs;
    }

    public static AppConfig userConfig() {
        return new AppConfig(Preferences.userNodeForPackage(AppConfig.class));
    }

    // --- DETECTION ---
    public double getFwhmSeed() { return prefs.getDouble(KEY_FWHM_SEED, DEFAULT_FWHM_SEED); }
    public void setFwhmSeed(double v) throws ConfigurationException { prefs.putDouble(KEY_FWHM_SEED, requirePositive(KEY_FWHM_SEED, v)); }

    public double getThreshold() { return prefs.getDouble(KEY_THRESHOLD, DEFAULT_THRESHOLD); }
    public void setThreshold(double v) throws ConfigurationException { prefs.putDouble(KEY_THRESHOLD, requirePositive(KEY_THRESHOLD, v)); }

    public double getSigmaClip() { return prefs.getDouble(KEY_SIGMA_CLIP, DEFAULT_SIGMA_CLIP); }
    public void setSigmaClip(double v) throws ConfigurationException { prefs.putDouble(KEY_SIGMA_CLIP, requirePositive(KEY_SIGMA_CLIP, v)); }

    // --- PHOTOMETRY ---
    public double getComparisonMagnitude() { return prefs.getDouble(KEY_COMP_MAG, DEFAULT_COMPARISON_MAGNITUDE); }
    public void setComparisonMagnitude(double v) throws ConfigurationException {
        if (!Double.isFinite(v)) throw new ConfigurationException(KEY_COMP_MAG + " must be a finite number (was " + v + ")");
        prefs.putDouble(KEY_COMP_MAG, v);
    }

    public int getFwhmPatchSize() { return prefs.getInt(KEY_PATCH_SIZE, DEFAULT_PATCH_SIZE); }
    public void setFwhmPatchSize(int v) throws ConfigurationException {
        if (v < 3 || v % 2 == 0) throw new ConfigurationException(KEY_PATCH_SIZE + " must be an odd number >= 3 (was " + v + ")");
        prefs.putInt(KEY_PATCH_SIZE, v);
    }

    public static double parsePositive(String name, String text) throws ConfigurationException {
        try {
            return requirePositive(name, Double.parseDouble(text.trim()));
        } catch (NumberFormatException | NullPointerException e) {
            throw new ConfigurationException(name + " is not a number: '" + text + "'");
        }
    }

    static double requirePositive(String name, double v) throws ConfigurationException {
        if (!(v > 0) || Double.isInfinite(v)) {
            throw new ConfigurationException(name + " must be a positive number (was " + v + ")");
        }
        return v;
    }
}
