package com.astropsf.model;

import com.astropsf.exception.ConfigurationException;
import com.astropsf.exception.PreconditionException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public class PhotometrySession {

    private final Map<StarRole, List<StarCandidate>> stars = new EnumMap<>(StarRole.class);
    private final double fwhmSeed;
    private double fwhm;
    private double comparisonMagnitude;

    public PhotometrySession(double fwhmSeed, double comparisonMagnitude) throws ConfigurationException {
        this.fwhmSeed = AppConfig.requirePositive("fwhm_seed", fwhmSeed);
        this.fwhm = fwhmSeed;
        setComparisonMagnitude(comparisonMagnitude);
        for (StarRole role : StarRole.values()) stars.put(role, new ArrayList<>());
    }

    public static PhotometrySession from(AppConfig config) throws ConfigurationException {
        return new PhotometrySession(config.getFwhmSeed(), config.getComparisonMagnitude());
    }

    public void addStar(StarCandidate star) {
        stars.get(star.role).add(star);
    }

    public void replaceStars(StarRole role, List<StarCandidate> candidates) {
        List<StarCandidate> list = stars.get(role);
        list.clear();
        for (StarCandidate c : candidates) {
            if (c.role != role) {
                throw new IllegalArgumentException("Candidate " + c + " does not belong to the " + role.label() + " list");
            }
            list.add(c);
        }
    }

    public void clear(StarRole role) {
        stars.get(role).clear();
    }

    public void reset() {
        for (List<StarCandidate> list : stars.values()) list.clear();
        fwhm = fwhmSeed;
    }

    public List<StarCandidate> stars(StarRole role) {
        return Collections.unmodifiableList(new ArrayList<>(stars.get(role)));
    }

    public StarCandidate activeStar(StarRole role) throws PreconditionException {
        List<StarCandidate> list = stars.get(role);
        if (list.isEmpty()) {
            throw new PreconditionException("No " + role.label() + " star coordinates have been selected");
        }
        return list.get(0);
    }

    public double getFwhm() { return fwhm; }

    public void setFwhm(double fwhm) throws ConfigurationException {
        this.fwhm = AppConfig.requirePositive("fwhm", fwhm);
    }

    public double getComparisonMagnitude() { return comparisonMagnitude; }

    public void setComparisonMagnitude(double magnitude) throws ConfigurationException {
        if (!Double.isFinite(magnitude)) {
            throw new ConfigurationException("comparison_magnitude must be a finite number (was " + magnitude + ")");
        }
        this.comparisonMagnitude = magnitude;
    }
}
