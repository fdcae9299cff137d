package com.astropsf.model;

public enum StarRole {
    TARGET("target"),
    COMPARISON("comparison");

    private final String label;

    StarRole(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
