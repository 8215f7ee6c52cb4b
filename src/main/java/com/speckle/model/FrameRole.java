package com.speckle.model;

public enum FrameRole {
    DARK, FLAT, DATA;

    public String label() { return name().toLowerCase() + "List"; }
}
