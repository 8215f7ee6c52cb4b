package com.speckle.model;

// Telescope and AO properties that end up in init_props.dat, as numeric text.
public record KisipProps(String headerOffset, String telescopeDiameterMm, String aoLockX, String aoLockY, String aoUsed) {
}
