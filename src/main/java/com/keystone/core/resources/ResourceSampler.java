package com.keystone.core.resources;

/**
 * Source of raw resource readings.
 */
@FunctionalInterface
public interface ResourceSampler {

    ResourceUsage sample();
}
