package com.ttennebkram.stylize.registry.fixtures;

/**
 * Packaged as a bogus plugin entry point.
 */
public class NotAnEffect {
}
