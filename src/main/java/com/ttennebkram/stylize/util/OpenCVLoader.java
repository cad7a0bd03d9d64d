package com.ttennebkram.stylize.util;

import org.opencv.core.Core;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the OpenCV native library bundled with the openpnp artifact.
 * Safe to call multiple times - only loads once per process.
 */
public final class OpenCVLoader {

    private static final Logger log = LoggerFactory.getLogger(OpenCVLoader.class);

    private static boolean loaded = false;

    private OpenCVLoader() {
    }

    public static synchronized void ensureLoaded() {
        if (loaded) return;
        nu.pattern.OpenCV.loadLocally();
        loaded = true;
        log.debug("OpenCV {} native library loaded", Core.VERSION);
    }
}
