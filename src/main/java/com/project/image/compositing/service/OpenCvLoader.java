package com.project.image.compositing.service;

import org.opencv.core.Core;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the bundled OpenCV native library once per JVM.
 */
final class OpenCvLoader {
    private static final Logger log = LoggerFactory.getLogger(OpenCvLoader.class);

    static {
        try {
            nu.pattern.OpenCV.loadLocally();
            log.info("OpenCV {} loaded successfully", Core.VERSION);
        } catch (RuntimeException | LinkageError e) {
            log.error("Failed to load OpenCV", e);
            throw e;
        }
    }

    private OpenCvLoader() {
    }

    /** Forces class initialisation; a no-op after the first call. */
    static void ensureLoaded() {
    }
}
