package io.github.simbo1905.tex.math;

import java.util.logging.Logger;

/// Centralized logger for the render pipeline.
/// Pipeline classes use it via:
///   import static io.github.simbo1905.tex.math.TexLogging.LOG;
final class TexLogging {
    public static final Logger LOG = Logger.getLogger("io.github.simbo1905.tex.math");

    private TexLogging() {}
}
