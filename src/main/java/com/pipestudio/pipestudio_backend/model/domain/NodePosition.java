package com.pipestudio.pipestudio_backend.model.domain;

/** Canvas position. Carried through unchanged; never read by the engine. */
public record NodePosition(double x, double y) {
}
