package com.phillippitts.retroauto.domain;

/** Pixel comparison mode used by the vision matcher. */
public enum ColorMode {
    GRAYSCALE, COLOR
}
