package com.cardiorecords.domain.model;

/**
 * Rhythm classification produced by the upstream analyzer.
 */
public enum Classification {
    NORMAL,
    AFIB,
    VT,
    STEMI,
    BRADYCARDIA,
    TACHYCARDIA,
    OTHER
}
