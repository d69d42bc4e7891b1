package com.cardiorecords.domain.model;

public enum Severity {
    NORMAL,
    WARNING,
    DANGER
}
