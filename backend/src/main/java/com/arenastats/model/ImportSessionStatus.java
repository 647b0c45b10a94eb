package com.arenastats.model;

public enum ImportSessionStatus {
    RUNNING,
    COMPLETED,
    FAILED
}
