package com.fitjourney.backend.journey.target;

public enum TargetKind {
    PROTEIN,
    CALORIES
}
