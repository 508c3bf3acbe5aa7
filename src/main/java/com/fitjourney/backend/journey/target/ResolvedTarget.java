package com.fitjourney.backend.journey.target;

public record ResolvedTarget(double value, TargetSource source) {}
