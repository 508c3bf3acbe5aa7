package com.fitjourney.backend.weight.support;

public final class Units {
    private Units() {}

    // 1 lb = 0.45359237 kg
    private static final double KG_PER_LB = 0.45359237d;
    private static final double LBS_PER_KG = 1.0d / KG_PER_LB;

    /** 無條件捨去到指定小數位 */
    public static Double floor(Number v, int scale) {
        if (v == null) return null;
        if (scale < 0) throw new IllegalArgumentException("scale must be >= 0");
        double factor = Math.pow(10d, scale);
        // + 1e-8: 避免 40.1 變成 40.0999999 被多捨 0.1
        return Math.floor(v.doubleValue() * factor + 1e-8) / factor;
    }

    /** lbs → kg（捨去到 0.1 kg） */
    public static Double lbsToKg1(Number lbs) {
        if (lbs == null) return null;
        return floor(lbs.doubleValue() * KG_PER_LB, 1);
    }

    /** kg → lbs（捨去到 0.1 lbs） */
    public static Double kgToLbs1(Number kg) {
        if (kg == null) return null;
        return floor(kg.doubleValue() * LBS_PER_KG, 1);
    }
}
