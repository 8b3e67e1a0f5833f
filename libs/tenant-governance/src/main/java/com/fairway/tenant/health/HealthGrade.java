package com.fairway.tenant.health;

import java.math.BigDecimal;

public enum HealthGrade {

    EXCELLENT("excellent", 90),
    GOOD("good", 80),
    FAIR("fair", 70),
    POOR("poor", 60),
    CRITICAL("critical", 0);

    private final String value;
    private final int minimumScore;

    HealthGrade(String value, int minimumScore) {
        this.value = value;
        this.minimumScore = minimumScore;
    }

    public String value() {
        return value;
    }

    public int minimumScore() {
        return minimumScore;
    }

    /** Highest grade whose minimum the score reaches. */
    public static HealthGrade forScore(BigDecimal score) {
        for (HealthGrade grade : values()) {
            if (score.compareTo(BigDecimal.valueOf(grade.minimumScore)) >= 0) {
                return grade;
            }
        }
        return CRITICAL;
    }
}
