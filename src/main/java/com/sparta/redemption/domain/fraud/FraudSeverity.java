package com.sparta.redemption.domain.fraud;

/**
 * 플래그 심각도와 위험 점수 가중치
 */
public enum FraudSeverity {
    LOW(10),
    MEDIUM(20),
    HIGH(40);

    private final int score;

    FraudSeverity(int score) {
        this.score = score;
    }

    public int getScore() {
        return score;
    }
}
