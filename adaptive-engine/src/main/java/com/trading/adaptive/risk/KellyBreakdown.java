package com.trading.adaptive.risk;

/**
 * Every intermediate of one Kelly sizing computation.
 *
 * @param winProbability calibrated confidence used as p
 * @param rewardRisk reward/risk ratio R of the bucket
 * @param sigma ROE standard deviation of the bucket
 * @param rawKelly {@code max(0, (pR - (1 - p)) / R)}
 * @param volRatio {@code targetSigma / max(sigma, targetSigma)}
 * @param adjusted {@code rawKelly * volRatio}
 * @param conservative {@code kFactor * adjusted}
 * @param capped {@code min(conservative, fMax)}, halved while the daily loss cap is exceeded
 * @param positionUsd capped fraction of the wallet, clamped to the position bounds
 * @param fraction {@code positionUsd / wallet}, or 0 for an empty wallet
 */
public record KellyBreakdown(
    String bucket,
    double winProbability,
    double rewardRisk,
    double sigma,
    double rawKelly,
    double volRatio,
    double adjusted,
    double conservative,
    double capped,
    boolean dailyCapApplied,
    double positionUsd,
    double fraction
) {
}
