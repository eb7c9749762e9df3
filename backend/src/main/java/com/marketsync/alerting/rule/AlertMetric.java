package com.marketsync.alerting.rule;

/**
 * Metric a rule compares against its threshold. Values are computed per (entity, window).
 */
public enum AlertMetric {
    /** (close − open) / open · 100 of the window's bucket. */
    PRICE_CHANGE_PCT,
    /** Bucket volume change vs the previous bucket, in percent. */
    VOLUME_CHANGE_PCT,
    RSI,
    /** Mean quality score of the bucket's contributing records. */
    COMPLETENESS,
    /** Minutes since the entity's latest stored record. */
    STALENESS_MINUTES,
    /** Records in the window below the minimum quality score. */
    LOW_QUALITY_COUNT,
    /** Distance of the close outside the Bollinger band in percent; positive above, negative below. */
    BOLLINGER_BREAKOUT_PCT
}
