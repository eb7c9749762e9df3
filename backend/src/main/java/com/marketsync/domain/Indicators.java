package com.marketsync.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Technical indicators over the close series ending at a bucket. Null when the lookback is too short.
 */
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Getter
@Setter
public class Indicators {

    private Double sma7;
    private Double sma20;
    private Double ema12;
    private Double ema26;
    private Double rsi14;
    private Double macd;
    private Double bollingerUpper;
    private Double bollingerLower;
    private Double atr14;

    public static Indicators empty() {
        return new Indicators();
    }
}
