package com.stratlab.core.indicators;

import com.stratlab.core.model.Bar;

import java.util.List;

/**
 * Average Directional Index.
 * Directional movement is normalized by the rolling-mean ATR and both DI and
 * DX are smoothed by a plain rolling mean.
 */
public final class ADX {

    private ADX() {}

    public record Result(double[] adx, double[] plusDI, double[] minusDI) {}

    public static Result calculate(List<Bar> bars, int period) {
        int n = bars.size();
        double[] plusDM = new double[n];
        double[] minusDM = new double[n];

        for (int i = 1; i < n; i++) {
            double upMove = bars.get(i).high() - bars.get(i - 1).high();
            double downMove = bars.get(i - 1).low() - bars.get(i).low();
            plusDM[i] = (upMove > downMove && upMove > 0) ? upMove : 0;
            minusDM[i] = (downMove > upMove && downMove > 0) ? downMove : 0;
        }

        double[] atr = ATR.calculate(bars, period);
        double[] plusMean = Series.rollingMean(plusDM, period);
        double[] minusMean = Series.rollingMean(minusDM, period);

        double[] plusDI = new double[n];
        double[] minusDI = new double[n];
        double[] dx = new double[n];
        for (int i = 0; i < n; i++) {
            plusDI[i] = 100 * plusMean[i] / atr[i];
            minusDI[i] = 100 * minusMean[i] / atr[i];
            dx[i] = 100 * Math.abs(plusDI[i] - minusDI[i]) / (plusDI[i] + minusDI[i]);
        }

        double[] adx = Series.rollingMean(dx, period);
        return new Result(adx, plusDI, minusDI);
    }
}
