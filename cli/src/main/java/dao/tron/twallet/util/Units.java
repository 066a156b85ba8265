package dao.tron.twallet.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Amount conversions. Fractions below the smallest unit are floored.
 */
public final class Units {
    private Units() {}

    public static final int TRX_DECIMALS = 6;

    public static long trxToSun(BigDecimal trx) {
        return toSubunits(trx, TRX_DECIMALS).longValueExact();
    }

    public static BigDecimal sunToTrx(long sun) {
        return BigDecimal.valueOf(sun, TRX_DECIMALS).stripTrailingZeros();
    }

    public static BigInteger toSubunits(BigDecimal coins, int decimals) {
        return coins.movePointRight(decimals).setScale(0, RoundingMode.FLOOR).toBigIntegerExact();
    }

    public static BigDecimal fromSubunits(BigInteger subunits, int decimals) {
        return new BigDecimal(subunits, decimals).stripTrailingZeros();
    }
}
