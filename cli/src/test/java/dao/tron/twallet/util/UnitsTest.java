package dao.tron.twallet.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class UnitsTest {

    @Test
    @DisplayName("TRX converts to sun with six decimals")
    void testTrxToSun() {
        assertEquals(1_000_000L, Units.trxToSun(BigDecimal.ONE));
        assertEquals(1_500_000L, Units.trxToSun(new BigDecimal("1.5")));
        assertEquals(1L, Units.trxToSun(new BigDecimal("0.000001")));
    }

    @Test
    @DisplayName("Fractions below one sun are floored")
    void testTrxToSunFloors() {
        assertEquals(0L, Units.trxToSun(new BigDecimal("0.0000009")));
        assertEquals(1_234_567L, Units.trxToSun(new BigDecimal("1.2345679")));
    }

    @Test
    @DisplayName("Sun converts back to TRX without trailing zeros")
    void testSunToTrx() {
        assertEquals("1.5", Units.sunToTrx(1_500_000L).toPlainString());
        assertEquals("10", Units.sunToTrx(10_000_000L).toPlainString());
        assertEquals("0", Units.sunToTrx(0L).toPlainString());
    }

    @Test
    @DisplayName("Token amounts follow the token's decimals")
    void testTokenSubunits() {
        assertEquals(BigInteger.valueOf(250), Units.toSubunits(new BigDecimal("2.5"), 2));
        assertEquals(new BigInteger("1000000000000000000"), Units.toSubunits(BigDecimal.ONE, 18));
        assertEquals("2.5", Units.fromSubunits(BigInteger.valueOf(250), 2).toPlainString());
        assertEquals("7", Units.fromSubunits(BigInteger.valueOf(7), 0).toPlainString());
    }
}
