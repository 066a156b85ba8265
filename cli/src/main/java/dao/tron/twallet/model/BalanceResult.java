package dao.tron.twallet.model;

import java.math.BigDecimal;

/**
 * Outcome of a single balance query. Exactly one of {@code balance} and {@code error} is set.
 */
public record BalanceResult(int index, String address, BigDecimal balance, String error) {

    public static BalanceResult ok(int index, String address, BigDecimal balance) {
        return new BalanceResult(index, address, balance, null);
    }

    public static BalanceResult failed(int index, String address, String error) {
        return new BalanceResult(index, address, null, error);
    }

    public boolean isOk() {
        return error == null;
    }

    public String format() {
        return isOk()
                ? index + ". " + address + ": " + balance.toPlainString()
                : index + ". " + address + ": error: " + error;
    }
}
