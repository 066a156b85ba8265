package dao.tron.twallet.model;

/**
 * Outcome of broadcasting (and optionally confirming) one transaction.
 * {@code txId} is null when the broadcast itself failed.
 */
public record TxResult(int index, String label, String address, String txId, String error, boolean confirmed) {

    public static TxResult sent(int index, String label, String address, String txId) {
        return new TxResult(index, label, address, txId, null, false);
    }

    public static TxResult failed(int index, String label, String address, String error) {
        return new TxResult(index, label, address, null, error, false);
    }

    public TxResult confirmedOk() {
        return new TxResult(index, label, address, txId, null, true);
    }

    public TxResult confirmationFailed(String error) {
        return new TxResult(index, label, address, txId, error, false);
    }

    public boolean isSent() {
        return txId != null && error == null;
    }

    public String format() {
        String prefix = label + ". " + address + ": ";
        if (txId == null) {
            return prefix + "error: " + error;
        }
        if (error != null) {
            return prefix + "tx id = " + txId + ": error: " + error;
        }
        return prefix + "tx id = " + txId + (confirmed ? " - OK" : "");
    }
}
