package dao.tron.twallet.model;

public record TransferSummary(int succeeded, int failed, int skipped) {

    public static TransferSummary empty() {
        return new TransferSummary(0, 0, 0);
    }
}
