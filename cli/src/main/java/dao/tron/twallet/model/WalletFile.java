package dao.tron.twallet.model;

/**
 * JSON layout of a saved wallet file ({@code idNNNNNN.json}).
 */
public record WalletFile(String address, String privateKey) {

    public static WalletFile of(Wallet wallet) {
        return new WalletFile(wallet.address(), wallet.privateKey());
    }
}
