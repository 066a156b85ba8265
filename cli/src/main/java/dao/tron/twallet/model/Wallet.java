package dao.tron.twallet.model;

import dao.tron.twallet.util.TronKeys;
import org.tron.trident.core.key.KeyPair;

/**
 * A key pair together with its position in the configured wallet list.
 */
public record Wallet(int index, KeyPair keyPair) {

    public static Wallet fromPrivateKey(int index, String hexPrivateKey) {
        return new Wallet(index, new KeyPair(TronKeys.stripHexPrefix(hexPrivateKey)));
    }

    public static Wallet generate(int index) {
        return new Wallet(index, KeyPair.generate());
    }

    public String address() {
        return keyPair.toBase58CheckAddress();
    }

    public String privateKey() {
        return keyPair.toPrivateKey();
    }

    @Override
    public String toString() {
        return index + ". " + address();
    }
}
