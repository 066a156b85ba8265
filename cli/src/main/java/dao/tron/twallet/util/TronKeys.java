package dao.tron.twallet.util;

import org.tron.trident.core.ApiWrapper;

/**
 * Key and address helpers.
 */
public final class TronKeys {
    private TronKeys() {}

    public static String stripHexPrefix(String value) {
        if (value == null) return "";
        return (value.startsWith("0x") || value.startsWith("0X"))
                ? value.substring(2)
                : value;
    }

    /**
     * @return true if {@code base58} decodes to a TRON address
     */
    public static boolean isValidAddress(String base58) {
        if (base58 == null || base58.isBlank()) return false;
        try {
            return ApiWrapper.parseAddress(base58).size() == 21;
        } catch (Exception e) {
            return false;
        }
    }
}
