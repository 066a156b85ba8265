package dao.tron.twallet.service;

import dao.tron.twallet.model.ContractArtifact;
import org.tron.trident.core.key.KeyPair;

import java.math.BigInteger;

/**
 * Blocking access to the chain. Every method throws {@link ChainClientException} on failure.
 */
public interface ChainClient {

    /** TRX balance in sun. */
    long getBalance(String address);

    /** Sends {@code sun} from the sender's account; returns the tx id. */
    String transfer(KeyPair sender, String toAddress, long sun);

    /** Waits until the transaction is in a block and succeeded; returns its block number. */
    long waitForConfirmation(String txId);

    BigInteger trc20BalanceOf(String contractAddress, String holderAddress);

    String trc20Transfer(String contractAddress, KeyPair sender, String toAddress, BigInteger amount);

    String trc20Mint(String contractAddress, KeyPair owner, String toAddress, BigInteger amount);

    /**
     * Creates a TRC-20 contract owned by {@code owner} with constructor {@code (name, symbol, decimals)}.
     *
     * @return the create transaction id
     */
    String trc20Deploy(KeyPair owner, ContractArtifact artifact, String name, String symbol, int decimals);

    /** Waits for a create transaction like {@link #waitForConfirmation}; returns the new contract address. */
    String waitForContractAddress(String txId);
}
