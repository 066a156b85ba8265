package dao.tron.twallet.service;

import dao.tron.twallet.model.ContractArtifact;
import org.tron.trident.core.key.KeyPair;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory chain. Transfers move balances immediately and are confirmed in block 1.
 */
class StubChainClient implements ChainClient {

    record Sent(String kind, String from, String to, BigInteger amount, String txId) {}

    final Map<String, Long> trxBalances = new ConcurrentHashMap<>();
    final Map<String, BigInteger> tokenBalances = new ConcurrentHashMap<>();
    final Set<String> failingAddresses = Collections.synchronizedSet(new HashSet<>());
    final Set<String> failingConfirmations = Collections.synchronizedSet(new HashSet<>());
    final List<Sent> sent = Collections.synchronizedList(new ArrayList<>());
    final List<String> confirmed = Collections.synchronizedList(new ArrayList<>());
    final List<ContractArtifact> deployed = Collections.synchronizedList(new ArrayList<>());
    final Map<String, String> createdContracts = new ConcurrentHashMap<>();
    private final AtomicInteger txCounter = new AtomicInteger();

    @Override
    public long getBalance(String address) {
        failIfConfigured(address);
        return trxBalances.getOrDefault(address, 0L);
    }

    @Override
    public String transfer(KeyPair sender, String toAddress, long sun) {
        String from = sender.toBase58CheckAddress();
        failIfConfigured(toAddress);
        trxBalances.merge(from, -sun, Long::sum);
        trxBalances.merge(toAddress, sun, Long::sum);
        return record("trx", from, toAddress, BigInteger.valueOf(sun));
    }

    @Override
    public long waitForConfirmation(String txId) {
        if (failingConfirmations.contains(txId)) {
            throw new ChainClientException("Transaction failed: REVERT. txId=" + txId);
        }
        confirmed.add(txId);
        return 1L;
    }

    @Override
    public BigInteger trc20BalanceOf(String contractAddress, String holderAddress) {
        failIfConfigured(holderAddress);
        return tokenBalances.getOrDefault(holderAddress, BigInteger.ZERO);
    }

    @Override
    public String trc20Transfer(String contractAddress, KeyPair sender, String toAddress, BigInteger amount) {
        String from = sender.toBase58CheckAddress();
        failIfConfigured(toAddress);
        tokenBalances.merge(from, amount.negate(), BigInteger::add);
        tokenBalances.merge(toAddress, amount, BigInteger::add);
        return record("token", from, toAddress, amount);
    }

    @Override
    public String trc20Mint(String contractAddress, KeyPair owner, String toAddress, BigInteger amount) {
        failIfConfigured(toAddress);
        tokenBalances.merge(toAddress, amount, BigInteger::add);
        return record("mint", owner.toBase58CheckAddress(), toAddress, amount);
    }

    @Override
    public String trc20Deploy(KeyPair owner, ContractArtifact artifact, String name, String symbol, int decimals) {
        deployed.add(artifact);
        String txId = record("deploy", owner.toBase58CheckAddress(), null, BigInteger.valueOf(decimals));
        createdContracts.put(txId, KeyPair.generate().toBase58CheckAddress());
        return txId;
    }

    @Override
    public String waitForContractAddress(String txId) {
        waitForConfirmation(txId);
        String contract = createdContracts.get(txId);
        if (contract == null) {
            throw new ChainClientException("Transaction has no contract address. txId=" + txId);
        }
        return contract;
    }

    private String record(String kind, String from, String to, BigInteger amount) {
        String txId = "tx" + txCounter.incrementAndGet();
        sent.add(new Sent(kind, from, to, amount, txId));
        return txId;
    }

    private void failIfConfigured(String address) {
        if (failingAddresses.contains(address)) {
            throw new ChainClientException("rpc unavailable for " + address);
        }
    }
}
