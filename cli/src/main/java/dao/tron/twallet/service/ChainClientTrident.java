package dao.tron.twallet.service;

import dao.tron.twallet.config.RpcProperties;
import dao.tron.twallet.model.ContractArtifact;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.tron.trident.abi.FunctionEncoder;
import org.tron.trident.abi.FunctionReturnDecoder;
import org.tron.trident.abi.TypeReference;
import org.tron.trident.abi.datatypes.Address;
import org.tron.trident.abi.datatypes.Bool;
import org.tron.trident.abi.datatypes.Function;
import org.tron.trident.abi.datatypes.Type;
import org.tron.trident.abi.datatypes.Utf8String;
import org.tron.trident.abi.datatypes.generated.Uint256;
import org.tron.trident.abi.datatypes.generated.Uint8;
import org.tron.trident.core.ApiWrapper;
import org.tron.trident.core.NodeType;
import org.tron.trident.core.key.KeyPair;
import org.tron.trident.proto.Chain;
import org.tron.trident.proto.Response;
import org.tron.trident.utils.Base58Check;
import org.tron.trident.utils.Numeric;

import java.math.BigInteger;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

@Slf4j
@Service
public class ChainClientTrident implements ChainClient {

    private final RpcProperties props;
    /**
     * Guard signing/broadcasting so concurrent jobs don't trip over non-thread-safe internals.
     * Receipt polling is done outside this lock.
     */
    private final Object broadcastLock = new Object();
    private volatile ApiWrapper wrapper;

    public ChainClientTrident(RpcProperties props) {
        this.props = props;
    }

    @Override
    public long getBalance(String address) {
        try {
            return wrapper().getAccountBalance(address);
        } catch (Exception e) {
            throw new ChainClientException("getBalance failed for " + address + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String transfer(KeyPair sender, String toAddress, long sun) {
        try {
            Response.TransactionExtention txnExt = wrapper().transfer(sender.toBase58CheckAddress(), toAddress, sun);
            requireSuccess(txnExt, "transfer");
            return signAndBroadcast(txnExt, sender);
        } catch (ChainClientException e) {
            throw e;
        } catch (Exception e) {
            throw new ChainClientException("transfer failed: " + e.getMessage(), e);
        }
    }

    @Override
    public long waitForConfirmation(String txId) {
        return confirmedTxInfo(txId).getBlockNumber();
    }

    @Override
    public String waitForContractAddress(String txId) {
        Response.TransactionInfo txInfo = confirmedTxInfo(txId);
        byte[] contract = txInfo.getContractAddress().toByteArray();
        if (contract.length == 0) {
            throw new ChainClientException("Transaction has no contract address. txId=" + txId);
        }
        return Base58Check.bytesToBase58(contract);
    }

    private Response.TransactionInfo confirmedTxInfo(String txId) {
        RpcProperties.Polling polling = props.getPolling();
        Response.TransactionInfo txInfo = waitForTxInfo(
                txId,
                Duration.ofSeconds(polling.getTxInfoTimeoutSeconds()),
                Duration.ofMillis(polling.getTxInfoPollInitialMs()),
                Duration.ofMillis(polling.getTxInfoPollMaxMs())
        );
        if (txInfo == null) {
            throw new ChainClientException("no TransactionInfo after timeout. txId=" + txId);
        }
        if (txInfo.getResult() != Response.TransactionInfo.code.SUCESS) {
            String errorMsg = txInfo.getResMessage() != null ? txInfo.getResMessage().toStringUtf8() : "Unknown error";
            throw new ChainClientException("Transaction failed: " + errorMsg + ". txId=" + txId);
        }
        return txInfo;
    }

    @Override
    public BigInteger trc20BalanceOf(String contractAddress, String holderAddress) {
        try {
            Function balanceOfFn = new Function(
                    "balanceOf",
                    Collections.singletonList(new Address(holderAddress)),
                    Collections.singletonList(new TypeReference<Uint256>() {})
            );

            String encodedHex = FunctionEncoder.encode(balanceOfFn);
            Response.TransactionExtention txn = wrapper().triggerConstantContract(
                    holderAddress,
                    contractAddress,
                    encodedHex,
                    NodeType.SOLIDITY_NODE
            );
            requireSuccess(txn, "balanceOf");
            if (txn.getConstantResultCount() == 0) {
                throw new ChainClientException("No constantResult for balanceOf");
            }

            String resultHex = Numeric.toHexString(txn.getConstantResult(0).toByteArray());
            @SuppressWarnings("rawtypes")
            List<Type> decoded =
                    FunctionReturnDecoder.decode(resultHex, balanceOfFn.getOutputParameters());
            if (decoded.size() != 1) {
                throw new ChainClientException("Unexpected balanceOf outputs=" + decoded.size());
            }
            return ((Uint256) decoded.get(0)).getValue();
        } catch (ChainClientException e) {
            throw e;
        } catch (Exception e) {
            throw new ChainClientException("balanceOf failed for " + holderAddress + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String trc20Transfer(String contractAddress, KeyPair sender, String toAddress, BigInteger amount) {
        Function transferFn = new Function(
                "transfer",
                Arrays.asList(new Address(toAddress), new Uint256(amount)),
                Collections.singletonList(new TypeReference<Bool>() {})
        );
        return triggerAndBroadcast(contractAddress, sender, transferFn);
    }

    @Override
    public String trc20Mint(String contractAddress, KeyPair owner, String toAddress, BigInteger amount) {
        Function mintFn = new Function(
                "mint",
                Arrays.asList(new Address(toAddress), new Uint256(amount)),
                Collections.emptyList()
        );
        return triggerAndBroadcast(contractAddress, owner, mintFn);
    }

    @Override
    public String trc20Deploy(KeyPair owner, ContractArtifact artifact, String name, String symbol, int decimals) {
        List<Type<?>> constructorArgs = Arrays.asList(
                new Utf8String(name),
                new Utf8String(symbol),
                new Uint8(decimals)
        );
        // deployContract takes the owner from the wrapper's own key
        ApiWrapper ownerWrapper = connect(owner.toPrivateKey());
        try {
            Response.TransactionExtention txnExt = ownerWrapper.deployContract(
                    artifact.contractName(),
                    artifact.abi(),
                    artifact.bytecode(),
                    constructorArgs,
                    props.getFeeLimit(),
                    100L,
                    props.getFeeLimit(),
                    0L,
                    null,
                    0L
            );
            requireSuccess(txnExt, "deploy " + artifact.contractName());
            synchronized (broadcastLock) {
                Chain.Transaction signed = ownerWrapper.signTransaction(txnExt, owner);
                return ownerWrapper.broadcastTransaction(signed);
            }
        } catch (ChainClientException e) {
            throw e;
        } catch (Exception e) {
            throw new ChainClientException("deploy " + artifact.contractName() + " failed: " + e.getMessage(), e);
        } finally {
            ownerWrapper.close();
        }
    }

    private String triggerAndBroadcast(String contractAddress, KeyPair signer, Function fn) {
        try {
            String encodedHex = FunctionEncoder.encode(fn);
            Response.TransactionExtention txnExt = wrapper().triggerContract(
                    signer.toBase58CheckAddress(),
                    contractAddress,
                    encodedHex,
                    0L,
                    0L,
                    null,
                    props.getFeeLimit()
            );
            requireSuccess(txnExt, fn.getName());
            return signAndBroadcast(txnExt, signer);
        } catch (ChainClientException e) {
            throw e;
        } catch (Exception e) {
            throw new ChainClientException(fn.getName() + " failed: " + e.getMessage(), e);
        }
    }

    private String signAndBroadcast(Response.TransactionExtention txnExt, KeyPair signer) {
        synchronized (broadcastLock) {
            Chain.Transaction signed = wrapper().signTransaction(txnExt, signer);
            return wrapper().broadcastTransaction(signed);
        }
    }

    private static void requireSuccess(Response.TransactionExtention txnExt, String action) {
        if (!txnExt.getResult().getResult()) {
            throw new ChainClientException(action + " trigger failed: " + txnExt.getResult().getMessage().toStringUtf8());
        }
    }

    private Response.TransactionInfo waitForTxInfo(String txId, Duration timeout, Duration pollInitial, Duration pollMax) {
        long deadline = System.currentTimeMillis() + timeout.toMillis();
        long sleepMs = Math.max(100, pollInitial.toMillis());
        long maxSleepMs = Math.max(sleepMs, pollMax.toMillis());
        while (System.currentTimeMillis() < deadline) {
            try {
                Response.TransactionInfo info = wrapper().getTransactionInfoById(txId);
                if (info != null && info.getBlockNumber() > 0) return info;
            } catch (Exception e) {
                // not indexed yet
                log.trace("TransactionInfo not available yet for {}: {}", txId, e.getMessage());
            }
            try {
                long jitter = ThreadLocalRandom.current().nextLong(0, 150);
                Thread.sleep(sleepMs + jitter);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new ChainClientException("Interrupted while waiting for " + txId, ie);
            }
            sleepMs = Math.min(maxSleepMs, (long) Math.ceil(sleepMs * 1.5));
        }
        return null;
    }

    private ApiWrapper wrapper() {
        ApiWrapper current = wrapper;
        if (current == null) {
            synchronized (this) {
                if (wrapper == null) {
                    // Every transaction is signed with an explicit key pair, the wrapper's own key is never used.
                    wrapper = connect(KeyPair.generate().toPrivateKey());
                }
                current = wrapper;
            }
        }
        return current;
    }

    private ApiWrapper connect(String key) {
        ApiWrapper created = switch (props.getNetwork()) {
            case NILE -> ApiWrapper.ofNile(key);
            case SHASTA -> ApiWrapper.ofShasta(key);
            case MAINNET -> {
                if (props.getApiKey() == null || props.getApiKey().isBlank()) {
                    throw new IllegalStateException("rpc.api-key is required for MAINNET");
                }
                yield ApiWrapper.ofMainnet(key, props.getApiKey());
            }
            case CUSTOM -> {
                if (props.getGrpcEndpoint() == null || props.getGrpcEndpointSolidity() == null) {
                    throw new IllegalStateException("rpc.grpc-endpoint and rpc.grpc-endpoint-solidity are required for CUSTOM");
                }
                yield new ApiWrapper(props.getGrpcEndpoint(), props.getGrpcEndpointSolidity(), key);
            }
        };
        log.info("Connected to {} (endpoint={})", props.getNetwork(),
                props.getNetwork() == RpcProperties.Network.CUSTOM ? props.getGrpcEndpoint() : "trongrid");
        return created;
    }

    @PreDestroy
    public void shutdown() {
        ApiWrapper current = wrapper;
        if (current != null) {
            current.close();
        }
    }
}
