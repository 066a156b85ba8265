package dao.tron.twallet.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dao.tron.twallet.config.RpcExecutorConfig;
import dao.tron.twallet.config.TokenProperties;
import dao.tron.twallet.model.BalanceResult;
import dao.tron.twallet.model.ContractArtifact;
import dao.tron.twallet.model.Wallet;
import dao.tron.twallet.scheduler.Job;
import dao.tron.twallet.scheduler.Worker;
import dao.tron.twallet.scheduler.WorkerFactory;
import dao.tron.twallet.util.Units;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * TRC-20 token operations against the contract configured in {@code token.address}.
 */
@Slf4j
@Service
public class TokenService {

    private static final String DEFAULT_CONTRACT_NAME = "MintableTRC20";

    private final ChainClient chainClient;
    private final WalletService walletService;
    private final WorkerFactory workerFactory;
    private final TokenProperties tokenProps;
    private final ObjectMapper objectMapper;
    private final Executor rpcExecutor;

    public TokenService(ChainClient chainClient,
                        WalletService walletService,
                        WorkerFactory workerFactory,
                        TokenProperties tokenProps,
                        ObjectMapper objectMapper,
                        @Qualifier(RpcExecutorConfig.RPC_EXECUTOR) Executor rpcExecutor) {
        this.chainClient = chainClient;
        this.walletService = walletService;
        this.workerFactory = workerFactory;
        this.tokenProps = tokenProps;
        this.objectMapper = objectMapper;
        this.rpcExecutor = rpcExecutor;
    }

    public BigInteger toSubunits(BigDecimal coins) {
        return Units.toSubunits(coins, tokenProps.getDecimals());
    }

    public BigDecimal toCoins(BigInteger subunits) {
        return Units.fromSubunits(subunits, tokenProps.getDecimals());
    }

    public String contractAddress() {
        String address = tokenProps.getAddress();
        if (address == null || address.isBlank()) {
            throw new IllegalStateException("token.address is not configured");
        }
        return address;
    }

    /**
     * Token balance of every configured wallet. Lanes query their wallets one at a time.
     *
     * @return one result per configured wallet, in wallet order
     */
    public List<BalanceResult> balances() {
        String contract = contractAddress();
        Worker<BalanceResult> worker = workerFactory.newWorker();
        for (Wallet wallet : walletService.configuredWallets()) {
            worker.push(Job.supplyAsync(() -> queryBalance(contract, wallet), rpcExecutor));
        }
        List<BalanceResult> results = new ArrayList<>(worker.runAndCollectResults());
        results.sort(Comparator.comparingInt(BalanceResult::index));
        return results;
    }

    /**
     * Mints {@code amount} whole tokens to {@code holder} and waits for the confirmation.
     *
     * @return mint transaction id
     */
    public String mint(String holder, BigDecimal amount) {
        String contract = contractAddress();
        Wallet owner = walletService.tokenOwner()
                .orElseThrow(() -> new IllegalStateException("token.owner is not configured"));
        BigInteger subunits = toSubunits(amount);
        if (subunits.signum() <= 0) {
            throw new IllegalArgumentException("Mint amount is below the token's smallest unit: " + amount.toPlainString());
        }

        String txId = chainClient.trc20Mint(contract, owner.keyPair(), holder, subunits);
        log.info("Mint {} -> {} broadcast: tx={}", amount.toPlainString(), holder, txId);
        long block = chainClient.waitForConfirmation(txId);
        log.info("Mint tx {} confirmed in block {}", txId, block);
        return txId;
    }

    /**
     * Deploys the {@code token.artifact} contract from the owner wallet with
     * {@code (token.name, token.symbol, token.decimals)} and waits for the confirmation.
     *
     * @return the new contract address, to be set as {@code token.address}
     */
    public String deploy() {
        Wallet owner = walletService.tokenOwner()
                .orElseThrow(() -> new IllegalStateException("token.owner is not configured"));
        ContractArtifact artifact = loadArtifact(tokenProps.getArtifact());

        String txId = chainClient.trc20Deploy(owner.keyPair(), artifact,
                tokenProps.getName(), tokenProps.getSymbol(), tokenProps.getDecimals());
        log.info("Deploy {} ({}, {}, {}) from {} broadcast: tx={}", artifact.contractName(),
                tokenProps.getName(), tokenProps.getSymbol(), tokenProps.getDecimals(), owner.address(), txId);
        String contract = chainClient.waitForContractAddress(txId);
        log.info("Deploy tx {} confirmed, contract {}", txId, contract);
        return contract;
    }

    /**
     * Reads a compiled contract JSON. {@code abi} may be an array or a string,
     * {@code bytecode} may carry a 0x prefix.
     */
    ContractArtifact loadArtifact(Resource resource) {
        if (resource == null) {
            throw new IllegalStateException(
                    "token.artifact is not configured; compile classpath:contracts/MintableTRC20.sol and point it at the JSON");
        }
        if (!resource.exists()) {
            throw new IllegalStateException("token.artifact not found: " + resource.getDescription());
        }
        JsonNode root;
        try (InputStream in = resource.getInputStream()) {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Can't read contract artifact: " + resource.getDescription(), e);
        }

        JsonNode abi = root.path("abi");
        String bytecode = root.path("bytecode").asText("");
        if (bytecode.startsWith("0x") || bytecode.startsWith("0X")) {
            bytecode = bytecode.substring(2);
        }
        if (abi.isMissingNode() || abi.isNull() || bytecode.isEmpty()) {
            throw new IllegalStateException("Contract artifact needs \"abi\" and \"bytecode\": " + resource.getDescription());
        }
        String name = root.path("contractName").asText(DEFAULT_CONTRACT_NAME);
        return new ContractArtifact(name, abi.isTextual() ? abi.asText() : abi.toString(), bytecode);
    }

    private BalanceResult queryBalance(String contract, Wallet wallet) {
        try {
            return BalanceResult.ok(wallet.index(), wallet.address(),
                    toCoins(chainClient.trc20BalanceOf(contract, wallet.address())));
        } catch (ChainClientException e) {
            return BalanceResult.failed(wallet.index(), wallet.address(), e.getMessage());
        }
    }
}
