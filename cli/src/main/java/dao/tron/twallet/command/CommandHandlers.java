package dao.tron.twallet.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dao.tron.twallet.config.RpcProperties;
import dao.tron.twallet.config.TestProperties;
import dao.tron.twallet.config.TokenProperties;
import dao.tron.twallet.config.WalletProperties;
import dao.tron.twallet.config.WorkerProperties;
import dao.tron.twallet.model.BalanceResult;
import dao.tron.twallet.model.TransferSummary;
import dao.tron.twallet.model.TxResult;
import dao.tron.twallet.model.Wallet;
import dao.tron.twallet.service.AccountService;
import dao.tron.twallet.service.TokenService;
import dao.tron.twallet.service.TransferService;
import dao.tron.twallet.service.WalletService;
import dao.tron.twallet.util.TronKeys;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One method per CLI command. Results go to {@code out}, progress goes to the log.
 */
@Component
public class CommandHandlers {

    private static final String REDACTED = "<redacted>";

    private final WalletService walletService;
    private final AccountService accountService;
    private final TokenService tokenService;
    private final TransferService transferService;
    private final RpcProperties rpcProps;
    private final TokenProperties tokenProps;
    private final WalletProperties walletProps;
    private final TestProperties testProps;
    private final WorkerProperties workerProps;
    private final ObjectMapper objectMapper;
    private final PrintStream out;

    @Autowired
    public CommandHandlers(WalletService walletService,
                           AccountService accountService,
                           TokenService tokenService,
                           TransferService transferService,
                           RpcProperties rpcProps,
                           TokenProperties tokenProps,
                           WalletProperties walletProps,
                           TestProperties testProps,
                           WorkerProperties workerProps,
                           ObjectMapper objectMapper) {
        this(walletService, accountService, tokenService, transferService,
                rpcProps, tokenProps, walletProps, testProps, workerProps, objectMapper, System.out);
    }

    CommandHandlers(WalletService walletService,
                    AccountService accountService,
                    TokenService tokenService,
                    TransferService transferService,
                    RpcProperties rpcProps,
                    TokenProperties tokenProps,
                    WalletProperties walletProps,
                    TestProperties testProps,
                    WorkerProperties workerProps,
                    ObjectMapper objectMapper,
                    PrintStream out) {
        this.walletService = walletService;
        this.accountService = accountService;
        this.tokenService = tokenService;
        this.transferService = transferService;
        this.rpcProps = rpcProps;
        this.tokenProps = tokenProps;
        this.walletProps = walletProps;
        this.testProps = testProps;
        this.workerProps = workerProps;
        this.objectMapper = objectMapper;
        this.out = out;
    }

    /**
     * Generates {@code count} wallets. Without a directory the keys are printed as a
     * {@code wallets.keys} block ready to paste into the config file.
     */
    public void walletGenerate(int count, Path dir) {
        List<Wallet> wallets = walletService.generate(count);
        if (dir != null) {
            printSaved(walletService.save(wallets, dir));
            return;
        }
        out.println("wallets:");
        out.println("  keys:");
        for (Wallet wallet : wallets) {
            out.println("    - " + wallet.privateKey() + "  # " + wallet);
        }
    }

    /**
     * Prints configured wallets. With neither or both flags each line is {@code address | key}.
     */
    public void walletList(boolean pubkey, boolean keypair) {
        for (Wallet wallet : walletService.configuredWallets()) {
            if (pubkey == keypair) {
                out.println(wallet.address() + " | " + wallet.privateKey());
            } else if (pubkey) {
                out.println(wallet.address());
            } else {
                out.println(wallet.privateKey());
            }
        }
    }

    public void walletSave(Path dir) {
        printSaved(walletService.save(walletService.configuredWallets(), dir));
    }

    public void walletRead(Path file) {
        out.println(walletService.read(file).privateKey());
    }

    public void showConfig() {
        Map<String, Object> config = new LinkedHashMap<>();

        Map<String, Object> rpc = new LinkedHashMap<>();
        rpc.put("network", rpcProps.getNetwork());
        rpc.put("grpcEndpoint", rpcProps.getGrpcEndpoint());
        rpc.put("grpcEndpointSolidity", rpcProps.getGrpcEndpointSolidity());
        rpc.put("apiKey", rpcProps.getApiKey() == null ? null : REDACTED);
        rpc.put("maxConcurrentCalls", rpcProps.getMaxConcurrentCalls());
        rpc.put("feeLimit", rpcProps.getFeeLimit());
        rpc.put("polling", rpcProps.getPolling());
        config.put("rpc", rpc);

        Map<String, Object> token = new LinkedHashMap<>();
        token.put("owner", walletService.tokenOwner().map(Wallet::address).orElse(null));
        token.put("address", tokenProps.getAddress());
        token.put("decimals", tokenProps.getDecimals());
        token.put("name", tokenProps.getName());
        token.put("symbol", tokenProps.getSymbol());
        token.put("artifact", tokenProps.getArtifact() == null ? null : tokenProps.getArtifact().getDescription());
        config.put("token", token);

        Map<String, Object> wallets = new LinkedHashMap<>();
        wallets.put("keys", walletService.configuredWallets().stream().map(Wallet::address).toList());
        wallets.put("funder", walletProps.getFunder() == null
                ? null
                : Wallet.fromPrivateKey(-1, walletProps.getFunder()).address());
        config.put("wallets", wallets);

        config.put("test", Map.of("transfers", testProps.getTransfers()));

        Map<String, Object> worker = new LinkedHashMap<>();
        worker.put("lanes", workerProps.getLanes());
        worker.put("trxTransfers", workerProps.getTrxTransfers());
        worker.put("tokenTransfers", workerProps.getTokenTransfers());
        config.put("worker", worker);

        try {
            out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(config));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Can't serialize config: " + e.getOriginalMessage(), e);
        }
    }

    public void balances() {
        for (BalanceResult result : accountService.balances()) {
            out.println(result.format());
        }
    }

    public void airdrop(BigDecimal trx, boolean confirm) {
        for (TxResult result : accountService.airdrop(trx, confirm)) {
            out.println(result.format());
        }
    }

    public void tokenDeploy() {
        String contract = tokenService.deploy();
        out.println("contract address = " + contract);
        out.println("set token.address: " + contract + " in the config file to use it");
    }

    public void tokenBalances() {
        for (BalanceResult result : tokenService.balances()) {
            out.println(result.format());
        }
    }

    public void tokenMint(String holder, BigDecimal amount) {
        if (!TronKeys.isValidAddress(holder)) {
            throw new UsageException("Invalid holder address: " + holder);
        }
        out.println("tx id = " + tokenService.mint(holder, amount));
    }

    public void testTransferTrx() {
        printSummary("TRX", transferService.transferTrx());
    }

    public void testTransferTokens() {
        printSummary("Tokens", transferService.transferTokens());
    }

    public void help(String usage) {
        out.println(usage);
    }

    private void printSaved(List<Path> files) {
        for (Path file : files) {
            out.println("saved " + file);
        }
    }

    private void printSummary(String asset, TransferSummary summary) {
        out.println(asset + " transfers: ok = " + summary.succeeded()
                + ", failed = " + summary.failed()
                + ", skipped = " + summary.skipped());
    }
}
