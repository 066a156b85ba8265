package dao.tron.twallet.service;

import dao.tron.twallet.config.RpcExecutorConfig;
import dao.tron.twallet.config.TestProperties;
import dao.tron.twallet.config.WorkerProperties;
import dao.tron.twallet.model.TransferCase;
import dao.tron.twallet.model.TransferSummary;
import dao.tron.twallet.model.Wallet;
import dao.tron.twallet.scheduler.Job;
import dao.tron.twallet.scheduler.Worker;
import dao.tron.twallet.scheduler.WorkerFactory;
import dao.tron.twallet.util.Units;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.tron.trident.core.key.KeyPair;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Batched test transfers between configured wallets ({@code test.transfers.*}).
 *
 * <p>Each transfer is one worker job that checks the sender balance, broadcasts, and waits for
 * the confirmation. Jobs report their own failures; the worker only sees completions.</p>
 */
@Slf4j
@Service
public class TransferService {

    private final ChainClient chainClient;
    private final WalletService walletService;
    private final TokenService tokenService;
    private final WorkerFactory workerFactory;
    private final TestProperties testProps;
    private final WorkerProperties workerProps;
    private final Executor rpcExecutor;

    public TransferService(ChainClient chainClient,
                           WalletService walletService,
                           TokenService tokenService,
                           WorkerFactory workerFactory,
                           TestProperties testProps,
                           WorkerProperties workerProps,
                           @Qualifier(RpcExecutorConfig.RPC_EXECUTOR) Executor rpcExecutor) {
        this.chainClient = chainClient;
        this.walletService = walletService;
        this.tokenService = tokenService;
        this.workerFactory = workerFactory;
        this.testProps = testProps;
        this.workerProps = workerProps;
        this.rpcExecutor = rpcExecutor;
    }

    public TransferSummary transferTrx() {
        Asset trx = new Asset() {
            @Override public String name() { return "TRX"; }
            @Override public BigInteger toSubunits(BigDecimal amount) { return BigInteger.valueOf(Units.trxToSun(amount)); }
            @Override public BigDecimal toCoins(BigInteger subunits) { return Units.sunToTrx(subunits.longValueExact()); }
            @Override public BigInteger balanceOf(String address) { return BigInteger.valueOf(chainClient.getBalance(address)); }
            @Override public String send(KeyPair sender, String to, BigInteger subunits) {
                return chainClient.transfer(sender, to, subunits.longValueExact());
            }
        };
        return runTransfers(trx, testProps.getTransfers().getTrx(), workerProps.getTrxTransfers());
    }

    public TransferSummary transferTokens() {
        String contract = tokenService.contractAddress();
        Asset token = new Asset() {
            @Override public String name() { return "Tokens"; }
            @Override public BigInteger toSubunits(BigDecimal amount) { return tokenService.toSubunits(amount); }
            @Override public BigDecimal toCoins(BigInteger subunits) { return tokenService.toCoins(subunits); }
            @Override public BigInteger balanceOf(String address) { return chainClient.trc20BalanceOf(contract, address); }
            @Override public String send(KeyPair sender, String to, BigInteger subunits) {
                return chainClient.trc20Transfer(contract, sender, to, subunits);
            }
        };
        return runTransfers(token, testProps.getTransfers().getTokens(), workerProps.getTokenTransfers());
    }

    private TransferSummary runTransfers(Asset asset, List<TransferCase> cases, WorkerProperties.Batching batching) {
        List<Wallet> wallets = walletService.configuredWallets();
        if (wallets.isEmpty()) {
            log.warn("No wallets configured, nothing to transfer");
            return TransferSummary.empty();
        }

        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();
        int skipped = 0;

        Worker<Void> worker = workerFactory.newWorker();
        for (int i = 0; i < cases.size(); i++) {
            TransferCase c = cases.get(i);
            if (c.getFrom() >= wallets.size()) {
                log.error("{}. invalid sender wallet index {}", i, c.getFrom());
                skipped++;
                continue;
            }
            if (c.getTo() >= wallets.size()) {
                log.error("{}. invalid receiver wallet index {}", i, c.getTo());
                skipped++;
                continue;
            }
            BigInteger subunits = validSubunits(i, asset, c.getAmount());
            if (subunits == null) {
                skipped++;
                continue;
            }
            int n = i;
            Wallet from = wallets.get(c.getFrom());
            Wallet to = wallets.get(c.getTo());
            worker.push(Job.runAsync(() -> {
                if (executeOne(n, asset, from, to, subunits)) {
                    succeeded.incrementAndGet();
                } else {
                    failed.incrementAndGet();
                }
            }, rpcExecutor));
        }

        log.info("Running {} {} transfer(s) (mode={}, lanes={})",
                worker.size(), asset.name(), batching.getMode(), worker.laneCount());
        workerFactory.run(worker, batching);

        TransferSummary summary = new TransferSummary(succeeded.get(), failed.get(), skipped);
        log.info("{} transfers finished: ok={}, failed={}, skipped={}",
                asset.name(), summary.succeeded(), summary.failed(), summary.skipped());
        return summary;
    }

    /**
     * @return the amount in subunits, or null if it is zero after flooring or does not fit the asset
     */
    private static BigInteger validSubunits(int i, Asset asset, BigDecimal amount) {
        BigInteger subunits;
        try {
            subunits = asset.toSubunits(amount);
        } catch (ArithmeticException e) {
            log.error("{}. invalid {} amount {}: out of range", i, asset.name(), amount.toPlainString());
            return null;
        }
        if (subunits.signum() <= 0) {
            log.error("{}. invalid {} amount {}: below the smallest unit", i, asset.name(), amount.toPlainString());
            return null;
        }
        return subunits;
    }

    private boolean executeOne(int i, Asset asset, Wallet from, Wallet to, BigInteger subunits) {
        BigDecimal coins = asset.toCoins(subunits);
        try {
            BigInteger senderBalance = asset.balanceOf(from.address());
            if (subunits.compareTo(senderBalance) > 0) {
                log.error("{}. transfer {} -> {} error: insufficient balance {} < {}",
                        i, from.address(), to.address(), asset.toCoins(senderBalance).toPlainString(), coins.toPlainString());
                return false;
            }

            String txId = asset.send(from.keyPair(), to.address(), subunits);
            log.info("{}. transferred {} {} from {} to {}, tx: {}",
                    i, coins.toPlainString(), asset.name(), from.address(), to.address(), txId);

            long start = System.nanoTime();
            long block = chainClient.waitForConfirmation(txId);
            long spentMs = (System.nanoTime() - start) / 1_000_000L;
            log.info("{}. tx: {} confirmed in {} ms (block {})", i, txId, spentMs, block);
            return true;
        } catch (Exception e) {
            log.error("{}. transfer {} {} {} -> {} error: {}",
                    i, coins.toPlainString(), asset.name(), from.address(), to.address(), e.getMessage());
            return false;
        }
    }

    private interface Asset {
        String name();
        BigInteger toSubunits(BigDecimal amount);
        BigDecimal toCoins(BigInteger subunits);
        BigInteger balanceOf(String address);
        String send(KeyPair sender, String to, BigInteger subunits);
    }
}
