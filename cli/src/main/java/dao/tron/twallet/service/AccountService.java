package dao.tron.twallet.service;

import dao.tron.twallet.config.RpcExecutorConfig;
import dao.tron.twallet.model.BalanceResult;
import dao.tron.twallet.model.TxResult;
import dao.tron.twallet.model.Wallet;
import dao.tron.twallet.scheduler.Job;
import dao.tron.twallet.scheduler.Worker;
import dao.tron.twallet.scheduler.WorkerFactory;
import dao.tron.twallet.util.Units;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * TRX balances and airdrops for the configured wallets.
 */
@Slf4j
@Service
public class AccountService {

    static final String TOKEN_OWNER_LABEL = "token:owner";

    private final ChainClient chainClient;
    private final WalletService walletService;
    private final WorkerFactory workerFactory;
    private final Executor rpcExecutor;

    public AccountService(ChainClient chainClient,
                          WalletService walletService,
                          WorkerFactory workerFactory,
                          @Qualifier(RpcExecutorConfig.RPC_EXECUTOR) Executor rpcExecutor) {
        this.chainClient = chainClient;
        this.walletService = walletService;
        this.workerFactory = workerFactory;
        this.rpcExecutor = rpcExecutor;
    }

    /**
     * Queries all balances concurrently. Failed queries are reported per wallet.
     *
     * @return one result per configured wallet, in wallet order
     */
    public List<BalanceResult> balances() {
        Worker<BalanceResult> worker = workerFactory.newWorker();
        for (Wallet wallet : walletService.configuredWallets()) {
            worker.push(Job.supplyAsync(() -> queryBalance(wallet), rpcExecutor));
        }
        List<BalanceResult> results = new ArrayList<>(worker.runAllJoinedAndCollectResults());
        // collected lane by lane
        results.sort(Comparator.comparingInt(BalanceResult::index));
        return results;
    }

    /**
     * Sends {@code trx} from the funder to every configured wallet and to the token owner.
     * The funder never pays itself.
     *
     * @param confirm also wait until every successfully broadcast transfer is confirmed
     * @return one result per recipient, configured wallets first, token owner last
     */
    public List<TxResult> airdrop(BigDecimal trx, boolean confirm) {
        long sun = Units.trxToSun(trx);
        if (sun <= 0) {
            throw new IllegalArgumentException("Airdrop amount must be at least 1 sun (current: " + trx.toPlainString() + " TRX)");
        }
        Wallet funder = walletService.funder()
                .orElseThrow(() -> new IllegalStateException("Airdrop needs wallets.funder or token.owner to be configured"));

        List<Wallet> wallets = walletService.configuredWallets();
        Worker<TxResult> sends = workerFactory.newWorker();
        for (Wallet wallet : wallets) {
            pushSend(sends, funder, wallet.index(), String.valueOf(wallet.index()), wallet.address(), sun);
        }
        walletService.tokenOwner().ifPresent(owner ->
                pushSend(sends, funder, wallets.size(), TOKEN_OWNER_LABEL, owner.address(), sun));

        List<TxResult> results = new ArrayList<>(sends.runAllJoinedAndCollectResults());
        results.sort(Comparator.comparingInt(TxResult::index));
        if (!confirm) {
            return results;
        }

        log.info("Waiting for confirmation of all transactions...");
        Worker<TxResult> confirmations = workerFactory.newWorker();
        for (TxResult result : results) {
            if (result.isSent()) {
                confirmations.push(Job.supplyAsync(() -> confirm(result), rpcExecutor));
            } else {
                confirmations.push(() -> CompletableFuture.completedFuture(result));
            }
        }
        List<TxResult> confirmed = new ArrayList<>(confirmations.runAllJoinedAndCollectResults());
        confirmed.sort(Comparator.comparingInt(TxResult::index));
        return confirmed;
    }

    private void pushSend(Worker<TxResult> worker, Wallet funder, int index, String label, String address, long sun) {
        if (address.equals(funder.address())) {
            log.info("Skipping airdrop to {} ({}): it is the funder", label, address);
            return;
        }
        worker.push(Job.supplyAsync(() -> send(funder, index, label, address, sun), rpcExecutor));
    }

    private TxResult send(Wallet funder, int index, String label, String address, long sun) {
        try {
            return TxResult.sent(index, label, address, chainClient.transfer(funder.keyPair(), address, sun));
        } catch (ChainClientException e) {
            log.debug("Airdrop to {} failed", address, e);
            return TxResult.failed(index, label, address, e.getMessage());
        }
    }

    private TxResult confirm(TxResult sent) {
        try {
            chainClient.waitForConfirmation(sent.txId());
            return sent.confirmedOk();
        } catch (ChainClientException e) {
            return sent.confirmationFailed(e.getMessage());
        }
    }

    private BalanceResult queryBalance(Wallet wallet) {
        try {
            return BalanceResult.ok(wallet.index(), wallet.address(), Units.sunToTrx(chainClient.getBalance(wallet.address())));
        } catch (ChainClientException e) {
            return BalanceResult.failed(wallet.index(), wallet.address(), e.getMessage());
        }
    }
}
