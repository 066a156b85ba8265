package dao.tron.twallet.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import dao.tron.twallet.config.TokenProperties;
import dao.tron.twallet.config.WalletProperties;
import dao.tron.twallet.model.Wallet;
import dao.tron.twallet.model.WalletFile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
public class WalletService {

    private final WalletProperties walletProps;
    private final TokenProperties tokenProps;
    private final ObjectMapper objectMapper;

    public WalletService(WalletProperties walletProps, TokenProperties tokenProps, ObjectMapper objectMapper) {
        this.walletProps = walletProps;
        this.tokenProps = tokenProps;
        this.objectMapper = objectMapper;
    }

    public List<Wallet> configuredWallets() {
        List<String> keys = walletProps.getKeys();
        List<Wallet> wallets = new ArrayList<>(keys.size());
        for (int i = 0; i < keys.size(); i++) {
            wallets.add(Wallet.fromPrivateKey(i, keys.get(i)));
        }
        return wallets;
    }

    public Optional<Wallet> tokenOwner() {
        String owner = tokenProps.getOwner();
        if (owner == null || owner.isBlank()) return Optional.empty();
        return Optional.of(Wallet.fromPrivateKey(-1, owner));
    }

    /**
     * Airdrop payer: {@code wallets.funder}, or the token owner when no funder is configured.
     */
    public Optional<Wallet> funder() {
        String funder = walletProps.getFunder();
        if (funder == null || funder.isBlank()) return tokenOwner();
        return Optional.of(Wallet.fromPrivateKey(-1, funder));
    }

    public List<Wallet> generate(int count) {
        if (count < 1) {
            throw new IllegalArgumentException("count must be positive (current: " + count + ")");
        }
        List<Wallet> wallets = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            wallets.add(Wallet.generate(i));
        }
        return wallets;
    }

    /**
     * Writes one {@code idNNNNNN.json} file per wallet into an existing directory.
     *
     * @return written files, in wallet order
     */
    public List<Path> save(List<Wallet> wallets, Path dir) {
        if (!Files.isDirectory(dir)) {
            throw new IllegalArgumentException("Invalid wallet save dir: " + dir);
        }
        List<Path> written = new ArrayList<>(wallets.size());
        for (Wallet wallet : wallets) {
            Path file = dir.resolve(String.format("id%06d.json", wallet.index()));
            try {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), WalletFile.of(wallet));
            } catch (IOException e) {
                throw new UncheckedIOException("Can't save wallet to file: path: " + file, e);
            }
            log.debug("Wallet {} saved to {}", wallet.address(), file);
            written.add(file);
        }
        return written;
    }

    /**
     * Reads a wallet file written by {@link #save}. The key is authoritative; a stored address
     * that does not match it is reported and ignored.
     */
    public Wallet read(Path file) {
        WalletFile stored;
        try {
            stored = objectMapper.readValue(file.toFile(), WalletFile.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Can't read wallet file: path: " + file, e);
        }
        if (stored.privateKey() == null || stored.privateKey().isBlank()) {
            throw new IllegalArgumentException("Wallet file has no privateKey: " + file);
        }
        Wallet wallet = Wallet.fromPrivateKey(0, stored.privateKey());
        if (stored.address() != null && !stored.address().equals(wallet.address())) {
            log.warn("Wallet file {} lists address {} but its key belongs to {}", file, stored.address(), wallet.address());
        }
        return wallet;
    }
}
