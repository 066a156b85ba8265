package dao.tron.twallet.command;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Dispatches the positional arguments to {@link CommandHandlers} and records the exit code.
 */
@Slf4j
@Component
public class CommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    static final String CONFIG_FILE_PROPERTY = "twallet.config-file";

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: twallet [-c|--config <file>] <command>",
            "",
            "Commands:",
            "  wallet generate <count> [dir]      generate wallets, print them or save to dir",
            "  wallet list [--pubkey] [--keypair] list configured wallets",
            "  wallet save <dir>                  save configured wallets as json files",
            "  wallet read <path>                 print the private key stored in a wallet file",
            "  show-config                        print the effective configuration",
            "  balances                           TRX balances of configured wallets",
            "  airdrop <trx> [--confirm]          send TRX from the funder to every wallet",
            "  token deploy                       deploy token.artifact from the token owner",
            "  token balances                     token balances of configured wallets",
            "  token mint <holder> <amount>       mint tokens to holder",
            "  test transfer trx|tokens           run configured batched test transfers",
            "  help                               print this message");

    private final CommandHandlers handlers;
    private final PrintStream err;
    private int exitCode = EXIT_OK;

    @Autowired
    public CommandRunner(CommandHandlers handlers) {
        this(handlers, System.err);
    }

    CommandRunner(CommandHandlers handlers, PrintStream err) {
        this.handlers = handlers;
        this.err = err;
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            dispatch(args);
            exitCode = EXIT_OK;
        } catch (UsageException e) {
            err.println("error: " + e.getMessage());
            err.println();
            err.println(USAGE);
            exitCode = EXIT_USAGE;
        } catch (RuntimeException e) {
            log.error("{}", e.getMessage());
            log.debug("Command failed", e);
            exitCode = EXIT_ERROR;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Rewrites {@code -c <file>}, {@code --config <file>} and {@code --config=<file>}
     * into the {@value #CONFIG_FILE_PROPERTY} property so Spring can import the file.
     */
    public static String[] normalize(String[] args) {
        List<String> result = new ArrayList<>(args.length);
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ((arg.equals("-c") || arg.equals("--config")) && i + 1 < args.length) {
                result.add("--" + CONFIG_FILE_PROPERTY + "=" + args[++i]);
            } else if (arg.startsWith("--config=")) {
                result.add("--" + CONFIG_FILE_PROPERTY + "=" + arg.substring("--config=".length()));
            } else {
                result.add(arg);
            }
        }
        return result.toArray(new String[0]);
    }

    void dispatch(ApplicationArguments args) {
        List<String> words = args.getNonOptionArgs();
        if (words.isEmpty()) {
            throw new UsageException("missing command");
        }
        switch (words.get(0)) {
            case "help" -> handlers.help(USAGE);
            case "wallet" -> wallet(words, args);
            case "show-config" -> {
                expectArgs(words, 1);
                handlers.showConfig();
            }
            case "balances" -> {
                expectArgs(words, 1);
                handlers.balances();
            }
            case "airdrop" -> {
                expectArgs(words, 2);
                handlers.airdrop(parseAmount(words.get(1)), args.containsOption("confirm"));
            }
            case "token" -> token(words);
            case "test" -> test(words);
            default -> throw new UsageException("unknown command: " + words.get(0));
        }
    }

    private void wallet(List<String> words, ApplicationArguments args) {
        String sub = subcommand(words, "wallet");
        switch (sub) {
            case "generate" -> {
                if (words.size() < 3 || words.size() > 4) {
                    throw new UsageException("usage: wallet generate <count> [dir]");
                }
                handlers.walletGenerate(parseCount(words.get(2)), words.size() == 4 ? Path.of(words.get(3)) : null);
            }
            case "list" -> {
                expectArgs(words, 2);
                handlers.walletList(args.containsOption("pubkey"), args.containsOption("keypair"));
            }
            case "save" -> {
                expectArgs(words, 3);
                handlers.walletSave(Path.of(words.get(2)));
            }
            case "read" -> {
                expectArgs(words, 3);
                handlers.walletRead(Path.of(words.get(2)));
            }
            default -> throw new UsageException("unknown wallet command: " + sub);
        }
    }

    private void token(List<String> words) {
        String sub = subcommand(words, "token");
        switch (sub) {
            case "deploy" -> {
                expectArgs(words, 2);
                handlers.tokenDeploy();
            }
            case "balances" -> {
                expectArgs(words, 2);
                handlers.tokenBalances();
            }
            case "mint" -> {
                expectArgs(words, 4);
                handlers.tokenMint(words.get(2), parseAmount(words.get(3)));
            }
            default -> throw new UsageException("unknown token command: " + sub);
        }
    }

    private void test(List<String> words) {
        if (words.size() != 3 || !words.get(1).equals("transfer")) {
            throw new UsageException("usage: test transfer trx|tokens");
        }
        switch (words.get(2)) {
            case "trx" -> handlers.testTransferTrx();
            case "tokens" -> handlers.testTransferTokens();
            default -> throw new UsageException("unknown transfer kind: " + words.get(2));
        }
    }

    private static String subcommand(List<String> words, String command) {
        if (words.size() < 2) {
            throw new UsageException("missing " + command + " command");
        }
        return words.get(1);
    }

    private static void expectArgs(List<String> words, int count) {
        if (words.size() != count) {
            throw new UsageException("wrong number of arguments for '" + String.join(" ", words) + "'");
        }
    }

    private static int parseCount(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new UsageException("invalid count: " + value);
        }
    }

    private static BigDecimal parseAmount(String value) {
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            throw new UsageException("invalid amount: " + value);
        }
    }
}
