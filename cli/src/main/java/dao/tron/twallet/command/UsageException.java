package dao.tron.twallet.command;

/**
 * Malformed command line. Reported with the usage text and exit code 2.
 */
public class UsageException extends RuntimeException {

    public UsageException(String message) {
        super(message);
    }
}
