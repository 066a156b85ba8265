package dao.tron.twallet.service;

public class ChainClientException extends RuntimeException {

    public ChainClientException(String message) {
        super(message);
    }

    public ChainClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
