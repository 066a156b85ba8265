package dao.tron.twallet.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "rpc")
public class RpcProperties {

    public enum Network { NILE, SHASTA, MAINNET, CUSTOM }

    /**
     * Target network. NILE, SHASTA and MAINNET use the public TronGrid endpoints.
     */
    @NotNull
    private Network network = Network.NILE;

    /**
     * Full node gRPC endpoint, CUSTOM network only.
     * Example: 127.0.0.1:50051
     */
    private String grpcEndpoint;

    /**
     * Solidity node gRPC endpoint, CUSTOM network only.
     * Example: 127.0.0.1:50061
     */
    private String grpcEndpointSolidity;

    /**
     * TronGrid API key (required by MAINNET).
     */
    private String apiKey;

    /**
     * Size of the thread pool running blocking RPC calls.
     * Bounds the number of simultaneous requests regardless of the worker mode.
     */
    @Min(1)
    private int maxConcurrentCalls = 64;

    /**
     * Fee limit for TRC-20 contract calls, in sun.
     */
    @Min(1)
    private long feeLimit = 100_000_000L;

    @Valid
    private Polling polling = new Polling();

    @Data
    public static class Polling {
        /**
         * Timeout for getting TransactionInfo after broadcasting a tx.
         */
        @Min(1)
        private long txInfoTimeoutSeconds = 60;
        /**
         * Initial poll interval for TransactionInfo.
         */
        @Min(1)
        private long txInfoPollInitialMs = 250;
        /**
         * Maximum poll interval for TransactionInfo (backoff cap).
         */
        @Min(1)
        private long txInfoPollMaxMs = 2000;
    }
}
