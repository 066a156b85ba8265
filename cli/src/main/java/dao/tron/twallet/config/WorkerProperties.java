package dao.tron.twallet.config;

import dao.tron.twallet.scheduler.RunMode;
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
@ConfigurationProperties(prefix = "worker")
public class WorkerProperties {

    /**
     * Number of lanes (parallel threads) per worker.
     * Default: unset, one lane per available processor.
     */
    @Min(1)
    private Integer lanes;

    @Valid
    private Batching trxTransfers = new Batching(RunMode.ALL_JOINED, null);

    @Valid
    private Batching tokenTransfers = new Batching(RunMode.SINGLE_THREADED, 32);

    @Data
    public static class Batching {

        @NotNull
        private RunMode mode;

        /**
         * Chunk size for SINGLE_THREADED mode.
         * Default: unset, the lane count.
         */
        @Min(1)
        private Integer batchSize;

        public Batching() {
            this(RunMode.ALL_JOINED, null);
        }

        public Batching(RunMode mode, Integer batchSize) {
            this.mode = mode;
            this.batchSize = batchSize;
        }
    }
}
