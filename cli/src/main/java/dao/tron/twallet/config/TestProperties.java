package dao.tron.twallet.config;

import dao.tron.twallet.model.TransferCase;
import jakarta.validation.Valid;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "test")
public class TestProperties {

    @Valid
    private Transfers transfers = new Transfers();

    @Data
    public static class Transfers {
        /**
         * TRX transfers between configured wallets.
         */
        @Valid
        private List<TransferCase> trx = new ArrayList<>();

        /**
         * TRC-20 transfers between configured wallets.
         */
        @Valid
        private List<TransferCase> tokens = new ArrayList<>();
    }
}
