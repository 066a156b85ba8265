package dao.tron.twallet.config;

import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "wallets")
public class WalletProperties {

    static final String PRIVATE_KEY_PATTERN = "^(0x)?[0-9a-fA-F]{64}$";

    /**
     * Private keys (hex, 64 characters) of the managed wallets.
     * Wallet indices used elsewhere (test transfers) refer to this list.
     */
    private List<@Pattern(regexp = PRIVATE_KEY_PATTERN) String> keys = new ArrayList<>();

    /**
     * Private key paying for airdrops. Defaults to the token owner.
     */
    @Pattern(regexp = PRIVATE_KEY_PATTERN)
    private String funder;
}
