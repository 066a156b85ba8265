package dao.tron.twallet.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "token")
public class TokenProperties {

    /**
     * Token owner private key (hex, 64 characters). Signs mint calls.
     */
    @Pattern(regexp = WalletProperties.PRIVATE_KEY_PATTERN)
    private String owner;

    /**
     * TRC-20 token contract address (base58 format)
     * Example: TXYZopYRdj2D9XRtbG411XZZ3kM5VkAeBf
     */
    private String address;

    @Min(0)
    @Max(36)
    private int decimals = 6;

    /**
     * Constructor arguments used by {@code token deploy}.
     */
    @NotBlank
    private String name = "Test Token";

    @NotBlank
    private String symbol = "TTK";

    /**
     * Compiled mintable TRC-20 (JSON with "abi" and "bytecode"), deployed by {@code token deploy}.
     * Accepts {@code classpath:} and {@code file:} locations.
     * The constructor must take (string name, string symbol, uint8 decimals),
     * as {@code classpath:contracts/MintableTRC20.sol} does.
     * Example: file:build/MintableTRC20.json
     */
    private Resource artifact;
}
