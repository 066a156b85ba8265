package dao.tron.twallet.model;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One configured test transfer between two wallets, referenced by index into {@code wallets.keys}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TransferCase {

    @Min(0)
    private int from;

    @Min(0)
    private int to;

    @NotNull
    @Positive
    private BigDecimal amount;    // TRX or whole tokens
}
