package ringSettler;

import java.util.Objects;

/**
 * Collaborators a ring settles against: the spendable scaler, the token registry and the
 * address credited with fees and captured spread.
 */
public record SettlementContext(
        SpendableAmountScaler spendableScaler,
        TokenRegistry tokenRegistry,
        String feeHolder) {

    public SettlementContext {
        Objects.requireNonNull(spendableScaler, "spendableScaler");
        Objects.requireNonNull(tokenRegistry, "tokenRegistry");
        Objects.requireNonNull(feeHolder, "feeHolder");
    }
}
