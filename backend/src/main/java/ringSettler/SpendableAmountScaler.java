package ringSettler;

import java.util.concurrent.CompletableFuture;

/**
 * Bounds an order's fill amounts by what its owner can actually fund.
 */
public interface SpendableAmountScaler {

    /**
     * Sets {@code fillAmountS}, {@code fillAmountB} and {@code fillAmountFee} of the order to
     * its spendable-scaled amounts. Implementations may invalidate the order, or complete
     * exceptionally when the balance lookup fails.
     */
    CompletableFuture<Void> scale(Order order);
}
