package ringSettler;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes consistent fill amounts for every order of a ring.
 *
 * <p>Each order is first bounded by its spendable balance. A backward sweep then shrinks every
 * predecessor whose buy amount exceeds what its successor sells, and a second sweep re-runs
 * from the end of the ring down to the last position that caused a shrink. A final forward
 * pass makes every edge exact, turning any surplus into {@code splitS}.
 *
 * <p>All divisions truncate, so rounding can only shrink amounts.
 */
final class OrderFitter {
    private static final Logger LOG = LoggerFactory.getLogger(OrderFitter.class);

    private final SpendableAmountScaler spendableScaler;

    OrderFitter(SpendableAmountScaler spendableScaler) {
        this.spendableScaler = Objects.requireNonNull(spendableScaler, "spendableScaler");
    }

    void fit(List<Order> orders) {
        scaleBySpendableAmount(orders);

        int ringSize = orders.size();
        if (LOG.isDebugEnabled()) {
            LOG.debug("Ring rate before fitting: {}", rate(orders));
        }

        int smallest = 0;
        for (int i = ringSize - 1; i >= 0; i--) {
            smallest = resize(orders, i, smallest);
        }
        for (int i = ringSize - 1; i >= smallest; i--) {
            resize(orders, i, smallest);
        }

        for (int i = 0; i < ringSize; i++) {
            Order current = orders.get(i);
            Order next = orders.get(nextIndex(i, ringSize));
            if (next.getFillAmountS().compareTo(current.getFillAmountB()) < 0) {
                throw new UnsettleableRingException("unsettleable ring: order " + nextIndex(i, ringSize)
                        + " sells " + next.getFillAmountS() + " but order " + i
                        + " requires " + current.getFillAmountB());
            }
            next.setSplitS(next.getFillAmountS().subtract(current.getFillAmountB()));
            next.setFillAmountS(current.getFillAmountB());
        }
    }

    private void scaleBySpendableAmount(List<Order> orders) {
        CompletableFuture<?>[] pending = new CompletableFuture<?>[orders.size()];
        for (int i = 0; i < orders.size(); i++) {
            CompletableFuture<Void> scaled;
            try {
                scaled = spendableScaler.scale(orders.get(i));
            } catch (RuntimeException ex) {
                throw scalingFailed(ex);
            }
            if (scaled == null) {
                throw new UnsettleableRingException("spendable amount scaling failed: no result for order " + i);
            }
            pending[i] = scaled;
        }
        try {
            CompletableFuture.allOf(pending).join();
        } catch (CompletionException ex) {
            throw scalingFailed(ex.getCause() != null ? ex.getCause() : ex);
        } catch (CancellationException ex) {
            throw scalingFailed(ex);
        }
    }

    private static UnsettleableRingException scalingFailed(Throwable cause) {
        return new UnsettleableRingException("spendable amount scaling failed: " + cause.getMessage(), cause);
    }

    /**
     * Shrinks the predecessor of order {@code i} when it wants more than order {@code i} sells.
     *
     * @return {@code i} when a shrink happened, otherwise {@code smallest}
     */
    static int resize(List<Order> orders, int i, int smallest) {
        int j = previousIndex(i, orders.size());
        Order order = orders.get(i);
        Order prevOrder = orders.get(j);

        if (prevOrder.getFillAmountB().compareTo(order.getFillAmountS()) <= 0) {
            return smallest;
        }
        prevOrder.setFillAmountB(order.getFillAmountS());
        prevOrder.setFillAmountS(prevOrder.sellFor(prevOrder.getFillAmountB()));
        prevOrder.setFillAmountFee(prevOrder.feeFor(prevOrder.getFillAmountS()));
        return i;
    }

    static int previousIndex(int i, int ringSize) {
        return (i + ringSize - 1) % ringSize;
    }

    static int nextIndex(int i, int ringSize) {
        return (i + 1) % ringSize;
    }

    // Diagnostic only, never gates settlement.
    static BigDecimal rate(List<Order> orders) {
        BigDecimal rate = BigDecimal.ONE;
        for (Order order : orders) {
            rate = rate.multiply(new BigDecimal(order.getAmountS()))
                    .divide(new BigDecimal(order.getAmountB()), MathContext.DECIMAL64);
        }
        return rate;
    }
}
