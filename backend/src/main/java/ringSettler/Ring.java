package ringSettler;

import java.util.List;
import java.util.Objects;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A cyclic sequence of orders where order {@code i} sells the token order {@code i + 1} buys.
 *
 * <p>A ring is built fresh for one settlement attempt and driven through
 * {@link #updateHash()}, {@link #checkOrdersValid()}, {@link #checkTokensRegistered()},
 * {@link #calculateFillAmountAndFee()} and {@link #getRingTransferItems(int)}. The orders are
 * mutated in place while fitting and must not be shared with another ring.
 */
public final class Ring {
    private static final Logger LOG = LoggerFactory.getLogger(Ring.class);

    private final List<Order> orders;
    private final String owner;
    private final String feeRecipient;
    private final RingValidator validator;
    private final OrderFitter fitter;
    private final TransferPlanner planner;
    private byte[] hash;
    private boolean valid = true;

    public Ring(SettlementContext context, List<Order> orders, String owner, String feeRecipient) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(orders, "orders");
        if (orders.size() < 2) {
            throw new IllegalArgumentException("a ring needs at least two orders");
        }
        this.orders = List.copyOf(orders);
        this.owner = Objects.requireNonNull(owner, "owner");
        this.feeRecipient = Objects.requireNonNull(feeRecipient, "feeRecipient");
        this.validator = new RingValidator(context.tokenRegistry());
        this.fitter = new OrderFitter(context.spendableScaler());
        this.planner = new TransferPlanner(context.feeHolder());
    }

    public List<Order> getOrders() {
        return orders;
    }

    public int size() {
        return orders.size();
    }

    public String getOwner() {
        return owner;
    }

    public String getFeeRecipient() {
        return feeRecipient;
    }

    public boolean isValid() {
        return valid;
    }

    /**
     * @return the ring hash, or {@code null} before {@link #updateHash()} was called
     */
    public byte[] getHash() {
        return hash == null ? null : hash.clone();
    }

    public String getHashHex() {
        return hash == null ? null : "0x" + Hex.toHexString(hash);
    }

    public void updateHash() {
        hash = RingIdentity.compute(orders);
    }

    public void checkOrdersValid() {
        valid = validator.checkOrdersValid(orders, valid);
    }

    public void checkTokensRegistered() {
        valid = validator.checkTokensRegistered(orders, valid);
    }

    /**
     * Scales every order by its spendable amount and fits the fill amounts of the whole ring.
     *
     * @throws UnsettleableRingException if some edge of the ring cannot be made consistent;
     *                                   the ring is invalid afterwards
     */
    public void calculateFillAmountAndFee() {
        try {
            fitter.fit(orders);
        } catch (UnsettleableRingException ex) {
            valid = false;
            LOG.warn("Ring {} is unsettleable: {}", getHashHex(), ex.getMessage());
            throw ex;
        } catch (RuntimeException ex) {
            valid = false;
            LOG.warn("Fitting ring {} failed", getHashHex(), ex);
            throw ex;
        }
        // scaling may have invalidated orders
        checkOrdersValid();
    }

    /**
     * Plans the transfers settling this ring. Fee and spread go entirely to the fee holder.
     *
     * @param walletSplitPercentage share of fees reserved for wallets, in {@code [0, 100]}
     * @return the ordered transfers, empty when the ring is invalid
     * @throws IllegalArgumentException if {@code walletSplitPercentage} is out of range
     * @throws RingInvariantException   if a fitted order violates its bounds
     */
    public List<TransferItem> getRingTransferItems(int walletSplitPercentage) {
        if (walletSplitPercentage < 0 || walletSplitPercentage > 100) {
            throw new IllegalArgumentException("invalid walletSplitPercentage: " + walletSplitPercentage);
        }
        if (!valid) {
            LOG.warn("Ring {} cannot be settled", getHashHex());
            return List.of();
        }
        return planner.plan(orders);
    }
}
