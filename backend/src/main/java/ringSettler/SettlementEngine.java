package ringSettler;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SettlementEngine {

    private final SettlementContext context;
    private final List<Consumer<SettlementResult>> settlementListeners = new CopyOnWriteArrayList<>();
    private static final Logger LOG = LoggerFactory.getLogger(SettlementEngine.class);

    public SettlementEngine(SettlementContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    public void onSettlement(Consumer<SettlementResult> listener) {
        if (listener != null) {
            this.settlementListeners.add(listener);
        }
    }

    /**
     * Runs one full settlement attempt over a fresh ring built from {@code orders}.
     *
     * @throws UnsettleableRingException if fitting fails
     * @throws IllegalArgumentException  if the ring or the percentage is malformed
     */
    public SettlementResult settle(List<Order> orders, String owner, String feeRecipient, int walletSplitPercentage) {
        if (walletSplitPercentage < 0 || walletSplitPercentage > 100) {
            throw new IllegalArgumentException("invalid walletSplitPercentage: " + walletSplitPercentage);
        }
        Ring ring = new Ring(context, orders, owner, feeRecipient);
        ring.updateHash();
        LOG.info("Settling ring: hash={}, size={}, owner={}, feeRecipient={}",
                ring.getHashHex(), ring.size(), ring.getOwner(), ring.getFeeRecipient());

        ring.checkOrdersValid();
        ring.checkTokensRegistered();
        if (ring.isValid()) {
            ring.calculateFillAmountAndFee();
        }
        List<TransferItem> transfers = ring.getRingTransferItems(walletSplitPercentage);

        SettlementResult result = new SettlementResult(ring.getHashHex(), ring.isValid(), transfers, Instant.now());
        LOG.info("Ring settled: hash={}, valid={}, transfers={}", result.ringHash(), result.valid(), transfers.size());
        publish(result);
        return result;
    }

    private void publish(SettlementResult result) {
        for (Consumer<SettlementResult> listener : settlementListeners) {
            try {
                listener.accept(result);
            } catch (Exception ex) {
                LOG.warn("Settlement listener failed", ex);
            }
        }
    }
}
