package ringSettler;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns fitted orders into the ordered transfers that settle a ring. Each order pays its
 * principal to the owner of its ring-predecessor, and its fee and spread to the fee holder.
 */
final class TransferPlanner {
    private static final Logger LOG = LoggerFactory.getLogger(TransferPlanner.class);

    private final String feeHolder;

    TransferPlanner(String feeHolder) {
        this.feeHolder = Objects.requireNonNull(feeHolder, "feeHolder");
    }

    List<TransferItem> plan(List<Order> orders) {
        int ringSize = orders.size();
        List<TransferItem> transferItems = new ArrayList<>(ringSize * 3);
        for (int i = 0; i < ringSize; i++) {
            Order currOrder = orders.get(i);
            String token = currOrder.getTokenS();
            String from = currOrder.getOwner();
            String to = orders.get(OrderFitter.previousIndex(i, ringSize)).getOwner();
            BigInteger amount = currOrder.getFillAmountS();

            logOrder(i, currOrder);
            checkBounds(i, currOrder);

            if (amount.signum() == 0) {
                continue;
            }

            transferItems.add(new TransferItem(token, from, to, amount));
            if (currOrder.getFillAmountFee().signum() > 0) {
                transferItems.add(new TransferItem(currOrder.getFeeToken(), from, feeHolder, currOrder.getFillAmountFee()));
            }
            if (currOrder.getSplitS().signum() > 0) {
                transferItems.add(new TransferItem(token, from, feeHolder, currOrder.getSplitS()));
            }
        }
        return List.copyOf(transferItems);
    }

    static void checkBounds(int index, Order order) {
        BigInteger fillAmountS = order.getFillAmountS();
        BigInteger splitS = order.getSplitS();
        BigInteger fillAmountFee = order.getFillAmountFee();
        require(fillAmountS.signum() >= 0, index, "fillAmountS should be non-negative");
        require(splitS.signum() >= 0, index, "splitS should be non-negative");
        require(fillAmountFee.signum() >= 0, index, "fillAmountFee should be non-negative");
        require(fillAmountS.add(splitS).compareTo(order.getAmountS()) <= 0, index, "fillAmountS + splitS <= amountS");
        require(fillAmountS.compareTo(order.getAmountS()) <= 0, index, "fillAmountS <= amountS");
        require(fillAmountFee.compareTo(order.getFeeAmount()) <= 0, index, "fillAmountFee <= feeAmount");
    }

    private static void require(boolean condition, int index, String message) {
        if (!condition) {
            throw new RingInvariantException("order " + index + ": " + message);
        }
    }

    private static void logOrder(int index, Order order) {
        if (!LOG.isDebugEnabled()) {
            return;
        }
        BigDecimal expectedRate = new BigDecimal(order.getAmountS())
                .divide(new BigDecimal(order.getAmountB()), MathContext.DECIMAL64);
        BigDecimal actualRate = order.getFillAmountB().signum() == 0
                ? null
                : new BigDecimal(order.getFillAmountS().add(order.getSplitS()))
                        .divide(new BigDecimal(order.getFillAmountB()), MathContext.DECIMAL64);
        LOG.debug("order[{}]: amountS={}, amountB={}, fillAmountS={}, fillAmountB={}, splitS={}, fillAmountFee={},"
                        + " expectedRate={}, actualRate={}",
                index,
                order.getAmountS(),
                order.getAmountB(),
                order.getFillAmountS(),
                order.getFillAmountB(),
                order.getSplitS(),
                order.getFillAmountFee(),
                expectedRate,
                actualRate);
    }
}
