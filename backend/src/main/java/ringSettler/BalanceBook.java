package ringSettler;

import java.math.BigInteger;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Simple in-memory balance repository that bounds orders by what their owners hold.
 */
public final class BalanceBook implements SpendableAmountScaler {
    private final ConcurrentHashMap<String, ConcurrentHashMap<String, BigInteger>> balancesByOwner = new ConcurrentHashMap<>();

    public void credit(String owner, String token, BigInteger amount) {
        Objects.requireNonNull(amount, "amount");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("amount cannot be negative");
        }
        if (amount.signum() == 0) {
            return;
        }
        balancesByOwner.computeIfAbsent(normalizeKey(owner), __ -> new ConcurrentHashMap<>())
                .merge(normalizeKey(token), amount, BigInteger::add);
    }

    public BigInteger balanceOf(String owner, String token) {
        Map<String, BigInteger> balances = balancesByOwner.get(normalizeKey(owner));
        if (balances == null) {
            return BigInteger.ZERO;
        }
        return balances.getOrDefault(normalizeKey(token), BigInteger.ZERO);
    }

    public Map<String, BigInteger> snapshotBalances(String owner) {
        Map<String, BigInteger> balances = balancesByOwner.get(normalizeKey(owner));
        return balances == null ? Map.of() : Collections.unmodifiableMap(balances);
    }

    @Override
    public CompletableFuture<Void> scale(Order order) {
        Objects.requireNonNull(order, "order");
        BigInteger amountS = order.getAmountS();
        BigInteger feeAmount = order.getFeeAmount();
        BigInteger spendableS = balanceOf(order.getOwner(), order.getTokenS());
        BigInteger fillAmountS = amountS;

        if (feeAmount.signum() > 0) {
            if (normalizeKey(order.getFeeToken()).equals(normalizeKey(order.getTokenS()))) {
                // sell amount and fee are paid from the same balance
                BigInteger totalAmountS = amountS.add(feeAmount);
                if (spendableS.compareTo(totalAmountS) < 0) {
                    fillAmountS = spendableS.multiply(amountS).divide(totalAmountS);
                }
            } else {
                BigInteger spendableFee = balanceOf(order.getOwner(), order.getFeeToken());
                if (spendableFee.compareTo(feeAmount) < 0) {
                    fillAmountS = amountS.multiply(spendableFee).divide(feeAmount);
                }
            }
        }
        fillAmountS = fillAmountS.min(spendableS);

        order.setFillAmountS(fillAmountS);
        order.setFillAmountB(order.buyFor(fillAmountS));
        order.setFillAmountFee(order.feeFor(fillAmountS));
        return CompletableFuture.completedFuture(null);
    }

    static String normalizeKey(String address) {
        if (address == null || address.isBlank()) {
            return "";
        }
        return address.trim().toLowerCase(Locale.ROOT);
    }
}
