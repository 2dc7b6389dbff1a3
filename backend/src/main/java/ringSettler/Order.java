package ringSettler;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Represents a single order taking part in a ring, including its nominal amounts and the
 * mutable fill state computed while the ring is fitted.
 */
public final class Order {

    private final byte[] hash;
    private final String owner;
    private final String tokenS;
    private final String tokenB;
    private final String feeToken;
    private final BigInteger amountS;
    private final BigInteger amountB;
    private final BigInteger feeAmount;
    private BigInteger fillAmountS;
    private BigInteger fillAmountB;
    private BigInteger fillAmountFee;
    private BigInteger splitS = BigInteger.ZERO;
    private boolean valid;

    /**
     * Constructs an order. Fill amounts start at the nominal amounts until the spendable
     * scaler bounds them by the owner's balance.
     *
     * @param hash      identity hash produced by the order subsystem
     * @param owner     address of the order owner
     * @param tokenS    address of the token the order sells
     * @param tokenB    address of the token the order buys
     * @param feeToken  address of the token the fee is paid in
     * @param amountS   nominal sell amount
     * @param amountB   nominal buy amount
     * @param feeAmount maximum fee the order pays
     * @param valid     validity verdict of the order subsystem
     */
    public Order(
            byte[] hash,
            String owner,
            String tokenS,
            String tokenB,
            String feeToken,
            BigInteger amountS,
            BigInteger amountB,
            BigInteger feeAmount,
            boolean valid) {

        this.hash = Objects.requireNonNull(hash, "hash").clone();
        this.owner = Objects.requireNonNull(owner, "owner");
        this.tokenS = Objects.requireNonNull(tokenS, "tokenS");
        this.tokenB = Objects.requireNonNull(tokenB, "tokenB");
        this.feeToken = Objects.requireNonNull(feeToken, "feeToken");
        this.amountS = requirePositive(amountS, "amountS");
        this.amountB = requirePositive(amountB, "amountB");
        Objects.requireNonNull(feeAmount, "feeAmount");
        if (feeAmount.signum() < 0) {
            throw new IllegalArgumentException("feeAmount cannot be negative");
        }
        this.feeAmount = feeAmount;
        this.fillAmountS = amountS;
        this.fillAmountB = amountB;
        this.fillAmountFee = feeAmount;
        this.valid = valid;
    }

    private static BigInteger requirePositive(BigInteger value, String name) {
        Objects.requireNonNull(value, name);
        if (value.signum() <= 0) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    public byte[] getHash() {
        return hash.clone();
    }

    public String getOwner() {
        return owner;
    }

    public String getTokenS() {
        return tokenS;
    }

    public String getTokenB() {
        return tokenB;
    }

    public String getFeeToken() {
        return feeToken;
    }

    public BigInteger getAmountS() {
        return amountS;
    }

    public BigInteger getAmountB() {
        return amountB;
    }

    public BigInteger getFeeAmount() {
        return feeAmount;
    }

    public BigInteger getFillAmountS() {
        return fillAmountS;
    }

    public void setFillAmountS(BigInteger fillAmountS) {
        this.fillAmountS = Objects.requireNonNull(fillAmountS, "fillAmountS");
    }

    public BigInteger getFillAmountB() {
        return fillAmountB;
    }

    public void setFillAmountB(BigInteger fillAmountB) {
        this.fillAmountB = Objects.requireNonNull(fillAmountB, "fillAmountB");
    }

    public BigInteger getFillAmountFee() {
        return fillAmountFee;
    }

    public void setFillAmountFee(BigInteger fillAmountFee) {
        this.fillAmountFee = Objects.requireNonNull(fillAmountFee, "fillAmountFee");
    }

    public BigInteger getSplitS() {
        return splitS;
    }

    public void setSplitS(BigInteger splitS) {
        this.splitS = Objects.requireNonNull(splitS, "splitS");
    }

    public boolean isValid() {
        return valid;
    }

    public void invalidate() {
        this.valid = false;
    }

    /**
     * Fee owed for a given sell amount, scaled by the order's own fee ratio.
     */
    public BigInteger feeFor(BigInteger sellAmount) {
        return feeAmount.multiply(sellAmount).divide(amountS);
    }

    /**
     * Buy amount matching a given sell amount at the order's declared price.
     */
    public BigInteger buyFor(BigInteger sellAmount) {
        return sellAmount.multiply(amountB).divide(amountS);
    }

    /**
     * Sell amount matching a given buy amount at the order's declared price.
     */
    public BigInteger sellFor(BigInteger buyAmount) {
        return buyAmount.multiply(amountS).divide(amountB);
    }
}
