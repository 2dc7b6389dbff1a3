package ringSettler;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Immutable instruction to move {@code amount} of {@code token} from one address to another.
 */
public record TransferItem(
        String token,
        String from,
        String to,
        BigInteger amount) {

    public TransferItem {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(amount, "amount");
    }
}
