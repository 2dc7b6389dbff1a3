package ringSettler;

import java.io.ByteArrayOutputStream;
import java.util.List;
import java.util.Objects;
import org.bouncycastle.jcajce.provider.digest.Keccak;

/**
 * Derives the content-addressed identifier of a ring: Keccak-256 over the packed
 * concatenation of its order hashes, in ring order.
 */
public final class RingIdentity {

    public static final int HASH_LENGTH = 32;

    private RingIdentity() {
    }

    public static byte[] compute(List<Order> orders) {
        Objects.requireNonNull(orders, "orders");
        ByteArrayOutputStream packed = new ByteArrayOutputStream(orders.size() * HASH_LENGTH);
        for (Order order : orders) {
            packed.writeBytes(order.getHash());
        }
        return new Keccak.Digest256().digest(packed.toByteArray());
    }
}
