package ringSettler;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class RingIdentityTests {

    private static Order order(byte[] hash) {
        return new Order(hash, "A", "X", "Y", "X", BigInteger.ONE, BigInteger.ONE, BigInteger.ZERO, true);
    }

    @Test
    void emptyInputHashesToKeccakOfNothing() {
        Assertions.assertEquals(
                "c5d2460186f7233c927e7db2dcc703c0e500b653ca82273b7bfad8045d85a470",
                Hex.toHexString(RingIdentity.compute(List.of())));
    }

    @Test
    void identicalSequencesGiveIdenticalIdentity() {
        List<Order> first = List.of(order(RingScenarioTests.orderHash(0)), order(RingScenarioTests.orderHash(1)));
        List<Order> second = List.of(order(RingScenarioTests.orderHash(0)), order(RingScenarioTests.orderHash(1)));

        Assertions.assertArrayEquals(RingIdentity.compute(first), RingIdentity.compute(second));
        Assertions.assertEquals(RingIdentity.HASH_LENGTH, RingIdentity.compute(first).length);
    }

    @Test
    void permutingOrdersChangesIdentity() {
        Order a = order(RingScenarioTests.orderHash(0));
        Order b = order(RingScenarioTests.orderHash(1));
        Order c = order(RingScenarioTests.orderHash(2));

        byte[] abc = RingIdentity.compute(List.of(a, b, c));
        byte[] acb = RingIdentity.compute(List.of(a, c, b));
        byte[] bca = RingIdentity.compute(List.of(b, c, a));

        Assertions.assertFalse(Arrays.equals(abc, acb));
        Assertions.assertFalse(Arrays.equals(abc, bca));
    }

    @Test
    void hashesArePackedWithoutPadding() {
        byte[] left = {0x01, 0x02};
        byte[] right = {0x03};
        byte[] packed = RingIdentity.compute(List.of(order(left), order(right)));
        byte[] joined = RingIdentity.compute(List.of(order(new byte[] {0x01}), order(new byte[] {0x02, 0x03})));

        Assertions.assertArrayEquals(packed, joined);
    }

    @Test
    void orderHashIsCopiedOnConstruction() {
        byte[] hash = RingScenarioTests.orderHash(0);
        Order order = order(hash);
        byte[] before = RingIdentity.compute(List.of(order));

        hash[0] = (byte) 0x7f;

        Assertions.assertArrayEquals(before, RingIdentity.compute(List.of(order)));
    }
}
