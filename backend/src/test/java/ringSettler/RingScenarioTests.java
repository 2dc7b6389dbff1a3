package ringSettler;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

final class RingScenarioTests {

    private static final String FEE_HOLDER = "FEE";
    private static final String MINER = "MINER";

    private enum Outcome {
        OK,
        INVALID,
        UNSETTLEABLE
    }

    private record Balance(String owner, String token, BigInteger amount) {
    }

    private record OrderSpec(String owner, String tokenS, String tokenB, String feeToken, BigInteger amountS, BigInteger amountB, BigInteger feeAmount) {
    }

    private record Fill(BigInteger fillAmountS, BigInteger fillAmountB, BigInteger fillAmountFee, BigInteger splitS) {
    }

    private record Result(Outcome outcome, int transferCount) {
    }

    private record ParsedData(List<Balance> balances, Set<String> unregistered, List<OrderSpec> orders, List<Fill> fills, List<TransferItem> transfers, Result result) {
    }

    private static final class InputHandler {

        ParsedData getInformations(String fileName) {
            List<Balance> balances = new ArrayList<>();
            Set<String> unregistered = new HashSet<>();
            List<OrderSpec> orders = new ArrayList<>();
            List<Fill> fills = new ArrayList<>();
            List<TransferItem> transfers = new ArrayList<>();
            Result result = null;

            try (BufferedReader reader = openReader(fileName)) {
                String line;
                while ((line = reader.readLine()) != null) {
                    line = line.trim();
                    if (line.isEmpty()) {
                        continue;
                    }
                    if (result != null) {
                        throw new IllegalStateException("Result should only be specified at the end.");
                    }

                    String[] tokens = line.split("\\s+");
                    switch (Character.toUpperCase(tokens[0].charAt(0))) {
                        case 'B' -> balances.add(new Balance(tokens[1], tokens[2], amount(tokens[3])));
                        case 'N' -> unregistered.add(tokens[1]);
                        case 'O' -> orders.add(new OrderSpec(tokens[1], tokens[2], tokens[3], tokens[4],
                                amount(tokens[5]), amount(tokens[6]), amount(tokens[7])));
                        case 'F' -> fills.add(new Fill(amount(tokens[1]), amount(tokens[2]), amount(tokens[3]), amount(tokens[4])));
                        case 'T' -> transfers.add(new TransferItem(tokens[1], tokens[2], tokens[3], amount(tokens[4])));
                        case 'R' -> result = new Result(
                                Outcome.valueOf(tokens[1].toUpperCase(Locale.ROOT)),
                                Integer.parseInt(tokens[2]));
                        default -> throw new IllegalStateException("Unsupported line: " + line);
                    }
                }
            } catch (IOException ex) {
                throw new IllegalStateException("Failed to read test file.", ex);
            }

            if (result == null) {
                throw new IllegalStateException("No result specified.");
            }
            return new ParsedData(balances, unregistered, orders, fills, transfers, result);
        }

        private BufferedReader openReader(String fileName) {
            String resource = "/TestFiles/" + fileName;
            InputStream stream = RingScenarioTests.class.getResourceAsStream(resource);
            if (stream == null) {
                throw new IllegalArgumentException("Missing test file: " + resource);
            }
            return new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8));
        }

        private BigInteger amount(String token) {
            BigInteger value = new BigInteger(token);
            if (value.signum() < 0) {
                throw new IllegalStateException("Value must be non-negative: " + token);
            }
            return value;
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "Ring_Symmetric.txt",
            "Ring_TighterPrice.txt",
            "Ring_Spread.txt",
            "Ring_SpendableShrink.txt",
            "Ring_ThreeOrders.txt",
            "Ring_SameTokenFee.txt",
            "Ring_ZeroBalance.txt",
            "Ring_Unsettleable.txt",
            "Ring_UnregisteredToken.txt",
    })
    void ringScenarioSuite(String fileName) {
        ParsedData parsed = new InputHandler().getInformations(fileName);

        BalanceBook balanceBook = new BalanceBook();
        for (Balance balance : parsed.balances()) {
            balanceBook.credit(balance.owner(), balance.token(), balance.amount());
        }
        InMemoryTokenRegistry tokenRegistry = new InMemoryTokenRegistry();
        List<Order> orders = new ArrayList<>();
        for (int i = 0; i < parsed.orders().size(); i++) {
            OrderSpec spec = parsed.orders().get(i);
            for (String token : List.of(spec.tokenS(), spec.tokenB(), spec.feeToken())) {
                if (!parsed.unregistered().contains(token)) {
                    tokenRegistry.registerToken(token);
                }
            }
            orders.add(new Order(orderHash(i), spec.owner(), spec.tokenS(), spec.tokenB(), spec.feeToken(),
                    spec.amountS(), spec.amountB(), spec.feeAmount(), true));
        }

        SettlementEngine engine = new SettlementEngine(new SettlementContext(balanceBook, tokenRegistry, FEE_HOLDER));
        Result expected = parsed.result();

        if (expected.outcome() == Outcome.UNSETTLEABLE) {
            Assertions.assertThrows(UnsettleableRingException.class, () -> engine.settle(orders, MINER, MINER, 0));
            return;
        }

        SettlementResult result = engine.settle(orders, MINER, MINER, 0);
        Assertions.assertEquals(expected.outcome() == Outcome.OK, result.valid(), "Unexpected validity");
        Assertions.assertEquals(expected.transferCount(), result.transfers().size(), "Unexpected transfer count");
        if (!parsed.transfers().isEmpty()) {
            Assertions.assertEquals(parsed.transfers(), result.transfers(), "Unexpected transfers");
        }

        for (int i = 0; i < parsed.fills().size(); i++) {
            Fill fill = parsed.fills().get(i);
            Order order = orders.get(i);
            Assertions.assertEquals(fill.fillAmountS(), order.getFillAmountS(), "fillAmountS of order " + i);
            Assertions.assertEquals(fill.fillAmountB(), order.getFillAmountB(), "fillAmountB of order " + i);
            Assertions.assertEquals(fill.fillAmountFee(), order.getFillAmountFee(), "fillAmountFee of order " + i);
            Assertions.assertEquals(fill.splitS(), order.getSplitS(), "splitS of order " + i);
        }

        if (result.valid()) {
            for (int i = 0; i < orders.size(); i++) {
                Order current = orders.get(i);
                Order next = orders.get((i + 1) % orders.size());
                Assertions.assertEquals(current.getFillAmountB(), next.getFillAmountS(), "edge " + i + " is not exact");
                Assertions.assertTrue(current.getFillAmountS().add(current.getSplitS()).compareTo(current.getAmountS()) <= 0);
                Assertions.assertTrue(current.getFillAmountFee().compareTo(current.getFeeAmount()) <= 0);
                Assertions.assertTrue(current.getSplitS().signum() >= 0);
            }
        }
    }

    static byte[] orderHash(int index) {
        byte[] hash = new byte[32];
        Arrays.fill(hash, (byte) (index + 1));
        return hash;
    }
}
