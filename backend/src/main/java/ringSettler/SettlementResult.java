package ringSettler;

import java.time.Instant;
import java.util.List;

/**
 * Immutable outcome of one settlement attempt.
 */
public record SettlementResult(
        String ringHash,
        boolean valid,
        List<TransferItem> transfers,
        Instant timestamp) {

    public SettlementResult {
        transfers = List.copyOf(transfers);
    }
}
