package ringSettler;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds per-order validity and token registration into a single verdict. Verdicts only ever
 * narrow: a ring found invalid stays invalid.
 */
final class RingValidator {
    private static final Logger LOG = LoggerFactory.getLogger(RingValidator.class);

    private final TokenRegistry tokenRegistry;

    RingValidator(TokenRegistry tokenRegistry) {
        this.tokenRegistry = Objects.requireNonNull(tokenRegistry, "tokenRegistry");
    }

    boolean checkOrdersValid(List<Order> orders, boolean valid) {
        boolean result = valid;
        for (Order order : orders) {
            result = result && order.isValid();
        }
        return result;
    }

    boolean checkTokensRegistered(List<Order> orders, boolean valid) {
        List<String> tokens = new ArrayList<>(orders.size());
        for (Order order : orders) {
            tokens.add(order.getTokenS());
        }
        boolean registered;
        try {
            registered = Boolean.TRUE.equals(tokenRegistry.areAllTokensRegistered(tokens).join());
        } catch (CompletionException ex) {
            LOG.warn("Token registration lookup failed for {}", tokens, ex.getCause());
            registered = false;
        }
        if (!registered) {
            LOG.warn("Ring contains unregistered tokens: {}", tokens);
        }
        return valid && registered;
    }
}
