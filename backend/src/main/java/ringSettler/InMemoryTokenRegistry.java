package ringSettler;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Token allow-list keyed by address. Lookups ignore case.
 */
public final class InMemoryTokenRegistry implements TokenRegistry {
    private final Set<String> tokens = ConcurrentHashMap.newKeySet();

    public void registerToken(String token) {
        String key = normalizeKey(token);
        if (key.isEmpty()) {
            throw new IllegalArgumentException("token address is required");
        }
        tokens.add(key);
    }

    public void unregisterToken(String token) {
        tokens.remove(normalizeKey(token));
    }

    public boolean isRegistered(String token) {
        return tokens.contains(normalizeKey(token));
    }

    public List<String> registeredTokens() {
        return List.copyOf(new TreeSet<>(tokens));
    }

    @Override
    public CompletableFuture<Boolean> areAllTokensRegistered(List<String> candidates) {
        for (String token : candidates) {
            if (!isRegistered(token)) {
                return CompletableFuture.completedFuture(false);
            }
        }
        return CompletableFuture.completedFuture(true);
    }

    private static String normalizeKey(String token) {
        if (token == null || token.isBlank()) {
            return "";
        }
        return token.trim().toLowerCase(Locale.ROOT);
    }
}
