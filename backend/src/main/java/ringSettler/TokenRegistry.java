package ringSettler;

import java.util.List;
import java.util.concurrent.CompletableFuture;

public interface TokenRegistry {

    CompletableFuture<Boolean> areAllTokensRegistered(List<String> tokens);
}
