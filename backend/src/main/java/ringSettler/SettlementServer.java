package ringSettler;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import io.javalin.Javalin;
import io.javalin.json.JsonMapper;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.lang.reflect.Type;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SettlementServer {
    private static final Gson JSON = new Gson();
    private static final Logger LOG = LoggerFactory.getLogger(SettlementServer.class);
    private static final String SEED_RESOURCE = "/settlement.json";
    private static final String DEFAULT_FEE_HOLDER = "0x0000000000000000000000000000000000000fee";

    public static void main(String[] args) {
        BalanceBook balanceBook = new BalanceBook();
        InMemoryTokenRegistry tokenRegistry = new InMemoryTokenRegistry();
        String feeHolder = loadSeed(SEED_RESOURCE, balanceBook, tokenRegistry);
        LOG.info("Fee holder={}, registered tokens={}", feeHolder, tokenRegistry.registeredTokens());

        SettlementEngine engine = new SettlementEngine(new SettlementContext(balanceBook, tokenRegistry, feeHolder));
        SettlementFeedService settlementFeed = new SettlementFeedService();
        engine.onSettlement(settlementFeed::broadcastSettlement);

        int port = resolvePort();
        Javalin app = Javalin.create(config -> config.jsonMapper(gsonMapper())).start("0.0.0.0", port);

        app.post("/api/ring/settle", ctx -> {
            RingPayloadCodec.RingRequest request;
            try {
                request = RingPayloadCodec.parseRequest(ctx.body());
            } catch (IllegalArgumentException | NullPointerException ex) {
                LOG.warn("Rejected ring payload: {}", ex.getMessage());
                ctx.status(400).json(Map.of("status", "error", "message", String.valueOf(ex.getMessage())));
                return;
            }

            try {
                SettlementResult result = engine.settle(
                        request.orders(),
                        request.owner(),
                        request.feeRecipient(),
                        request.walletSplitPercentage());
                ctx.json(RingPayloadCodec.toJson(result));
            } catch (UnsettleableRingException ex) {
                ctx.status(422).json(Map.of("status", "error", "message", ex.getMessage()));
            } catch (IllegalArgumentException ex) {
                LOG.warn("Rejected ring: {}", ex.getMessage());
                ctx.status(400).json(Map.of("status", "error", "message", ex.getMessage()));
            }
        });

        app.get("/api/tokens", ctx -> ctx.json(tokenRegistry.registeredTokens()));

        app.post("/api/balances", ctx -> {
            try {
                JsonObject body = JSON.fromJson(ctx.body(), JsonObject.class);
                if (body == null) {
                    throw new IllegalArgumentException("Body is required");
                }
                String owner = RingPayloadCodec.requireString(body, "owner");
                String token = RingPayloadCodec.requireString(body, "token");
                BigInteger amount = RingPayloadCodec.parseAmount(body, "amount", null);
                balanceBook.credit(owner, token, amount);
                ctx.json(Map.of(
                        "owner", owner,
                        "token", token,
                        "balance", balanceBook.balanceOf(owner, token).toString()));
            } catch (JsonParseException | IllegalArgumentException ex) {
                LOG.warn("Rejected balance payload: {}", ex.getMessage());
                ctx.status(400).json(Map.of("status", "error", "message", String.valueOf(ex.getMessage())));
            }
        });

        app.ws("/ws/settlements", ws -> {
            ws.onConnect(ctx -> settlementFeed.register(ctx.session));
            ws.onClose(ctx -> settlementFeed.unregister(ctx.session));
        });
    }

    private static JsonMapper gsonMapper() {
        return new JsonMapper() {
            @Override
            public String toJsonString(Object obj, Type type) {
                return JSON.toJson(obj, type);
            }

            @Override
            public <T> T fromJsonString(String json, Type targetType) {
                return JSON.fromJson(json, targetType);
            }
        };
    }

    private static int resolvePort() {
        String envPort = System.getenv("PORT");
        if (envPort != null && !envPort.isBlank()) {
            try {
                return Integer.parseInt(envPort.trim());
            } catch (NumberFormatException ex) {
                LOG.warn("Invalid PORT environment value '{}', falling back to 7070", envPort);
            }
        }
        return 7070;
    }

    /**
     * Loads fee holder, registered tokens and balances from a classpath resource.
     *
     * @return the fee holder address
     */
    static String loadSeed(String resource, BalanceBook balanceBook, InMemoryTokenRegistry tokenRegistry) {
        try (InputStream stream = SettlementServer.class.getResourceAsStream(resource)) {
            if (stream == null) {
                LOG.warn("{} not found, starting with an empty context", resource);
                return DEFAULT_FEE_HOLDER;
            }
            JsonElement root = JSON.fromJson(new InputStreamReader(stream, StandardCharsets.UTF_8), JsonElement.class);
            if (root == null || !root.isJsonObject()) {
                LOG.warn("{} must be a JSON object", resource);
                return DEFAULT_FEE_HOLDER;
            }
            JsonObject object = root.getAsJsonObject();
            if (object.has("tokens") && object.get("tokens").isJsonArray()) {
                for (JsonElement token : object.getAsJsonArray("tokens")) {
                    tokenRegistry.registerToken(token.getAsString());
                }
            }
            if (object.has("balances") && object.get("balances").isJsonArray()) {
                for (JsonElement element : object.getAsJsonArray("balances")) {
                    if (!element.isJsonObject()) {
                        continue;
                    }
                    JsonObject balance = element.getAsJsonObject();
                    if (!balance.has("owner") || !balance.has("token")) {
                        LOG.warn("Skipping seed balance with missing owner or token");
                        continue;
                    }
                    try {
                        balanceBook.credit(
                                balance.get("owner").getAsString(),
                                balance.get("token").getAsString(),
                                RingPayloadCodec.parseAmount(balance, "amount", BigInteger.ZERO));
                    } catch (IllegalArgumentException ex) {
                        LOG.warn("Invalid seed balance {}: {}", balance, ex.getMessage());
                    }
                }
            }
            if (object.has("feeHolder") && object.get("feeHolder").isJsonPrimitive()) {
                return object.get("feeHolder").getAsString();
            }
            return DEFAULT_FEE_HOLDER;
        } catch (Exception ex) {
            LOG.warn("Failed to load {}", resource, ex);
            return DEFAULT_FEE_HOLDER;
        }
    }
}
