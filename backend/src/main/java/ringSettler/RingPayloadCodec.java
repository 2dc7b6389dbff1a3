package ringSettler;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

/**
 * Maps ring settlement requests and results to and from JSON. Amounts travel as decimal
 * strings, hashes and addresses as {@code 0x} hex.
 */
public final class RingPayloadCodec {
    private static final Gson JSON = new Gson();

    private RingPayloadCodec() {
    }

    public record RingRequest(String owner, String feeRecipient, int walletSplitPercentage, List<Order> orders) {
    }

    public static RingRequest parseRequest(String rawBody) {
        if (rawBody == null || rawBody.isBlank()) {
            throw new IllegalArgumentException("Body is required");
        }
        JsonElement root;
        try {
            root = JSON.fromJson(rawBody, JsonElement.class);
        } catch (JsonParseException ex) {
            throw new IllegalArgumentException("Body must be valid JSON");
        }
        if (root == null || !root.isJsonObject()) {
            throw new IllegalArgumentException("Ring payload must be a JSON object");
        }
        JsonObject object = root.getAsJsonObject();
        String owner = requireString(object, "owner");
        String feeRecipient = getOptionalString(object, "feeRecipient");
        int walletSplitPercentage = object.has("walletSplitPercentage")
                ? parseInteger(object.get("walletSplitPercentage"), "walletSplitPercentage")
                : 0;
        if (!object.has("orders") || !object.get("orders").isJsonArray()) {
            throw new IllegalArgumentException("'orders' property must be an array");
        }
        List<Order> orders = new ArrayList<>();
        for (JsonElement element : object.getAsJsonArray("orders")) {
            if (!element.isJsonObject()) {
                throw new IllegalArgumentException("Unsupported order entry: " + element);
            }
            orders.add(parseOrder(element.getAsJsonObject()));
        }
        return new RingRequest(owner, feeRecipient != null ? feeRecipient : owner, walletSplitPercentage, List.copyOf(orders));
    }

    public static Order parseOrder(JsonObject object) {
        String tokenS = requireString(object, "tokenS");
        String feeToken = getOptionalString(object, "feeToken");
        return new Order(
                parseHex(requireString(object, "hash"), "hash"),
                requireString(object, "owner"),
                tokenS,
                requireString(object, "tokenB"),
                feeToken != null ? feeToken : tokenS,
                parseAmount(object, "amountS", null),
                parseAmount(object, "amountB", null),
                parseAmount(object, "feeAmount", BigInteger.ZERO),
                parseFlag(object, "valid", true));
    }

    public static Map<String, Object> toJson(SettlementResult result) {
        List<Map<String, Object>> transfers = new ArrayList<>();
        for (TransferItem item : result.transfers()) {
            transfers.add(toJson(item));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ringHash", result.ringHash());
        body.put("valid", result.valid());
        body.put("transfers", transfers);
        body.put("timestamp", result.timestamp().toString());
        return body;
    }

    public static Map<String, Object> toJson(TransferItem item) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("token", item.token());
        body.put("from", item.from());
        body.put("to", item.to());
        body.put("amount", item.amount().toString());
        return body;
    }

    public static String toJsonString(Object payload) {
        return JSON.toJson(payload);
    }

    static byte[] parseHex(String value, String member) {
        String digits = value.startsWith("0x") || value.startsWith("0X") ? value.substring(2) : value;
        if (digits.isEmpty() || digits.length() % 2 != 0) {
            throw new IllegalArgumentException(member + " must be an even-length hex string");
        }
        try {
            return Hex.decode(digits);
        } catch (DecoderException ex) {
            throw new IllegalArgumentException(member + " is not valid hex: " + value, ex);
        }
    }

    static BigInteger parseAmount(JsonObject object, String member, BigInteger fallback) {
        if (!object.has(member) || object.get(member).isJsonNull()) {
            if (fallback == null) {
                throw new IllegalArgumentException(member + " is required");
            }
            return fallback;
        }
        try {
            return new BigInteger(object.get(member).getAsString().trim());
        } catch (NumberFormatException | UnsupportedOperationException | IllegalStateException ex) {
            throw new IllegalArgumentException(member + " must be an integer amount", ex);
        }
    }

    static int parseInteger(JsonElement element, String member) {
        if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            throw new IllegalArgumentException(member + " must be an integer");
        }
        try {
            return element.getAsBigDecimal().intValueExact();
        } catch (NumberFormatException | ArithmeticException ex) {
            throw new IllegalArgumentException(member + " must be an integer", ex);
        }
    }

    static boolean parseFlag(JsonObject object, String member, boolean fallback) {
        if (!object.has(member) || object.get(member).isJsonNull()) {
            return fallback;
        }
        JsonElement element = object.get(member);
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isBoolean()) {
            throw new IllegalArgumentException(member + " must be a boolean");
        }
        return element.getAsBoolean();
    }

    static String requireString(JsonObject object, String member) {
        String value = getOptionalString(object, member);
        if (value == null) {
            throw new IllegalArgumentException(member + " is required");
        }
        return value;
    }

    private static String getOptionalString(JsonObject object, String member) {
        if (object.has(member) && object.get(member).isJsonPrimitive()
                && object.get(member).getAsJsonPrimitive().isString()) {
            String value = object.get(member).getAsString();
            return value != null && !value.isBlank() ? value.trim() : null;
        }
        return null;
    }
}
