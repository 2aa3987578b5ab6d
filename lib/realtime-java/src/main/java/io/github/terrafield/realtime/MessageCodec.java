package io.github.terrafield.realtime;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import io.github.terrafield.realtime.errors.InvalidPayloadError;

import java.util.Map;

/**
 * Converts between wire frames and {@link RealtimeMessage} values and applies
 * per-event payload validators.
 */
final class MessageCodec {

    static final String HEARTBEAT_EVENT = "heartbeat";

    private static final String FIELD_EVENT = "event";
    private static final String FIELD_TYPE = "type";
    private static final String FIELD_PAYLOAD = "payload";
    private static final String FIELD_ACTION = "action";

    private final Gson gson;
    private final Map<String, PayloadValidator> validators;

    MessageCodec(Map<String, PayloadValidator> validators) {
        this(createGson(), validators);
    }

    MessageCodec(Gson gson, Map<String, PayloadValidator> validators) {
        this.gson = gson;
        this.validators = Map.copyOf(validators);
    }

    /**
     * Decodes a push frame. Frames keyed by {@code type} instead of {@code event}
     * are accepted with the whole frame as payload.
     */
    RealtimeMessage decode(String frame) {
        JsonElement root;
        try {
            root = JsonParser.parseString(frame);
        } catch (JsonParseException e) {
            throw new InvalidPayloadError(null, "frame is not valid JSON", e);
        }
        if (!root.isJsonObject()) {
            throw new InvalidPayloadError(null, "frame is not a JSON object");
        }
        JsonObject object = root.getAsJsonObject();

        String event = stringMember(object, FIELD_EVENT);
        if (event != null) {
            return new RealtimeMessage(event, object.get(FIELD_PAYLOAD));
        }
        String type = stringMember(object, FIELD_TYPE);
        if (type != null) {
            return new RealtimeMessage(type, object);
        }
        throw new InvalidPayloadError(null, "frame has no event name");
    }

    /**
     * Decodes a polling response body; a body that is not JSON becomes a string primitive.
     */
    JsonElement decodeBody(String body) {
        if (body == null || body.isEmpty()) {
            return new JsonPrimitive("");
        }
        try {
            return JsonParser.parseString(body);
        } catch (JsonParseException e) {
            return new JsonPrimitive(body);
        }
    }

    void validate(String event, JsonElement payload) {
        if (event == null) {
            return;
        }
        PayloadValidator validator = validators.get(event);
        if (validator != null && !validator.isValid(payload)) {
            throw new InvalidPayloadError(event, "payload rejected for event " + event + ": " + payload);
        }
    }

    String encode(Object data) {
        if (data instanceof String) {
            return (String) data;
        }
        if (data instanceof JsonElement) {
            return data.toString();
        }
        return gson.toJson(data);
    }

    String heartbeatPing(long timestamp) {
        JsonObject ping = new JsonObject();
        ping.addProperty(FIELD_TYPE, HEARTBEAT_EVENT);
        ping.addProperty(FIELD_ACTION, "ping");
        ping.addProperty("timestamp", timestamp);
        return ping.toString();
    }

    boolean isHeartbeat(RealtimeMessage message) {
        return HEARTBEAT_EVENT.equals(message.getEvent());
    }

    boolean isPong(RealtimeMessage message) {
        if (!isHeartbeat(message) || !message.getPayload().isJsonObject()) {
            return false;
        }
        return "pong".equals(stringMember(message.getPayload().getAsJsonObject(), FIELD_ACTION));
    }

    private static String stringMember(JsonObject object, String name) {
        JsonElement element = object.get(name);
        if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            return null;
        }
        String value = element.getAsString();
        return value.isEmpty() ? null : value;
    }

    private static Gson createGson() {
        return new GsonBuilder()
                .disableHtmlEscaping()
                .serializeNulls()
                .create();
    }
}
