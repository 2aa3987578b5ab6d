package io.github.terrafield.realtime;

import com.google.gson.JsonElement;

/**
 * Shape check applied to payloads of one event before they reach subscribers.
 */
@FunctionalInterface
public interface PayloadValidator {

    /**
     * Accepts any payload.
     */
    PayloadValidator ANY = payload -> true;

    /**
     * Accepts JSON objects only.
     */
    PayloadValidator OBJECT = payload -> payload != null && payload.isJsonObject();

    /**
     * Accepts JSON arrays only.
     */
    PayloadValidator ARRAY = payload -> payload != null && payload.isJsonArray();

    /**
     * Checks a payload.
     *
     * @param payload the decoded payload
     * @return true if the payload may be dispatched
     */
    boolean isValid(JsonElement payload);

    /**
     * Accepts JSON objects carrying all the given members.
     *
     * @param members required member names
     * @return the validator
     */
    static PayloadValidator objectWith(String... members) {
        return payload -> {
            if (payload == null || !payload.isJsonObject()) {
                return false;
            }
            for (String member : members) {
                if (!payload.getAsJsonObject().has(member)) {
                    return false;
                }
            }
            return true;
        };
    }
}
