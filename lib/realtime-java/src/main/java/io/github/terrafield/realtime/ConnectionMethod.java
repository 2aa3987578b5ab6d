package io.github.terrafield.realtime;

import com.google.gson.annotations.SerializedName;

/**
 * Delivery path currently used to feed subscriptions.
 */
public enum ConnectionMethod {
    @SerializedName("websocket")
    PUSH("websocket"),

    @SerializedName("polling")
    POLLING("polling");

    private final String value;

    ConnectionMethod(String value) {
        this.value = value;
    }

    /**
     * Returns the string value shown to observers and used in environment settings.
     *
     * @return the method string value
     */
    public String getValue() {
        return value;
    }

    /**
     * Parses a string value to ConnectionMethod.
     *
     * @param value the string value
     * @return the corresponding method, or null if the value is not recognized
     */
    public static ConnectionMethod fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (ConnectionMethod method : values()) {
            if (method.value.equalsIgnoreCase(value.trim())) {
                return method;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return value;
    }
}
