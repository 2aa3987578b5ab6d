package io.github.terrafield.realtime;

import com.google.gson.annotations.SerializedName;

/**
 * Connection status reported to observers.
 * <p>
 * {@link #POLLING} is reported if and only if the method is {@link ConnectionMethod#POLLING};
 * the remaining values belong to {@link ConnectionMethod#PUSH}.
 */
public enum ConnectionStatus {
    @SerializedName("connected")
    CONNECTED("connected"),

    @SerializedName("connecting")
    CONNECTING("connecting"),

    @SerializedName("disconnected")
    DISCONNECTED("disconnected"),

    @SerializedName("error")
    ERROR("error"),

    @SerializedName("polling")
    POLLING("polling");

    private final String value;

    ConnectionStatus(String value) {
        this.value = value;
    }

    /**
     * Returns the string value shown to observers.
     *
     * @return the status string value
     */
    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
