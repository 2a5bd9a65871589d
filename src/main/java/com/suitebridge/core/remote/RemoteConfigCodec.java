package com.suitebridge.core.remote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.suitebridge.core.config.ArgumentException;
import com.suitebridge.core.config.Configuration;

/**
 * Serializes the reporter settings of a runner into the opaque {@code remoteArgs}
 * handed to forked runners, and reads them back.
 * <p>
 * The payload is a single JSON document carried as the only element of the array.
 */
public class RemoteConfigCodec {

    private final ObjectMapper objectMapper;

    public RemoteConfigCodec() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public RemoteConfigCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String[] encode(Configuration configuration) {
        try {
            return new String[]{objectMapper.writeValueAsString(RemoteConfiguration.from(configuration))};
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize remote configuration", e);
        }
    }

    /**
     * @throws ArgumentException when the arguments were not produced by {@link #encode}
     */
    public RemoteConfiguration decode(String[] remoteArgs) {
        if (remoteArgs.length != 1) {
            throw new ArgumentException("Expected exactly one remote argument, but got " + remoteArgs.length);
        }
        try {
            return objectMapper.readValue(remoteArgs[0], RemoteConfiguration.class);
        } catch (JsonProcessingException e) {
            throw new ArgumentException("Malformed remote arguments: " + e.getOriginalMessage(), e);
        }
    }
}
