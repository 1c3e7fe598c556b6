package com.presencelite.broadcast;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.presencelite.geo.GeohashCodec;
import com.presencelite.model.TrustTier;

import java.io.IOException;
import java.util.EnumSet;

/**
 * JSON wire format for {@link PresenceBroadcast} plus the canonical bytes
 * that signatures cover.
 */
public class BroadcastCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);

    private final GeohashCodec geohashCodec;

    public BroadcastCodec(GeohashCodec geohashCodec) {
        this.geohashCodec = geohashCodec;
    }

    /** Everything in the envelope except the signature, in a fixed order. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private record SignedContent(
        String senderIdentity,
        BroadcastType type,
        BroadcastPayload payload,
        long timestamp,
        long sequence,
        int ttlSeconds
    ) {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public byte[] encode(PresenceBroadcast broadcast) {
        try {
            return MAPPER.writeValueAsBytes(broadcast);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize broadcast " + broadcast.sequence(), e);
        }
    }

    public PresenceBroadcast decode(byte[] bytes) throws MalformedBroadcastException {
        if (bytes == null || bytes.length == 0) {
            throw new MalformedBroadcastException("Empty broadcast");
        }
        PresenceBroadcast broadcast;
        try {
            broadcast = MAPPER.readValue(bytes, PresenceBroadcast.class);
        } catch (IOException e) {
            throw new MalformedBroadcastException("Undecodable broadcast: " + e.getMessage(), e);
        }
        validate(broadcast);
        return broadcast;
    }

    public byte[] signingBytes(PresenceBroadcast broadcast) {
        var content = new SignedContent(
            broadcast.senderIdentity(),
            broadcast.type(),
            broadcast.payload(),
            broadcast.timestamp(),
            broadcast.sequence(),
            broadcast.ttlSeconds());
        try {
            return MAPPER.writeValueAsBytes(content);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize signed content", e);
        }
    }

    /**
     * Structural checks the type system cannot express. Signatures are
     * checked by the receiver, which knows the verifier.
     */
    public void validate(PresenceBroadcast b) throws MalformedBroadcastException {
        if (b == null) {
            throw new MalformedBroadcastException("Null broadcast");
        }
        require(isPresent(b.senderIdentity()), "missing sender");
        require(b.type() != null, "missing type");
        require(isPresent(b.signature()), "unsigned");
        require(b.timestamp() > 0, "missing timestamp");
        require(b.sequence() > 0, "non-positive sequence");
        require(b.ttlSeconds() > 0, "non-positive ttl");

        if (b.type() == BroadcastType.LEAVE) {
            require(b.payload() == null, "leave carries a payload");
            return;
        }
        require(b.payload() != null, "missing payload");
        require(b.payload().broadcastType() == b.type(),
            "payload kind " + b.payload().broadcastType() + " does not match type " + b.type());

        if (b.payload() instanceof LocationPayload location) {
            validateLocation(location);
        } else if (b.payload() instanceof StatusPayload status) {
            require(status.status() != null, "missing status");
        } else if (b.payload() instanceof ProximityPayload proximity) {
            require(isPresent(proximity.targetIdentity()), "missing proximity target");
            require(proximity.category() != null, "missing proximity category");
            require(proximity.proof() != null, "missing proximity proof");
        }
    }

    private void validateLocation(LocationPayload location) throws MalformedBroadcastException {
        require(location.commitment() != null && isPresent(location.commitment().digest()), "missing commitment");
        require(location.precisionLevels() != null && !location.precisionLevels().isEmpty(), "no precision levels");
        var seen = EnumSet.noneOf(TrustTier.class);
        for (var level : location.precisionLevels()) {
            require(level.trustTier() != null, "precision level without tier");
            require(seen.add(level.trustTier()), "duplicate precision level for " + level.trustTier());
            require(geohashCodec.isValid(level.geohash()), "invalid geohash for " + level.trustTier());
            require(level.precision() == level.geohash().length(),
                "precision " + level.precision() + " does not match geohash length for " + level.trustTier());
        }
    }

    private static boolean isPresent(String s) {
        return s != null && !s.isBlank();
    }

    private static void require(boolean condition, String problem) throws MalformedBroadcastException {
        if (!condition) {
            throw new MalformedBroadcastException("Malformed broadcast: " + problem);
        }
    }
}
