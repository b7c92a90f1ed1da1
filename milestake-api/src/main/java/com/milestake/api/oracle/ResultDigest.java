package com.milestake.api.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.milestake.blockchain.signature.Hashes;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Canonical serialization of a result set and its Keccak-256 commitment.
 *
 * <p>Entries appear in join order, compact, with miles written as plain
 * two-decimal numbers, so the same standings always hash the same.
 */
public final class ResultDigest {

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
            .build();

    private ResultDigest() {}

    public static Result of(List<ParticipantStanding> standings) {
        List<ParticipantStanding> ordered = standings.stream()
                .sorted(Comparator.comparingInt(ParticipantStanding::joinOrder))
                .toList();
        try {
            String json = CANONICAL.writeValueAsString(ordered);
            return new Result(json, Hashes.keccak256(json));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize result set", e);
        }
    }

    /**
     * Participant addresses of a serialized result set, in the order written.
     */
    public static List<String> addresses(String json) {
        try {
            List<String> addresses = new ArrayList<>();
            for (JsonNode entry : CANONICAL.readTree(json)) {
                addresses.add(entry.path("address").asText());
            }
            return addresses;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable result set", e);
        }
    }

    public record Result(String json, String hash) {}
}
