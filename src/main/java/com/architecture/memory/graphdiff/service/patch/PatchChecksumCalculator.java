package com.architecture.memory.graphdiff.service.patch;

import com.architecture.memory.graphdiff.dto.patch.PatchOperation;
import com.architecture.memory.graphdiff.exception.PatchChecksumException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * SHA-256 over the canonical JSON form of an ordered operation list.
 *
 * Canonical form: properties and map entries sorted by key, nulls inside values kept.
 * An operation list survives a JSON round trip with the same checksum; reordering
 * or altering any operation changes it.
 */
@Component
public class PatchChecksumCalculator {

    private static final String ALGORITHM = "SHA-256";

    private final ObjectMapper canonicalMapper = JsonMapper.builder()
            .findAndAddModules()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    public String calculate(List<PatchOperation> operations) {
        return sha256(canonicalJson(operations));
    }

    public boolean matches(List<PatchOperation> operations, String checksum) {
        return checksum != null && checksum.equals(calculate(operations));
    }

    String canonicalJson(List<PatchOperation> operations) {
        try {
            return canonicalMapper.writeValueAsString(operations);
        } catch (JsonProcessingException e) {
            throw new PatchChecksumException("Patch operations are not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private static String sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance(ALGORITHM);
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }
}
