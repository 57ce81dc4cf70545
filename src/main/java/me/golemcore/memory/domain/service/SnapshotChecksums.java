package me.golemcore.memory.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import me.golemcore.memory.domain.exception.MemoryException;
import me.golemcore.memory.domain.model.StateSnapshot;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Map;

/**
 * Canonical serialization and SHA-256 checksums of snapshot state.
 *
 * <p>
 * The canonical form is compact JSON with map entries ordered by key, so a
 * state that went through a JSON round trip hashes to the same value.
 */
@Component
public class SnapshotChecksums {

    private static final char[] HEX = "0123456789abcdef".toCharArray();
    private static final TypeReference<Map<String, Object>> STATE_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper canonicalMapper;

    public SnapshotChecksums(ObjectMapper objectMapper) {
        this.canonicalMapper = objectMapper.copy()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(SerializationFeature.INDENT_OUTPUT, false);
    }

    public String canonicalJson(Map<String, Object> state) {
        try {
            return canonicalMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new MemoryException("Snapshot state is not serializable", e);
        }
    }

    /**
     * Reduce arbitrary values to plain JSON maps, lists and scalars so the state
     * hashes identically before and after persistence.
     */
    public Map<String, Object> normalize(Map<String, Object> state) {
        try {
            return canonicalMapper.readValue(canonicalJson(state), STATE_TYPE);
        } catch (JsonProcessingException e) {
            throw new MemoryException("Snapshot state is not serializable", e);
        }
    }

    public String checksum(Map<String, Object> state) {
        return sha256Hex(canonicalJson(state));
    }

    /**
     * Whether the stored checksum still matches the state.
     */
    public boolean verify(StateSnapshot snapshot) {
        if (snapshot == null || snapshot.getChecksum() == null || snapshot.getState() == null) {
            return false;
        }
        return MessageDigest.isEqual(
                snapshot.getChecksum().getBytes(StandardCharsets.US_ASCII),
                checksum(snapshot.getState()).getBytes(StandardCharsets.US_ASCII));
    }

    static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder builder = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                int v = b & 0xFF;
                builder.append(HEX[v >>> 4]).append(HEX[v & 0x0F]);
            }
            return builder.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
