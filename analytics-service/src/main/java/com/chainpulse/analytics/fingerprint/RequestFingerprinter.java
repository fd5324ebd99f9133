package com.chainpulse.analytics.fingerprint;

import com.chainpulse.analytics.normalize.CanonicalRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import org.springframework.stereotype.Component;

/**
 * Derives the cache / dedup key of a canonical request.
 *
 * <p>The request is written as compact JSON with alphabetically ordered properties and then
 * hashed with FarmHash Fingerprint64. The hash is seedless and its output is frozen by Guava,
 * so keys stay valid across restarts and redeploys. A collision would serve another request's
 * number; at 64 bits that risk is accepted.
 */
@Component
public class RequestFingerprinter {

    private final ObjectMapper canonicalMapper = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .disable(MapperFeature.SORT_CREATOR_PROPERTIES_FIRST)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.INDENT_OUTPUT)
            .build();

    private final HashFunction hashFunction = Hashing.farmHashFingerprint64();

    /**
     * @return 16 lowercase hex characters
     */
    public String fingerprint(CanonicalRequest canonical) {
        return hashFunction.hashBytes(canonicalBytes(canonical)).toString();
    }

    /**
     * {@code <adapter>:<fingerprint>}
     */
    public String cacheKey(CanonicalRequest canonical) {
        return canonical.adapter() + ":" + fingerprint(canonical);
    }

    public byte[] canonicalBytes(CanonicalRequest canonical) {
        try {
            return canonicalMapper.writeValueAsBytes(canonical);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Canonical request is not serializable: " + canonical, e);
        }
    }
}
