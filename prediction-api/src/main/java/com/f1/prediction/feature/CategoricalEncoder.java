package com.f1.prediction.feature;

import com.f1.prediction.model.PreRaceAttributes;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import static com.f1.prediction.feature.FeatureCatalog.*;

/**
 * Maps categorical strings to stable integers in {@code [0, modulus)}.
 * <p>
 * The code is the MD5 digest of the UTF-8 bytes read as an unsigned integer, modulo the
 * modulus. It depends on the string content only, never on {@link Object#hashCode()},
 * so training and inference agree across processes and machines. Collisions are accepted.
 */
public class CategoricalEncoder {

    public static final int DEFAULT_MODULUS = 1000;

    /** Scheme identifier of the default encoder; changing the algorithm or modulus changes it. */
    public static final String SCHEME = "md5-mod-" + DEFAULT_MODULUS + "/v1";

    /** Code used for a missing value. */
    public static final int MISSING_CODE = 0;

    private final BigInteger modulus;

    public CategoricalEncoder() {
        this(DEFAULT_MODULUS);
    }

    public CategoricalEncoder(int modulus) {
        if (modulus < 1) {
            throw new IllegalArgumentException("Modulus must be positive, got " + modulus);
        }
        this.modulus = BigInteger.valueOf(modulus);
    }

    public int encode(String value) {
        if (value == null) {
            return MISSING_CODE;
        }
        byte[] digest = md5().digest(value.getBytes(StandardCharsets.UTF_8));
        return new BigInteger(1, digest).mod(modulus).intValue();
    }

    /**
     * Adds a {@code <column>_encoded} feature for every hash-encoded categorical attribute.
     */
    public FeatureRow encode(FeatureRow row, PreRaceAttributes attributes) {
        return row.toBuilder()
                .put(CIRCUIT_NAME + ENCODED_SUFFIX, encode(attributes.circuitName()))
                .put(COUNTRY + ENCODED_SUFFIX, encode(attributes.country()))
                .put(EVENT_NAME + ENCODED_SUFFIX, encode(attributes.eventName()))
                .put(DRIVER_CODE + ENCODED_SUFFIX, encode(attributes.driverCode()))
                .put(CONSTRUCTOR + ENCODED_SUFFIX, encode(attributes.constructor()))
                .build();
    }

    /**
     * Scheme identifier for this encoder's modulus, recorded with the feature schema.
     */
    public String scheme() {
        return "md5-mod-" + modulus + "/v1";
    }

    private static MessageDigest md5() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            // Every Java platform is required to ship MD5
            throw new IllegalStateException("MD5 digest unavailable", e);
        }
    }
}
