package com.jobrunner.strategy.isolated;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobrunner.core.JobDescriptor;
import com.jobrunner.exception.JobExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON encoding of {@link JobEnvelope}.
 *
 * <p>Only plain data crosses the process boundary: strings, integers, finite floating
 * point numbers, booleans, null, and lists or string-keyed maps of those. Numbers are
 * normalised before encoding, so the child sees exactly the values that were sent. No type information is written and none
 * is honoured on read, so a payload can never name a class to instantiate besides
 * the job class itself, which the launcher checks.
 */
public final class JobStateCodec {

    private static final Logger log = LoggerFactory.getLogger(JobStateCodec.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final Object NOT_PLAIN = new Object();

    private JobStateCodec() {
    }

    /**
     * Build the envelope for a job with its effective limits.
     */
    public static JobEnvelope envelope(JobDescriptor job, int timeoutSeconds, int maxMemoryMb) {
        return new JobEnvelope(
                job.getClass().getName(),
                job.getType(),
                job.getId(),
                timeoutSeconds,
                maxMemoryMb,
                plainData(job.getId(), job.exportFields()));
    }

    public static byte[] encode(JobEnvelope envelope) {
        try {
            return MAPPER.writeValueAsBytes(envelope);
        } catch (IOException e) {
            throw new JobExecutionException("Failed to serialize job: " + e.getMessage(), e);
        }
    }

    public static JobEnvelope decode(byte[] json) throws IOException {
        return MAPPER.readValue(json, JobEnvelope.class);
    }

    public static JobEnvelope read(Path file) throws IOException {
        return MAPPER.readValue(file.toFile(), JobEnvelope.class);
    }

    /**
     * Copy of the fields holding only plain data, normalised to the types the child
     * reads back; anything else is dropped with a warning.
     */
    public static Map<String, Object> plainData(String jobId, Map<String, Object> fields) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (fields == null) {
            return result;
        }
        fields.forEach((name, value) -> {
            Object plain = normalize(value);
            if (plain != NOT_PLAIN) {
                result.put(name, plain);
            } else {
                log.warn("Field '{}' of job {} is not plain data and is not transmitted", name, jobId);
            }
        });
        return result;
    }

    static boolean isPlain(Object value) {
        return normalize(value) != NOT_PLAIN;
    }

    /**
     * Map a value onto what JSON decoding yields for it: integers become the narrowest of
     * Integer, Long and BigInteger, floats become the Double of their decimal form.
     * BigDecimal and non-finite numbers have no exact JSON counterpart and are not plain.
     */
    static Object normalize(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return narrowest(BigInteger.valueOf(((Number) value).longValue()));
        }
        if (value instanceof BigInteger big) {
            return narrowest(big);
        }
        if (value instanceof Double d) {
            return Double.isFinite(d) ? d : NOT_PLAIN;
        }
        if (value instanceof Float f) {
            return Float.isFinite(f) ? Double.valueOf(Float.toString(f)) : NOT_PLAIN;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                Object plain = normalize(item);
                if (plain == NOT_PLAIN) {
                    return NOT_PLAIN;
                }
                copy.add(plain);
            }
            return copy;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    return NOT_PLAIN;
                }
                Object plain = normalize(entry.getValue());
                if (plain == NOT_PLAIN) {
                    return NOT_PLAIN;
                }
                copy.put(key, plain);
            }
            return copy;
        }
        return NOT_PLAIN;
    }

    private static Object narrowest(BigInteger value) {
        if (value.bitLength() < Integer.SIZE) {
            return value.intValue();
        }
        if (value.bitLength() < Long.SIZE) {
            return value.longValue();
        }
        return value;
    }
}
