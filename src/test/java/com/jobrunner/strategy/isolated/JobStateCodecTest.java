package com.jobrunner.strategy.isolated;

import com.jobrunner.fixtures.SendEmailJob;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for JobStateCodec.
 */
class JobStateCodecTest {

    @Test
    @DisplayName("Envelope should carry class, identity, limits and fields")
    void envelopeCarriesJob() throws Exception {
        SendEmailJob job = new SendEmailJob("ops@example.com", "Weekly digest");

        JobEnvelope envelope = JobStateCodec.decode(
                JobStateCodec.encode(JobStateCodec.envelope(job, 20, 96)));

        assertEquals(SendEmailJob.class.getName(), envelope.jobClass());
        assertEquals(job.getType(), envelope.type());
        assertEquals(job.getId(), envelope.id());
        assertEquals(20, envelope.timeoutSeconds());
        assertEquals(96, envelope.maxMemoryMb());
        assertEquals("ops@example.com", envelope.fields().get("recipient"));
        assertEquals("Weekly digest", envelope.fields().get("subject"));
    }

    @Test
    @DisplayName("Should drop fields that are not plain data")
    void shouldDropNonPlainFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("name", "report");
        fields.put("nothing", null);
        fields.put("nested", Map.of("ids", List.of(1, 2L, 3.5)));
        fields.put("thread", Thread.currentThread());
        fields.put("mixed", List.of("ok", new Object()));

        Map<String, Object> plain = JobStateCodec.plainData("job_1", fields);

        assertEquals(List.of("name", "nothing", "nested"), List.copyOf(plain.keySet()));
    }

    @Test
    @DisplayName("Decoded fields should equal the transmitted fields exactly")
    void decodedFieldsEqualTransmitted() throws Exception {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("count", 5L);
        fields.put("small", (short) 7);
        fields.put("offset", 9_000_000_000L);
        fields.put("huge", new BigInteger("123456789012345678901234567890"));
        fields.put("ratio", 1.5f);
        fields.put("scale", 0.1f);
        fields.put("weight", 2.25);
        fields.put("nested", Map.of("ids", List.of(1, 2L, 3.5f)));

        Map<String, Object> sent = JobStateCodec.plainData("job_1", fields);
        Map<String, Object> received = JobStateCodec.decode(JobStateCodec.encode(
                new JobEnvelope("x.Job", "Job", "job_1", 10, 64, sent))).fields();

        assertEquals(sent, received);
        assertEquals(5, received.get("count"));
        assertEquals(9_000_000_000L, received.get("offset"));
        assertEquals(new BigInteger("123456789012345678901234567890"), received.get("huge"));
        assertEquals(1.5, received.get("ratio"));
        assertEquals(0.1, received.get("scale"));
        assertEquals(Map.of("ids", List.of(1, 2, 3.5)), received.get("nested"));
    }

    @Test
    @DisplayName("Should drop values without an exact JSON form")
    void shouldDropInexactValues() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("amount", new BigDecimal("0.10000000000000000000001"));
        fields.put("nan", Double.NaN);
        fields.put("inf", Float.POSITIVE_INFINITY);
        fields.put("label", "kept");

        assertEquals(Map.of("label", "kept"), JobStateCodec.plainData("job_1", fields));
    }

    @Test
    @DisplayName("Should not write type information")
    void shouldNotWriteTypeInformation() {
        String json = new String(JobStateCodec.encode(JobStateCodec.envelope(new SendEmailJob(), 10, 64)),
                StandardCharsets.UTF_8);

        assertFalse(json.contains("@class"));
        assertFalse(json.contains("@type"));
    }

    @Test
    @DisplayName("Plain-data check should reject maps with non-string keys")
    void rejectsNonStringKeys() {
        assertTrue(JobStateCodec.isPlain(Map.of("a", true)));
        assertFalse(JobStateCodec.isPlain(Map.of(1, "a")));
    }
}
