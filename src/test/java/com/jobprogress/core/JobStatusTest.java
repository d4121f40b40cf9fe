package com.jobprogress.core;

import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class JobStatusTest {

    private static JobStatus status(int total, int remaining, boolean failed, Map<String, String> metadata) {
        return new JobStatus(new JobRecord("job", total, remaining, failed, metadata, null));
    }

    @Test
    public void testProgress() {
        assertEquals(0.0, status(4, 4, false, Map.of()).getProgress());
        assertEquals(0.25, status(4, 3, false, Map.of()).getProgress());
        assertEquals(1.0, status(4, 0, false, Map.of()).getProgress());
    }

    @Test
    public void testZeroTotalHasZeroProgress() {
        JobStatus status = status(0, 0, false, Map.of());

        assertEquals(0.0, status.getProgress());
        assertTrue(status.isComplete());
    }

    @Test
    public void testFailureReason() {
        assertNull(status(2, 2, false, Map.of()).getFailureReason());
        assertEquals("disk full",
                status(2, 2, true, Map.of(ProgressStore.FAILURE_REASON_KEY, "disk full")).getFailureReason());
    }

    @Test
    public void testMetadataIsDetachedAndReadOnly() {
        Map<String, String> metadata = new HashMap<>();
        metadata.put("a", "1");
        JobStatus status = status(1, 1, false, metadata);

        metadata.put("b", "2");

        assertEquals(1, status.getMetadata().size());
        assertThrows(UnsupportedOperationException.class, () -> status.getMetadata().put("c", "3"));
    }

    @Test
    public void testToJson() {
        JSONObject json = status(4, 1, true, Map.of("owner", "tiler")).toJson();

        assertEquals(4, json.getInt("total"));
        assertEquals(1, json.getInt("remaining"));
        assertEquals(0.75, json.getDouble("progress"));
        assertTrue(json.getBoolean("failed"));
        assertEquals("tiler", json.getJSONObject("metadata").getString("owner"));
    }
}
