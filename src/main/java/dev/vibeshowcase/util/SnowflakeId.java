package dev.vibeshowcase.util;

import java.time.Instant;

/**
 * Time-ordered 53-bit id generator.
 *
 * <p>Layout, most significant first:</p>
 * <pre>
 * | 41 bits (millis since 2024-01-01) | 4 bits (node id) | 8 bits (sequence) |
 * </pre>
 *
 * <p>Ids stay below 2<sup>53</sup> so browser clients can hold them as plain
 * JSON numbers without losing precision. 16 nodes, 256 ids per millisecond per node.</p>
 */
public final class SnowflakeId {

    // 2024-01-01T00:00:00Z
    static final long CUSTOM_EPOCH = 1704067200000L;

    private static final int NODE_ID_BITS = 4;
    private static final int SEQUENCE_BITS = 8;

    public static final long MAX_NODE_ID = (1L << NODE_ID_BITS) - 1;
    private static final long MAX_SEQUENCE = (1L << SEQUENCE_BITS) - 1;

    private static final int NODE_ID_SHIFT = SEQUENCE_BITS;
    private static final int TIMESTAMP_SHIFT = SEQUENCE_BITS + NODE_ID_BITS;

    // tolerated backwards clock drift before refusing to generate
    private static final long MAX_DRIFT_MS = 5;

    private final long nodeId;
    private long lastTimestamp = -1L;
    private long sequence = 0L;

    public SnowflakeId(long nodeId) {
        if (nodeId < 0 || nodeId > MAX_NODE_ID) {
            throw new IllegalArgumentException(
                    "Node ID must be between 0 and " + MAX_NODE_ID + ", got: " + nodeId);
        }
        this.nodeId = nodeId;
    }

    /**
     * Generates the next id. Monotonic per instance.
     *
     * @throws IllegalStateException if the clock moved backwards by more than a few milliseconds
     */
    public synchronized long nextId() {
        long timestamp = currentTimestamp();

        if (timestamp < lastTimestamp) {
            long drift = lastTimestamp - timestamp;
            if (drift > MAX_DRIFT_MS) {
                throw new IllegalStateException(
                        "Clock moved backwards by " + drift + "ms. Refusing to generate ID.");
            }
            timestamp = lastTimestamp;
        }

        if (timestamp == lastTimestamp) {
            sequence = (sequence + 1) & MAX_SEQUENCE;
            if (sequence == 0) {
                timestamp = waitNextMillis(lastTimestamp);
            }
        } else {
            sequence = 0;
        }

        lastTimestamp = timestamp;
        return (timestamp << TIMESTAMP_SHIFT) | (nodeId << NODE_ID_SHIFT) | sequence;
    }

    public static Instant extractInstant(long id) {
        return Instant.ofEpochMilli((id >>> TIMESTAMP_SHIFT) + CUSTOM_EPOCH);
    }

    public static int extractNodeId(long id) {
        return (int) ((id >>> NODE_ID_SHIFT) & MAX_NODE_ID);
    }

    private long waitNextMillis(long last) {
        long timestamp = currentTimestamp();
        while (timestamp <= last) {
            Thread.onSpinWait();
            timestamp = currentTimestamp();
        }
        return timestamp;
    }

    private long currentTimestamp() {
        return System.currentTimeMillis() - CUSTOM_EPOCH;
    }
}
