package com.phillippitts.blast.service.serial;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One logged serial message.
 *
 * @param direction TX or RX
 * @param sequence per-direction sequence number starting at 1
 * @param timestamp when the message was logged
 * @param sinceLastMs milliseconds since the previous message in the same direction, -1 for the first
 * @param roundTripMs RX only: milliseconds since the most recent TX, -1 when unknown
 * @param length payload length in bytes
 * @param hex hex dump of the payload
 * @param ascii printable rendering with {@code \xNN} escapes
 * @param command TX only: command label (nullable)
 * @param parsed RX only: whether the payload parsed successfully
 */
public record CommunicationEntry(Direction direction,
                                 long sequence,
                                 Instant timestamp,
                                 double sinceLastMs,
                                 double roundTripMs,
                                 int length,
                                 String hex,
                                 String ascii,
                                 String command,
                                 boolean parsed) {

    Map<String, Object> toFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("direction", direction.name());
        fields.put("sequence", sequence);
        fields.put("timestamp", timestamp.toString());
        fields.put("since_last_ms", sinceLastMs);
        if (direction == Direction.RX) {
            fields.put("round_trip_ms", roundTripMs);
            fields.put("parsed", parsed);
        } else {
            fields.put("command", command);
        }
        fields.put("length", length);
        fields.put("hex", hex);
        fields.put("ascii", ascii);
        return fields;
    }
}
