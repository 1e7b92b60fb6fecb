package com.phillippitts.blast.service.serial;

import com.phillippitts.blast.config.properties.SerialLoggerProperties;
import com.phillippitts.blast.exception.LogRecordRejectedException;
import com.phillippitts.blast.service.router.LogCategory;
import com.phillippitts.blast.service.router.LogRecord;
import com.phillippitts.blast.service.router.RecordSink;
import com.phillippitts.blast.service.router.Severity;
import com.phillippitts.blast.util.BoundedHistory;
import com.phillippitts.blast.util.LogSanitizer;
import com.phillippitts.blast.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Protocol-level diagnostic logging for the serial link, independent of business parsing.
 *
 * <p>Each sent and received frame gets a per-direction sequence number, the gap since the
 * previous frame in the same direction, a hex dump and a printable rendering. Received
 * frames also get the round-trip time since the most recent send. Entries are kept in a
 * bounded buffer per direction and a truncated summary is routed to the
 * {@link LogCategory#SERIAL} stream.
 */
public class CommunicationLogger {

    private static final Logger LOG = LogManager.getLogger(CommunicationLogger.class);

    private static final DateTimeFormatter DUMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final byte STX = 0x02;
    private static final byte ETX = 0x03;

    private final SerialLoggerProperties properties;
    private final RecordSink sink;
    private final Clock clock;
    private final BoundedHistory<CommunicationEntry> sent;
    private final BoundedHistory<CommunicationEntry> received;

    private final Lock lock = new ReentrantLock();
    private long txSequence;
    private long rxSequence;
    private Instant lastTx;
    private Instant lastRx;
    private byte[] lastReceivedFrame;
    private long timeouts;
    private long jsonParseErrors;
    private long malformedMessages;
    private long checksumErrors;
    private long reconnectAttempts;
    private long reconnectSuccesses;
    private final AtomicLong dumpSequence = new AtomicLong();

    public CommunicationLogger(SerialLoggerProperties properties, RecordSink sink, Clock clock) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sent = new BoundedHistory<>(properties.getBufferSize());
        this.received = new BoundedHistory<>(properties.getBufferSize());
    }

    /**
     * Logs a frame written to the link.
     *
     * @param data raw bytes
     * @param command command label (nullable)
     */
    public CommunicationEntry logSent(byte[] data, String command) {
        byte[] bytes = data == null ? new byte[0] : data;
        CommunicationEntry entry;
        lock.lock();
        try {
            Instant now = clock.instant();
            double sinceLast = lastTx == null ? -1 : TimeUtils.millisBetween(lastTx, now);
            entry = new CommunicationEntry(Direction.TX, ++txSequence, now, sinceLast, -1, bytes.length,
                    LogSanitizer.toHex(bytes), LogSanitizer.toSafeAscii(bytes), command, true);
            lastTx = now;
            sent.add(entry);
        } finally {
            lock.unlock();
        }
        LOG.debug("TX[{}] {} ({} bytes)", entry.sequence(), command == null ? "" : command, entry.length());
        summarize(entry, Severity.DEBUG, "TX[" + entry.sequence() + "] " + (command == null ? "" : command));
        return entry;
    }

    /**
     * Logs a frame read from the link.
     *
     * @param data raw bytes
     * @param parsed parsed payload, or null if parsing failed
     */
    public CommunicationEntry logReceived(byte[] data, Map<String, ?> parsed) {
        byte[] bytes = data == null ? new byte[0] : data;
        CommunicationEntry entry;
        lock.lock();
        try {
            Instant now = clock.instant();
            double sinceLast = lastRx == null ? -1 : TimeUtils.millisBetween(lastRx, now);
            double roundTrip = lastTx == null ? -1 : TimeUtils.millisBetween(lastTx, now);
            entry = new CommunicationEntry(Direction.RX, ++rxSequence, now, sinceLast, roundTrip, bytes.length,
                    LogSanitizer.toHex(bytes), LogSanitizer.toSafeAscii(bytes), null, parsed != null);
            lastRx = now;
            lastReceivedFrame = Arrays.copyOf(bytes, bytes.length);
            received.add(entry);
        } finally {
            lock.unlock();
        }
        summarize(entry, Severity.DEBUG, "RX[" + entry.sequence() + "] PARSED=" + (entry.parsed() ? "OK" : "FAIL"));
        return entry;
    }

    public void logTimeout(Duration waited, String context) {
        lock.lock();
        try {
            timeouts++;
        } finally {
            lock.unlock();
        }
        LOG.warn("Serial timeout after {} ms ({})", waited.toMillis(), context);
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("event", "timeout");
        fields.put("waited_ms", waited.toMillis());
        fields.put("context", context == null ? "" : context);
        tryEnqueue(Severity.WARNING, "Serial timeout", fields);
    }

    /**
     * Counts a protocol error and logs the offending frame.
     *
     * @param error underlying failure (nullable)
     */
    public void logProtocolError(ProtocolErrorKind kind, byte[] raw, Throwable error) {
        Objects.requireNonNull(kind, "kind");
        byte[] bytes = raw == null ? new byte[0] : raw;
        lock.lock();
        try {
            switch (kind) {
                case JSON_PARSE -> jsonParseErrors++;
                case MALFORMED -> malformedMessages++;
                case CHECKSUM -> checksumErrors++;
            }
        } finally {
            lock.unlock();
        }
        String message = error == null ? "" : String.valueOf(error.getMessage());
        LOG.warn("Serial protocol error {} ({} bytes): {}", kind, bytes.length, message);
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("event", "protocol_error");
        fields.put("kind", kind.name());
        fields.put("length", bytes.length);
        fields.put("hex", LogSanitizer.truncate(LogSanitizer.toHex(bytes), properties.getSummaryHexLimit()));
        fields.put("ascii", LogSanitizer.truncate(LogSanitizer.toSafeAscii(bytes), properties.getSummaryAsciiLimit()));
        fields.put("error", message);
        tryEnqueue(Severity.ERROR, "Protocol error: " + kind.name(), fields);
    }

    public void logReconnection(int attempt, boolean success) {
        lock.lock();
        try {
            reconnectAttempts++;
            if (success) {
                reconnectSuccesses++;
            }
        } finally {
            lock.unlock();
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("event", "reconnection");
        fields.put("attempt", attempt);
        fields.put("success", success);
        tryEnqueue(success ? Severity.INFO : Severity.WARNING,
                "Reconnection attempt " + attempt + (success ? " succeeded" : " failed"), fields);
    }

    public CommunicationStatistics getStatistics() {
        long tx;
        long rx;
        long to;
        long json;
        long malformed;
        long checksum;
        long attempts;
        long successes;
        lock.lock();
        try {
            tx = txSequence;
            rx = rxSequence;
            to = timeouts;
            json = jsonParseErrors;
            malformed = malformedMessages;
            checksum = checksumErrors;
            attempts = reconnectAttempts;
            successes = reconnectSuccesses;
        } finally {
            lock.unlock();
        }
        int samples = 0;
        double min = Double.MAX_VALUE;
        double max = 0;
        double total = 0;
        for (CommunicationEntry entry : received.snapshot()) {
            if (entry.roundTripMs() >= 0) {
                samples++;
                min = Math.min(min, entry.roundTripMs());
                max = Math.max(max, entry.roundTripMs());
                total += entry.roundTripMs();
            }
        }
        long errors = json + malformed + checksum;
        double errorRate = rx == 0 ? 0d : (double) errors / rx;
        return new CommunicationStatistics(tx, rx, to, json, malformed, checksum, attempts, successes,
                errorRate, samples, samples == 0 ? 0d : min, samples == 0 ? 0d : total / samples,
                samples == 0 ? 0d : max);
    }

    public RecentCommunications getRecentCommunications(int count) {
        return new RecentCommunications(sent.last(count), received.last(count));
    }

    /**
     * Best-effort classification of a raw frame for diagnostics. Never used for decoding.
     */
    public ProtocolAnalysis analyzeProtocol(byte[] data) {
        byte[] bytes = data == null ? new byte[0] : data;
        int len = bytes.length;
        String startsWith = LogSanitizer.toHex(Arrays.copyOfRange(bytes, 0, Math.min(4, len)));
        String endsWith = LogSanitizer.toHex(Arrays.copyOfRange(bytes, Math.max(0, len - 4), len));
        String text = new String(bytes, StandardCharsets.ISO_8859_1);

        int open = text.indexOf('{');
        int close = text.lastIndexOf('}');
        boolean containsJson = open >= 0 && close > open;
        boolean jsonValid = false;
        if (containsJson) {
            try {
                new JSONObject(text.substring(open, close + 1));
                jsonValid = true;
            } catch (JSONException e) {
                LOG.trace("Embedded JSON does not parse: {}", e.getMessage());
            }
        }

        ProtocolAnalysis.LineEnding ending;
        if (text.endsWith("\r\n")) {
            ending = ProtocolAnalysis.LineEnding.CRLF;
        } else if (text.endsWith("\n")) {
            ending = ProtocolAnalysis.LineEnding.LF;
        } else if (text.endsWith("\r")) {
            ending = ProtocolAnalysis.LineEnding.CR;
        } else {
            ending = ProtocolAnalysis.LineEnding.NONE;
        }

        ProtocolAnalysis.Format format = containsJson ? ProtocolAnalysis.Format.JSON : ProtocolAnalysis.Format.UNKNOWN;
        if (text.startsWith("$")) {
            format = ProtocolAnalysis.Format.NMEA;
        } else if (text.startsWith("AT")) {
            format = ProtocolAnalysis.Format.AT_COMMAND;
        } else if (len >= 2 && bytes[0] == STX && bytes[len - 1] == ETX) {
            format = ProtocolAnalysis.Format.STX_ETX;
        }
        return new ProtocolAnalysis(len, startsWith, endsWith, containsJson, jsonValid, ending, format);
    }

    /**
     * Writes buffered traffic, statistics and an analysis of the last received frame to a
     * dump file in the current run. File names carry a per-logger sequence so dumps taken
     * within the same second do not overwrite each other.
     *
     * @return the dump file name
     * @throws com.phillippitts.blast.exception.LogRecordRejectedException if the router refuses the artifact
     */
    public String dumpCommunications(String reason) {
        Instant now = clock.instant();
        byte[] lastFrame;
        lock.lock();
        try {
            lastFrame = lastReceivedFrame;
        } finally {
            lock.unlock();
        }
        CommunicationStatistics stats = getStatistics();
        JSONObject dump = new JSONObject();
        dump.put("reason", reason == null ? "" : reason);
        dump.put("timestamp", now.toString());
        dump.put("statistics", new JSONObject(statisticsFields(stats)));
        dump.put("sent", toJson(sent.snapshot()));
        dump.put("received", toJson(received.snapshot()));
        if (lastFrame != null) {
            dump.put("last_received_analysis", new JSONObject(analyzeProtocol(lastFrame).toFields()));
        }
        String fileName = "serial_dump_" + DUMP_FORMAT.format(now.atZone(ZoneId.systemDefault()))
                + "_" + dumpSequence.incrementAndGet() + ".json";
        sink.enqueueArtifact(fileName, dump.toString(2));
        LOG.info("Serial communication dump queued as {} ({})", fileName, reason);
        return fileName;
    }

    private static JSONArray toJson(List<CommunicationEntry> entries) {
        JSONArray array = new JSONArray();
        for (CommunicationEntry entry : entries) {
            array.put(new JSONObject(entry.toFields()));
        }
        return array;
    }

    private static Map<String, Object> statisticsFields(CommunicationStatistics s) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("total_sent", s.totalSent());
        fields.put("total_received", s.totalReceived());
        fields.put("timeouts", s.timeouts());
        fields.put("json_parse_errors", s.jsonParseErrors());
        fields.put("malformed_messages", s.malformedMessages());
        fields.put("checksum_errors", s.checksumErrors());
        fields.put("error_rate", TimeUtils.round3(s.errorRate()));
        fields.put("min_round_trip_ms", TimeUtils.round3(s.minRoundTripMs()));
        fields.put("avg_round_trip_ms", TimeUtils.round3(s.avgRoundTripMs()));
        fields.put("max_round_trip_ms", TimeUtils.round3(s.maxRoundTripMs()));
        return fields;
    }

    private void summarize(CommunicationEntry entry, Severity severity, String message) {
        Map<String, Object> fields = entry.toFields();
        fields.put("hex", LogSanitizer.truncate(entry.hex(), properties.getSummaryHexLimit()));
        fields.put("ascii", LogSanitizer.truncate(entry.ascii(), properties.getSummaryAsciiLimit()));
        tryEnqueue(severity, message, fields);
    }

    private void tryEnqueue(Severity severity, String message, Map<String, Object> fields) {
        try {
            sink.enqueue(new LogRecord(LogCategory.SERIAL, clock.instant(), severity, message, fields));
        } catch (LogRecordRejectedException e) {
            LOG.debug("Dropped serial record '{}': {}", message, e.getMessage());
        }
    }
}
