package com.phillippitts.blast.service.serial;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Heuristic description of a raw frame, used only to annotate diagnostics.
 *
 * @param length frame length
 * @param startsWithHex hex of up to the first four bytes
 * @param endsWithHex hex of up to the last four bytes
 * @param containsJson whether a {@code {...}} span is present
 * @param jsonValid whether that span parses as a JSON object
 * @param lineEnding trailing line terminator
 * @param format best-guess framing
 */
public record ProtocolAnalysis(int length,
                               String startsWithHex,
                               String endsWithHex,
                               boolean containsJson,
                               boolean jsonValid,
                               LineEnding lineEnding,
                               Format format) {

    public enum LineEnding { CRLF, LF, CR, NONE }

    public enum Format { JSON, NMEA, AT_COMMAND, STX_ETX, UNKNOWN }

    Map<String, Object> toFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("length", length);
        fields.put("starts_with", startsWithHex);
        fields.put("ends_with", endsWithHex);
        fields.put("contains_json", containsJson);
        fields.put("json_valid", jsonValid);
        fields.put("line_ending", lineEnding.name());
        fields.put("format", format.name());
        return fields;
    }
}
