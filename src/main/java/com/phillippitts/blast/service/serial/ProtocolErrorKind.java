package com.phillippitts.blast.service.serial;

/** Protocol error categories counted by the communication logger. */
public enum ProtocolErrorKind {
    JSON_PARSE,
    MALFORMED,
    CHECKSUM
}
