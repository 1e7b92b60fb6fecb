package com.phillippitts.blast.service.serial;

/** Direction of a serial message relative to this host. */
public enum Direction {
    TX,
    RX
}
