package com.phillippitts.blast.service.serial;

import java.util.List;

/** Most recent buffered messages per direction, oldest first. */
public record RecentCommunications(List<CommunicationEntry> sent, List<CommunicationEntry> received) {
}
