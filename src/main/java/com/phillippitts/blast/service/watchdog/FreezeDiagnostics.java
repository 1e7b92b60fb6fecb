package com.phillippitts.blast.service.watchdog;

import com.phillippitts.blast.service.performance.ResourceSnapshot;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Builds the JSON diagnostic dump written when a freeze is detected: thread stacks, a
 * resource snapshot and the recent operation history.
 */
final class FreezeDiagnostics {

    private final int maxStackDepth;

    FreezeDiagnostics(int maxStackDepth) {
        this.maxStackDepth = maxStackDepth;
    }

    String capture(ComponentFrozenEvent event, ResourceSnapshot resources, List<OperationRecord> operations) {
        JSONObject dump = new JSONObject();
        dump.put("timestamp", event.detectedAt().toString());
        dump.put("component", event.component());
        dump.put("freeze_count", event.freezeCount());
        dump.put("frozen_for_ms", event.frozenFor().toMillis());
        dump.put("timeout_ms", event.timeout().toMillis());
        dump.put("last_heartbeat", event.lastHeartbeat().toString());
        dump.put("threads", threads());
        dump.put("resources", resources(resources));
        dump.put("recent_operations", operations(operations));
        return dump.toString(2);
    }

    private JSONArray threads() {
        JSONArray threads = new JSONArray();
        Map<Thread, StackTraceElement[]> all = Thread.getAllStackTraces();
        all.entrySet().stream()
                .sorted(Comparator.comparing(e -> e.getKey().getName()))
                .forEach(e -> {
                    Thread t = e.getKey();
                    JSONObject info = new JSONObject();
                    info.put("name", t.getName());
                    info.put("id", t.getId());
                    info.put("state", t.getState().name());
                    info.put("daemon", t.isDaemon());
                    JSONArray frames = new JSONArray();
                    StackTraceElement[] stack = e.getValue();
                    for (int i = 0; i < Math.min(maxStackDepth, stack.length); i++) {
                        frames.put(stack[i].toString());
                    }
                    info.put("stack", frames);
                    threads.put(info);
                });
        return threads;
    }

    private static JSONObject resources(ResourceSnapshot snapshot) {
        JSONObject json = new JSONObject();
        json.put("memory_mb", Math.round(snapshot.memoryMb() * 10d) / 10d);
        json.put("cpu_percent", snapshot.cpuPercent());
        json.put("thread_count", snapshot.threadCount());
        json.put("available_processors", Runtime.getRuntime().availableProcessors());
        return json;
    }

    private static JSONArray operations(List<OperationRecord> operations) {
        JSONArray array = new JSONArray();
        for (OperationRecord op : operations) {
            JSONObject json = new JSONObject();
            json.put("timestamp", op.timestamp().toString());
            json.put("operation", op.operation());
            json.put("thread", op.thread());
            json.put("details", new JSONObject(op.details()));
            array.put(json);
        }
        return array;
    }
}
