package com.phillippitts.blast.service.watchdog;

/**
 * Remediation hook invoked once per freeze episode. Runs on the poll loop thread and must
 * not block for long; exceptions are logged and otherwise ignored.
 */
@FunctionalInterface
public interface FreezeCallback {

    void onFreeze(ComponentFrozenEvent event);
}
