/**
 * Telemetry subsystem exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.blast.exception.BlastException} - Base exception for all
 *       subsystem errors</li>
 *   <li>{@link com.phillippitts.blast.exception.LogRecordRejectedException} - A record was not
 *       accepted by the log router
 *     <ul>
 *       <li>{@link com.phillippitts.blast.exception.LogQueueOverloadedException} - Backpressure
 *           signal raised when the log queue is full</li>
 *       <li>{@link com.phillippitts.blast.exception.LogRouterClosedException} - The router has
 *           already been shut down</li>
 *     </ul>
 *   </li>
 *   <li>{@link com.phillippitts.blast.exception.LogDirectoryException} - Fatal failure to
 *       create the run directory or a category stream at startup</li>
 *   <li>{@link com.phillippitts.blast.exception.RecoveryException} - Raised when the value of
 *       an exhausted retry is requested</li>
 * </ul>
 *
 * <p>All exceptions are unchecked, support exception chaining via {@code cause} and carry
 * context fields (category, capacity, path, attempts) for diagnostics.
 *
 * @see com.phillippitts.blast.exception.BlastException
 * @since 1.0
 */
package com.phillippitts.blast.exception;
