/**
 * Structured failure records surfaced to callers of the reconciler.
 *
 * <h2>Error Codes</h2>
 * <pre>
 * CLIENT_CALL_FAILED        → {PHASE}_FAILED
 * POLL_TIMEOUT, POLL_FATAL  → {PHASE}_TIMEOUT_OR_ERROR
 * NOT_FOUND                 → {PHASE}_NOT_FOUND
 * CANCELLED                 → {PHASE}_CANCELLED
 * MALFORMED_IMPORT_ID       → MALFORMED_IMPORT_ID
 * </pre>
 *
 * @since 1.0.0
 * @author Reconciler Team
 */
package com.ryuqq.reconciler.core.diagnostic;
