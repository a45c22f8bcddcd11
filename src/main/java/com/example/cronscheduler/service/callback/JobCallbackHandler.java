package com.example.cronscheduler.service.callback;

/**
 * A {@link JobCallback} discovered as a Spring bean.
 * <p>
 * Handlers should:
 * - Be stateless
 * - Translate their own errors into exceptions with a useful message
 * - Not manage transactions
 */
public interface JobCallbackHandler extends JobCallback {

    /**
     * The callback kind this handler serves, matched against the job's {@code kind}
     */
    String getKind();
}
