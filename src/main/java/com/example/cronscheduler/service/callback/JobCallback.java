package com.example.cronscheduler.service.callback;

import java.util.Map;

/**
 * The work a job performs.
 * <p>
 * Receives the job's callback config unchanged and returns an output map that is
 * recorded in run history. Failure is signalled by throwing.
 */
@FunctionalInterface
public interface JobCallback {

    Map<String, Object> run(Map<String, Object> callbackConfig) throws Exception;
}
