package com.al.clinicalnormalizer.service.pipeline;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Carries the caller's MDC (document id) into worker threads.
 */
final class MdcTaskDecorator {

    static final String MDC_KEY = "documentId";

    private MdcTaskDecorator() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    static <T> Callable<T> wrap(Callable<T> task) {
        Map<String, String> callerContext = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (callerContext != null) {
                MDC.setContextMap(callerContext);
            } else {
                MDC.clear();
            }
            try {
                return task.call();
            } finally {
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        };
    }
}
