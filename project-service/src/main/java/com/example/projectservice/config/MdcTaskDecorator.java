package com.example.projectservice.config;

import org.slf4j.MDC;
import org.springframework.core.task.TaskDecorator;

import java.util.Map;

/**
 * Carries the submitting thread's MDC (correlation id) into executor threads.
 *
 * The context is captured when the task is submitted and restored around its run;
 * the worker's own context is put back afterwards since pooled threads are reused.
 */
public class MdcTaskDecorator implements TaskDecorator {

    @Override
    public Runnable decorate(Runnable runnable) {
        Map<String, String> submitterContext = MDC.getCopyOfContextMap();

        return () -> {
            Map<String, String> workerContext = MDC.getCopyOfContextMap();
            try {
                if (submitterContext != null) {
                    MDC.setContextMap(submitterContext);
                } else {
                    MDC.clear();
                }
                runnable.run();
            } finally {
                if (workerContext != null) {
                    MDC.setContextMap(workerContext);
                } else {
                    MDC.clear();
                }
            }
        };
    }
}
