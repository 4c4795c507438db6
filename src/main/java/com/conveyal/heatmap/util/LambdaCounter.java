package com.conveyal.heatmap.util;

import org.slf4j.Logger;

/**
 * Allows counting iterations and logging from inside lambdas and worker tasks running on several threads at once.
 * An instance that is "effectively final" can still have its increment method called in a lambda function.
 * Increments are synchronized, so this is meant for coarse units of work (chunks, not individual cells).
 */
public class LambdaCounter {

    private final Logger logger;

    private int count = 0;

    private final int total;

    private final int logFrequency;

    private String message;

    /**
     * Create a counter that will log the number of iterations out of a specified total.
     * It expects a message string with two {} placeholders. The first is the count and the second is the total.
     */
    public LambdaCounter (Logger logger, int total, int logFrequency, String message) {
        this.logger = logger;
        this.total = total;
        this.logFrequency = logFrequency;
        this.message = message;
    }

    public synchronized void increment () {
        count += 1;
        if (count % logFrequency == 0) {
            log();
        }
    }

    private void log () {
        if (total > 0) {
            logger.debug(message, count, total);
        } else {
            logger.debug(message, count);
        }
    }

    public synchronized void done () {
        message = "Done. " + message;
        log();
    }

}
