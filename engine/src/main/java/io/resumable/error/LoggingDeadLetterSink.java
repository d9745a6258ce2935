package io.resumable.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingDeadLetterSink implements DeadLetterSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingDeadLetterSink.class);

    @Override
    public void acceptFailure(DeadLetter letter) {
        log.warn("Dead letter job={} offset={} class={} attempts={} error={}",
                letter.jobId(), letter.offset(), letter.errorClass(), letter.attempts(), letter.error());
    }
}
