package com.questrail.debuglink.transport.bus;

import com.questrail.debuglink.time.DeterministicScheduler;
import com.questrail.debuglink.time.ManualMonotonicClock;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

class BusTransportLoggingTest {

    @Test
    void heartbeatLossIsLoggedAsWarning() {
        ManualMonotonicClock clock = new ManualMonotonicClock();
        DeterministicScheduler scheduler = new DeterministicScheduler(clock);
        BusTransport transport = new BusTransport(new LocalBus(), scheduler, clock, HeartbeatPolicy.defaults());

        Logger logger = (Logger) LoggerFactory.getLogger(BusTransport.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        boolean originalAdditive = logger.isAdditive();
        logger.setAdditive(false);
        appender.start();
        logger.addAppender(appender);

        try {
            // Nobody listens on the session channel, so no pong ever arrives.
            transport.connect("silent");
            scheduler.advanceMillis(5000);
        } finally {
            logger.detachAppender(appender);
            logger.setAdditive(originalAdditive);
            appender.stop();
        }

        ILoggingEvent warning = appender.list.stream()
                .filter(e -> e.getLevel() == Level.WARN)
                .findFirst()
                .orElseThrow();
        assertEquals("Pong timeout on 'nulldc-debugger-silent' - connection lost", warning.getFormattedMessage());
    }
}
