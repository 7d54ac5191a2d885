package com.postq.internal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;

/**
 * Closes the application context and exits the JVM with status 1 so a
 * supervisor can restart the process.
 */
public class ExitingFatalErrorHandler implements FatalErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(ExitingFatalErrorHandler.class);

    private final ApplicationContext applicationContext;

    public ExitingFatalErrorHandler(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
    }

    @Override
    public void onFatalError(String reason, Throwable cause) {
        log.error("PostQ stopping the application: {}", reason, cause);
        Thread exit = new Thread(() -> System.exit(SpringApplication.exit(applicationContext, () -> 1)),
                "postq-fatal-exit");
        exit.start();
    }
}
