package io.catalogsync.orchestration;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

@ApplicationScoped
public class LoggingProgressReporter implements ProgressReporter {

    private static final Logger LOG = Logger.getLogger(LoggingProgressReporter.class);

    @Override
    public void report(int stage, String message) {
        LOG.infof("[%d] %s", stage, message);
    }
}
