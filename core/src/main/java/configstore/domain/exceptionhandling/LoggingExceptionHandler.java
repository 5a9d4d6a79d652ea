package configstore.domain.exceptionhandling;

import configstore.domain.exceptions.ExternalException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jspecify.annotations.Nullable;

/**
 * {@link ExternalException}s are rendered with their stack trace. Anything else is reduced to its message, followed by the
 * message of the root cause when the wrapper does not already repeat it.
 */
@ApplicationScoped
public class LoggingExceptionHandler implements ExceptionHandler {

    @Inject
    @ConfigProperty(name = "cs.exceptions.printstacktrace", defaultValue = "false")
    private boolean printStackTrace;

    public LoggingExceptionHandler() {
    }

    public LoggingExceptionHandler(final boolean printStackTrace) {
        this.printStackTrace = printStackTrace;
    }

    @Override
    public String getExceptionMessage(@Nullable final Throwable e) {
        if (e == null) {
            return "Exception was null";
        }

        if (printStackTrace || e instanceof ExternalException) {
            return ExceptionUtils.getStackTrace(e);
        }

        final String message = describe(e);
        final Throwable root = ExceptionUtils.getRootCause(e);
        if (root == null || root == e) {
            return message;
        }

        final String rootMessage = describe(root);
        return message.contains(rootMessage) ? message : message + " (caused by " + rootMessage + ")";
    }

    private static String describe(final Throwable e) {
        return StringUtils.isBlank(e.getMessage()) ? e.toString() : e.getMessage();
    }
}
