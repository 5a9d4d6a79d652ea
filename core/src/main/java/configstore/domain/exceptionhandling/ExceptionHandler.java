package configstore.domain.exceptionhandling;

/**
 * Converts exceptions into messages suitable for log lines.
 */
public interface ExceptionHandler {
    String getExceptionMessage(Throwable e);
}
