package configstore.domain.exceptions;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Combines several independent failures of one logical operation. Each failure is also attached as a suppressed
 * exception so stack traces show all of them.
 */
public class AggregateFailure extends ConfigStoreFailure {
    private final List<Throwable> failures;

    public AggregateFailure(final List<? extends Throwable> failures) {
        super(failures.size() + " errors: " + failures.stream()
                .map(Throwable::getMessage)
                .collect(Collectors.joining("; ")));
        this.failures = List.copyOf(failures);
        this.failures.forEach(this::addSuppressed);
    }

    public List<Throwable> getFailures() {
        return failures;
    }
}
