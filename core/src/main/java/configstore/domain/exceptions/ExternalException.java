package configstore.domain.exceptions;

/**
 * Marker interface for external exceptions. These exceptions might be transient and may be resolved by retrying.
 */
public interface ExternalException {
}
