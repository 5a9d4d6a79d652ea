package configstore.domain.exceptions;

/**
 * Marker interface for internal exceptions. Usually this means a programming error, a configuration error or
 * content that can not be decoded. These exceptions can not be resolved by retrying.
 */
public interface InternalException {
}
