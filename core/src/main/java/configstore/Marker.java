package configstore;

/**
 * Weld scans recursively from the package of this class to find beans in every module.
 */
public final class Marker {
    private Marker() {
    }
}
