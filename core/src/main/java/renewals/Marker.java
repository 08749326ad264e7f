package renewals;

/**
 * Lives in the root package so Weld can scan every module recursively from here.
 */
public class Marker {
}
