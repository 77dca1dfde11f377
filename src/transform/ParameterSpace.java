package transform;

/**
 * The two parameter spaces a vector can live in.
 */
public enum ParameterSpace {
    /**
     * What the simulator consumes.
     */
    ORIGINAL,
    /**
     * What an optimiser manipulates.
     */
    INPUT
}
