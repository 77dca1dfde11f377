package benchmark;

/**
 * Thrown by a simulator that failed to produce a trace.
 */
public class SimulationException extends Exception {

    private static final long serialVersionUID = 3275128849012675103L;

    public SimulationException(String message) {
        super(message);
    }

    public SimulationException(String message, Throwable cause) {
        super(message, cause);
    }

}
