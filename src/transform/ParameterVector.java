package transform;

import java.util.Arrays;

/**
 * An immutable parameter vector tagged with the space it lives in.
 * <p>
 * Equality is exact: two vectors are equal only if they are in the same space
 * and every entry has the same bit pattern. This makes the class usable as a
 * memoisation key.
 * </p>
 */
public final class ParameterVector {

    private final double[] values;
    private final ParameterSpace space;

    public ParameterVector(double[] values, ParameterSpace space) {
        if (values == null || space == null) {
            throw new NullPointerException("Parameter values and space must be defined");
        }
        this.values = Arrays.copyOf(values, values.length);
        this.space = space;
    }

    public static ParameterVector original(double... values) {
        return new ParameterVector(values, ParameterSpace.ORIGINAL);
    }

    public static ParameterVector input(double... values) {
        return new ParameterVector(values, ParameterSpace.INPUT);
    }

    public ParameterSpace getSpace() {
        return space;
    }

    public int length() {
        return values.length;
    }

    public double get(int i) {
        return values[i];
    }

    public double[] toArray() {
        return Arrays.copyOf(values, values.length);
    }

    public boolean isFinite() {
        for (double v : values) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        return true;
    }

    /**
     * @throws IllegalArgumentException if this vector is not in the expected space
     */
    public ParameterVector requireSpace(ParameterSpace expected) {
        if (space != expected) {
            throw new IllegalArgumentException("Parameter vector in " + space
                    + " space where " + expected + " space is required");
        }
        return this;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ParameterVector)) {
            return false;
        }
        ParameterVector other = (ParameterVector) obj;
        return space == other.space && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * space.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return space + Arrays.toString(values);
    }
}
