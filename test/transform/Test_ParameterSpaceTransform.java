package transform;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NotFiniteNumberException;
import org.apache.commons.math3.exception.NotStrictlyPositiveException;
import org.apache.commons.math3.exception.ZeroException;
import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

public class Test_ParameterSpaceTransform {

    private static final double[] DEFAULTS = {2.0, 0.5, 3.0e-3};

    @Test
    public void roundTripForEveryFlagCombination() {
        double[] p = {1.3, 0.7, 5.0e-4};
        int n = DEFAULTS.length;
        for (int scale = 0; scale < 2; scale++) {
            for (int mask = 0; mask < (1 << n); mask++) {
                boolean[] log = new boolean[n];
                for (int i = 0; i < n; i++) {
                    log[i] = (mask & (1 << i)) != 0;
                }
                ParameterSpaceTransform t = new ParameterSpaceTransform(DEFAULTS, new TransformConfig(scale == 1, log));
                ParameterVector back = t.toOriginal(t.toInput(ParameterVector.original(p)));
                assertEquals(ParameterSpace.ORIGINAL, back.getSpace());
                for (int i = 0; i < n; i++) {
                    assertEquals(p[i], back.get(i), Math.abs(p[i]) * 1e-10, "Scale " + scale + " mask " + mask);
                }
            }
        }
    }

    @Test
    public void identityWithoutFlags() {
        double[] defaults = {1.0, 2.0};
        ParameterSpaceTransform t = new ParameterSpaceTransform(defaults, new TransformConfig(2));
        assertArrayEquals(defaults, t.toInput(defaults));
        assertArrayEquals(defaults, t.toOriginal(defaults));
    }

    @Test
    public void scaleFactorMakesDefaultOne() {
        ParameterSpaceTransform t = new ParameterSpaceTransform(new double[]{2.0},
                new TransformConfig(true, new boolean[]{false}));
        assertEquals(ParameterVector.input(1.0), t.toInput(ParameterVector.original(2.0)));
        assertEquals(ParameterVector.original(2.0), t.toOriginal(ParameterVector.input(1.0)));
    }

    @Test
    public void scaleThenLog() {
        ParameterSpaceTransform t = new ParameterSpaceTransform(new double[]{2.0},
                new TransformConfig(true, new boolean[]{true}));
        assertEquals(0.0, t.toInput(new double[]{2.0})[0], 0);
        assertEquals(Math.log(2), t.toInput(new double[]{4.0})[0], 1e-15);
        assertEquals(2.0 * Math.E, t.toOriginal(new double[]{1.0})[0], 1e-12);
    }

    @Test
    public void logOfNonPositiveThrows() {
        final ParameterSpaceTransform t = new ParameterSpaceTransform(new double[]{1.0},
                new TransformConfig(false, new boolean[]{true}));
        assertThrows(NotStrictlyPositiveException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                t.toInput(new double[]{0.0});
            }
        });
        assertThrows(NotStrictlyPositiveException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                t.toInput(new double[]{-1.0});
            }
        });
    }

    @Test
    public void invalidDefaults() {
        assertThrows(ZeroException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                new ParameterSpaceTransform(new double[]{0.0, 1.0}, new TransformConfig(true, new boolean[2]));
            }
        });
        assertThrows(NotFiniteNumberException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                new ParameterSpaceTransform(new double[]{Double.NaN}, new TransformConfig(1));
            }
        });
        assertThrows(DimensionMismatchException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                new ParameterSpaceTransform(new double[]{1.0}, new TransformConfig(2));
            }
        });
    }

    @Test
    public void spaceAndLengthChecked() {
        final ParameterSpaceTransform t = new ParameterSpaceTransform(new double[]{1.0, 1.0}, new TransformConfig(2));
        assertThrows(IllegalArgumentException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                t.toInput(ParameterVector.input(1.0, 1.0));
            }
        });
        assertThrows(IllegalArgumentException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                t.toOriginal(ParameterVector.original(1.0, 1.0));
            }
        });
        assertThrows(DimensionMismatchException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                t.toInput(new double[]{1.0});
            }
        });
    }

    @Test
    public void vectorEqualityIsExact() {
        ParameterVector a = ParameterVector.input(0.1 + 0.2, 1.0);
        ParameterVector b = ParameterVector.input(0.1 + 0.2, 1.0);
        ParameterVector c = ParameterVector.input(0.3, 1.0);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
        assertNotEquals(a, ParameterVector.original(0.1 + 0.2, 1.0));
    }

    @Test
    public void vectorIsImmutable() {
        double[] values = {1.0, 2.0};
        ParameterVector v = ParameterVector.original(values);
        values[0] = 5.0;
        v.toArray()[1] = 5.0;
        assertEquals(1.0, v.get(0));
        assertEquals(2.0, v.get(1));
    }

}
