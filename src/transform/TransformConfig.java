package transform;

import java.util.Arrays;

/**
 * Flags controlling the mapping between original and input parameter space.
 * The scale factor flag is global, the log transform flags are per parameter.
 */
public class TransformConfig {

    private boolean useScaleFactor = false;
    private boolean[] logTransform;

    public TransformConfig(int numParam) {
        this.logTransform = new boolean[numParam];
    }

    public TransformConfig(boolean useScaleFactor, boolean[] logTransform) {
        this.useScaleFactor = useScaleFactor;
        this.logTransform = Arrays.copyOf(logTransform, logTransform.length);
    }

    public TransformConfig(TransformConfig src) {
        this(src.useScaleFactor, src.logTransform);
    }

    public boolean isUseScaleFactor() {
        return useScaleFactor;
    }

    public void setUseScaleFactor(boolean useScaleFactor) {
        this.useScaleFactor = useScaleFactor;
    }

    public boolean[] getLogTransform() {
        return Arrays.copyOf(logTransform, logTransform.length);
    }

    public void setLogTransform(boolean[] logTransform) {
        this.logTransform = Arrays.copyOf(logTransform, logTransform.length);
    }

    public boolean isLogTransformed(int index) {
        return logTransform[index];
    }

    public int getNumParam() {
        return logTransform.length;
    }

}
