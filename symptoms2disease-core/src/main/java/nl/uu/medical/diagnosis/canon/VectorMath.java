package nl.uu.medical.diagnosis.canon;

final class VectorMath {
    private VectorMath() {}

    static double dot(float[] a, float[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += (double) a[i] * b[i];
        }
        return sum;
    }

    static double norm(float[] v) {
        return Math.sqrt(dot(v, v));
    }

    /**
     * Copy of {@code v} scaled to unit length; a zero vector is returned unchanged.
     */
    static float[] unitNormalize(float[] v) {
        double n = norm(v);
        float[] out = new float[v.length];
        if (n == 0.0) {
            System.arraycopy(v, 0, out, 0, v.length);
            return out;
        }
        for (int i = 0; i < v.length; i++) {
            out[i] = (float) (v[i] / n);
        }
        return out;
    }

    static boolean isZero(float[] v) {
        for (float x : v) {
            if (x != 0.0f) return false;
        }
        return true;
    }
}
