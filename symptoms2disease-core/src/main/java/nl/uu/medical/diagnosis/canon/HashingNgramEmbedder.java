package nl.uu.medical.diagnosis.canon;

import java.nio.charset.StandardCharsets;

/**
 * Deterministic subword embedder that needs no trained model.
 * <p>
 * Each word is represented by its own token plus the character n-grams of {@code <word>},
 * hashed into {@code dimension} signed buckets. The phrase vector is the mean of the
 * unit-length word vectors, so phrases sharing words or word fragments land close together.
 * </p>
 */
public final class HashingNgramEmbedder implements PhraseEmbedder {

    public static final int DEFAULT_DIMENSION = 300;
    public static final int DEFAULT_MIN_N = 3;
    public static final int DEFAULT_MAX_N = 5;

    private static final int FNV_OFFSET = 0x811c9dc5;
    private static final int FNV_PRIME = 0x01000193;

    private final int dimension;
    private final int minN;
    private final int maxN;

    public HashingNgramEmbedder() {
        this(DEFAULT_DIMENSION);
    }

    public HashingNgramEmbedder(int dimension) {
        this(dimension, DEFAULT_MIN_N, DEFAULT_MAX_N);
    }

    public HashingNgramEmbedder(int dimension, int minN, int maxN) {
        if (dimension < 1) throw new IllegalArgumentException("dimension must be >= 1 but was " + dimension);
        if (minN < 1 || maxN < minN) {
            throw new IllegalArgumentException("Invalid n-gram range [" + minN + ", " + maxN + "]");
        }
        this.dimension = dimension;
        this.minN = minN;
        this.maxN = maxN;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public float[] embed(String text) {
        float[] phrase = new float[dimension];
        if (text == null || text.isBlank()) return phrase;

        int words = 0;
        for (String word : text.strip().split("\\s+")) {
            float[] wv = wordVector(word);
            double n = VectorMath.norm(wv);
            if (n == 0.0) continue;
            for (int i = 0; i < dimension; i++) {
                phrase[i] += (float) (wv[i] / n);
            }
            words++;
        }
        if (words > 1) {
            for (int i = 0; i < dimension; i++) {
                phrase[i] /= words;
            }
        }
        return phrase;
    }

    private float[] wordVector(String word) {
        float[] v = new float[dimension];
        addFeature(v, "w:" + word);
        String padded = "<" + word + ">";
        for (int n = minN; n <= maxN; n++) {
            for (int i = 0; i + n <= padded.length(); i++) {
                addFeature(v, padded.substring(i, i + n));
            }
        }
        return v;
    }

    private void addFeature(float[] v, String feature) {
        int h = fnv1a(feature);
        int bucket = Math.floorMod(h, dimension);
        // sign from an independent mix of the hash
        int mixed = Integer.rotateLeft(h * 0x9E3779B9, 16);
        v[bucket] += (mixed & 1) == 0 ? 1.0f : -1.0f;
    }

    static int fnv1a(String s) {
        int h = FNV_OFFSET;
        for (byte b : s.getBytes(StandardCharsets.UTF_8)) {
            h ^= (b & 0xff);
            h *= FNV_PRIME;
        }
        return h;
    }
}
