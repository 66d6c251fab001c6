package nl.uu.medical.diagnosis.canon;

/**
 * Maps a phrase into a fixed-dimension vector space. Implementations need not normalize;
 * callers unit-normalize before searching.
 */
public interface PhraseEmbedder {

    int dimension();

    float[] embed(String text);
}
