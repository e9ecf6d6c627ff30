package ru.javaboys.huntymatch.support;

import ru.javaboys.huntymatch.exception.ServiceUnavailableException;
import ru.javaboys.huntymatch.service.EmbeddingProvider;

import java.util.List;
import java.util.Locale;

/**
 * Deterministic embedding: one dimension per vocabulary term, set when the text mentions it.
 */
public class KeywordEmbeddingProvider implements EmbeddingProvider {

    private final List<String> vocabulary;
    private int calls;
    private boolean down;

    public KeywordEmbeddingProvider(String... vocabulary) {
        this.vocabulary = List.of(vocabulary);
    }

    public void setDown(boolean down) {
        this.down = down;
    }

    public int getCalls() {
        return calls;
    }

    @Override
    public float[] embed(String text) {
        calls++;
        if (down) {
            throw new ServiceUnavailableException("embedding-provider", "provider is down");
        }
        String t = text.toLowerCase(Locale.ROOT);
        float[] v = new float[vocabulary.size() + 1];
        for (int i = 0; i < vocabulary.size(); i++) {
            if (t.contains(vocabulary.get(i))) v[i] = 1f;
        }
        // keeps every vector non-zero
        v[vocabulary.size()] = 0.1f;
        return v;
    }
}
