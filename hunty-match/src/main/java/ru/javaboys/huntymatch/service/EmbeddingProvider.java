package ru.javaboys.huntymatch.service;

public interface EmbeddingProvider {

    float[] embed(String text);
}
