package com.example.faceclusters.ai.clustering;

public enum NoiseLevel {
    ACCEPTABLE,
    MODERATE,
    CONCERNING
}
