package io.github.jakubt4.astrolabe.service.compatibility;

/**
 * The eight factors of Ashtakoota matching with their maximum points (36 in all).
 */
public enum Koota {

    VARNA(1), VASHYA(2), TARA(3), YONI(4), GRAHA_MAITRI(5), GANA(6), BHAKOOT(7), NADI(8);

    public static final double TOTAL = 36.0;

    private final double maxPoints;

    Koota(final double maxPoints) {
        this.maxPoints = maxPoints;
    }

    public double maxPoints() {
        return maxPoints;
    }
}
