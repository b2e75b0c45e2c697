package io.github.jakubt4.astrolabe.service.dosha;

/**
 * Kaal Sarp variants, named by the house Rahu occupies (Anant = 1st ... Sheshnag = 12th).
 */
public enum KaalSarpType {

    ANANT, KULIK, VASUKI, SHANKHPAL, PADMA, MAHAPADMA, TAKSHAK, KARKOTAK, SHANKHACHOOD, GHATAK, VISHDHAR, SHESHNAG;

    public static KaalSarpType ofRahuHouse(final int house) {
        return values()[house - 1];
    }
}
