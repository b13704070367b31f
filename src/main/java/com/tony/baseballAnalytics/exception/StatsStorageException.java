package com.tony.baseballAnalytics.exception;

/**
 * Échec de lecture/écriture du stockage de stats (fichier mensuel illisible, disque plein...).
 */
public class StatsStorageException extends RuntimeException {

    public StatsStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
