package org.pdm;

/**
 * Radice della gerarchia di eccezioni del motore logico.
 *
 * Tutte le eccezioni sono non controllate: gli errori di sintassi, di assegnamento
 * incompleto e di costruzione della base di regole vengono segnalati subito al
 * chiamante, che decide se mostrarli all'utente.
 */
public class LogicException extends RuntimeException {

    public LogicException(String message) {
        super(message);
    }

    public LogicException(String message, Throwable cause) {
        super(message, cause);
    }
}
