package org.pdm.rules;

import org.pdm.LogicException;

/**
 * Documento di regole non conforme allo schema {dominio: [{id, premise, conclusion, text}]}.
 */
public class RuleSetFormatException extends LogicException {

    public RuleSetFormatException(String message) {
        super(message);
    }

    public RuleSetFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
