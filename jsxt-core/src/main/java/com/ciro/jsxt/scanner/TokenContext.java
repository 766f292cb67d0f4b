package com.ciro.jsxt.scanner;

/** Contexto sintáctico aproximado para distinguir regex de división. */
public enum TokenContext {
    /** Acaba de terminar un operando (identificador, número, {@code )}, string...): {@code /} es división. */
    AFTER_OPERAND,
    /** Se espera un operando (operador, delimitador, keyword como {@code return}): {@code /} abre regex. */
    BEFORE_OPERAND
}
