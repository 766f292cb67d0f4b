package com.ciro.jsxt.scanner;

/**
 * Estrategia para encontrar el próximo {@code <} donde intentar parsear JSX.
 * Trabaja con índices de char de {@link String}.
 */
@FunctionalInterface
public interface CandidateLocator {

    /** Recorrido de candidatos de {@code source} a partir de {@code fromIndex}. */
    Candidates open(String source, int fromIndex);

    /** Índice del próximo candidato a partir de {@code fromIndex} (inclusive), o -1. */
    default int nextCandidate(String source, int fromIndex) {
        return open(source, fromIndex).next();
    }

    /** Candidatos de un fuente, en orden. Guarda el contexto léxico entre llamadas. */
    interface Candidates {

        /** Próximo candidato, o -1. Sin un {@link #skipTo} en el medio devuelve el mismo. */
        int next();

        /**
         * Sigue desde {@code index}, posterior al último candidato. Lo salteado
         * cuenta como un fragmento JSX ya consumido, o sea un operando.
         */
        void skipTo(int index);
    }
}
