package com.ciro.jsxt.scanner;

/** Cualquier {@code <} es candidato, incluso dentro de strings o comentarios. */
public final class FirstAngleLocator implements CandidateLocator {

    public static final FirstAngleLocator INSTANCE = new FirstAngleLocator();

    private FirstAngleLocator() {}

    @Override
    public Candidates open(String source, int fromIndex) {
        return new AngleCandidates(source, fromIndex);
    }

    private static final class AngleCandidates implements Candidates {
        private final String source;
        private int from;

        AngleCandidates(String source, int from) {
            this.source = source;
            this.from = from;
        }

        @Override
        public int next() {
            return source.indexOf('<', from);
        }

        @Override
        public void skipTo(int index) {
            from = index;
        }
    }
}
