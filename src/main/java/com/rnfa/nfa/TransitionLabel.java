package com.rnfa.nfa;

public sealed interface TransitionLabel extends Comparable<TransitionLabel> {
    Epsilon EPSILON = new Epsilon();

    static Literal of(char character) {
        return new Literal(character);
    }

    boolean isEpsilon();

    record Epsilon() implements TransitionLabel {
        @Override
        public boolean isEpsilon() {
            return true;
        }

        @Override
        public String toString() {
            return "ε";
        }
    }

    record Literal(char character) implements TransitionLabel {
        @Override
        public boolean isEpsilon() {
            return false;
        }

        @Override
        public String toString() {
            return String.valueOf(character);
        }
    }

    // Epsilon sorts before every literal
    @Override
    default int compareTo(TransitionLabel other) {
        int mine = this instanceof Literal literal ? literal.character() : -1;
        int theirs = other instanceof Literal literal ? literal.character() : -1;
        return Integer.compare(mine, theirs);
    }
}
