package dev.aparikh.msgexplorer.filter;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed keyword expression such as {@code "soup ladies,food,NOT job"}.
 * <p>
 * Commas separate clauses. A clause starting with the word {@code NOT} excludes, every
 * other clause is an alternative. Words inside a clause must all match. A
 * message matches when it matches at least one alternative (or there are none)
 * and no excluded clause. Words are tokenized like text search.
 */
public record KeywordQuery(
        List<Clause> alternatives,
        List<Clause> negations
) {
    public static final KeywordQuery MATCH_ALL = new KeywordQuery(List.of(), List.of());

    private static final String NOT = "NOT";

    public KeywordQuery {
        alternatives = List.copyOf(alternatives);
        negations = List.copyOf(negations);
    }

    public static KeywordQuery parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return MATCH_ALL;
        }
        List<Clause> alternatives = new ArrayList<>();
        List<Clause> negations = new ArrayList<>();
        for (String part : raw.split(",")) {
            String clause = part.trim();
            boolean negated = isNegated(clause);
            List<String> tokens = TextTokenizer.tokenize(negated ? clause.substring(NOT.length()) : clause);
            if (tokens.isEmpty()) {
                continue;
            }
            if (negated) {
                negations.add(new Clause(tokens));
            } else {
                alternatives.add(new Clause(tokens));
            }
        }
        return new KeywordQuery(alternatives, negations);
    }

    private static boolean isNegated(String clause) {
        return clause.startsWith(NOT)
                && (clause.length() == NOT.length() || Character.isWhitespace(clause.charAt(NOT.length())));
    }

    public boolean isMatchAll() {
        return alternatives.isEmpty() && negations.isEmpty();
    }

    /**
     * @param values lowercased values of the keyword dimension
     */
    public boolean matches(List<String> values, TextMatch match) {
        boolean included = alternatives.isEmpty()
                || alternatives.stream().anyMatch(clause -> clause.matches(values, match));
        return included && negations.stream().noneMatch(clause -> clause.matches(values, match));
    }

    /**
     * Words that must all match one of the message's values.
     */
    public record Clause(List<String> tokens) {

        public Clause {
            tokens = List.copyOf(tokens);
        }

        boolean matches(List<String> values, TextMatch match) {
            return tokens.stream()
                    .allMatch(token -> values.stream().anyMatch(value -> match.matches(value, token)));
        }
    }
}
