package com.williamcallahan.llmorchestrator.service;

import com.williamcallahan.llmorchestrator.domain.CompletionResponse;
import com.williamcallahan.llmorchestrator.domain.SynthesisStrategy;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.ToDoubleFunction;

/**
 * Picks one answer out of several providers' answers to the same request.
 *
 * <p>Answers are compared after trimming and collapsing whitespace. Among equally supported
 * answers the one first returned by the better-ranked provider wins.</p>
 */
final class ResponseSynthesizer {

    private ResponseSynthesizer() {
    }

    /**
     * Chooses the answer returned to the caller.
     *
     * @param answers successful answers in router rank order, never empty
     * @return the chosen answer
     */
    static Ballot choose(SynthesisStrategy strategy, List<Ballot> answers) {
        Objects.requireNonNull(strategy, "strategy");
        if (answers.isEmpty()) {
            throw new IllegalArgumentException("answers must not be empty");
        }
        return switch (strategy) {
            case FIRST_VALID -> answers.get(0);
            case MAJORITY_VOTE -> mostSupported(answers, ballot -> 1.0);
            case QUALITY_WEIGHTED -> mostSupported(answers, Ballot::weight);
        };
    }

    static String normalize(String text) {
        return text.strip().replaceAll("\\s+", " ");
    }

    private static Ballot mostSupported(List<Ballot> answers, ToDoubleFunction<Ballot> support) {
        Map<String, Double> totals = new LinkedHashMap<>();
        Map<String, Ballot> firstSeen = new LinkedHashMap<>();
        for (Ballot ballot : answers) {
            String key = normalize(ballot.response().text());
            totals.merge(key, support.applyAsDouble(ballot), Double::sum);
            firstSeen.putIfAbsent(key, ballot);
        }
        String winner = null;
        double best = Double.NEGATIVE_INFINITY;
        for (Map.Entry<String, Double> entry : totals.entrySet()) {
            if (entry.getValue() > best) {
                best = entry.getValue();
                winner = entry.getKey();
            }
        }
        return firstSeen.get(winner);
    }

    /**
     * One provider's answer.
     *
     * @param response provider answer
     * @param weight configured provider weight
     */
    record Ballot(CompletionResponse response, double weight) {
        Ballot {
            Objects.requireNonNull(response, "response");
        }
    }
}
