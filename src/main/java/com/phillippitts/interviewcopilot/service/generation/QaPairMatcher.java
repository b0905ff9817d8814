package com.phillippitts.interviewcopilot.service.generation;

import com.phillippitts.interviewcopilot.domain.QaPair;
import com.phillippitts.interviewcopilot.service.text.TokenizerUtil;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Finds the prepared Q&amp;A pair whose question best matches a detected question.
 *
 * <p>Similarity is the Jaccard overlap of content keywords; the best pair at or above the
 * threshold wins, earlier pairs winning ties.
 */
@Component
public class QaPairMatcher {

    public Optional<QaPair> match(String question, List<QaPair> pairs, double threshold) {
        if (pairs == null || pairs.isEmpty()) {
            return Optional.empty();
        }
        Set<String> questionKeywords = TokenizerUtil.keywords(question);
        if (questionKeywords.isEmpty()) {
            return Optional.empty();
        }
        QaPair best = null;
        double bestScore = -1;
        for (QaPair pair : pairs) {
            if (pair.answer().isBlank()) {
                continue;
            }
            double score = TokenizerUtil.jaccard(questionKeywords, TokenizerUtil.keywords(pair.question()));
            if (score >= threshold && score > bestScore) {
                best = pair;
                bestScore = score;
            }
        }
        return Optional.ofNullable(best);
    }
}
