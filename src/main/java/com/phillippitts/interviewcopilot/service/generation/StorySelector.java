package com.phillippitts.interviewcopilot.service.generation;

import com.phillippitts.interviewcopilot.domain.StarStory;
import com.phillippitts.interviewcopilot.service.text.TokenizerUtil;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Selects the STAR stories most relevant to a question.
 *
 * <p><b>Scoring:</b>
 * <ul>
 *   <li>Each story tag whose keywords appear in the question adds {@value #TAG_WEIGHT}</li>
 *   <li>Each question keyword found in the title or narrative adds 1</li>
 * </ul>
 * Stories with a positive score are ordered by score descending; ties keep profile order.
 * Stories that score zero are left to the caller, which may still use them as background.
 *
 * <p>Stateless and thread-safe.
 */
@Component
public class StorySelector {

    static final int TAG_WEIGHT = 3;

    public List<ScoredStory> select(String question, List<StarStory> stories, int maxStories) {
        if (stories == null || stories.isEmpty() || maxStories <= 0) {
            return List.of();
        }
        Set<String> questionKeywords = TokenizerUtil.keywords(question);
        if (questionKeywords.isEmpty()) {
            return List.of();
        }

        List<ScoredStory> qualifying = new ArrayList<>();
        for (StarStory story : stories) {
            ScoredStory scored = score(questionKeywords, story);
            if (scored.score() > 0) {
                qualifying.add(scored);
            }
        }
        // List.sort is stable, so equal scores keep profile order
        qualifying.sort(Comparator.comparingInt(ScoredStory::score).reversed());
        return List.copyOf(qualifying.subList(0, Math.min(maxStories, qualifying.size())));
    }

    ScoredStory score(Set<String> questionKeywords, StarStory story) {
        int tagMatches = 0;
        for (String tag : story.tags()) {
            Set<String> tagKeywords = TokenizerUtil.keywords(tag);
            if (!tagKeywords.isEmpty() && tagKeywords.stream().anyMatch(questionKeywords::contains)) {
                tagMatches++;
            }
        }
        Set<String> overlap = new LinkedHashSet<>(TokenizerUtil.keywords(story.narrative()));
        overlap.retainAll(questionKeywords);
        int keywordOverlap = overlap.size();
        return new ScoredStory(story, tagMatches, keywordOverlap, tagMatches * TAG_WEIGHT + keywordOverlap);
    }
}
