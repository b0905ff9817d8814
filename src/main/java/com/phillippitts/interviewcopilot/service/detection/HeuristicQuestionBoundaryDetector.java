package com.phillippitts.interviewcopilot.service.detection;

import com.phillippitts.interviewcopilot.domain.QuestionEvent;
import com.phillippitts.interviewcopilot.domain.QuestionType;
import com.phillippitts.interviewcopilot.service.text.TokenizerUtil;
import com.phillippitts.interviewcopilot.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Keyword-based question boundary detector.
 *
 * <p><b>Algorithm:</b>
 * <ol>
 *   <li>Normalise whitespace and strip leading hesitation words ("um", "uh", "so")</li>
 *   <li>Reject empty text, text under {@value #MIN_CHARS} characters and filler-only text</li>
 *   <li>Accept if the text contains {@code ?}, starts with or contains a question or prompt
 *       phrase, or runs to at least {@value #MIN_WORDS_WITHOUT_INDICATOR} words</li>
 *   <li>Classify and emit a single {@link QuestionEvent}</li>
 * </ol>
 *
 * <p>Stateless and thread-safe.
 */
@Component
public class HeuristicQuestionBoundaryDetector implements QuestionBoundaryDetector {

    private static final Logger LOG = LogManager.getLogger(HeuristicQuestionBoundaryDetector.class);

    static final int MIN_CHARS = 5;
    static final int MIN_WORDS_WITHOUT_INDICATOR = 8;

    /** Acknowledgements and hesitations that never make a question on their own. */
    private static final Set<String> FILLER = Set.of(
            "okay", "ok", "yeah", "yes", "yep", "yup", "no", "nope", "right", "sure", "uh", "um",
            "uhm", "hmm", "mm", "mhm", "huh", "ah", "oh", "great", "thanks", "thank", "you", "cool",
            "alright", "all", "got", "it", "so", "well", "sounds", "good", "nice", "perfect", "i",
            "see", "like", "hi", "hello", "bye", "awesome", "exactly", "totally", "fine", "wow",
            "interesting", "makes", "sense", "that", "that's", "is", "and", "gotcha");

    private static final Set<String> LEADING_HESITATIONS = Set.of("um", "uh", "uhm", "hmm", "so", "well", "okay", "ok");

    private static final List<String> QUESTION_PHRASES = List.of(
            "what", "how", "why", "when", "where", "who", "which", "whose",
            "can you", "could you", "would you", "will you", "should you",
            "do you", "did you", "does", "have you", "has",
            "describe", "tell me", "explain", "share", "talk about",
            "give me", "walk me through", "think of");

    @Override
    public Optional<QuestionEvent> detect(String snapshot) {
        String text = normalise(snapshot);
        if (text.isEmpty() || text.length() < MIN_CHARS) {
            LOG.debug("No question: snapshot empty or too short");
            return Optional.empty();
        }
        List<String> tokens = TokenizerUtil.tokenize(text);
        if (isFillerOnly(tokens)) {
            LOG.debug("No question: filler-only snapshot '{}'", LogSanitizer.preview(text, 60));
            return Optional.empty();
        }
        if (!isLikelyQuestion(text, tokens.size())) {
            LOG.debug("No question: no indicator in short snapshot '{}'", LogSanitizer.preview(text, 60));
            return Optional.empty();
        }
        QuestionType type = QuestionClassifier.classify(text);
        QuestionEvent event = QuestionEvent.of(text, type, snapshot);
        LOG.info("Question detected: id={}, type={}, preview='{}'",
                event.questionId(), type.wireName(), LogSanitizer.preview(text, 80));
        return Optional.of(event);
    }

    static boolean isFillerOnly(List<String> tokens) {
        return tokens.isEmpty() || FILLER.containsAll(tokens);
    }

    static boolean isLikelyQuestion(String text, int wordCount) {
        if (text.indexOf('?') >= 0) {
            return true;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        String padded = " " + lower.replaceAll("[^\\p{Alpha}' ]", " ") + " ";
        for (String phrase : QUESTION_PHRASES) {
            if (lower.startsWith(phrase) || padded.contains(" " + phrase + " ")) {
                return true;
            }
        }
        // Longer statements without an indicator are usually prompts ("I'd like to hear ...")
        return wordCount >= MIN_WORDS_WITHOUT_INDICATOR;
    }

    static String normalise(String snapshot) {
        if (snapshot == null) {
            return "";
        }
        String text = snapshot.strip().replaceAll("\\s+", " ");
        // Drop leading hesitations, keeping the rest of the sentence intact
        while (!text.isEmpty()) {
            int space = text.indexOf(' ');
            String head = (space < 0 ? text : text.substring(0, space))
                    .toLowerCase(Locale.ROOT).replaceAll("[^\\p{Alpha}]", "");
            if (space < 0 || !LEADING_HESITATIONS.contains(head)) {
                break;
            }
            text = text.substring(space + 1).stripLeading();
        }
        return text;
    }
}
