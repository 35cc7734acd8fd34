package mathtex.lang;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

import lombok.AccessLevel;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Guesses whether a line without math delimiters is a whole expression. This
 * is a best-effort filter: a wrong guess either leaves prose alone or sends it
 * to a parser that will reject it.
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class MathLineClassifier {

    static final int MAX_LENGTH = 100;

    private static final String OPERATORS = "+-*/^_=";

    private static final Pattern WORD_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}_]+");
    private static final Pattern SENTENCE_BREAK = Pattern.compile("[.,:;!?]\\s+[a-zA-Z]");

    // English and French function words
    private static final Set<String> STOP_WORDS = Set.of(
        // english
        "the", "and", "or", "but", "if", "then", "when", "where", "how", "what",
        "is", "are", "was", "were", "have", "has", "had", "will", "would", "could",
        "should", "may", "might", "can", "must", "shall", "to", "of", "in", "on",
        "at", "by", "for", "with", "from", "as", "an", "a",
        // french
        "le", "la", "les", "un", "une", "des", "et", "ou", "mais", "si",
        "alors", "quand", "où", "comment", "que", "quoi", "est", "sont", "était", "étaient",
        "ai", "avons", "avez", "ont", "aurai", "aurais", "aurait", "aurions", "auriez", "auraient",
        "peux", "peut", "pouvons", "pouvez", "peuvent", "dois", "doit", "devons", "devez", "doivent",
        "pourrais", "pourrait", "devrais", "devrait", "à", "de", "dans", "sur", "par", "pour",
        "avec", "sans", "sous", "entre", "comme", "en", "au", "aux", "du");

    public static boolean looksLikeMath(@NonNull String line) {
        if (!hasOperator(line)) {
            return false;
        }
        if (hasStopWord(line)) {
            return false;
        }
        if (line.length() > MAX_LENGTH) {
            return false;
        }
        return !SENTENCE_BREAK.matcher(line).find();
    }

    private static boolean hasOperator(String line) {
        for (var i = 0; i < line.length(); i++) {
            if (OPERATORS.indexOf(line.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasStopWord(String line) {
        for (var word : WORD_SEPARATOR.split(line)) {
            if (STOP_WORDS.contains(word.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
