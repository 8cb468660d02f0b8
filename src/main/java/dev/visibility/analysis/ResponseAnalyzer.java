package dev.visibility.analysis;

import dev.visibility.llm.LlmResponse;
import dev.visibility.llm.PromptType;
import dev.visibility.retry.ErrorSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a raw LLM reply into mention, sentiment, rank and competitor signals.
 * Stateless apart from a compiled-pattern cache.
 */
@Slf4j
@Component
public class ResponseAnalyzer {

    static final double EXACT_CONFIDENCE = 0.95;
    static final double PARTIAL_CONFIDENCE = 0.85;
    static final double CONTEXTUAL_CONFIDENCE = 0.6;
    static final double NO_MATCH_CONFIDENCE = 0.9;

    private static final int MIN_RANK = 1;
    private static final int MAX_RANK = 10;

    private static final List<String> POSITIVE_INDICATORS = List.of(
            "excellent", "outstanding", "great", "amazing", "fantastic", "wonderful",
            "professional", "reliable", "trustworthy", "reputable", "quality",
            "highly recommended", "top-rated", "best", "leading", "premier",
            "experienced", "skilled", "expert", "knowledgeable", "competent",
            "friendly", "helpful", "responsive", "efficient", "thorough",
            "satisfied", "pleased", "happy", "impressed", "delighted");

    private static final List<String> NEGATIVE_INDICATORS = List.of(
            "terrible", "awful", "horrible", "disappointing", "poor", "bad",
            "unprofessional", "unreliable", "untrustworthy", "questionable",
            "avoid", "warning", "complaint", "problem", "issue", "concern",
            "rude", "unhelpful", "slow", "inefficient", "careless",
            "overpriced", "expensive", "cheap", "low-quality", "subpar",
            "dissatisfied", "unhappy", "frustrated", "disappointed", "regret");

    private static final List<String> NEUTRAL_INDICATORS = List.of(
            "okay", "average", "decent", "standard", "typical", "normal",
            "adequate", "acceptable", "reasonable", "fair", "moderate",
            "mixed", "varies", "depends", "sometimes", "generally");

    private static final List<Pattern> IMPLICIT_POSITIVE = compileAll(
            "would\\s+recommend", "good\\s+choice", "solid\\s+option",
            "worth\\s+considering", "established\\s+presence", "professional\\s+standards");

    private static final List<Pattern> IMPLICIT_NEGATIVE = compileAll(
            "would\\s+not\\s+recommend", "be\\s+careful", "limited\\s+information",
            "don't\\s+have\\s+enough", "insufficient\\s+data");

    private static final List<Pattern> CONTEXTUAL_PATTERNS = compileAll(
            "this\\s+(?:business|company|establishment|place|location)",
            "they\\s+(?:are|offer|provide|specialize)",
            "their\\s+(?:services|reputation|quality|experience)",
            "it\\s+(?:is|appears|seems|looks)");

    private static final List<String> BUSINESS_CONTEXT_WORDS = List.of(
            "services", "reputation", "quality", "professional", "experience",
            "customers", "clients", "staff", "team", "location", "business");

    private static final List<String> NAME_SUFFIXES = List.of(
            "inc", "llc", "corp", "corporation", "company", "co", "ltd", "group", "services", "solutions");
    private static final List<String> NAME_PREFIXES = List.of("the", "a", "an");
    private static final Map<String, String> NAME_REPLACEMENTS = Map.of(
            "&", "and",
            " and ", " & ",
            "centre", "center",
            "center", "centre");

    private static final Pattern LIST_MARKER = Pattern.compile("^\\s*(\\d+)[.)]\\s+(.*)$");
    private static final Pattern BULLET_MARKER = Pattern.compile("^\\s*[-*\\u2022]\\s+(.*)$");
    private static final Pattern NUMBERED_LIST = Pattern.compile("(?m)^\\s*\\d+[.)]");
    private static final Pattern SENTENCE_BREAK = Pattern.compile("\\.\\s+[A-Z]");
    private static final Pattern NAME_TERMINATOR = Pattern.compile("\\s+[-\\u2013\\u2014]\\s+|:|\\s*\\(|,");

    private static final List<Pattern> INVALID_NAME_PATTERNS = compileAll(
            "^(here are|i'd recommend|i recommend|to give you|that's a|i need|quality recommendations)",
            "^(each of these|these businesses|professional standards|local community)",
            "^(demonstrated|serves the|effectively|strong community presence)",
            "^(with strong|community presence|demonstrated professional)",
            "^(some top|top recommendations|recommendations for)",
            "^(a great|great question|little more|more information)",
            "^(what you're|you're looking|looking for)",
            "^(and|or|but|if|when|where|why|how)\\s+",
            "^(is|are|was|were|be|been|being)\\s+",
            "^(can|could|should|would|will|may|might)\\s+",
            "^(this|that|these|those)\\s+",
            "^(it|they|we|you|he|she)\\s+");

    private static final List<String> FILLER_PHRASES = List.of(
            "quality professional services", "professional services providers", "strong community presence",
            "demonstrated professional standards", "serves the local community", "professional service with",
            "established local reputation", "quality recommendations for", "each of these businesses");

    private static final Set<String> GENERIC_WORDS = Set.of(
            "quality", "professional", "local", "community", "excellence", "choice", "group", "services", "solutions");

    private static final List<String> FALSE_POSITIVES = List.of(
            "google", "facebook", "twitter", "linkedin", "instagram",
            "better business bureau", "bbb", "yelp", "tripadvisor",
            "united states", "new york", "california", "texas",
            "monday", "tuesday", "wednesday", "thursday", "friday", "saturday", "sunday",
            "january", "february", "march", "april", "may", "june",
            "july", "august", "september", "october", "november", "december");

    private static final Map<String, Pattern> PATTERN_CACHE = new ConcurrentHashMap<>();

    /**
     * Analyze one reply. Never throws; an internal failure yields a result with
     * {@code mentioned=false}, zero confidence and the error message.
     */
    public QueryResult analyze(LlmResponse response, String businessName, PromptType promptType) {
        String model = response != null ? response.model() : null;
        try {
            String text = response.content() != null ? response.content() : "";
            boolean recommendation = promptType == PromptType.RECOMMENDATION;

            // 1. Mention detection
            MentionAnalysis mention = analyzeMention(text, businessName, !recommendation);

            // 2. Sentiment toward the business
            SentimentAnalysis sentiment = analyzeSentiment(text, mention);

            // 3. Competitors and rank, recommendation replies only
            CompetitorAnalysis competitors = recommendation
                    ? analyzeCompetitors(text, businessName, mention.mentioned())
                    : new CompetitorAnalysis(List.of(), null, 0.5, "Not a recommendation query");

            double confidence = mention.confidence() * 0.5
                    + sentiment.confidence() * 0.3
                    + competitors.confidence() * 0.2;

            return new QueryResult(
                    model,
                    promptType,
                    mention.mentioned(),
                    sentiment.sentiment(),
                    clamp(confidence),
                    competitors.targetRank(),
                    competitors.competitors(),
                    text,
                    response.tokensUsed(),
                    null,
                    response.processingTimeMs(),
                    null);
        } catch (RuntimeException e) {
            String message = ErrorSanitizer.sanitize(e);
            log.warn("Response analysis failed for model {}: {}", model, message);
            return new QueryResult(model, promptType, false, Sentiment.NEUTRAL, 0.0, null, List.of(),
                    response != null && response.content() != null ? response.content() : "",
                    response != null ? response.tokensUsed() : 0, null,
                    response != null ? response.processingTimeMs() : 0,
                    "Analysis failed: " + message);
        }
    }

    /**
     * Detect whether the business is referenced: exact name, a cheap variant, or
     * (when allowed) an indirect "this business / they offer" reference.
     */
    public MentionAnalysis analyzeMention(String text, String businessName, boolean allowContextual) {
        if (businessName == null || businessName.isBlank()) {
            return MentionAnalysis.none(0.0, "Business name is blank");
        }
        if (text == null || text.isBlank()) {
            return MentionAnalysis.none(NO_MATCH_CONFIDENCE, "Empty response");
        }

        String name = businessName.trim();
        String lowerText = text.toLowerCase(Locale.ROOT);

        if (lowerText.contains(name.toLowerCase(Locale.ROOT))) {
            return new MentionAnalysis(true, EXACT_CONFIDENCE, MatchType.EXACT, List.of(name),
                    "Exact match found for \"" + name + "\"");
        }

        for (String variant : nameVariants(name)) {
            if (containsWord(lowerText, variant.toLowerCase(Locale.ROOT))) {
                return new MentionAnalysis(true, PARTIAL_CONFIDENCE, MatchType.PARTIAL, List.of(variant),
                        "Partial match found for variation \"" + variant + "\"");
            }
        }

        if (allowContextual && CONTEXTUAL_PATTERNS.stream().anyMatch(p -> p.matcher(text).find())) {
            long contextWords = BUSINESS_CONTEXT_WORDS.stream().filter(lowerText::contains).count();
            if (contextWords >= 2) {
                return new MentionAnalysis(true, CONTEXTUAL_CONFIDENCE, MatchType.CONTEXTUAL, List.of(),
                        "Contextual business reference with " + contextWords + " business-related terms");
            }
        }

        return MentionAnalysis.none(NO_MATCH_CONFIDENCE, "No mention of business name or variations found");
    }

    /**
     * Classify sentiment. Only meaningful when the business was mentioned;
     * otherwise neutral with low confidence.
     */
    public SentimentAnalysis analyzeSentiment(String text, MentionAnalysis mention) {
        if (!mention.mentioned()) {
            return new SentimentAnalysis(Sentiment.NEUTRAL, 0.5, 0.0, List.of(),
                    "Business not mentioned, neutral sentiment assigned");
        }

        String lowerText = text.toLowerCase(Locale.ROOT);
        List<String> positive = matching(lowerText, POSITIVE_INDICATORS);
        List<String> negative = matching(lowerText, NEGATIVE_INDICATORS);
        List<String> neutral = matching(lowerText, NEUTRAL_INDICATORS);
        int total = positive.size() + negative.size() + neutral.size();

        if (total == 0) {
            return implicitSentiment(text);
        }

        double score = (double) (positive.size() - negative.size()) / total;
        Sentiment sentiment;
        double confidence;
        if (score > 0.3) {
            sentiment = Sentiment.POSITIVE;
            confidence = Math.min(0.95, 0.6 + score * 0.35);
        } else if (score < -0.3) {
            sentiment = Sentiment.NEGATIVE;
            confidence = Math.min(0.95, 0.6 + Math.abs(score) * 0.35);
        } else {
            sentiment = Sentiment.NEUTRAL;
            confidence = 0.7;
        }

        List<String> keywords = new ArrayList<>(positive);
        keywords.addAll(negative);
        keywords.addAll(neutral);
        return new SentimentAnalysis(sentiment, confidence, score, keywords,
                String.format("Found %d positive, %d negative, %d neutral indicators",
                        positive.size(), negative.size(), neutral.size()));
    }

    private SentimentAnalysis implicitSentiment(String text) {
        long positive = IMPLICIT_POSITIVE.stream().filter(p -> p.matcher(text).find()).count();
        long negative = IMPLICIT_NEGATIVE.stream().filter(p -> p.matcher(text).find()).count();
        if (positive > negative) {
            return new SentimentAnalysis(Sentiment.POSITIVE, 0.6, 0.5, List.of(),
                    "Implicit positive sentiment detected from context");
        }
        if (negative > positive) {
            return new SentimentAnalysis(Sentiment.NEGATIVE, 0.6, -0.5, List.of(),
                    "Implicit negative sentiment detected from context");
        }
        return new SentimentAnalysis(Sentiment.NEUTRAL, 0.8, 0.0, List.of(),
                "No clear sentiment indicators found, defaulting to neutral");
    }

    /**
     * Collect other business names from numbered and bulleted lists, in order of
     * appearance, and locate the target's own list position.
     */
    public CompetitorAnalysis analyzeCompetitors(String text, String businessName, boolean targetMentioned) {
        Set<String> competitors = new LinkedHashSet<>();
        for (String line : text.split("\\R")) {
            String candidate = listItemName(line);
            if (candidate == null) {
                continue;
            }
            if (isValidBusinessName(candidate)
                    && !isSameBusiness(candidate, businessName)
                    && !isCommonFalsePositive(candidate)
                    && !isResponseText(candidate)) {
                competitors.add(candidate);
            }
        }

        Integer targetRank = null;
        if (targetMentioned && businessName != null && !businessName.isBlank()) {
            targetRank = findListPosition(text, businessName);
            if (targetRank == null) {
                for (String variant : nameVariants(businessName.trim())) {
                    targetRank = findListPosition(text, variant);
                    if (targetRank != null) {
                        break;
                    }
                }
            }
        }

        List<String> names = new ArrayList<>(competitors);
        double confidence = competitorConfidence(text, names.size());
        return new CompetitorAnalysis(names, targetRank, confidence,
                "Found " + names.size() + " potential competitors"
                        + (targetRank != null ? ", target ranked at position " + targetRank : ""));
    }

    /**
     * Position from a leading "N." or "N)" marker on the first line containing the name.
     *
     * @return a rank in [1, 10], or null when no such line exists
     */
    public Integer findListPosition(String text, String name) {
        if (text == null || name == null || name.isBlank()) {
            return null;
        }
        String needle = name.trim().toLowerCase(Locale.ROOT);
        for (String line : text.split("\\R")) {
            Matcher matcher = LIST_MARKER.matcher(line);
            if (matcher.matches() && containsWord(line.toLowerCase(Locale.ROOT), needle)) {
                try {
                    int rank = Integer.parseInt(matcher.group(1));
                    if (rank >= MIN_RANK && rank <= MAX_RANK) {
                        return rank;
                    }
                } catch (NumberFormatException e) {
                    log.debug("Ignoring oversized list marker in line: {}", line);
                }
            }
        }
        return null;
    }

    /**
     * Cheap spelling variants: without legal suffix or leading article,
     * "&" and "and" swapped, centre/center, and word initials.
     */
    List<String> nameVariants(String name) {
        Set<String> variants = new LinkedHashSet<>();
        for (String suffix : NAME_SUFFIXES) {
            Pattern pattern = getPattern("\\s+" + suffix + "\\.?$");
            if (pattern.matcher(name).find()) {
                variants.add(pattern.matcher(name).replaceAll("").trim());
            }
        }
        for (String prefix : NAME_PREFIXES) {
            Pattern pattern = getPattern("^" + prefix + "\\s+");
            if (pattern.matcher(name).find()) {
                variants.add(pattern.matcher(name).replaceAll("").trim());
            }
        }
        String lower = name.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> replacement : NAME_REPLACEMENTS.entrySet()) {
            if (lower.contains(replacement.getKey())) {
                variants.add(lower.replace(replacement.getKey(), replacement.getValue()));
            }
        }
        String[] words = name.trim().split("\\s+");
        if (words.length > 1) {
            StringBuilder initials = new StringBuilder();
            for (String word : words) {
                if (Character.isLetter(word.charAt(0))) {
                    initials.append(Character.toUpperCase(word.charAt(0)));
                }
            }
            if (initials.length() >= 2) {
                variants.add(initials.toString());
            }
        }
        variants.remove(name);
        variants.removeIf(v -> v.length() < 2);
        return new ArrayList<>(variants);
    }

    private String listItemName(String line) {
        String item;
        Matcher numbered = LIST_MARKER.matcher(line);
        if (numbered.matches()) {
            item = numbered.group(2);
        } else {
            Matcher bullet = BULLET_MARKER.matcher(line);
            if (!bullet.matches()) {
                return null;
            }
            item = bullet.group(1);
        }
        item = item.replace("**", "").trim();
        Matcher terminator = NAME_TERMINATOR.matcher(item);
        if (terminator.find()) {
            item = item.substring(0, terminator.start());
        }
        item = item.trim();
        while (item.endsWith(".")) {
            item = item.substring(0, item.length() - 1).trim();
        }
        return item.isEmpty() ? null : item;
    }

    private boolean isValidBusinessName(String name) {
        if (name.length() < 2 || name.length() > 80) {
            return false;
        }
        if (!Character.isUpperCase(name.charAt(0))) {
            return false;
        }
        if (INVALID_NAME_PATTERNS.stream().anyMatch(p -> p.matcher(name).find())) {
            return false;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        if (FILLER_PHRASES.stream().anyMatch(lower::contains)) {
            return false;
        }
        return !GENERIC_WORDS.contains(lower) && name.chars().anyMatch(Character::isLetter);
    }

    private boolean isSameBusiness(String candidate, String businessName) {
        if (businessName == null || businessName.isBlank()) {
            return false;
        }
        String a = candidate.trim().toLowerCase(Locale.ROOT);
        String b = businessName.trim().toLowerCase(Locale.ROOT);
        if (a.equals(b)) {
            return true;
        }
        Set<String> left = new LinkedHashSet<>();
        left.add(a);
        nameVariants(candidate.trim()).forEach(v -> left.add(v.toLowerCase(Locale.ROOT)));
        Set<String> right = new LinkedHashSet<>();
        right.add(b);
        nameVariants(businessName.trim()).forEach(v -> right.add(v.toLowerCase(Locale.ROOT)));
        left.retainAll(right);
        return !left.isEmpty();
    }

    private boolean isCommonFalsePositive(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return FALSE_POSITIVES.stream().anyMatch(fp -> containsWord(lower, fp));
    }

    private boolean isResponseText(String text) {
        return text.length() > 100 || text.contains("\n") || SENTENCE_BREAK.matcher(text).find();
    }

    private double competitorConfidence(String text, int competitorCount) {
        double confidence = 0.5;
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.contains("recommend") || lower.contains("top") || lower.contains("best")) {
            confidence += 0.2;
        }
        if (NUMBERED_LIST.matcher(text).find()) {
            confidence += 0.2;
        }
        if (competitorCount > 10) {
            confidence -= 0.2;
        } else if (competitorCount == 0) {
            confidence -= 0.3;
        }
        return Math.max(0.1, Math.min(0.95, confidence));
    }

    private List<String> matching(String lowerText, List<String> indicators) {
        return indicators.stream().filter(indicator -> containsWord(lowerText, indicator)).toList();
    }

    private boolean containsWord(String text, String word) {
        return getPattern("(?<!\\w)" + Pattern.quote(word) + "(?!\\w)").matcher(text).find();
    }

    private Pattern getPattern(String regex) {
        return PATTERN_CACHE.computeIfAbsent(regex, r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE));
    }

    private static List<Pattern> compileAll(String... regexes) {
        List<Pattern> patterns = new ArrayList<>();
        for (String regex : regexes) {
            patterns.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
        }
        return List.copyOf(patterns);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
