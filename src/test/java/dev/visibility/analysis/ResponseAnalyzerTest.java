package dev.visibility.analysis;

import dev.visibility.llm.LlmResponse;
import dev.visibility.llm.PromptType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ResponseAnalyzerTest {

    private final ResponseAnalyzer analyzer = new ResponseAnalyzer();

    private static LlmResponse reply(String content) {
        return new LlmResponse(content, 120, "openai/gpt-4-turbo", false, 850);
    }

    @Nested
    @DisplayName("analyzeMention")
    class AnalyzeMention {

        @Test
        @DisplayName("Should detect an exact, case-insensitive name match")
        void shouldDetectExactMatch() {
            MentionAnalysis mention = analyzer.analyzeMention("We love ACME CO for repairs.", "Acme Co", true);

            assertThat(mention.mentioned()).isTrue();
            assertThat(mention.matchType()).isEqualTo(MatchType.EXACT);
            assertThat(mention.confidence()).isEqualTo(0.95);
        }

        @ParameterizedTest
        @CsvSource(delimiter = '|', value = {
                "Acme Co|Acme is well known across town.",
                "Smith & Sons|smith and sons handled our roof.",
                "The Blue Door|Blue Door has the best croissants."
        })
        @DisplayName("Should detect a partial match through a name variant")
        void shouldDetectPartialMatch(String name, String text) {
            MentionAnalysis mention = analyzer.analyzeMention(text, name, true);

            assertThat(mention.mentioned()).isTrue();
            assertThat(mention.matchType()).isEqualTo(MatchType.PARTIAL);
            assertThat(mention.confidence()).isEqualTo(0.85);
        }

        @Test
        @DisplayName("Should accept an indirect reference only when contextual matching is allowed")
        void shouldHonourContextualFlag() {
            String text = "This business is known for their services and a quality reputation.";

            MentionAnalysis allowed = analyzer.analyzeMention(text, "Zeta Corp", true);
            MentionAnalysis disallowed = analyzer.analyzeMention(text, "Zeta Corp", false);

            assertThat(allowed.matchType()).isEqualTo(MatchType.CONTEXTUAL);
            assertThat(allowed.confidence()).isEqualTo(0.6);
            assertThat(disallowed.mentioned()).isFalse();
            assertThat(disallowed.confidence()).isEqualTo(0.9);
        }

        @Test
        @DisplayName("Should not match a name embedded inside another word")
        void shouldRespectWordBoundaries() {
            MentionAnalysis mention = analyzer.analyzeMention("Acmeville has many shops.", "Acme Co", false);

            assertThat(mention.mentioned()).isFalse();
        }

        @Test
        @DisplayName("Should report zero confidence for a blank business name")
        void shouldRejectBlankName() {
            MentionAnalysis mention = analyzer.analyzeMention("Some text", "  ", true);

            assertThat(mention.mentioned()).isFalse();
            assertThat(mention.confidence()).isZero();
        }
    }

    @Nested
    @DisplayName("analyzeSentiment")
    class AnalyzeSentiment {

        private final MentionAnalysis mentioned =
                new MentionAnalysis(true, 0.95, MatchType.EXACT, java.util.List.of("Acme Co"), "exact");

        @Test
        @DisplayName("Should classify explicit praise as positive")
        void shouldClassifyPositive() {
            SentimentAnalysis sentiment = analyzer.analyzeSentiment("Acme Co is excellent and reliable.", mentioned);

            assertThat(sentiment.sentiment()).isEqualTo(Sentiment.POSITIVE);
            assertThat(sentiment.score()).isEqualTo(1.0);
            assertThat(sentiment.keywords()).containsExactly("excellent", "reliable");
        }

        @Test
        @DisplayName("Should classify explicit criticism as negative")
        void shouldClassifyNegative() {
            SentimentAnalysis sentiment = analyzer.analyzeSentiment(
                    "Acme Co has been terrible lately, avoid them.", mentioned);

            assertThat(sentiment.sentiment()).isEqualTo(Sentiment.NEGATIVE);
            assertThat(sentiment.score()).isEqualTo(-1.0);
        }

        @Test
        @DisplayName("Should not count indicators that only appear inside longer words")
        void shouldUseWholeWords() {
            SentimentAnalysis sentiment = analyzer.analyzeSentiment("Acme Co was unreliable.", mentioned);

            assertThat(sentiment.keywords()).containsExactly("unreliable");
            assertThat(sentiment.sentiment()).isEqualTo(Sentiment.NEGATIVE);
        }

        @Test
        @DisplayName("Should fall back to implicit phrases when no indicator appears")
        void shouldUseImplicitPhrases() {
            SentimentAnalysis sentiment = analyzer.analyzeSentiment("Acme Co would be a solid option.", mentioned);

            assertThat(sentiment.sentiment()).isEqualTo(Sentiment.POSITIVE);
            assertThat(sentiment.confidence()).isEqualTo(0.6);
        }

        @Test
        @DisplayName("Should stay neutral when the business is not mentioned")
        void shouldStayNeutralWithoutMention() {
            SentimentAnalysis sentiment = analyzer.analyzeSentiment(
                    "Everything is excellent.", MentionAnalysis.none(0.9, "none"));

            assertThat(sentiment.sentiment()).isEqualTo(Sentiment.NEUTRAL);
            assertThat(sentiment.confidence()).isEqualTo(0.5);
        }
    }

    @Nested
    @DisplayName("competitors and ranking")
    class Competitors {

        @Test
        @DisplayName("Should extract list items in order and skip noise")
        void shouldExtractCompetitors() {
            String text = """
                    * **Blue Door Bakery**: great pastries
                    - Google Maps listing
                    - quality
                    - Corner Cafe (downtown)
                    - Blue Door Bakery
                    """;

            CompetitorAnalysis analysis = analyzer.analyzeCompetitors(text, "Acme", false);

            assertThat(analysis.competitors()).containsExactly("Blue Door Bakery", "Corner Cafe");
            assertThat(analysis.targetRank()).isNull();
        }

        @Test
        @DisplayName("Should locate the list position of a name")
        void shouldFindListPosition() {
            String text = "1) Rapid Rooter\n2) Mile High Plumbing\n3. Acme Co - family owned\n12. Acme Co";

            assertThat(analyzer.findListPosition(text, "Acme Co")).isEqualTo(3);
            assertThat(analyzer.findListPosition(text, "Nobody")).isNull();
            assertThat(analyzer.findListPosition("12. Acme Co", "Acme Co")).isNull();
        }

        @Test
        @DisplayName("Should generate suffix, prefix and initials variants")
        void shouldGenerateNameVariants() {
            assertThat(analyzer.nameVariants("The Acme Company"))
                    .contains("The Acme", "Acme Company", "TAC")
                    .doesNotContain("The Acme Company");
        }
    }

    @Nested
    @DisplayName("analyze")
    class Analyze {

        @Test
        @DisplayName("Should rank the business and list competitors for a recommendation reply")
        void shouldAnalyzeRecommendation() {
            String text = """
                    Here are the top plumbers in Denver:

                    1. Rapid Rooter - fast service
                    2. Acme Co - reliable and professional
                    3. Mile High Plumbing

                    All are reputable.""";

            QueryResult result = analyzer.analyze(reply(text), "Acme Co", PromptType.RECOMMENDATION);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.mentioned()).isTrue();
            assertThat(result.sentiment()).isEqualTo(Sentiment.POSITIVE);
            assertThat(result.rankPosition()).isEqualTo(2);
            assertThat(result.competitorMentions()).containsExactly("Rapid Rooter", "Mile High Plumbing");
            assertThat(result.confidence()).isCloseTo(0.94, within(0.001));
            assertThat(result.model()).isEqualTo("openai/gpt-4-turbo");
            assertThat(result.tokensUsed()).isEqualTo(120);
        }

        @Test
        @DisplayName("Should leave rank and competitors empty for a factual reply")
        void shouldSkipCompetitorsForFactual() {
            QueryResult result = analyzer.analyze(reply("1. Acme Co is excellent."), "Acme Co", PromptType.FACTUAL);

            assertThat(result.rankPosition()).isNull();
            assertThat(result.competitorMentions()).isEmpty();
            assertThat(result.confidence()).isCloseTo(0.86, within(0.001));
        }

        @Test
        @DisplayName("Should capture an internal failure instead of throwing")
        void shouldCaptureFailure() {
            QueryResult result = analyzer.analyze(null, "Acme Co", PromptType.OPINION);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.error()).startsWith("Analysis failed:");
            assertThat(result.mentioned()).isFalse();
            assertThat(result.confidence()).isZero();
        }
    }
}
