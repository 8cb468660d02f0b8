package dev.visibility.llm;

import dev.visibility.config.LlmProperties;
import dev.visibility.metrics.VisibilityMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Offline gateway that answers with plausible canned replies.
 * Used when no LLM provider is configured; replies are stable for a given model and prompt.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.llm.provider", havingValue = "simulated", matchIfMissing = true)
public class SimulatedLlmGatewayClient extends AbstractLlmGatewayClient {

  private static final List<String> DESCRIPTORS = List.of(
      "reputable", "professional", "reliable", "experienced", "trusted",
      "established", "excellent", "outstanding", "top-rated");

  private static final Map<String, List<String>> COMPETITORS = Map.of(
      "restaurant", List.of("Local Bistro", "Corner Cafe", "Family Kitchen", "Downtown Grill"),
      "dental", List.of("Family Dental", "Modern Dentistry", "Gentle Care Dental", "Smile Center"),
      "law", List.of("Smith & Associates", "Legal Solutions", "Community Law", "Professional Legal"),
      "default", List.of("Quality Services", "Local Excellence", "Community Choice", "Professional Group"));

  private static final List<Pattern> NAME_PATTERNS = List.of(
      Pattern.compile("about\\s+([^?]+?)(?:\\?|\\.|\\s+in\\s+)", Pattern.CASE_INSENSITIVE),
      Pattern.compile("going to\\s+([^?]+?)(?:\\?|\\.|\\s+in\\s+|\\s+for\\s+)", Pattern.CASE_INSENSITIVE),
      Pattern.compile("services of\\s+([^?]+?)(?:\\?|\\.|\\s+in\\s+)", Pattern.CASE_INSENSITIVE),
      Pattern.compile("recommended\\s+([^?]+?)(?:\\?|\\.|\\s+in\\s+|\\s+to\\s+)", Pattern.CASE_INSENSITIVE));

  private static final Pattern INDUSTRY_PATTERN = Pattern.compile(
      "(?:best|top 5|most reputable)\\s+([A-Za-z\\s]+?)(?:\\s+in\\s+|\\?)", Pattern.CASE_INSENSITIVE);

  public SimulatedLlmGatewayClient(LlmProperties properties, ResponseCache cache, VisibilityMetrics metrics) {
    super(properties, cache, metrics);
    log.info("LLM provider not configured - using simulated gateway");
  }

  @Override
  protected Mono<LlmResponse> execute(String model, String prompt, QueryOptions options) {
    int seed = seed(model + "|" + prompt);
    String content = isRecommendation(prompt)
        ? recommendationReply(prompt, seed)
        : descriptiveReply(prompt, seed);
    int tokens = (prompt.length() + content.length()) / 4;
    return Mono.just(new LlmResponse(content, tokens, model, false, 0));
  }

  static int seed(String key) {
    return Math.floorMod(key.hashCode(), Integer.MAX_VALUE);
  }

  @Override
  public boolean isEnabled() {
    return false;
  }

  private boolean isRecommendation(String prompt) {
    String lower = prompt.toLowerCase(Locale.ROOT);
    return lower.contains("recommend") && !lower.contains("recommended ");
  }

  private String descriptiveReply(String prompt, int seed) {
    String name = extractBusinessName(prompt);
    if (name == null || seed % 10 < 3) {
      return "I don't have specific detailed information about that business in my current knowledge base. "
          + "For accurate and up-to-date details, I'd recommend checking their official website, "
          + "recent customer reviews, or contacting them directly.";
    }
    String descriptor = DESCRIPTORS.get(seed % DESCRIPTORS.size());
    return String.format("Based on available information, %s is a %s local business that has been serving "
        + "the community for several years. Customers describe them as friendly and responsive, and they "
        + "maintain professional standards. I'd still suggest reading recent reviews before deciding.",
        name, descriptor);
  }

  private String recommendationReply(String prompt, int seed) {
    String industry = extractIndustry(prompt);
    List<String> names = new ArrayList<>(competitorsFor(industry));
    int count = 3 + seed % 2;

    StringBuilder reply = new StringBuilder();
    reply.append("Here are some top ").append(industry).append(" I'd recommend:\n\n");
    for (int i = 0; i < count && i < names.size(); i++) {
      reply.append(i + 1).append(". ").append(names.get(i))
          .append(" - Quality ").append(industry).append(" with a strong community presence\n");
    }
    reply.append("\nEach of these has demonstrated professional standards in the area.");
    return reply.toString();
  }

  private List<String> competitorsFor(String industry) {
    String lower = industry.toLowerCase(Locale.ROOT);
    if (lower.contains("dental")) {
      return COMPETITORS.get("dental");
    }
    if (lower.contains("law") || lower.contains("legal")) {
      return COMPETITORS.get("law");
    }
    if (lower.contains("restaurant") || lower.contains("cafe")) {
      return COMPETITORS.get("restaurant");
    }
    return COMPETITORS.get("default");
  }

  String extractBusinessName(String prompt) {
    for (Pattern pattern : NAME_PATTERNS) {
      Matcher matcher = pattern.matcher(prompt);
      if (matcher.find()) {
        return matcher.group(1).trim();
      }
    }
    return null;
  }

  String extractIndustry(String prompt) {
    Matcher matcher = INDUSTRY_PATTERN.matcher(prompt);
    return matcher.find() ? matcher.group(1).trim().toLowerCase(Locale.ROOT) : "businesses";
  }
}
