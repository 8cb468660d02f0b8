package dev.visibility.llm;

import dev.visibility.model.BusinessContext;
import dev.visibility.model.CrawlData;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds customer-style prompts for a business from its category, location and crawl data.
 */
@Component
public class PromptGenerator {

    private static final Map<PromptType, List<String>> TEMPLATES = new EnumMap<>(PromptType.class);

    static {
        TEMPLATES.put(PromptType.FACTUAL, List.of(
                "What information do you have about {businessName}{locationContext}? Please provide factual details "
                        + "about their services, reputation, contact information, and any notable characteristics.",
                "Can you tell me about {businessName}{locationContext}? I'm looking for factual information about "
                        + "what they do, their background, and their reputation in the community.",
                "I need information about {businessName}{locationContext}. What can you tell me about their services, "
                        + "experience, and standing in the {industry} industry?"));
        TEMPLATES.put(PromptType.OPINION, List.of(
                "I'm considering using the services of {businessName}{locationContext}. Based on what you know, would "
                        + "you say they are a reputable and reliable {businessType}? What's your assessment of their "
                        + "quality and trustworthiness?",
                "I'm thinking about going to {businessName}{locationContext} for {serviceContext}. Do you think they're "
                        + "a good choice? What's your opinion on their reputation and service quality?",
                "A friend recommended {businessName}{locationContext} to me. What's your take on them? Are they known "
                        + "for being professional and delivering good results in the {industry} space?"));
        TEMPLATES.put(PromptType.RECOMMENDATION, List.of(
                "What are the best {industryPlural}{locationContext}? I'm looking for top recommendations for quality "
                        + "{serviceType} providers in the area.",
                "Can you recommend the top 5 {industryPlural}{locationContext}? I need reliable options for "
                        + "{serviceContext} and want to know who the leading providers are.",
                "I'm looking for the most reputable {industryPlural}{locationContext}. Who would you recommend for "
                        + "someone seeking high-quality {serviceType} services?"));
    }

    private static final Map<String, Industry> INDUSTRIES = new LinkedHashMap<>();

    static {
        INDUSTRIES.put("healthcare", new Industry("healthcare providers", "medical care", "healthcare provider"));
        INDUSTRIES.put("dental", new Industry("dental practices", "dental care", "dental practice"));
        INDUSTRIES.put("medical", new Industry("medical practices", "medical services", "medical provider"));
        INDUSTRIES.put("veterinary", new Industry("veterinary clinics", "pet care", "veterinary clinic"));
        INDUSTRIES.put("legal", new Industry("law firms", "legal services", "law firm"));
        INDUSTRIES.put("accounting", new Industry("accounting firms", "financial services", "accounting firm"));
        INDUSTRIES.put("consulting", new Industry("consulting firms", "business consulting", "consulting company"));
        INDUSTRIES.put("real estate", new Industry("real estate agencies", "property services", "real estate agency"));
        INDUSTRIES.put("restaurant", new Industry("restaurants", "dining", "restaurant"));
        INDUSTRIES.put("cafe", new Industry("cafes", "coffee and food", "cafe"));
        INDUSTRIES.put("catering", new Industry("catering companies", "event catering", "catering service"));
        INDUSTRIES.put("hotel", new Industry("hotels", "accommodation", "hotel"));
        INDUSTRIES.put("retail", new Industry("retail stores", "shopping", "retail business"));
        INDUSTRIES.put("automotive", new Industry("auto services", "vehicle maintenance", "automotive service"));
        INDUSTRIES.put("beauty", new Industry("beauty salons", "beauty services", "beauty salon"));
        INDUSTRIES.put("fitness", new Industry("fitness centers", "fitness training", "fitness facility"));
        INDUSTRIES.put("technology", new Industry("tech companies", "technology solutions", "technology company"));
        INDUSTRIES.put("marketing", new Industry("marketing agencies", "marketing services", "marketing agency"));
        INDUSTRIES.put("construction", new Industry("construction companies", "construction services",
                "construction company"));
        INDUSTRIES.put("cleaning", new Industry("cleaning services", "cleaning", "cleaning service"));
        INDUSTRIES.put("plumbing", new Industry("plumbers", "plumbing", "plumbing company"));
    }

    private static final Industry DEFAULT_INDUSTRY = new Industry("businesses", "professional services", "business");
    private static final String DEFAULT_INDUSTRY_KEY = "business";

    private static final List<String> SERVICE_KEYWORDS = List.of(
            "consulting", "design", "development", "marketing", "sales",
            "repair", "maintenance", "installation", "training", "support",
            "care", "treatment", "therapy", "advice", "planning");

    public String generate(BusinessContext context, PromptType type) {
        List<String> templates = TEMPLATES.get(type);
        String template = templates.get(Math.floorMod(context.name().hashCode(), templates.size()));
        String industryKey = extractIndustry(context);
        Industry industry = INDUSTRIES.getOrDefault(industryKey, DEFAULT_INDUSTRY);

        return template
                .replace("{businessName}", context.name())
                .replace("{locationContext}", locationContext(context))
                .replace("{industryPlural}", industry.plural())
                .replace("{industry}", industryKey)
                .replace("{businessType}", industry.type())
                .replace("{serviceType}", industry.service())
                .replace("{serviceContext}", serviceContext(context, industry.service()));
    }

    /**
     * Industry key from the category first, then the crawled description and services.
     */
    String extractIndustry(BusinessContext context) {
        if (context.category() != null && !context.category().isBlank()) {
            String category = context.category().toLowerCase(Locale.ROOT);
            for (String key : INDUSTRIES.keySet()) {
                if (category.contains(key)) {
                    return key;
                }
            }
            String fuzzy = fuzzyIndustry(category);
            if (fuzzy != null) {
                return fuzzy;
            }
        }

        CrawlData crawl = context.crawlData();
        if (crawl != null) {
            String text = (nullToEmpty(crawl.description()) + " " + nullToEmpty(crawl.category()) + " "
                    + String.join(" ", crawl.services())).toLowerCase(Locale.ROOT);
            for (String key : INDUSTRIES.keySet()) {
                if (text.contains(key)) {
                    return key;
                }
            }
            String fuzzy = fuzzyIndustry(text);
            if (fuzzy != null) {
                return fuzzy;
            }
        }
        return DEFAULT_INDUSTRY_KEY;
    }

    private String fuzzyIndustry(String text) {
        if (text.contains("food") || text.contains("dining")) {
            return "restaurant";
        }
        if (text.contains("health") || text.contains("doctor") || text.contains("clinic")) {
            return "healthcare";
        }
        if (text.contains("law") || text.contains("attorney") || text.contains("lawyer")) {
            return "legal";
        }
        if (text.contains("tech") || text.contains("software")) {
            return "technology";
        }
        if (text.contains("shop") || text.contains("store")) {
            return "retail";
        }
        return null;
    }

    private String locationContext(BusinessContext context) {
        if (context.location() == null) {
            return "";
        }
        String display = context.location().display();
        return display.isEmpty() ? "" : " in " + display;
    }

    private String serviceContext(BusinessContext context, String defaultService) {
        CrawlData crawl = context.crawlData();
        if (crawl == null) {
            return defaultService;
        }
        if (!crawl.services().isEmpty()) {
            return crawl.services().get(0).toLowerCase(Locale.ROOT);
        }
        if (crawl.description() != null) {
            String description = crawl.description().toLowerCase(Locale.ROOT);
            for (String keyword : SERVICE_KEYWORDS) {
                if (description.contains(keyword)) {
                    return keyword;
                }
            }
        }
        return defaultService;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private record Industry(String plural, String service, String type) {
    }
}
