package dev.visibility.crawl;

import dev.visibility.config.CrawlerProperties;
import dev.visibility.config.RetryProperties;
import dev.visibility.model.CrawlData;
import dev.visibility.model.CrawlResult;
import dev.visibility.retry.ErrorContext;
import dev.visibility.retry.ErrorSanitizer;
import dev.visibility.retry.ProcessingError;
import dev.visibility.retry.RetryExecutor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Fetches a homepage and pulls name, description and contact details out of its markup.
 */
@Slf4j
@Service
public class JsoupWebsiteCrawler implements WebsiteCrawler {

    private static final List<String> SOCIAL_HOSTS = List.of(
            "facebook.com", "instagram.com", "linkedin.com", "twitter.com", "x.com", "youtube.com");

    private final WebClient webClient;
    private final CrawlerProperties properties;
    private final RetryExecutor retryExecutor;
    private final RetryProperties retryProperties;
    private final Clock clock;

    public JsoupWebsiteCrawler(WebClient.Builder webClientBuilder, CrawlerProperties properties,
                               RetryExecutor retryExecutor, RetryProperties retryProperties, Clock clock) {
        HttpClient httpClient = HttpClient.create()
                .followRedirect(true)
                .httpResponseDecoder(spec -> spec.maxHeaderSize(32768));

        this.webClient = webClientBuilder
                .codecs(config -> config.defaultCodecs().maxInMemorySize(properties.getMaxBodySizeMb() * 1024 * 1024))
                .clientConnector(new ReactorClientHttpConnector(Objects.requireNonNull(httpClient)))
                .defaultHeader("User-Agent", properties.getUserAgent())
                .defaultHeader("Accept", "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8")
                .defaultHeader("Accept-Language", "en-US,en;q=0.9")
                .build();
        this.properties = properties;
        this.retryExecutor = retryExecutor;
        this.retryProperties = retryProperties;
        this.clock = clock;
    }

    @Override
    public Mono<CrawlResult> crawl(String url) {
        ErrorContext context = ErrorContext.of("crawl").withUrl(url);
        return retryExecutor.withRetry(() -> fetch(url), context, retryProperties.forOperation(RetryProperties.CRAWL))
                .map(html -> CrawlResult.success(parse(html, url)))
                .doOnNext(result -> log.info("Crawled {} -> '{}'", url, result.data().name()))
                .onErrorResume(e -> {
                    String message = ErrorSanitizer.sanitize(e);
                    log.warn("Crawl failed for {}: {}", url, message);
                    return Mono.just(CrawlResult.failed(message));
                });
    }

    @SuppressWarnings("null")
    private Mono<String> fetch(String url) {
        return webClient.get()
                .uri(url)
                .retrieve()
                .onStatus(HttpStatusCode::isError,
                        response -> Mono.just(new ProcessingError(
                                "Crawl request failed with status " + response.statusCode().value(),
                                ProcessingError.CRAWL_FAILED, response.statusCode().is5xxServerError(),
                                ErrorContext.of("crawl").withUrl(url))))
                .bodyToMono(String.class)
                .defaultIfEmpty("")
                .timeout(properties.getTimeout())
                .onErrorMap(TimeoutException.class, e -> new ProcessingError(
                        "Crawl timeout after " + properties.getTimeout().toMillis() + "ms",
                        ProcessingError.CRAWL_FAILED, true, ErrorContext.of("crawl").withUrl(url), e))
                .onErrorMap(WebClientRequestException.class, e -> new ProcessingError(
                        "Crawl network error: " + e.getMessage(),
                        ProcessingError.CRAWL_FAILED, true, ErrorContext.of("crawl").withUrl(url), e));
    }

    CrawlData parse(String html, String url) {
        Document doc = Jsoup.parse(html, url);

        String name = firstNonBlank(
                meta(doc, "meta[property=og:site_name]"),
                meta(doc, "meta[property=og:title]"),
                cleanTitle(doc.title()));
        String description = firstNonBlank(
                meta(doc, "meta[name=description]"),
                meta(doc, "meta[property=og:description]"));

        String phone = null;
        Element tel = doc.selectFirst("a[href^=tel:]");
        if (tel != null) {
            phone = tel.attr("href").substring("tel:".length()).trim();
        }
        String email = null;
        Element mail = doc.selectFirst("a[href^=mailto:]");
        if (mail != null) {
            email = mail.attr("href").substring("mailto:".length()).split("\\?")[0].trim();
        }

        Set<String> social = new LinkedHashSet<>();
        for (Element link : doc.select("a[href]")) {
            String href = link.absUrl("href");
            if (SOCIAL_HOSTS.stream().anyMatch(href::contains)) {
                social.add(href);
            }
        }

        return CrawlData.builder()
                .name(name)
                .description(description)
                .phone(phone)
                .email(email)
                .services(new ArrayList<>())
                .socialLinks(new ArrayList<>(social))
                .crawledAt(clock.instant())
                .build();
    }

    private String meta(Document doc, String selector) {
        Element element = doc.selectFirst(selector);
        return element != null ? element.attr("content").trim() : null;
    }

    private String cleanTitle(String title) {
        if (title == null || title.isBlank()) {
            return null;
        }
        // "Acme Dental | Home" -> "Acme Dental"
        return title.split("\\s[|\\-\\u2013]\\s")[0].trim();
    }

    private String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
