package com.cashflow.config;

import com.cashflow.model.card.CardCatalog;
import com.cashflow.model.card.DealCard;
import com.cashflow.model.card.DoodadCard;
import com.cashflow.model.card.MarketCard;
import com.cashflow.model.card.ProfessionCard;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Loads the profession and card decks at startup.
 * <p>
 * Every deck lives in its own JSON file under {@code game.cards.location}
 * (default {@code classpath:cards/}). A missing or unreadable file is logged and leaves
 * that deck empty; the other decks still load.
 */
@Component
@Slf4j
public class CardCatalogLoader {

    static final String PROFESSIONS = "professions.json";
    static final String SMALL_DEALS = "small-deals.json";
    static final String BIG_DEALS = "big-deals.json";
    static final String MARKET = "market.json";
    static final String DOODADS = "doodads.json";

    private final ObjectMapper objectMapper;
    private final String location;

    @Getter
    private CardCatalog catalog = new CardCatalog(List.of(), List.of(), List.of(), List.of(), List.of());

    public CardCatalogLoader(ObjectMapper objectMapper,
                             @Value("${game.cards.location:classpath:cards/}") String location) {
        this.objectMapper = objectMapper;
        this.location = location.endsWith("/") ? location : location + "/";
    }

    @PostConstruct
    public void loadCatalog() {
        catalog = new CardCatalog(
                loadDeck(PROFESSIONS, new TypeReference<List<ProfessionCard>>() { }),
                loadDeck(SMALL_DEALS, new TypeReference<List<DealCard>>() { }),
                loadDeck(BIG_DEALS, new TypeReference<List<DealCard>>() { }),
                loadDeck(MARKET, new TypeReference<List<MarketCard>>() { }),
                loadDeck(DOODADS, new TypeReference<List<DoodadCard>>() { }));

        if (catalog.professions().isEmpty()) {
            log.warn("No professions found! Games cannot be started without at least one profession.");
        }
        log.info("Loaded card catalog: {} professions, {} small deals, {} big deals, {} market cards, {} doodads",
                catalog.professions().size(), catalog.smallDeals().size(), catalog.bigDeals().size(),
                catalog.marketCards().size(), catalog.doodads().size());
    }

    /**
     * Professions in file order.
     *
     * @throws IllegalStateException if no profession could be loaded
     */
    public List<ProfessionCard> getProfessions() {
        if (catalog.professions().isEmpty()) {
            throw new IllegalStateException("No professions loaded from " + location);
        }
        return catalog.professions();
    }

    private <T> List<T> loadDeck(String fileName, TypeReference<List<T>> type) {
        Resource resource = new PathMatchingResourcePatternResolver().getResource(location + fileName);
        if (!resource.exists()) {
            log.warn("Card file not found: {}{}", location, fileName);
            return List.of();
        }
        try (InputStream is = resource.getInputStream()) {
            List<T> cards = objectMapper.readValue(is, type);
            log.debug("Loaded {} card(s) from {}", cards.size(), fileName);
            return cards;
        } catch (IOException | JacksonException e) {
            log.error("Failed to load card file: {}", fileName, e);
            return List.of();
        }
    }
}
