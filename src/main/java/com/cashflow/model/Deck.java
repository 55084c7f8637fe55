package com.cashflow.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * A draw pile and its discard pile. The first element of {@code cards} is the top of the deck.
 */
public record Deck<T>(List<T> cards, List<T> discardPile) {

    public Deck {
        cards = Collections.unmodifiableList(new ArrayList<>(cards));
        discardPile = Collections.unmodifiableList(new ArrayList<>(discardPile));
    }

    public static <T> Deck<T> shuffled(List<T> cards, Random random) {
        List<T> copy = new ArrayList<>(cards);
        Collections.shuffle(copy, random);
        return new Deck<>(copy, List.of());
    }

    public boolean exhausted() {
        return cards.isEmpty() && discardPile.isEmpty();
    }

    /**
     * Draws the top card, reshuffling the discard pile into a new deck when the deck is empty.
     *
     * @throws IllegalStateException if both the deck and the discard pile are empty
     */
    public Draw<T> draw(Random random) {
        if (cards.isEmpty()) {
            if (discardPile.isEmpty()) {
                throw new IllegalStateException("Deck and discard pile are both empty");
            }
            return shuffled(discardPile, random).draw(random);
        }
        return new Draw<>(cards.get(0), new Deck<>(cards.subList(1, cards.size()), discardPile));
    }

    public Deck<T> discard(T card) {
        List<T> updated = new ArrayList<>(discardPile);
        updated.add(card);
        return new Deck<>(cards, updated);
    }

    /**
     * Same-length deck of null placeholders with an empty discard pile.
     */
    public Deck<T> hidden() {
        return new Deck<>(Collections.nCopies(cards.size(), null), List.of());
    }

    public record Draw<T>(T card, Deck<T> deck) {
    }
}
