package com.gt.flashcards.card;

import com.gt.flashcards.model.CardChange;
import org.springframework.context.ApplicationEvent;

// Published after a card is created, reviewed or deleted.
public class CardChangedEvent extends ApplicationEvent {

    private final String owner;
    private final CardChange cardChange;

    public CardChangedEvent(Object source, String owner, CardChange cardChange) {
        super(source);
        this.owner = owner;
        this.cardChange = cardChange;
    }

    public String getOwner() {
        return owner;
    }

    public CardChange getCardChange() {
        return cardChange;
    }
}
