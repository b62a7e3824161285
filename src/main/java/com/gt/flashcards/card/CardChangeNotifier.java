package com.gt.flashcards.card;

import com.gt.flashcards.model.CardChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Pushes card changes to the owner's subscribers.
 * <p>
 * Notifications are a convenience for keeping clients current; review scheduling never depends on them. A listener
 * that throws is dropped and will not receive further changes.
 */
@Component
public class CardChangeNotifier {

    private static final Logger log = LoggerFactory.getLogger(CardChangeNotifier.class);

    private final Map<String, List<Consumer<CardChange>>> listenersByOwner = new ConcurrentHashMap<>();

    public Runnable subscribe(String owner, Consumer<CardChange> listener) {
        listenersByOwner.computeIfAbsent(owner, key -> new CopyOnWriteArrayList<>()).add(listener);

        return () -> unsubscribe(owner, listener);
    }

    public int getSubscriberCount(String owner) {
        List<Consumer<CardChange>> listeners = listenersByOwner.get(owner);

        return listeners == null ? 0 : listeners.size();
    }

    @EventListener
    public void onCardChanged(CardChangedEvent event) {
        List<Consumer<CardChange>> listeners = listenersByOwner.get(event.getOwner());
        if (listeners == null) {
            return;
        }

        for (Consumer<CardChange> listener : listeners) {
            try {
                listener.accept(event.getCardChange());
            } catch (RuntimeException ex) {
                log.warn("Dropping card change subscriber for {}: {}", event.getOwner(), ex.getMessage());
                unsubscribe(event.getOwner(), listener);
            }
        }
    }

    private void unsubscribe(String owner, Consumer<CardChange> listener) {
        listenersByOwner.computeIfPresent(owner, (key, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }
}
