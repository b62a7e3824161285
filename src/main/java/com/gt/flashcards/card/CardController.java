package com.gt.flashcards.card;

import com.gt.flashcards.model.Card;
import com.gt.flashcards.model.CardChange;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

@RestController
@RequestMapping("/rest/cards")
public class CardController {

    private static final Logger log = LoggerFactory.getLogger(CardController.class);

    private static final long SUBSCRIPTION_TIMEOUT_MS = 30 * 60 * 1000;

    private final CardService cardService;

    @Autowired
    public CardController(CardService cardService) {
        this.cardService = cardService;
    }

    @GetMapping(value = "/all", produces = "application/json")
    public List<Card> getAllCards(@AuthenticationPrincipal UserDetails userDetails) {
        return cardService.loadAllCards(userDetails.getUsername());
    }

    @GetMapping(value = "/due", produces = "application/json")
    public List<Card> getDueCards(@AuthenticationPrincipal UserDetails userDetails) {
        return cardService.getDueCards(userDetails.getUsername());
    }

    @GetMapping(value = "/dueCount", produces = "application/json")
    public int getDueCardCount(@AuthenticationPrincipal UserDetails userDetails) {
        return cardService.countDueCards(userDetails.getUsername());
    }

    @GetMapping(value = "/{cardId}", produces = "application/json")
    public Card getCard(@PathVariable("cardId") String cardId,
                        @AuthenticationPrincipal UserDetails userDetails) {
        return cardService.getCard(userDetails.getUsername(), cardId);
    }

    @PutMapping(value = "/create", consumes = "application/json", produces = "application/json")
    public Card createCard(@RequestBody CreateCardRequest request,
                           @AuthenticationPrincipal UserDetails userDetails,
                           HttpServletResponse response) {
        Card card = cardService.createCard(userDetails.getUsername(), request.question(), request.answer());

        response.setStatus(HttpServletResponse.SC_CREATED);
        return card;
    }

    @DeleteMapping("/{cardId}")
    public void deleteCard(@PathVariable("cardId") String cardId,
                           @AuthenticationPrincipal UserDetails userDetails) {
        cardService.deleteCard(userDetails.getUsername(), cardId);
    }

    @GetMapping(value = "/subscribe", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter subscribeToChanges(@AuthenticationPrincipal UserDetails userDetails) {
        SseEmitter emitter = new SseEmitter(SUBSCRIPTION_TIMEOUT_MS);
        Runnable unsubscribe = cardService.subscribe(userDetails.getUsername(), cardChange -> sendCardChange(emitter, cardChange));

        emitter.onCompletion(unsubscribe);
        emitter.onTimeout(unsubscribe);
        emitter.onError(ex -> {
            log.debug("Card change stream for {} closed: {}", userDetails.getUsername(), ex.getMessage());
            unsubscribe.run();
        });

        return emitter;
    }

    private static void sendCardChange(SseEmitter emitter, CardChange cardChange) {
        try {
            emitter.send(SseEmitter.event().name("cardChanged").data(cardChange, MediaType.APPLICATION_JSON));
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to send card change " + cardChange.cardId(), ex);
        }
    }

    private record CreateCardRequest(String question, String answer) { }
}
